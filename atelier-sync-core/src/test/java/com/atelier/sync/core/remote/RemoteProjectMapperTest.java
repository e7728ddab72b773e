package com.atelier.sync.core.remote;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.atelier.project.model.HistoryItem;
import com.atelier.project.model.HistoryItemType;
import com.atelier.project.model.Project;
import com.atelier.project.model.ProjectState;
import com.atelier.project.model.WardrobeItem;
import com.atelier.project.model.WardrobeSource;
import com.atelier.sync.core.history.RemoteDeletion;
import com.atelier.sync.core.session.SyncSession;
import com.atelier.sync.spi.LineagePartition;
import com.atelier.sync.spi.RemoteProjectDocument;
import com.atelier.sync.spi.error.PermissionDeniedException;
import com.atelier.sync.spi.identity.UserIdentity;
import com.atelier.sync.testkit.InMemoryRemoteStore;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RemoteProjectMapperTest {

    private final InMemoryRemoteStore remote = new InMemoryRemoteStore();
    private final RemoteProjectMapper mapper = new RemoteProjectMapper(remote, new PushLedger());
    private final SyncSession session = new SyncSession(UserIdentity.of("user-a"), 1);

    private static HistoryItem item(String id, String parentId, String base, HistoryItemType type) {
        return HistoryItem.builder()
                .id(id)
                .parentId(parentId)
                .baseModelId(base)
                .type(type)
                .imageUrl("https://cdn.example/" + id + ".png")
                .build();
    }

    private final HistoryItem root = item("model-1000", null, "model-1000", HistoryItemType.MODEL_GENERATION);
    private final HistoryItem look = item("tryon-2000", "model-1000", "model-1000", HistoryItemType.TRY_ON);

    private ProjectState state(long syncVersion) {
        return ProjectState.builder()
                .id("p1")
                .modelDescription("tall")
                .generatedModelHistory(List.of(root))
                .stylingHistory(Map.of("model-1000", List.of(look)))
                .wardrobe(List.of(new WardrobeItem(
                        "w1", "Coat", "https://cdn.example/w1.png", "outer", null, WardrobeSource.USER, null, null)))
                .updatedAt(5_000L)
                .syncVersion(syncVersion)
                .build();
    }

    @Test
    void writeStoresAllCollectionsAndBumpsVersion() {
        PushResult result = mapper.write(Project.builder().id("p1").build(), state(2), session);

        assertThat(result).isEqualTo(new PushResult(3, 3, 0));
        RemoteProjectDocument document = remote.fetchProject("p1").orElseThrow();
        assertThat(document.syncVersion()).isEqualTo(3);
        assertThat(document.updatedAt()).isEqualTo(5_000L);
        assertThat(document.ownerId()).isEqualTo("user-a");
        assertThat(document.stylingRootIds()).containsExactly("model-1000");
        assertThat(remote.fetchLineage("p1", LineagePartition.styling("model-1000"))).containsExactly(look);
    }

    @Test
    void readReassemblesTheWrittenState() {
        mapper.write(Project.builder().id("p1").title("Lookbook").build(), state(2), session);

        RemoteSnapshot snapshot = mapper.read("p1", "user-a").orElseThrow();

        assertThat(snapshot.project().title()).isEqualTo("Lookbook");
        assertThat(snapshot.state().sameContent(state(2))).isTrue();
        assertThat(snapshot.state().getSyncVersion()).isEqualTo(3);
    }

    @Test
    void unchangedItemsAreNotRewritten() {
        mapper.write(Project.builder().id("p1").build(), state(2), session);
        int afterFirst = remote.lineageItemWrites();

        PushResult second = mapper.write(Project.builder().id("p1").build(), state(3), session);

        assertThat(second.itemsWritten()).isZero();
        assertThat(remote.lineageItemWrites()).isEqualTo(afterFirst);
        assertThat(remote.fetchProject("p1").orElseThrow().syncVersion()).isEqualTo(4);
    }

    @Test
    void renameIsWrittenEvenWhenHashCodesCollide() {
        HistoryItem first = root.toBuilder().name("Aa").build();
        HistoryItem renamed = root.toBuilder().name("BB").build();
        assertThat(renamed.hashCode()).isEqualTo(first.hashCode());

        mapper.write(
                Project.builder().id("p1").build(),
                state(2).toBuilder().generatedModelHistory(List.of(first)).build(),
                session);
        PushResult second = mapper.write(
                Project.builder().id("p1").build(),
                state(3).toBuilder().generatedModelHistory(List.of(renamed)).build(),
                session);

        assertThat(second.itemsWritten()).isEqualTo(1);
        assertThat(remote.fetchLineage("p1", LineagePartition.primary()))
                .extracting(HistoryItem::name)
                .containsExactly("BB");
    }

    @Test
    void malformedItemsAreSkippedAndTheRestIsWritten() {
        HistoryItem untyped = item("model-3000", null, "model-3000", null);
        HistoryItem noImage = root.toBuilder().id("model-4000").imageUrl(null).build();
        ProjectState withBadItems = state(0).toBuilder()
                .generatedModelHistory(List.of(root, untyped, noImage))
                .build();

        PushResult result = mapper.write(Project.builder().id("p1").build(), withBadItems, session);

        assertThat(result.itemsSkipped()).isEqualTo(2);
        assertThat(remote.fetchLineage("p1", LineagePartition.primary())).containsExactly(root);
    }

    @Test
    void writingAnotherIdentitysProjectIsDenied() {
        Project foreign = Project.builder().id("p1").ownerId("user-b").build();

        assertThatThrownBy(() -> mapper.write(foreign, state(0), session))
                .isInstanceOf(PermissionDeniedException.class);
        assertThat(remote.hasProject("p1")).isFalse();
    }

    @Test
    void readIgnoresProjectsOfOtherIdentities() {
        remote.seedProject(new RemoteProjectDocument(
                Project.builder().id("p1").ownerId("user-b").build(), null, null, null, null, null, null, 1L, 1L));

        assertThat(mapper.read("p1", "user-a")).isEmpty();

        remote.setCaller("user-a");
        assertThat(mapper.read("p1", "user-a")).isEmpty();
    }

    @Test
    void readInfersMissingTypes() {
        remote.seedProject(new RemoteProjectDocument(
                Project.builder().id("p1").ownerId("user-a").build(), null, null, null, null, null,
                List.of("model-1000"), 1L, 1L));
        remote.seedLineage("p1", LineagePartition.primary(), List.of(root.withType(null)));
        remote.seedLineage("p1", LineagePartition.styling("model-1000"), List.of(look.withType(null)));

        ProjectState state = mapper.read("p1", "user-a").orElseThrow().state();

        assertThat(state.getGeneratedModelHistory().get(0).type()).isEqualTo(HistoryItemType.MODEL_GENERATION);
        assertThat(state.getStylingHistory().get("model-1000").get(0).type()).isEqualTo(HistoryItemType.TRY_ON_REVISION);
    }

    @Test
    void deletedItemIsRewrittenIfItComesBack() {
        mapper.write(Project.builder().id("p1").build(), state(0), session);
        mapper.delete("p1", new RemoteDeletion(LineagePartition.styling("model-1000"), "tryon-2000"));
        assertThat(remote.fetchLineage("p1", LineagePartition.styling("model-1000"))).isEmpty();

        mapper.write(Project.builder().id("p1").build(), state(1), session);

        assertThat(remote.fetchLineage("p1", LineagePartition.styling("model-1000"))).containsExactly(look);
    }
}
