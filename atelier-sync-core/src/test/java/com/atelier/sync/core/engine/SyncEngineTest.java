package com.atelier.sync.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import com.atelier.project.model.HistoryItem;
import com.atelier.project.model.HistoryItemType;
import com.atelier.project.model.Project;
import com.atelier.project.model.ProjectState;
import com.atelier.project.model.WardrobeItem;
import com.atelier.project.model.WardrobeSource;
import com.atelier.sync.core.blob.ExternalizationReport;
import com.atelier.sync.core.config.SyncSettings;
import com.atelier.sync.core.merge.MergeStrategy;
import com.atelier.sync.core.status.SyncStatus;
import com.atelier.sync.core.status.SyncStatusSnapshot;
import com.atelier.sync.spi.LineagePartition;
import com.atelier.sync.spi.RemoteProjectDocument;
import com.atelier.sync.spi.error.MalformedEntityException;
import com.atelier.sync.spi.error.RemoteUnavailableException;
import com.atelier.sync.spi.error.SyncErrorKind;
import com.atelier.sync.spi.identity.UserIdentity;
import com.atelier.sync.testkit.InMemoryBlobStore;
import com.atelier.sync.testkit.InMemoryLocalStore;
import com.atelier.sync.testkit.InMemoryRemoteStore;
import com.atelier.sync.testkit.SwitchableIdentityProvider;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SyncEngineTest {

    private static final UserIdentity USER_A = UserIdentity.of("user-a");
    private static final UserIdentity USER_B = UserIdentity.of("user-b");
    private static final Duration IDLE = Duration.ofSeconds(3);

    private final InMemoryLocalStore local = new InMemoryLocalStore();
    private final InMemoryRemoteStore remote = new InMemoryRemoteStore();
    private final InMemoryBlobStore blobs = new InMemoryBlobStore();
    private final SyncSettings settings = new SyncSettings();
    private final List<SyncStatus> transitions = new CopyOnWriteArrayList<>();

    private SyncEngine engine;

    private static HistoryItem item(String id, String parentId, String base, HistoryItemType type, String url) {
        return HistoryItem.builder()
                .id(id)
                .parentId(parentId)
                .baseModelId(base)
                .type(type)
                .imageUrl(url)
                .build();
    }

    private static HistoryItem root() {
        return item("model-1000", null, "model-1000", HistoryItemType.MODEL_GENERATION,
                "https://cdn.example/model-1000.png");
    }

    private static HistoryItem revision() {
        return item("model-2000", "model-1000", "model-1000", HistoryItemType.MODEL_REVISION,
                "https://cdn.example/model-2000.png");
    }

    private static RemoteProjectDocument remoteDocument(String id, String description, long updatedAt, long version) {
        return new RemoteProjectDocument(
                Project.builder().id(id).ownerId("user-a").title("Remote " + id).updatedAt(updatedAt)
                        .syncVersion(version).build(),
                description, null, null, null, null, List.of(), updatedAt, version);
    }

    @BeforeEach
    void setUp() {
        settings.setDebounce(Duration.ofMillis(50));
        engine = SyncEngine.builder()
                .localStore(local)
                .remoteStore(remote)
                .blobStore(blobs)
                .settings(settings)
                .statusListener((previous, current) -> {
                    if (current.projectId().equals("p1")) transitions.add(current.status());
                })
                .build();
        engine.init(USER_A);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    // ---------- save and push

    @Test
    void burstOfSavesIsPushedOnceWithLatestState() throws Exception {
        for (int i = 1; i <= 5; i++) {
            String description = "draft " + i;
            engine.saveEntity("p1", s -> s.toBuilder().modelDescription(description).build());
        }

        assertThat(engine.awaitIdle(IDLE)).isTrue();
        assertThat(remote.projectWrites("p1")).singleElement().satisfies(document -> {
            assertThat(document.modelDescription()).isEqualTo("draft 5");
            assertThat(document.syncVersion()).isEqualTo(1);
            assertThat(document.ownerId()).isEqualTo("user-a");
        });
        assertThat(local.loadState("p1").orElseThrow().getSyncVersion()).isEqualTo(1);
        assertThat(engine.statusOf("p1").status()).isEqualTo(SyncStatus.SYNCED);
        assertThat(transitions).containsSubsequence(SyncStatus.PENDING, SyncStatus.SYNCING, SyncStatus.SYNCED);
    }

    @Test
    void saveStampsUpdatedAtAndKeepsVersion() {
        ProjectState first = engine.saveEntity("p1", s -> s.toBuilder().syncVersion(99).build());
        ProjectState second = engine.saveEntity("p1", s -> s);

        assertThat(first.getSyncVersion()).isZero();
        assertThat(second.getUpdatedAt()).isGreaterThan(first.getUpdatedAt());
        assertThat(local.loadProject("p1").orElseThrow().ownerId()).isEqualTo("user-a");
    }

    @Test
    void patchMayNotChangeTheProjectId() {
        assertThatThrownBy(() -> engine.saveEntity("p1", s -> ProjectState.empty("p2")))
                .isInstanceOf(MalformedEntityException.class);
        assertThat(local.loadState("p1")).isEmpty();
    }

    @Test
    void operationsRequireAnActiveSession() {
        engine.teardown();

        assertThatThrownBy(() -> engine.saveEntity("p1", s -> s))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("init");
        assertThatThrownBy(() -> engine.loadEntity("p1")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> engine.forceFlush("p1")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void inlineBinaryIsKeptLocallyButNeverPushed() throws Exception {
        HistoryItem inline = item("model-1000", null, "model-1000", HistoryItemType.MODEL_GENERATION,
                "data:image/png;base64,aGVsbG8=");

        engine.saveEntity("p1", s -> s.toBuilder().generatedModelHistory(List.of(inline)).build());

        assertThat(engine.awaitIdle(IDLE)).isTrue();
        assertThat(remote.hasProject("p1")).isFalse();
        assertThat(local.loadState("p1").orElseThrow().getGeneratedModelHistory()).containsExactly(inline);
        SyncStatusSnapshot status = engine.statusOf("p1");
        assertThat(status.status()).isEqualTo(SyncStatus.ERROR);
        assertThat(status.lastErrorKind()).isEqualTo(SyncErrorKind.VALIDATION_REJECTED);

        ExternalizationReport report = engine.externalizeInlineImages("p1");

        assertThat(report.uploaded()).isEqualTo(1);
        assertThat(engine.awaitIdle(IDLE)).isTrue();
        assertThat(remote.fetchLineage("p1", LineagePartition.primary()))
                .singleElement()
                .satisfies(pushed -> assertThat(pushed.imageUrl()).startsWith(InMemoryBlobStore.BASE));
    }

    @Test
    void createProjectPushesImmediately() {
        Project created = engine.createProject(Project.builder().id("p1").title("Resort 27").build());

        assertThat(remote.hasProject("p1")).isTrue();
        assertThat(created.ownerId()).isEqualTo("user-a");
        assertThat(local.loadState("p1")).isPresent();
        assertThat(local.loadProject("p1").orElseThrow().syncVersion()).isEqualTo(1);
    }

    @Test
    void createProjectFailureIsThrownAndProjectKeptLocally() {
        remote.setOffline(true);

        assertThatThrownBy(() -> engine.createProject(Project.builder().id("p1").title("Resort 27").build()))
                .isInstanceOf(RemoteUnavailableException.class);
        assertThat(local.loadProject("p1")).isPresent();
        assertThat(engine.statusOf("p1").status()).isEqualTo(SyncStatus.OFFLINE);
    }

    @Test
    void failedPushIsNotRetriedUntilNextMutation() throws Exception {
        remote.setOffline(true);
        engine.saveEntity("p1", s -> s.toBuilder().modelDescription("offline edit").build());
        assertThat(engine.awaitIdle(IDLE)).isTrue();
        assertThat(engine.statusOf("p1").status()).isEqualTo(SyncStatus.OFFLINE);

        remote.setOffline(false);
        TimeUnit.MILLISECONDS.sleep(200);
        assertThat(remote.hasProject("p1")).isFalse();

        assertThat(engine.forceFlush("p1")).isTrue();
        assertThat(remote.fetchProject("p1").orElseThrow().modelDescription()).isEqualTo("offline edit");
    }

    @Test
    void pushToProjectOwnedByAnotherIdentityFails() throws Exception {
        local.saveProject(Project.builder().id("p1").ownerId("user-b").build());

        engine.saveEntity("p1", s -> s.toBuilder().modelDescription("mine?").build());

        assertThat(engine.awaitIdle(IDLE)).isTrue();
        assertThat(remote.hasProject("p1")).isFalse();
        assertThat(engine.statusOf("p1").lastErrorKind()).isEqualTo(SyncErrorKind.PERMISSION_DENIED);
    }

    // ---------- load

    @Test
    void loadEntityMergesNewerRemoteCopyAndPushesTheUnion() throws Exception {
        HistoryItem localOnly = root();
        HistoryItem remoteOnly = item("model-3000", null, "model-3000", HistoryItemType.MODEL_GENERATION,
                "https://cdn.example/model-3000.png");
        local.saveProject(Project.builder().id("p1").ownerId("user-a").updatedAt(1_000L).build());
        local.saveState(ProjectState.builder()
                .id("p1")
                .modelDescription("local")
                .generatedModelHistory(List.of(localOnly))
                .updatedAt(1_000L)
                .build());
        remote.seedLineage("p1", LineagePartition.primary(), List.of(remoteOnly));
        remote.seedProject(remoteDocument("p1", "remote", 5_000L, 3));

        ProjectState loaded = engine.loadEntity("p1").orElseThrow();

        assertThat(loaded.getModelDescription()).isEqualTo("remote");
        assertThat(loaded.getGeneratedModelHistory()).containsExactly(localOnly, remoteOnly);
        assertThat(loaded.getSyncVersion()).isEqualTo(4);
        assertThat(local.loadProject("p1").orElseThrow().title()).isEqualTo("Remote p1");
        assertThat(engine.awaitIdle(IDLE)).isTrue();
        assertThat(remote.fetchLineage("p1", LineagePartition.primary())).contains(localOnly, remoteOnly);
        assertThat(remote.fetchProject("p1").orElseThrow().syncVersion()).isEqualTo(5);
    }

    @Test
    void loadEntityAdoptsRemoteCopyWhenNothingIsLocal() throws Exception {
        remote.seedLineage("p1", LineagePartition.primary(), List.of(root()));
        remote.seedProject(remoteDocument("p1", "from another device", 5_000L, 2));

        ProjectState loaded = engine.loadEntity("p1").orElseThrow();

        assertThat(loaded.getModelDescription()).isEqualTo("from another device");
        assertThat(local.loadState("p1")).contains(loaded);
        assertThat(engine.awaitIdle(IDLE)).isTrue();
        assertThat(remote.projectWrites("p1")).isEmpty();
    }

    @Test
    void loadEntityServesLocalCopyWhenRemoteIsUnreachable() {
        engine.saveEntity("p1", s -> s.toBuilder().modelDescription("local only").build());
        remote.setOffline(true);

        assertThat(engine.loadEntity("p1")).hasValueSatisfying(
                state -> assertThat(state.getModelDescription()).isEqualTo("local only"));
        assertThat(engine.loadEntity("missing")).isEmpty();
    }

    // ---------- delete

    @Test
    void deleteEntityRemovesEverywhereAndDeletesOwnedBlobs() throws Exception {
        String owned = InMemoryBlobStore.BASE + "user-a/models/model-1000.png";
        HistoryItem hosted = root().withImageUrl(owned);
        WardrobeItem userCoat = new WardrobeItem("w1", "Coat", InMemoryBlobStore.BASE + "user-a/wardrobe/w1.png",
                "outer", null, WardrobeSource.USER, null, null);
        WardrobeItem catalogShirt = new WardrobeItem("w2", "Shirt", InMemoryBlobStore.BASE + "catalog/w2.png",
                "tops", null, WardrobeSource.PREDEFINED, null, null);
        engine.saveEntity("p1", s -> s.toBuilder()
                .generatedModelHistory(List.of(hosted))
                .wardrobe(List.of(userCoat, catalogShirt))
                .build());
        engine.forceFlush("p1");
        engine.saveEntity("p1", s -> s.toBuilder().modelDescription("queued").build());

        assertThat(engine.deleteEntity("p1")).isTrue();

        assertThat(local.loadState("p1")).isEmpty();
        assertThat(local.loadProject("p1")).isEmpty();
        assertThat(remote.hasProject("p1")).isFalse();
        assertThat(remote.fetchLineage("p1", LineagePartition.primary())).isEmpty();
        assertThat(blobs.deleted()).containsExactlyInAnyOrder(owned, userCoat.url());
        TimeUnit.MILLISECONDS.sleep(150);
        assertThat(remote.hasProject("p1")).isFalse();
        assertThat(engine.deleteEntity("p1")).isFalse();
    }

    @Test
    void deleteEntityStillRemovesLocalCopyWhenRemoteFails() {
        engine.saveEntity("p1", s -> s.toBuilder().modelDescription("x").build());
        remote.setOffline(true);

        assertThat(engine.deleteEntity("p1")).isTrue();
        assertThat(local.loadState("p1")).isEmpty();
    }

    @Test
    void deleteEntityWaitsForRunningPushSoRemoteCopyIsNotRecreated() throws Exception {
        remote.setWriteLatency(Duration.ofMillis(400));
        engine.saveEntity("p1", s -> s.toBuilder().modelDescription("slow").build());
        await().atMost(2, TimeUnit.SECONDS).until(() -> engine.statusOf("p1").status() == SyncStatus.SYNCING);

        assertThat(engine.deleteEntity("p1")).isTrue();

        assertThat(remote.hasProject("p1")).isFalse();
        assertThat(engine.awaitIdle(IDLE)).isTrue();
        assertThat(remote.hasProject("p1")).isFalse();
        assertThat(local.loadProject("p1")).isEmpty();
    }

    @Test
    void pushFinishingAfterDeletionRemovesItsRemoteCopy() throws Exception {
        settings.setDeleteDrainTimeout(Duration.ofMillis(20));
        remote.setWriteLatency(Duration.ofMillis(400));
        engine.saveEntity("p1", s -> s.toBuilder().modelDescription("slow").build());
        await().atMost(2, TimeUnit.SECONDS).until(() -> engine.statusOf("p1").status() == SyncStatus.SYNCING);

        assertThat(engine.deleteEntity("p1")).isTrue();

        assertThat(engine.awaitIdle(IDLE)).isTrue();
        assertThat(remote.projectWrites("p1")).hasSize(1);
        assertThat(remote.hasProject("p1")).isFalse();
        assertThat(local.loadState("p1")).isEmpty();
    }

    // ---------- lineage

    @Test
    void unifiedHistoryRoundTripsThroughPartitions() {
        HistoryItem look = item("tryon-3000", "model-2000", "model-1000", HistoryItemType.TRY_ON,
                "https://cdn.example/tryon-3000.png");

        ProjectState saved = engine.saveUnifiedHistory("p1", "model-1000", List.of(root(), revision(), look));

        assertThat(saved.getGeneratedModelHistory()).containsExactly(root(), revision());
        assertThat(saved.getStylingHistory()).containsOnlyKeys("model-1000");
        assertThat(engine.loadUnifiedHistory("p1", "model-1000")).containsExactly(root(), revision(), look);
        assertThat(engine.loadUnifiedHistory("unknown", "model-1000")).isEmpty();
    }

    @Test
    void deletingRootPromotesChildLocallyAndRemotely() throws Exception {
        engine.saveUnifiedHistory("p1", "model-1000", List.of(root(), revision()));
        engine.forceFlush("p1");

        ProjectState after = engine.deleteHistoryItem("p1", "model-1000").orElseThrow();

        assertThat(after.getGeneratedModelHistory()).singleElement().satisfies(promoted -> {
            assertThat(promoted.id()).isEqualTo("model-2000");
            assertThat(promoted.parentId()).isNull();
        });
        assertThat(remote.deletedItems()).containsExactly("model-1000");
        assertThat(engine.awaitIdle(IDLE)).isTrue();
        assertThat(remote.fetchLineage("p1", LineagePartition.primary())).singleElement().satisfies(
                pushed -> assertThat(pushed.parentId()).isNull());
        assertThat(engine.deleteHistoryItem("p1", "model-1000")).isEmpty();
    }

    @Test
    void failedRemoteItemDeletionIsRetriedOnNextPush() throws Exception {
        engine.saveUnifiedHistory("p1", "model-1000", List.of(root(), revision()));
        engine.forceFlush("p1");
        remote.setOffline(true);

        engine.deleteHistoryItem("p1", "model-2000");
        assertThat(engine.awaitIdle(IDLE)).isTrue();
        assertThat(remote.deletedItems()).isEmpty();

        remote.setOffline(false);
        engine.forceFlush("p1");

        assertThat(remote.deletedItems()).containsExactly("model-2000");
        assertThat(remote.fetchLineage("p1", LineagePartition.primary())).containsExactly(root());
    }

    @Test
    void deletingHostedItemDeletesItsBlob() {
        String owned = InMemoryBlobStore.BASE + "user-a/models/model-2000.png";
        engine.saveUnifiedHistory("p1", "model-1000", List.of(root(), revision().withImageUrl(owned)));

        engine.deleteHistoryItem("p1", "model-2000");

        assertThat(blobs.deleted()).containsExactly(owned);
    }

    @Test
    void updateHistoryItemEditsInPlace() {
        engine.saveUnifiedHistory("p1", "model-1000", List.of(root(), revision()));

        HistoryItem updated = engine.updateHistoryItem(
                        "p1", "model-2000", i -> i.toBuilder().name("Hero").starred(true).build())
                .orElseThrow();

        assertThat(updated.name()).isEqualTo("Hero");
        assertThat(updated.updatedAt()).isNotNull();
        assertThat(local.loadState("p1").orElseThrow().getGeneratedModelHistory())
                .filteredOn(HistoryItem::starred)
                .extracting(HistoryItem::id)
                .containsExactly("model-2000");
        assertThat(engine.updateHistoryItem("p1", "model-404", i -> i)).isEmpty();
        assertThatThrownBy(() -> engine.updateHistoryItem("p1", "model-2000", i -> i.toBuilder().id("x").build()))
                .isInstanceOf(MalformedEntityException.class);
    }

    @Test
    void untypedItemsAreRepaired() {
        HistoryItem untypedRoot = root().withType(null);
        HistoryItem untypedLook = item("tryon-3000", "model-1000", "model-1000", null,
                "https://cdn.example/tryon-3000.png");
        local.saveState(ProjectState.builder()
                .id("p1")
                .generatedModelHistory(List.of(untypedRoot))
                .stylingHistory(Map.of("model-1000", List.of(untypedLook)))
                .build());

        assertThat(engine.migrateHistoryTypes("p1")).isEqualTo(2);

        ProjectState repaired = local.loadState("p1").orElseThrow();
        assertThat(repaired.getGeneratedModelHistory().get(0).type()).isEqualTo(HistoryItemType.MODEL_GENERATION);
        assertThat(repaired.getStylingHistory().get("model-1000").get(0).type())
                .isEqualTo(HistoryItemType.TRY_ON_REVISION);
        assertThat(engine.migrateHistoryTypes("p1")).isZero();
    }

    // ---------- subscriptions and conflicts

    @Test
    void parkedConflictIsResolvedWithChosenStrategy() throws Exception {
        settings.setAutoMerge(false);
        engine.saveEntity("p1", s -> s.toBuilder().modelDescription("mine").build());
        engine.forceFlush("p1");
        long localUpdatedAt = local.loadState("p1").orElseThrow().getUpdatedAt();
        engine.subscribe("p1", null, change -> {});

        remote.seedProject(remoteDocument("p1", "theirs", localUpdatedAt + 1_000, 2));

        assertThat(engine.pendingConflict("p1")).isPresent();
        assertThat(engine.statusOf("p1").status()).isEqualTo(SyncStatus.CONFLICT);
        assertThat(local.loadState("p1").orElseThrow().getModelDescription()).isEqualTo("mine");

        ProjectState resolved = engine.resolveConflict("p1", MergeStrategy.PREFER_REMOTE);

        assertThat(resolved.getModelDescription()).isEqualTo("theirs");
        assertThat(engine.pendingConflict("p1")).isEmpty();
        assertThat(engine.awaitIdle(IDLE)).isTrue();
        assertThat(remote.fetchProject("p1").orElseThrow().modelDescription()).isEqualTo("theirs");
        assertThat(engine.statusOf("p1").status()).isEqualTo(SyncStatus.SYNCED);
        assertThatThrownBy(() -> engine.resolveConflict("p1", MergeStrategy.SMART))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void ownPushEchoIsNotTreatedAsRemoteChange() throws Exception {
        List<Object> changes = new CopyOnWriteArrayList<>();
        engine.subscribe("p1", null, changes::add);

        engine.saveEntity("p1", s -> s.toBuilder().modelDescription("mine").build());
        assertThat(engine.awaitIdle(IDLE)).isTrue();

        assertThat(changes).isEmpty();
        assertThat(remote.projectWrites("p1")).hasSize(1);
    }

    // ---------- session lifecycle

    @Test
    void identityChangeDropsPendingWrites() throws Exception {
        engine.teardown();
        SwitchableIdentityProvider identities = new SwitchableIdentityProvider(USER_A);
        engine.bind(identities);
        assertThat(engine.currentSession()).hasValueSatisfying(s -> assertThat(s.uid()).isEqualTo("user-a"));

        engine.saveEntity("p1", s -> s.toBuilder().modelDescription("a's draft").build());
        identities.signIn(USER_B);

        assertThat(engine.currentSession()).hasValueSatisfying(s -> assertThat(s.uid()).isEqualTo("user-b"));
        TimeUnit.MILLISECONDS.sleep(200);
        assertThat(remote.projectWrites("p1")).isEmpty();

        identities.signOut();
        assertThat(engine.currentSession()).isEmpty();
    }

    @Test
    void resultOfWriteRunningDuringTeardownIsDiscarded() throws Exception {
        remote.setWriteLatency(Duration.ofMillis(300));
        engine.saveEntity("p1", s -> s.toBuilder().modelDescription("slow").build());
        await().atMost(2, TimeUnit.SECONDS).until(() -> engine.statusOf("p1").status() == SyncStatus.SYNCING);

        engine.teardown();

        assertThat(engine.awaitIdle(IDLE)).isTrue();
        assertThat(remote.projectWrites("p1")).hasSize(1);
        assertThat(local.loadState("p1").orElseThrow().getSyncVersion()).isZero();
        assertThat(engine.statusOf("p1").status()).isEqualTo(SyncStatus.SYNCED);
    }

    @Test
    void reinitWithSameIdentityKeepsSession() {
        long epoch = engine.currentSession().orElseThrow().epoch();

        assertThat(engine.init(USER_A).epoch()).isEqualTo(epoch);
        assertThat(engine.init(USER_B).epoch()).isNotEqualTo(epoch);
    }

    @Test
    void initQueuesLocalProjectsThatAreAheadOfRemote() throws Exception {
        engine.teardown();
        local.saveProject(Project.builder().id("p9").ownerId("user-a").build());
        local.saveState(ProjectState.builder().id("p9").modelDescription("offline work").updatedAt(5_000L).build());
        local.saveProject(Project.builder().id("p8").ownerId("user-b").build());
        local.saveState(ProjectState.builder().id("p8").updatedAt(5_000L).build());

        engine.init(USER_A);

        assertThat(engine.awaitIdle(IDLE)).isTrue();
        assertThat(remote.fetchProject("p9").orElseThrow().modelDescription()).isEqualTo("offline work");
        assertThat(remote.hasProject("p8")).isFalse();
    }

    // ---------- migrations

    @Test
    void migrateLocalProjectsPushesOnlyMissingOwnProjects() {
        local.saveProject(Project.builder().id("p-mine").ownerId("user-a").build());
        local.saveProject(Project.builder().id("p-legacy").build());
        local.saveProject(Project.builder().id("p-foreign").ownerId("user-b").build());
        local.saveProject(Project.builder().id("p-synced").ownerId("user-a").build());
        remote.seedProject(remoteDocument("p-synced", null, 1L, 1));

        MigrationReport report = engine.migrateLocalProjects();

        assertThat(report).isEqualTo(new MigrationReport(4, 2, 2, 0));
        assertThat(remote.hasProject("p-mine")).isTrue();
        assertThat(remote.fetchProject("p-legacy").orElseThrow().ownerId()).isEqualTo("user-a");
        assertThat(remote.hasProject("p-foreign")).isFalse();
    }

    @Test
    void restoreProjectsCopiesMissingRemoteProjects() {
        remote.seedLineage("p-r", LineagePartition.primary(), List.of(root()));
        remote.seedProject(remoteDocument("p-r", "from cloud", 2_000L, 4));

        assertThat(engine.restoreProjects()).isEqualTo(1);
        assertThat(engine.restoreProjects()).isZero();

        ProjectState restored = local.loadState("p-r").orElseThrow();
        assertThat(restored.getModelDescription()).isEqualTo("from cloud");
        assertThat(restored.getGeneratedModelHistory()).containsExactly(root());
        assertThat(local.loadProject("p-r").orElseThrow().title()).isEqualTo("Remote p-r");
    }
}
