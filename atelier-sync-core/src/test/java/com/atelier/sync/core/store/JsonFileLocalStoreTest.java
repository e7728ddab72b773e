package com.atelier.sync.core.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.atelier.project.model.HistoryItem;
import com.atelier.project.model.HistoryItemType;
import com.atelier.project.model.Project;
import com.atelier.project.model.ProjectState;
import com.atelier.project.model.ProjectStatus;
import com.atelier.sync.spi.error.LocalStoreException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileLocalStoreTest {

    @TempDir
    Path dir;

    @Test
    void savesAndLoadsProjectAndState() {
        JsonFileLocalStore store = new JsonFileLocalStore(dir);
        Project project = Project.builder()
                .id("p1")
                .ownerId("user-a")
                .title("Autumn lookbook")
                .tags(List.of("autumn", "lookbook"))
                .status(ProjectStatus.IN_PROGRESS)
                .deadline(LocalDate.of(2026, 11, 30))
                .createdAt(1_000L)
                .updatedAt(2_000L)
                .syncVersion(3)
                .build();
        ProjectState state = ProjectState.builder()
                .id("p1")
                .modelDescription("tall, short hair")
                .generatedModelHistory(List.of(HistoryItem.builder()
                        .id("model-1000")
                        .type(HistoryItemType.MODEL_GENERATION)
                        .imageUrl("https://cdn.example/model-1000.png")
                        .build()))
                .generationSettings(Map.of("seed", 7))
                .updatedAt(2_000L)
                .syncVersion(3)
                .build();

        store.saveProject(project);
        store.saveState(state);

        assertThat(store.loadProject("p1")).contains(project);
        assertThat(store.loadState("p1")).contains(state);
        assertThat(store.listProjects()).containsExactly(project);
        assertThat(Files.exists(dir.resolve("states/p1.json"))).isTrue();
    }

    @Test
    void overwritesExistingRecord() {
        JsonFileLocalStore store = new JsonFileLocalStore(dir);
        store.saveState(ProjectState.builder().id("p1").modelDescription("v1").build());
        store.saveState(ProjectState.builder().id("p1").modelDescription("v2").build());

        assertThat(store.loadState("p1").orElseThrow().getModelDescription()).isEqualTo("v2");
    }

    @Test
    void missingRecordsAreEmptyAndDeleteIsIdempotent() {
        JsonFileLocalStore store = new JsonFileLocalStore(dir);

        assertThat(store.loadState("nope")).isEmpty();
        store.delete("nope");
        assertThat(store.listProjects()).isEmpty();
    }

    @Test
    void deleteRemovesBothRecords() {
        JsonFileLocalStore store = new JsonFileLocalStore(dir);
        store.saveProject(Project.builder().id("p1").build());
        store.saveState(ProjectState.empty("p1"));

        store.delete("p1");

        assertThat(store.loadProject("p1")).isEmpty();
        assertThat(store.loadState("p1")).isEmpty();
    }

    @Test
    void corruptStateFileIsReportedAsLocalStoreFailure() throws Exception {
        JsonFileLocalStore store = new JsonFileLocalStore(dir);
        Files.writeString(dir.resolve("states/p1.json"), "{ not json");

        assertThatThrownBy(() -> store.loadState("p1")).isInstanceOf(LocalStoreException.class);
    }

    @Test
    void unreadableProjectFilesAreSkippedWhenListing() throws Exception {
        JsonFileLocalStore store = new JsonFileLocalStore(dir);
        store.saveProject(Project.builder().id("p1").build());
        Files.writeString(dir.resolve("projects/broken.json"), "[]");

        assertThat(store.listProjects()).extracting(Project::id).containsExactly("p1");
    }

    @Test
    void rejectsIdsThatWouldEscapeTheStore() {
        JsonFileLocalStore store = new JsonFileLocalStore(dir);

        assertThatThrownBy(() -> store.loadState("../etc/passwd")).isInstanceOf(IllegalArgumentException.class);
    }
}
