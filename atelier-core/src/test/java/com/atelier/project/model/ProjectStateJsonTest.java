package com.atelier.project.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ProjectStateJsonTest {

    private final ObjectMapper mapper = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    @Test
    void usesWireNamesForTypesAndStarFlag() throws Exception {
        HistoryItem item = HistoryItem.builder()
                .id("tryon-1712000000000")
                .parentId("model-1711000000000")
                .baseModelId("model-1711000000000")
                .type(HistoryItemType.TRY_ON)
                .imageUrl("https://cdn.example/t.png")
                .starred(true)
                .build();

        String json = mapper.writeValueAsString(item);

        assertThat(json).contains("\"type\":\"try-on\"").contains("\"isStarred\":true");
        assertThat(json).doesNotContain("orderKey").doesNotContain("recency").doesNotContain("styling");
        assertThat(mapper.readValue(json, HistoryItem.class)).isEqualTo(item);
    }

    @Test
    void unknownTypeDecodesToNull() throws Exception {
        HistoryItem item = mapper.readValue("{\"id\":\"model-1\",\"type\":\"sketch\"}", HistoryItem.class);

        assertThat(item.type()).isNull();
    }

    @Test
    void stateSurvivesJson() throws Exception {
        HistoryItem root = HistoryItem.builder()
                .id("model-1")
                .type(HistoryItemType.MODEL_GENERATION)
                .imageUrl("https://cdn.example/1.png")
                .baseModelId("model-1")
                .build();
        ProjectState state = ProjectState.builder()
                .id("p1")
                .modelDescription("linen blazer")
                .generationSettings(Map.of("seed", 7))
                .generatedModelHistory(List.of(root))
                .stylingHistory(Map.of("model-1", List.of()))
                .wardrobe(List.of(new WardrobeItem(
                        "w-5", "Scarf", "https://cdn.example/w.png", "accessories", null, WardrobeSource.USER, null,
                        null)))
                .updatedAt(1000L)
                .syncVersion(3L)
                .build();

        ProjectState back = mapper.readValue(mapper.writeValueAsString(state), ProjectState.class);

        assertThat(back).isEqualTo(state);
        assertThat(back.stylingRootIds()).containsExactly("model-1");
    }

    @Test
    void sameContentIgnoresClocks() {
        ProjectState a = ProjectState.builder().id("p1").modelDescription("x").updatedAt(1).syncVersion(1).build();
        ProjectState b = a.toBuilder().updatedAt(99).syncVersion(7).build();

        assertThat(a.sameContent(b)).isTrue();
        assertThat(a).isNotEqualTo(b);
    }
}
