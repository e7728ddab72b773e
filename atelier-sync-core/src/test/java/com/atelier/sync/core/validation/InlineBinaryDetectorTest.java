package com.atelier.sync.core.validation;

import static org.assertj.core.api.Assertions.assertThat;

import com.atelier.project.model.HistoryItem;
import com.atelier.project.model.HistoryItemType;
import com.atelier.project.model.ProjectState;
import com.atelier.project.model.WardrobeItem;
import com.atelier.project.model.WardrobeSource;
import com.atelier.project.validation.ValidationResult;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InlineBinaryDetectorTest {

    private final InlineBinaryDetector detector = new InlineBinaryDetector();

    private static HistoryItem item(String id, String url) {
        return HistoryItem.builder().id(id).type(HistoryItemType.MODEL_GENERATION).imageUrl(url).build();
    }

    @Test
    void acceptsHostedReferences() {
        ProjectState state = ProjectState.builder()
                .id("p1")
                .generatedModelHistory(List.of(item("model-1", "https://cdn.example/model-1.png")))
                .generationSettings(Map.of("seed", 42, "style", "editorial"))
                .build();

        assertThat(detector.validate(state).ok()).isTrue();
    }

    @Test
    void rejectsDataUrlAndReportsItsPath() {
        ProjectState state = ProjectState.builder()
                .id("p1")
                .generatedModelHistory(List.of(
                        item("model-1", "https://cdn.example/model-1.png"),
                        item("model-2", "data:image/png;base64,iVBORw0KGgo=")))
                .build();

        ValidationResult result = detector.validate(state);

        assertThat(result.isRejected()).isTrue();
        assertThat(result.path()).isEqualTo("state.generatedModelHistory[1].imageUrl");
        assertThat(result.reason()).contains("state.generatedModelHistory[1].imageUrl");
    }

    @Test
    void findsInlineDataInsideStylingAndWardrobe() {
        HistoryItem look = HistoryItem.builder()
                .id("tryon-1")
                .type(HistoryItemType.TRY_ON)
                .imageUrl("DATA:image/jpeg;base64,/9j/")
                .build();
        ProjectState styled = ProjectState.builder().id("p1").stylingHistory(Map.of("model-1", List.of(look))).build();
        ProjectState wardrobe = ProjectState.builder()
                .id("p1")
                .wardrobe(List.of(new WardrobeItem(
                        "w1", "Coat", "data:image/png;base64,AAAA", "outer", null, WardrobeSource.USER, null, null)))
                .build();

        assertThat(detector.validate(styled).path()).isEqualTo("state.stylingHistory[model-1][0].imageUrl");
        assertThat(detector.validate(wardrobe).path()).isEqualTo("state.wardrobe[0].url");
    }

    @Test
    void rejectsRawBytesInGenerationSettings() {
        ProjectState state = ProjectState.builder()
                .id("p1")
                .generationSettings(Map.of("mask", new byte[] {1, 2, 3}))
                .build();

        assertThat(detector.validate(state).path()).isEqualTo("state.generationSettings[mask]");
    }

    @Test
    void markerMustBeAtTheStart() {
        assertThat(InlineBinaryDetector.isInlineBinary("https://cdn.example/data:file.png")).isFalse();
        assertThat(InlineBinaryDetector.isInlineBinary("data:")).isTrue();
        assertThat(InlineBinaryDetector.isInlineBinary("dat")).isFalse();
        assertThat(InlineBinaryDetector.isInlineBinary(null)).isFalse();
    }

    @Test
    void nullPayloadIsAccepted() {
        assertThat(detector.validate(null).ok()).isTrue();
    }
}
