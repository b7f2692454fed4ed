package tech.syncbridge.platform.sync;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConflictResolverTest {

    private static final Instant T1 = Instant.parse("2024-03-01T08:00:00Z");
    private static final Instant T2 = Instant.parse("2024-03-01T09:00:00Z");
    private static final Map<String, Object> SOURCE = Map.of("email", "new@example.com", "phone", "555");
    private static final Map<String, Object> TARGET = Map.of("email", "old@example.com", "company", "Acme");

    @Test
    @DisplayName("Most recent wins picks the newer side")
    void mostRecentWins_shouldPickNewerSide() {
        ConflictResolver.Decision targetNewer = ConflictResolver.resolve(ConflictPolicy.MOST_RECENT_WINS, SOURCE, T1, TARGET, T2);
        ConflictResolver.Decision sourceNewer = ConflictResolver.resolve(ConflictPolicy.MOST_RECENT_WINS, SOURCE, T2, TARGET, T1);

        assertThat(targetNewer.resolution()).isEqualTo(ConflictResolution.TARGET_WINS);
        assertThat(targetNewer.retained()).isEqualTo(TARGET);
        assertThat(sourceNewer.resolution()).isEqualTo(ConflictResolution.SOURCE_WINS);
    }

    @Test
    @DisplayName("Most recent wins sends ties and unknown times to the source")
    void mostRecentWins_shouldFavourSource_onTieOrMissingTimes() {
        assertThat(ConflictResolver.resolve(ConflictPolicy.MOST_RECENT_WINS, SOURCE, T1, TARGET, T1).resolution())
            .isEqualTo(ConflictResolution.SOURCE_WINS);
        assertThat(ConflictResolver.resolve(ConflictPolicy.MOST_RECENT_WINS, SOURCE, null, TARGET, null).resolution())
            .isEqualTo(ConflictResolution.SOURCE_WINS);
        assertThat(ConflictResolver.resolve(ConflictPolicy.MOST_RECENT_WINS, SOURCE, null, TARGET, T1).resolution())
            .isEqualTo(ConflictResolution.TARGET_WINS);
    }

    @Test
    @DisplayName("Fixed policies ignore modification times")
    void fixedPolicies_shouldIgnoreTimes() {
        assertThat(ConflictResolver.resolve(ConflictPolicy.SOURCE_WINS, SOURCE, T1, TARGET, T2).retained()).isEqualTo(SOURCE);
        assertThat(ConflictResolver.resolve(ConflictPolicy.TARGET_WINS, SOURCE, T2, TARGET, T1).retained()).isEqualTo(TARGET);

        ConflictResolver.Decision manual = ConflictResolver.resolve(ConflictPolicy.MANUAL_REVIEW, SOURCE, T1, TARGET, T2);
        assertThat(manual.resolution()).isEqualTo(ConflictResolution.MANUAL_REQUIRED);
        assertThat(manual.retained()).isNull();
    }

    @Test
    @DisplayName("Merge overlays source fields on target fields, recursing into nested objects")
    void merge_shouldOverlaySourceOnTarget() {
        Map<String, Object> source = Map.of("email", "new@example.com", "address", Map.of("city", "Berlin"));
        Map<String, Object> target = Map.of("company", "Acme", "address", Map.of("city", "Paris", "zip", "75001"));

        ConflictResolver.Decision decision = ConflictResolver.resolve(ConflictPolicy.MERGE, source, T1, target, T2);

        assertThat(decision.resolution()).isEqualTo(ConflictResolution.MERGE);
        assertThat(decision.retained())
            .containsEntry("email", "new@example.com")
            .containsEntry("company", "Acme")
            .containsEntry("address", Map.of("city", "Berlin", "zip", "75001"));
    }
}
