package com.farmsentinel.core.ensemble;

import com.farmsentinel.core.config.SeverityThresholds;
import com.farmsentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SeverityClassifier}.
 */
class SeverityClassifierTest {

    private final SeverityClassifier classifier = SeverityClassifier.defaults();

    @Test
    @DisplayName("Should map scores to tiers with inclusive lower bounds")
    void shouldClassifyAtBoundaries() {
        assertThat(classifier.classify(0.0)).isEqualTo(Severity.LOW);
        assertThat(classifier.classify(0.4999)).isEqualTo(Severity.LOW);
        assertThat(classifier.classify(0.5)).isEqualTo(Severity.MEDIUM);
        assertThat(classifier.classify(0.7999)).isEqualTo(Severity.MEDIUM);
        assertThat(classifier.classify(0.8)).isEqualTo(Severity.HIGH);
        assertThat(classifier.classify(1.0)).isEqualTo(Severity.HIGH);
    }

    @Test
    @DisplayName("Should use configured thresholds")
    void shouldUseCustomThresholds() {
        SeverityClassifier custom = new SeverityClassifier(new SeverityThresholds(0.3, 0.6));

        assertThat(custom.classify(0.35)).isEqualTo(Severity.MEDIUM);
        assertThat(custom.classify(0.6)).isEqualTo(Severity.HIGH);
    }

    @Test
    @DisplayName("Should reject thresholds out of order")
    void shouldRejectInvertedThresholds() {
        assertThatThrownBy(() -> new SeverityClassifier(new SeverityThresholds(0.9, 0.8)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
