package com.keyphraseforge.core.quota;

import com.keyphraseforge.core.model.CategoryQuota;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link QuotaTracker}.
 */
class QuotaTrackerTest {

    private CategoryCounter counter;
    private QuotaTracker tracker;

    @BeforeEach
    void setUp() {
        counter = new CategoryCounter();
        tracker = new QuotaTracker(Map.of(
            "reference", new CategoryQuota("reference", 2, 1),
            "guide", new CategoryQuota("guide", 5, 0)
        ), 5, counter);
    }

    @Test
    void shouldAdmit_belowSoftTarget_admits() {
        tracker.record("reference");

        assertThat(tracker.shouldAdmit("reference")).isEqualTo(QuotaDecision.ADMIT);
    }

    @Test
    void shouldAdmit_withinOverflowMargin_admitsOverQuota() {
        tracker.record("reference");
        tracker.record("reference");

        assertThat(tracker.shouldAdmit("reference")).isEqualTo(QuotaDecision.ADMIT_OVER_QUOTA);
    }

    @Test
    void shouldAdmit_pastMarginWithGlobalBudgetLeft_stillAdmitsOverQuota() {
        for (int i = 0; i < 3; i++) {
            tracker.record("reference");
        }

        assertThat(counter.total()).isEqualTo(3);
        assertThat(tracker.shouldAdmit("reference")).isEqualTo(QuotaDecision.ADMIT_OVER_QUOTA);
    }

    @Test
    void shouldAdmit_pastMarginAndGlobalTargetReached_rejects() {
        for (int i = 0; i < 3; i++) {
            tracker.record("reference");
        }
        tracker.record("guide");
        tracker.record("guide");

        assertThat(tracker.shouldAdmit("reference")).isEqualTo(QuotaDecision.REJECT);
        assertThat(tracker.shouldAdmit("guide")).isEqualTo(QuotaDecision.ADMIT);
    }

    @Test
    void shouldAdmit_unknownCategory_isAlwaysOverQuota() {
        assertThat(tracker.shouldAdmit("changelog")).isEqualTo(QuotaDecision.ADMIT_OVER_QUOTA);
    }

    @Test
    void record_countsPerCategoryInAdmissionOrder() {
        tracker.record("guide");
        tracker.record("reference");
        tracker.record("guide");

        assertThat(counter.counts()).containsExactly(Map.entry("guide", 2), Map.entry("reference", 1));
        assertThat(counter.total()).isEqualTo(3);
    }
}
