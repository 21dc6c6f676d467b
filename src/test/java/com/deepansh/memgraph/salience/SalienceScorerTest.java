package com.deepansh.memgraph.salience;

import com.deepansh.memgraph.config.MemoryProperties;
import com.deepansh.memgraph.store.TestWorkspace;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SalienceScorerTest {

    private final SalienceScorer scorer = new SalienceScorer(TestWorkspace.CLOCK, new MemoryProperties());

    @Test
    void score_todayWithZeroAccesses_isZero() {
        assertThat(scorer.score("2026-03-01", 0)).isEqualTo(0.0);
    }

    @Test
    void score_todaySingleAccess_isLnTwo() {
        assertThat(scorer.score("2026-03-01T08:15:00", 1)).isCloseTo(Math.log(2), within(1e-9));
    }

    @Test
    void recencyWeight_decaysExponentially() {
        // 365 / 3 days is one e-folding
        assertThat(scorer.recencyWeight("2026-03-01")).isEqualTo(1.0);
        assertThat(scorer.recencyWeight("2025-10-30", 365)).isCloseTo(Math.exp(-122 / (365 / 3.0)), within(1e-9));
    }

    @Test
    void recencyWeight_beyondWindow_isZero() {
        assertThat(scorer.recencyWeight("2025-03-01")).isEqualTo(0.0);
        assertThat(scorer.recencyWeight("2020-01-01")).isEqualTo(0.0);
    }

    @Test
    void recencyWeight_futureDate_countsAsToday() {
        assertThat(scorer.recencyWeight("2026-04-15")).isEqualTo(1.0);
    }

    @Test
    void recencyWeight_unparsable_usesLowDefault() {
        assertThat(scorer.recencyWeight("last tuesday")).isEqualTo(SalienceScorer.UNPARSABLE_RECENCY);
        assertThat(scorer.recencyWeight(null)).isEqualTo(SalienceScorer.UNPARSABLE_RECENCY);
    }

    @Test
    void score_nonDecreasingInAccessCount() {
        double previous = -1;
        for (int count = 0; count <= 50; count++) {
            double score = scorer.score("2026-01-15", count);
            assertThat(score).isGreaterThanOrEqualTo(previous);
            previous = score;
        }
    }

    @Test
    void score_nonIncreasingWithAge() {
        double previous = Double.MAX_VALUE;
        for (int daysAgo = 0; daysAgo <= 400; daysAgo += 7) {
            String date = TestWorkspace.CLOCK.instant().atZone(TestWorkspace.CLOCK.getZone())
                    .toLocalDate().minusDays(daysAgo).toString();
            double score = scorer.score(date, 3);
            assertThat(score).isLessThanOrEqualTo(previous);
            previous = score;
        }
    }
}
