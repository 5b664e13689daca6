package catisim.power;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SlopeSummary}.
 */
class SlopeSummaryTest {

    @Test
    @DisplayName("Non-finite slopes are skipped")
    void skipsNonFinite() {
        SlopeSummary s = SlopeSummary.of(new double[]{0.1, Double.NaN, 0.3, Double.POSITIVE_INFINITY, 0.2}, 1.96, 0.1);

        assertThat(s.count()).isEqualTo(3L);
        assertThat(s.mean()).isCloseTo(0.2, within(1e-12));
        assertThat(s.std()).isCloseTo(0.1, within(1e-12));
        assertThat(s.ciLow()).isCloseTo(0.2 - 1.96 * 0.1 / Math.sqrt(3), within(1e-12));
        assertThat(s.ciHigh()).isCloseTo(0.2 + 1.96 * 0.1 / Math.sqrt(3), within(1e-12));
    }

    @Test
    @DisplayName("Required replicates bring the half-width down to the relative error")
    void requiredReplicates() {
        SummaryStatistics stats = new SummaryStatistics();
        stats.addValue(0.1);
        stats.addValue(0.3);
        stats.addValue(0.2);

        SlopeSummary s = SlopeSummary.of(stats, 1.96, 0.1);

        // (1.96 * 0.1 / (0.1 * 0.2))^2 = 96.04
        assertThat(s.requiredReplicates()).isEqualTo(97);
    }

    @Test
    @DisplayName("Single replicate has a degenerate interval and no replicate estimate")
    void singleValue() {
        SlopeSummary s = SlopeSummary.of(new double[]{0.05}, 1.96, 0.1);

        assertThat(s.count()).isEqualTo(1L);
        assertThat(s.ciLow()).isEqualTo(0.05);
        assertThat(s.ciHigh()).isEqualTo(0.05);
        assertThat(s.requiredReplicates()).isZero();
    }

    @Test
    @DisplayName("No usable slope yields the empty summary")
    void empty() {
        assertThat(SlopeSummary.of(new double[]{Double.NaN}, 1.96, 0.1)).isSameAs(SlopeSummary.EMPTY);
        assertThat(SlopeSummary.EMPTY.mean()).isNaN();
        assertThat(SlopeSummary.EMPTY.count()).isZero();
    }
}
