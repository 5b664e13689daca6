package catisim.engine;

import catisim.model.Case;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ReportingDelayModel}.
 */
class ReportingDelayModelTest {

    // до конца вмешательства задержка заведомо > 0, после — ровно 0
    private final ReportingDelayModel model = new ReportingDelayModel(
            new CountDistribution(100.0, Double.POSITIVE_INFINITY),
            new CountDistribution(0.0, 1.0));

    @Test
    @DisplayName("Delay distribution switches at the intervention end")
    void switchesAtInterventionEnd() {
        Well19937c rng = new Well19937c(42L);

        assertThat(model.sampleDelay(4.9, 5.0, rng)).isPositive();
        assertThat(model.sampleDelay(5.0, 5.0, rng)).isZero();
        assertThat(model.sampleDelay(8.0, 5.0, rng)).isZero();
    }

    @Test
    @DisplayName("Index case uses the ring delay and anchors time since index report")
    void indexAnchorsReportTimes() {
        List<Case> chain = List.of(
                Case.unreported(3, 0, 0, 0.0),
                Case.unreported(3, 1, 1, 6.0),
                Case.unreported(3, 2, 1, 7.5));

        List<Case> reported = model.reportAll(chain, 5.0, 4, new Well19937c(1L));

        assertThat(reported).hasSize(3);
        assertThat(reported.get(0).reportTime()).isEqualTo(4.0);
        assertThat(reported.get(0).sinceIndexReport()).isEqualTo(0.0);
        assertThat(reported.get(1).reportTime()).isEqualTo(6.0);
        assertThat(reported.get(1).sinceIndexReport()).isEqualTo(2.0);
        assertThat(reported.get(2).sinceIndexReport()).isEqualTo(3.5);
        assertThat(reported).allMatch(Case::isReported);
    }

    @Test
    @DisplayName("Case reported before the index gets a negative time since index report")
    void earlyReporterIsNegative() {
        ReportingDelayModel instant = new ReportingDelayModel(
                new CountDistribution(0.0, 1.0), new CountDistribution(0.0, 1.0));
        List<Case> chain = List.of(Case.unreported(0, 0, 0, 0.0), Case.unreported(0, 1, 1, 2.0));

        List<Case> reported = instant.reportAll(chain, 10.0, 5, new Well19937c(1L));

        assertThat(reported.get(1).sinceIndexReport()).isEqualTo(-3.0);
    }

    @Test
    @DisplayName("Should reject a chain that does not start with the index case")
    void rejectsChainWithoutIndex() {
        List<Case> chain = List.of(Case.unreported(0, 1, 1, 2.0));

        assertThatThrownBy(() -> model.reportAll(chain, 5.0, 1, new Well19937c(1L)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
