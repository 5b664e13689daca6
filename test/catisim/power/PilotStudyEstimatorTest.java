package catisim.power;

import catisim.config.ConfigurationException;
import catisim.model.DelayBucket;
import catisim.model.RingSummary;
import catisim.regression.CountData;
import catisim.regression.CountRegression;
import catisim.regression.EstimationNonConvergenceException;
import catisim.regression.RegressionFit;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PilotStudyEstimator}.
 */
class PilotStudyEstimatorTest {

    static final RegressionFit FIT = new RegressionFit(-4.0, 0.1, 0.2, 0.03, 1e-10, 0.001,
            -4.4, -3.6, 0.04, 0.16, 1.1, 2.0, 0.01, 12);

    /** Кольцо i: i случаев, задержка i % 8, категория по i % 3, популяция 100 + i. */
    static List<RingSummary> table(int rows) {
        List<RingSummary> out = new ArrayList<>(rows);
        for (int i = 0; i < rows; i++) {
            int delay = i % 8;
            out.add(new RingSummary(i, i + 1, 0.0, 100.0 + i, delay, DelayBucket.of(delay), 0.8,
                    String.valueOf(1 + i % 3), 0, i % 3));
        }
        return out;
    }

    @Test
    @DisplayName("Builds the regression input from a sample without replacement")
    void buildsCountData() {
        AtomicReference<CountData> seen = new AtomicReference<>();
        CountRegression capture = data -> {
            seen.set(data);
            return FIT;
        };
        PilotStudyEstimator estimator = new PilotStudyEstimator(table(40), capture);

        PilotEstimate e = estimator.run(25, 3, new Well19937c(8L));

        CountData data = seen.get();
        assertThat(data.size()).isEqualTo(25);
        assertThat(Arrays.stream(data.response()).distinct().count()).isEqualTo(25);
        assertThat(data.groupCount()).isBetween(1, 3);
        for (int i = 0; i < data.size(); i++) {
            int ringId = data.response()[i] - 1;
            assertThat(data.covariate()[i]).isEqualTo(ringId % 8);
            assertThat(data.offset()[i]).isEqualTo(Math.log(100.0 + ringId));
        }
        assertThat(e.converged()).isTrue();
        assertThat(e.sampleSize()).isEqualTo(25);
        assertThat(e.replicate()).isEqualTo(3);
        assertThat(e.slope()).isEqualTo(0.1);
        assertThat(e.isSignificant()).isTrue();
    }

    @Test
    @DisplayName("Non-convergence becomes a failed estimate")
    void nonConvergenceRecorded() {
        CountRegression failing = data -> {
            throw new EstimationNonConvergenceException("no convergence after 3 iterations");
        };
        PilotStudyEstimator estimator = new PilotStudyEstimator(table(20), failing);

        PilotEstimate e = estimator.run(10, 0, new Well19937c(1L));

        assertThat(e.converged()).isFalse();
        assertThat(e.isSignificant()).isFalse();
        assertThat(e.slope()).isNaN();
        assertThat(e.failureReason()).contains("no convergence");
    }

    @Test
    @DisplayName("Same generator seed draws the same pilot sample")
    void reproducibleSample() {
        List<int[]> seen = new ArrayList<>();
        CountRegression capture = data -> {
            seen.add(data.response());
            return FIT;
        };
        PilotStudyEstimator estimator = new PilotStudyEstimator(table(50), capture);

        estimator.run(20, 0, new Well19937c(5L));
        estimator.run(20, 0, new Well19937c(5L));

        assertThat(seen.get(1)).containsExactly(seen.get(0));
    }

    @Test
    @DisplayName("Should reject sample sizes outside the table")
    void rejectsBadSampleSize() {
        PilotStudyEstimator estimator = new PilotStudyEstimator(table(20), data -> FIT);

        assertThatThrownBy(() -> estimator.run(21, 0, new Well19937c(1L)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("exceeds");
        assertThatThrownBy(() -> estimator.validateSampleSize(4))
                .isInstanceOf(ConfigurationException.class);
        assertThat(estimator.tableSize()).isEqualTo(20);
    }

    @Test
    @DisplayName("Should reject an empty ring table")
    void rejectsEmptyTable() {
        assertThatThrownBy(() -> new PilotStudyEstimator(List.of(), data -> FIT))
                .isInstanceOf(ConfigurationException.class);
    }
}
