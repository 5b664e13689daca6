package catisim.config;

import catisim.ScenarioFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link StudyParameters}, {@link StudyParametersBuilder} and {@link SimulationConfig}.
 */
class StudyParametersTest {

    private final StudyParameters base = ScenarioFactory.defaultParams();

    @Test
    @DisplayName("Builder copies every field and overrides only what is set")
    void builderCopies() {
        StudyParameters p = StudyParametersBuilder.from(base)
                .setVaccineDelayDays(10.0)
                .setPopulationMean(800.0)
                .build();

        assertThat(p.getVaccineDelayDays()).isEqualTo(10.0);
        assertThat(p.getPopulationMean()).isEqualTo(800.0);
        assertThat(p).usingRecursiveComparison()
                .ignoringFields("vaccineDelayDays", "populationMean")
                .isEqualTo(base);
    }

    @Test
    @DisplayName("Should reject invalid epidemiological parameters")
    void rejectsInvalid() {
        assertThatThrownBy(() -> StudyParametersBuilder.from(base).setPopulationMean(0.0).build())
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> StudyParametersBuilder.from(base).setOffspringDispersion(-1.0).build())
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> StudyParametersBuilder.from(base).setWashOnlyDelayDays(8.0).build())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("phase boundaries");
        assertThatThrownBy(() -> StudyParametersBuilder.from(base).setCoverage(1.1).build())
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> StudyParametersBuilder.from(base).setImplementationDelayMinDays(9).build())
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Offspring family follows the dispersion")
    void offspringFamily() {
        assertThat(base.getOffspringFamily()).isEqualTo(OffspringFamily.NEGATIVE_BINOMIAL);
        assertThat(StudyParametersBuilder.from(base).setOffspringDispersion(Double.POSITIVE_INFINITY).build()
                .getOffspringFamily()).isEqualTo(OffspringFamily.POISSON);
    }

    @Test
    @DisplayName("Run config sorts sample sizes and rejects duplicates")
    void simulationConfig() {
        SimulationConfig cfg = new SimulationConfig(100, 10, new int[]{75, 50}, 2, 5L);

        assertThat(cfg.getSampleSizes()).containsExactly(50, 75);
        assertThatThrownBy(() -> new SimulationConfig(100, 10, new int[]{50, 50}, 2, 5L))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("duplicate");
        assertThatThrownBy(() -> new SimulationConfig(0, 10, new int[]{50}, 2, 5L))
                .isInstanceOf(ConfigurationException.class);
    }
}
