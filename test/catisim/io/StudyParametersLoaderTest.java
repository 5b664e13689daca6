package catisim.io;

import catisim.ScenarioFactory;
import catisim.config.ConfigurationException;
import catisim.config.RunMode;
import catisim.config.SimulationConfig;
import catisim.config.StudyParameters;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link StudyParametersLoader}.
 */
class StudyParametersLoaderTest {

    private final StudyParametersLoader loader = new StudyParametersLoader();
    private final StudyParameters defaults = ScenarioFactory.defaultParams();

    @Test
    @DisplayName("Should override only the keys present in the resource")
    void appliesOverrides() throws IOException {
        Properties props = loader.loadResource("override.properties");

        StudyParameters p = loader.applyStudy(props, defaults);

        assertThat(p.getMeanOffspring()).isEqualTo(1.2);
        assertThat(p.getCoverage()).isEqualTo(0.5);
        assertThat(p.getImplementationDelayMaxDays()).isEqualTo(10);
        assertThat(p.getOffspringDispersion()).isEqualTo(defaults.getOffspringDispersion());
        assertThat(p.getFollowUpDays()).isEqualTo(defaults.getFollowUpDays());
    }

    @Test
    @DisplayName("Should read run settings and sort sample sizes")
    void appliesConfig() throws IOException {
        SimulationConfig base = ScenarioFactory.defaultConfig(2);

        SimulationConfig cfg = loader.applyConfig(loader.loadResource("override.properties"), base);

        assertThat(cfg.getReplicates()).isEqualTo(20);
        assertThat(cfg.getSampleSizes()).containsExactly(10, 20, 30);
        assertThat(cfg.getBaseSeed()).isEqualTo(42L);
        assertThat(cfg.getRingCount()).isEqualTo(base.getRingCount());
        assertThat(cfg.getThreads()).isEqualTo(2);
        assertThat(cfg.withBaseSeed(7L).getBaseSeed()).isEqualTo(7L);
    }

    @Test
    @DisplayName("Should select the run mode from the mode key")
    void appliesMode() throws IOException {
        Properties props = loader.loadResource("override.properties");
        SimulationConfig cfg = loader.applyConfig(props, ScenarioFactory.defaultConfig(2));

        RunMode mode = loader.applyMode(props, RunMode.SWEEP);

        assertThat(mode).isEqualTo(RunMode.SINGLE);
        assertThat(mode.sampleSizes(cfg)).containsExactly(10);
        assertThat(RunMode.SWEEP.sampleSizes(cfg)).containsExactly(10, 20, 30);
        assertThat(loader.applyMode(new Properties(), RunMode.SWEEP)).isEqualTo(RunMode.SWEEP);
    }

    @Test
    @DisplayName("Should reject an unknown run mode")
    void rejectsBadMode() {
        Properties props = new Properties();
        props.setProperty("mode", "sweeep");

        assertThatThrownBy(() -> loader.applyMode(props, RunMode.SWEEP))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("sweeep");
    }

    @Test
    @DisplayName("Should load a properties file from disk")
    void loadsFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("study.properties");
        Files.writeString(file, "offspringDispersion=Infinity\nfollowUpDays=21\n", StandardCharsets.UTF_8);

        StudyParameters p = loader.applyStudy(loader.load(file), defaults);

        assertThat(p.getOffspringDispersion()).isInfinite();
        assertThat(p.getFollowUpDays()).isEqualTo(21.0);
    }

    @Test
    @DisplayName("Bundled defaults resource is valid")
    void bundledResource() throws IOException {
        Properties props = loader.loadResource("study.properties");

        assertThat(loader.applyStudy(props, defaults)).isNotNull();
        assertThat(loader.applyConfig(props, ScenarioFactory.defaultConfig(1)).getSampleSizes()).isNotEmpty();
    }

    @Test
    @DisplayName("Should reject unknown keys and malformed numbers")
    void rejectsBadInput() {
        Properties unknown = new Properties();
        unknown.setProperty("meanOfspring", "2");
        Properties malformed = new Properties();
        malformed.setProperty("coverage", "high");
        Properties invalid = new Properties();
        invalid.setProperty("coverage", "1.5");

        assertThatThrownBy(() -> loader.applyStudy(unknown, defaults))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("meanOfspring");
        assertThatThrownBy(() -> loader.applyStudy(malformed, defaults))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("coverage");
        assertThatThrownBy(() -> loader.applyStudy(invalid, defaults))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void missingResource() {
        assertThatThrownBy(() -> loader.loadResource("does-not-exist.properties"))
                .isInstanceOf(IOException.class);
    }
}
