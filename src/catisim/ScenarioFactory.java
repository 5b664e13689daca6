package catisim;

import catisim.config.SimulationConfig;
import catisim.config.StudyParameters;

public final class ScenarioFactory {

    private ScenarioFactory() {}

    public static StudyParameters defaultParams() {
        return new StudyParameters(
                2.0, 1.5,
                5.0, 2.5,
                500.0, 250.0, 0.1,
                2.0, 2.0,
                3.0, 2.0,
                1.0, 2.0,
                0, 7,
                3.0,
                3.0, 7.0,
                0.66, 0.47, 0.65, 0.8,
                30.0,
                1.0, 1.0
        );
    }

    public static SimulationConfig defaultConfig(int threads) {
        return new SimulationConfig(
                1_000,
                1_000,
                new int[]{50, 75, 100, 125, 150},
                threads,
                1_000_000L
        );
    }
}
