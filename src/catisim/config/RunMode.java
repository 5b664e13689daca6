package catisim.config;

import java.util.Locale;

/**
 * Режим запуска: SINGLE — только первый размер выборки из конфигурации, SWEEP — все.
 */
public enum RunMode {
    SINGLE,
    SWEEP;

    public int[] sampleSizes(SimulationConfig cfg) {
        int[] all = cfg.getSampleSizes();
        return this == SINGLE ? new int[]{all[0]} : all;
    }

    /** Регистр не важен: "single", "Sweep". */
    public static RunMode parse(String raw) {
        String name = raw.trim().toUpperCase(Locale.ROOT);
        for (RunMode m : values()) {
            if (m.name().equals(name)) return m;
        }
        throw new ConfigurationException("mode: ожидается SINGLE или SWEEP, получено '" + raw + "'");
    }
}
