package catisim.config;

import java.util.Arrays;

/**
 * Конфигурация запуска: сколько колец, сколько реплик Monte Carlo, какие размеры выборки.
 * Эпидемиологию сюда не кладём — это StudyParameters.
 */
public class SimulationConfig {

    /** Количество симулируемых колец. */
    private final int ringCount;

    /** Количество реплик Monte Carlo на один размер выборки. */
    private final int replicates;

    /** Кандидатные размеры пилотной выборки (по возрастанию). */
    private final int[] sampleSizes;

    /** Количество потоков для параллельного запуска. */
    private final int threads;

    /** Базовый сид; сиды колец и реплик выводятся из него. */
    private final long baseSeed;

    public SimulationConfig(int ringCount,
                            int replicates,
                            int[] sampleSizes,
                            int threads,
                            long baseSeed) {
        if (ringCount <= 0) throw new ConfigurationException("ringCount must be > 0");
        if (replicates <= 0) throw new ConfigurationException("replicates must be > 0");
        if (threads <= 0) throw new ConfigurationException("threads must be > 0");
        if (sampleSizes == null || sampleSizes.length == 0) {
            throw new ConfigurationException("sampleSizes must not be empty");
        }
        int[] sorted = sampleSizes.clone();
        Arrays.sort(sorted);
        for (int i = 1; i < sorted.length; i++) {
            if (sorted[i] == sorted[i - 1]) {
                throw new ConfigurationException("duplicate sample size: " + sorted[i]);
            }
        }
        this.ringCount = ringCount;
        this.replicates = replicates;
        this.sampleSizes = sorted;
        this.threads = threads;
        this.baseSeed = baseSeed;
    }

    public int getRingCount() {
        return ringCount;
    }

    public int getReplicates() {
        return replicates;
    }

    public int[] getSampleSizes() {
        return sampleSizes.clone();
    }

    public int getThreads() {
        return threads;
    }

    public long getBaseSeed() {
        return baseSeed;
    }

    public SimulationConfig withBaseSeed(long newSeed) {
        return new SimulationConfig(ringCount, replicates, sampleSizes, threads, newSeed);
    }
}
