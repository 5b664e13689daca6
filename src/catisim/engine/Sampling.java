package catisim.engine;

import org.apache.commons.math3.distribution.GammaDistribution;
import org.apache.commons.math3.distribution.PoissonDistribution;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Генерация случайных величин поверх переданного генератора.
 * Все распределения создаются на переданном rng, чтобы поток оставался воспроизводимым.
 */
public final class Sampling {

    private Sampling() {}

    public static int poisson(RandomGenerator rng, double mean) {
        if (!(mean > 0.0)) return 0;
        return new PoissonDistribution(rng, mean,
                PoissonDistribution.DEFAULT_EPSILON,
                PoissonDistribution.DEFAULT_MAX_ITERATIONS).sample();
    }

    /**
     * NB(mean, size) как смесь Gamma-Poisson; size = infinity вырождается в Пуассон.
     */
    public static int negativeBinomial(RandomGenerator rng, double mean, double size) {
        if (!(mean > 0.0)) return 0;
        if (Double.isInfinite(size)) return poisson(rng, mean);
        double lambda = new GammaDistribution(rng, size, mean / size).sample();
        return poisson(rng, lambda);
    }

    /**
     * Gamma, заданная средним и ст. отклонением.
     */
    public static double gamma(RandomGenerator rng, double mean, double sd) {
        double shape = (mean * mean) / (sd * sd);
        double scale = (sd * sd) / mean;
        return new GammaDistribution(rng, shape, scale).sample();
    }

    /** Равномерное целое на [min, max] включительно. */
    public static int uniformInt(RandomGenerator rng, int min, int max) {
        if (max < min) throw new IllegalArgumentException("max < min: " + max + " < " + min);
        return min + rng.nextInt(max - min + 1);
    }
}
