package catisim.engine;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * Дискретное NB-распределение в целых сутках (задержки) или штуках (гетерогенность).
 */
public record CountDistribution(double mean, double dispersion) {

    public int sample(RandomGenerator rng) {
        return Sampling.negativeBinomial(rng, mean, dispersion);
    }
}
