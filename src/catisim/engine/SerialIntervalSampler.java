package catisim.engine;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * Серийный интервал: время от начала болезни родителя до начала болезни потомка, сут.
 */
@FunctionalInterface
public interface SerialIntervalSampler {

    double sample(RandomGenerator rng);

    static SerialIntervalSampler gamma(double mean, double sd) {
        if (!(mean > 0.0) || !(sd > 0.0)) {
            throw new IllegalArgumentException("serial interval mean/sd must be > 0");
        }
        return rng -> Sampling.gamma(rng, mean, sd);
    }
}
