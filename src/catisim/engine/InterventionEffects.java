package catisim.engine;

import catisim.config.ConfigurationException;
import catisim.config.StudyParameters;

/**
 * Множители восприимчивых по фазам CATI.
 * Множитель = доля восприимчивых, остающаяся после подавления: 1 - coverage * (1 - prod(1 - eff_i)).
 */
public record InterventionEffects(double washAndAntibiotic,
                                  double washOnly,
                                  double washPlusVaccine) {

    public InterventionEffects {
        requireMultiplier("washAndAntibiotic", washAndAntibiotic);
        requireMultiplier("washOnly", washOnly);
        requireMultiplier("washPlusVaccine", washPlusVaccine);
    }

    public static InterventionEffects from(StudyParameters p) {
        double coverage = p.getCoverage();
        return new InterventionEffects(
                multiplier(coverage, p.getWashEfficacy(), p.getAntibioticEfficacy()),
                multiplier(coverage, p.getWashEfficacy()),
                multiplier(coverage, p.getWashEfficacy(), p.getVaccineEfficacy())
        );
    }

    static double multiplier(double coverage, double... efficacies) {
        double escape = 1.0;
        for (double e : efficacies) escape *= (1.0 - e);
        return 1.0 - coverage * (1.0 - escape);
    }

    private static void requireMultiplier(String name, double v) {
        if (!(v >= 0.0 && v <= 1.0)) {
            throw new ConfigurationException(name + " multiplier must be in [0,1], got " + v);
        }
    }
}
