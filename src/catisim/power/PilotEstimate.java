package catisim.power;

import catisim.config.SimulationConstants;
import catisim.regression.RegressionFit;

/**
 * Одна реплика пилотного исследования (размер выборки, номер реплики).
 * Если подгонка не сошлась, converged = false, числовые поля NaN, причина в failureReason.
 */
public record PilotEstimate(int sampleSize,
                            int replicate,
                            boolean converged,
                            double intercept,
                            double slope,
                            double interceptPValue,
                            double slopePValue,
                            double interceptCiLow,
                            double interceptCiHigh,
                            double slopeCiLow,
                            double slopeCiHigh,
                            double overdispersionRatio,
                            double theta,
                            double randomEffectVariance,
                            String failureReason) {

    public static PilotEstimate fitted(int sampleSize, int replicate, RegressionFit f) {
        return new PilotEstimate(sampleSize, replicate, true,
                f.intercept(), f.slope(),
                f.interceptPValue(), f.slopePValue(),
                f.interceptCiLow(), f.interceptCiHigh(),
                f.slopeCiLow(), f.slopeCiHigh(),
                f.overdispersionRatio(), f.theta(), f.randomEffectVariance(),
                null);
    }

    public static PilotEstimate failed(int sampleSize, int replicate, String reason) {
        double nan = Double.NaN;
        return new PilotEstimate(sampleSize, replicate, false,
                nan, nan, nan, nan, nan, nan, nan, nan, nan, nan, nan,
                reason);
    }

    public boolean isSignificant() {
        return converged && slopePValue < SimulationConstants.SIGNIFICANCE_LEVEL;
    }
}
