package catisim.regression;

/**
 * Результат подгонки: фиксированные эффекты, их p-value и Wald-интервалы, статистики дисперсии.
 */
public record RegressionFit(double intercept,
                            double slope,
                            double interceptSe,
                            double slopeSe,
                            double interceptPValue,
                            double slopePValue,
                            double interceptCiLow,
                            double interceptCiHigh,
                            double slopeCiLow,
                            double slopeCiHigh,
                            double overdispersionRatio,
                            double theta,
                            double randomEffectVariance,
                            int iterations) {
}
