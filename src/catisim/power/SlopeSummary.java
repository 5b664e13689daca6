package catisim.power;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

/**
 * Сводка оценок коэффициента задержки по сошедшимся репликам одного размера выборки.
 * <p>
 * Интервал для среднего — нормальное приближение mean ± z·sd/√n.
 * requiredReplicates — сколько реплик нужно, чтобы полуширина интервала была
 * не больше relativeError·|mean|; 0, если оценить нельзя (sd = 0 или mean = 0).
 */
public record SlopeSummary(double mean,
                           double std,
                           double ciLow,
                           double ciHigh,
                           int requiredReplicates,
                           long count) {

    public static final SlopeSummary EMPTY =
            new SlopeSummary(Double.NaN, Double.NaN, Double.NaN, Double.NaN, 0, 0);

    /**
     * Конечные значения копятся в SummaryStatistics; NaN и бесконечности пропускаются.
     */
    public static SlopeSummary of(double[] slopes, double z, double relativeError) {
        SummaryStatistics stats = new SummaryStatistics();
        for (double s : slopes) {
            if (Double.isFinite(s)) stats.addValue(s);
        }
        return of(stats, z, relativeError);
    }

    public static SlopeSummary of(SummaryStatistics stats, double z, double relativeError) {
        long n = stats.getN();
        if (n == 0) return EMPTY;

        double mean = stats.getMean();
        // у одной реплики дисперсия не определена
        double std = n < 2 ? 0.0 : stats.getStandardDeviation();
        double margin = z * std / Math.sqrt(n);

        int required = 0;
        double tolerance = relativeError * Math.abs(mean);
        if (tolerance > 0.0 && std > 0.0) {
            required = (int) Math.ceil(Math.pow(z * std / tolerance, 2));
        }
        return new SlopeSummary(mean, std, mean - margin, mean + margin, required, n);
    }
}
