package catisim.config;

/**
 * Семейство распределения числа вторичных случаев.
 * Определяется один раз при сборке параметров, дальше по имени не диспетчеризуем.
 */
public enum OffspringFamily {
    NEGATIVE_BINOMIAL,
    POISSON;

    /**
     * Бесконечная (или незаданная) дисперсия означает пуассоновский предел.
     */
    public static OffspringFamily forDispersion(double dispersion) {
        if (Double.isNaN(dispersion) || Double.isInfinite(dispersion)) {
            return POISSON;
        }
        if (dispersion <= 0.0) {
            throw new ConfigurationException("dispersion must be > 0, got " + dispersion);
        }
        return NEGATIVE_BINOMIAL;
    }
}
