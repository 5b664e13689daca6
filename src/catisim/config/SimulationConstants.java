package catisim.config;

/**
 * Глобальные константы симуляции.
 * Всё, что не является входным параметром исследования, но влияет на расчёт, должно находиться здесь.
 */
public final class SimulationConstants {

    /** Порог значимости для коэффициента задержки */
    public static final double SIGNIFICANCE_LEVEL = 0.05;

    /** Уровень доверия для интервалов (мощность, коэффициенты) */
    public static final double CONFIDENCE_LEVEL = 0.95;

    // =========================================================================
    // ======================   ОГРАНИЧИТЕЛИ ЦЕПОЧКИ  ==========================
    // =========================================================================

    /** Максимальная глубина цепочки (поколений) до аварийной остановки */
    public static final int MAX_GENERATIONS = 1_000;

    /** Максимальное число случаев в одном кольце до аварийной остановки */
    public static final int MAX_CASES_PER_RING = 100_000;

    // =========================================================================
    // ===========================   СИДЫ  =====================================
    // =========================================================================

    /** Шаг сида между кольцами */
    public static final long RING_SEED_STRIDE = 10_000L;

    /** Смещение потока гетерогенности относительно потока симуляции */
    public static final long HETEROGENEITY_SALT = 7_919L;

    /** Шаг сида между репликами Monte Carlo */
    public static final long REPLICATE_SEED_STRIDE = 10_000L;

    /** Шаг сида между размерами выборки (1e10) */
    public static final long SAMPLE_SIZE_SEED_STRIDE = 10_000_000_000L;

    // =========================================================================
    // ========================   РЕГРЕССИЯ  ===================================
    // =========================================================================

    /** Минимальный размер пилотной выборки (2 фикс. эффекта + дисперсия + theta + 1) */
    public static final int MIN_SAMPLE_SIZE = 5;

    /** Максимум итераций PQL/IRLS */
    public static final int REGRESSION_MAX_ITERATIONS = 1_000;

    /** Критерий сходимости по изменению коэффициентов */
    public static final double REGRESSION_TOLERANCE = 1e-7;

    /** Верхняя граница theta (практически Пуассон) */
    public static final double MAX_THETA = 1e6;

    /** Нижняя граница theta */
    public static final double MIN_THETA = 1e-4;

    /** Нижняя граница дисперсии случайного intercept */
    public static final double MIN_RANDOM_EFFECT_VARIANCE = 1e-8;

    private SimulationConstants() {}
}
