package catisim.config;

/**
 * Эпидемиологические параметры исследования (immutable).
 * Единица времени: сутки от начала болезни индексного случая.
 */
public class StudyParameters {

    // ---------- Передача ----------

    /**
     * Среднее число вторичных случаев на один случай (R).
     */
    private final double meanOffspring;

    /**
     * Дисперсия (size) отрицательного биномиального распределения потомства.
     * Double.POSITIVE_INFINITY — пуассоновский предел.
     */
    private final double offspringDispersion;

    /**
     * Серийный интервал (Gamma): среднее и ст. отклонение, сут.
     */
    private final double serialIntervalMean;
    private final double serialIntervalSd;

    // ---------- Кольцо ----------

    /**
     * Размер популяции кольца (Gamma): среднее и ст. отклонение, чел.
     */
    private final double populationMean;
    private final double populationSd;

    /**
     * Доля исходно иммунных в кольце.
     */
    private final double immuneFraction;

    // ---------- Задержки сообщения ----------

    /**
     * Задержка "начало болезни -> сообщение" для индексного случая (NB): среднее и size, сут.
     */
    private final double indexReportDelayMean;
    private final double indexReportDelayDispersion;

    /**
     * Задержка сообщения до окончания вмешательства (NB): среднее и size, сут.
     */
    private final double reportDelayBeforeMean;
    private final double reportDelayBeforeDispersion;

    /**
     * Задержка сообщения после окончания вмешательства (NB): среднее и size, сут.
     */
    private final double reportDelayAfterMean;
    private final double reportDelayAfterDispersion;

    // ---------- Вмешательство ----------

    /**
     * Задержка "сообщение об индексном случае -> старт CATI" (равномерно, целые сутки).
     */
    private final int implementationDelayMinDays;
    private final int implementationDelayMaxDays;

    /**
     * Длительность развёртывания вмешательства, сут.
     */
    private final double interventionDurationDays;

    /**
     * Через сколько суток после окончания вмешательства перестаёт действовать антибиотик.
     */
    private final double washOnlyDelayDays;

    /**
     * Через сколько суток после окончания вмешательства начинает действовать вакцина.
     */
    private final double vaccineDelayDays;

    /** Эффективность антибиотикопрофилактики (0..1). */
    private final double antibioticEfficacy;

    /** Эффективность WASH (вода, хранение) (0..1). */
    private final double washEfficacy;

    /** Эффективность вакцины (0..1). */
    private final double vaccineEfficacy;

    /** Охват кольца вмешательством (0..1). */
    private final double coverage;

    // ---------- Наблюдение ----------

    /**
     * Окно наблюдения после сообщения об индексном случае, сут.
     */
    private final double followUpDays;

    /**
     * Синтетический случайный эффект гетерогенности (NB): среднее и size.
     */
    private final double heterogeneityMean;
    private final double heterogeneityDispersion;

    public StudyParameters(double meanOffspring,
                           double offspringDispersion,
                           double serialIntervalMean,
                           double serialIntervalSd,
                           double populationMean,
                           double populationSd,
                           double immuneFraction,
                           double indexReportDelayMean,
                           double indexReportDelayDispersion,
                           double reportDelayBeforeMean,
                           double reportDelayBeforeDispersion,
                           double reportDelayAfterMean,
                           double reportDelayAfterDispersion,
                           int implementationDelayMinDays,
                           int implementationDelayMaxDays,
                           double interventionDurationDays,
                           double washOnlyDelayDays,
                           double vaccineDelayDays,
                           double antibioticEfficacy,
                           double washEfficacy,
                           double vaccineEfficacy,
                           double coverage,
                           double followUpDays,
                           double heterogeneityMean,
                           double heterogeneityDispersion) {
        this.meanOffspring = meanOffspring;
        this.offspringDispersion = offspringDispersion;
        this.serialIntervalMean = serialIntervalMean;
        this.serialIntervalSd = serialIntervalSd;
        this.populationMean = populationMean;
        this.populationSd = populationSd;
        this.immuneFraction = immuneFraction;
        this.indexReportDelayMean = indexReportDelayMean;
        this.indexReportDelayDispersion = indexReportDelayDispersion;
        this.reportDelayBeforeMean = reportDelayBeforeMean;
        this.reportDelayBeforeDispersion = reportDelayBeforeDispersion;
        this.reportDelayAfterMean = reportDelayAfterMean;
        this.reportDelayAfterDispersion = reportDelayAfterDispersion;
        this.implementationDelayMinDays = implementationDelayMinDays;
        this.implementationDelayMaxDays = implementationDelayMaxDays;
        this.interventionDurationDays = interventionDurationDays;
        this.washOnlyDelayDays = washOnlyDelayDays;
        this.vaccineDelayDays = vaccineDelayDays;
        this.antibioticEfficacy = antibioticEfficacy;
        this.washEfficacy = washEfficacy;
        this.vaccineEfficacy = vaccineEfficacy;
        this.coverage = coverage;
        this.followUpDays = followUpDays;
        this.heterogeneityMean = heterogeneityMean;
        this.heterogeneityDispersion = heterogeneityDispersion;

        validate();
    }

    private void validate() {
        if (!(meanOffspring >= 0.0)) {
            throw new ConfigurationException("meanOffspring must be >= 0, got " + meanOffspring);
        }
        // бросает ConfigurationException на отрицательной дисперсии
        OffspringFamily.forDispersion(offspringDispersion);

        if (!(serialIntervalMean > 0.0) || !(serialIntervalSd > 0.0)) {
            throw new ConfigurationException("serial interval mean/sd must be > 0");
        }
        if (!(populationMean > 0.0)) {
            throw new ConfigurationException("populationMean must be > 0, got " + populationMean);
        }
        if (!(populationSd > 0.0)) {
            throw new ConfigurationException("populationSd must be > 0, got " + populationSd);
        }
        requireFraction("immuneFraction", immuneFraction);
        requireFraction("antibioticEfficacy", antibioticEfficacy);
        requireFraction("washEfficacy", washEfficacy);
        requireFraction("vaccineEfficacy", vaccineEfficacy);
        requireFraction("coverage", coverage);

        requirePositive("indexReportDelayDispersion", indexReportDelayDispersion);
        requirePositive("reportDelayBeforeDispersion", reportDelayBeforeDispersion);
        requirePositive("reportDelayAfterDispersion", reportDelayAfterDispersion);
        requirePositive("heterogeneityDispersion", heterogeneityDispersion);
        if (indexReportDelayMean < 0.0 || reportDelayBeforeMean < 0.0
                || reportDelayAfterMean < 0.0 || heterogeneityMean < 0.0) {
            throw new ConfigurationException("delay/heterogeneity means must be >= 0");
        }

        if (implementationDelayMinDays < 0 || implementationDelayMaxDays < implementationDelayMinDays) {
            throw new ConfigurationException("implementation delay range is invalid: ["
                    + implementationDelayMinDays + ", " + implementationDelayMaxDays + "]");
        }
        if (!(interventionDurationDays >= 0.0)) {
            throw new ConfigurationException("interventionDurationDays must be >= 0");
        }
        if (!(washOnlyDelayDays >= 0.0) || !(vaccineDelayDays >= washOnlyDelayDays)) {
            throw new ConfigurationException("phase boundaries must satisfy 0 <= washOnlyDelay <= vaccineDelay, got "
                    + washOnlyDelayDays + " / " + vaccineDelayDays);
        }
        if (!(followUpDays > 0.0)) {
            throw new ConfigurationException("followUpDays must be > 0, got " + followUpDays);
        }
    }

    private static void requireFraction(String name, double v) {
        if (!(v >= 0.0 && v <= 1.0)) {
            throw new ConfigurationException(name + " must be in [0,1], got " + v);
        }
    }

    private static void requirePositive(String name, double v) {
        if (!(v > 0.0)) {
            throw new ConfigurationException(name + " must be > 0, got " + v);
        }
    }

    // --------- производные ---------

    public OffspringFamily getOffspringFamily() {
        return OffspringFamily.forDispersion(offspringDispersion);
    }

    // --------- геттеры ---------

    public double getMeanOffspring() {
        return meanOffspring;
    }

    public double getOffspringDispersion() {
        return offspringDispersion;
    }

    public double getSerialIntervalMean() {
        return serialIntervalMean;
    }

    public double getSerialIntervalSd() {
        return serialIntervalSd;
    }

    public double getPopulationMean() {
        return populationMean;
    }

    public double getPopulationSd() {
        return populationSd;
    }

    public double getImmuneFraction() {
        return immuneFraction;
    }

    public double getIndexReportDelayMean() {
        return indexReportDelayMean;
    }

    public double getIndexReportDelayDispersion() {
        return indexReportDelayDispersion;
    }

    public double getReportDelayBeforeMean() {
        return reportDelayBeforeMean;
    }

    public double getReportDelayBeforeDispersion() {
        return reportDelayBeforeDispersion;
    }

    public double getReportDelayAfterMean() {
        return reportDelayAfterMean;
    }

    public double getReportDelayAfterDispersion() {
        return reportDelayAfterDispersion;
    }

    public int getImplementationDelayMinDays() {
        return implementationDelayMinDays;
    }

    public int getImplementationDelayMaxDays() {
        return implementationDelayMaxDays;
    }

    public double getInterventionDurationDays() {
        return interventionDurationDays;
    }

    public double getWashOnlyDelayDays() {
        return washOnlyDelayDays;
    }

    public double getVaccineDelayDays() {
        return vaccineDelayDays;
    }

    public double getAntibioticEfficacy() {
        return antibioticEfficacy;
    }

    public double getWashEfficacy() {
        return washEfficacy;
    }

    public double getVaccineEfficacy() {
        return vaccineEfficacy;
    }

    public double getCoverage() {
        return coverage;
    }

    public double getFollowUpDays() {
        return followUpDays;
    }

    public double getHeterogeneityMean() {
        return heterogeneityMean;
    }

    public double getHeterogeneityDispersion() {
        return heterogeneityDispersion;
    }
}
