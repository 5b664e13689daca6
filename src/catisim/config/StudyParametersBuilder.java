package catisim.config;

/**
 * Builder для StudyParameters.
 */
public class StudyParametersBuilder {

    // передача
    private double meanOffspring;
    private double offspringDispersion;
    private double serialIntervalMean;
    private double serialIntervalSd;

    // кольцо
    private double populationMean;
    private double populationSd;
    private double immuneFraction;

    // задержки сообщения
    private double indexReportDelayMean;
    private double indexReportDelayDispersion;
    private double reportDelayBeforeMean;
    private double reportDelayBeforeDispersion;
    private double reportDelayAfterMean;
    private double reportDelayAfterDispersion;

    // вмешательство
    private int implementationDelayMinDays;
    private int implementationDelayMaxDays;
    private double interventionDurationDays;
    private double washOnlyDelayDays;
    private double vaccineDelayDays;
    private double antibioticEfficacy;
    private double washEfficacy;
    private double vaccineEfficacy;
    private double coverage;

    // наблюдение
    private double followUpDays;
    private double heterogeneityMean;
    private double heterogeneityDispersion;

    public StudyParametersBuilder() {
    }

    /**
     * Создать builder на основе уже существующих параметров.
     */
    public static StudyParametersBuilder from(StudyParameters base) {
        StudyParametersBuilder b = new StudyParametersBuilder();
        b.meanOffspring = base.getMeanOffspring();
        b.offspringDispersion = base.getOffspringDispersion();
        b.serialIntervalMean = base.getSerialIntervalMean();
        b.serialIntervalSd = base.getSerialIntervalSd();
        b.populationMean = base.getPopulationMean();
        b.populationSd = base.getPopulationSd();
        b.immuneFraction = base.getImmuneFraction();
        b.indexReportDelayMean = base.getIndexReportDelayMean();
        b.indexReportDelayDispersion = base.getIndexReportDelayDispersion();
        b.reportDelayBeforeMean = base.getReportDelayBeforeMean();
        b.reportDelayBeforeDispersion = base.getReportDelayBeforeDispersion();
        b.reportDelayAfterMean = base.getReportDelayAfterMean();
        b.reportDelayAfterDispersion = base.getReportDelayAfterDispersion();
        b.implementationDelayMinDays = base.getImplementationDelayMinDays();
        b.implementationDelayMaxDays = base.getImplementationDelayMaxDays();
        b.interventionDurationDays = base.getInterventionDurationDays();
        b.washOnlyDelayDays = base.getWashOnlyDelayDays();
        b.vaccineDelayDays = base.getVaccineDelayDays();
        b.antibioticEfficacy = base.getAntibioticEfficacy();
        b.washEfficacy = base.getWashEfficacy();
        b.vaccineEfficacy = base.getVaccineEfficacy();
        b.coverage = base.getCoverage();
        b.followUpDays = base.getFollowUpDays();
        b.heterogeneityMean = base.getHeterogeneityMean();
        b.heterogeneityDispersion = base.getHeterogeneityDispersion();
        return b;
    }

    public StudyParameters build() {
        return new StudyParameters(
                meanOffspring,
                offspringDispersion,
                serialIntervalMean,
                serialIntervalSd,
                populationMean,
                populationSd,
                immuneFraction,
                indexReportDelayMean,
                indexReportDelayDispersion,
                reportDelayBeforeMean,
                reportDelayBeforeDispersion,
                reportDelayAfterMean,
                reportDelayAfterDispersion,
                implementationDelayMinDays,
                implementationDelayMaxDays,
                interventionDurationDays,
                washOnlyDelayDays,
                vaccineDelayDays,
                antibioticEfficacy,
                washEfficacy,
                vaccineEfficacy,
                coverage,
                followUpDays,
                heterogeneityMean,
                heterogeneityDispersion
        );
    }

    // --------- геттеры/сеттеры ---------

    public double getMeanOffspring() {
        return meanOffspring;
    }

    public StudyParametersBuilder setMeanOffspring(double meanOffspring) {
        this.meanOffspring = meanOffspring;
        return this;
    }

    public double getOffspringDispersion() {
        return offspringDispersion;
    }

    public StudyParametersBuilder setOffspringDispersion(double offspringDispersion) {
        this.offspringDispersion = offspringDispersion;
        return this;
    }

    public double getSerialIntervalMean() {
        return serialIntervalMean;
    }

    public StudyParametersBuilder setSerialIntervalMean(double serialIntervalMean) {
        this.serialIntervalMean = serialIntervalMean;
        return this;
    }

    public double getSerialIntervalSd() {
        return serialIntervalSd;
    }

    public StudyParametersBuilder setSerialIntervalSd(double serialIntervalSd) {
        this.serialIntervalSd = serialIntervalSd;
        return this;
    }

    public double getPopulationMean() {
        return populationMean;
    }

    public StudyParametersBuilder setPopulationMean(double populationMean) {
        this.populationMean = populationMean;
        return this;
    }

    public double getPopulationSd() {
        return populationSd;
    }

    public StudyParametersBuilder setPopulationSd(double populationSd) {
        this.populationSd = populationSd;
        return this;
    }

    public double getImmuneFraction() {
        return immuneFraction;
    }

    public StudyParametersBuilder setImmuneFraction(double immuneFraction) {
        this.immuneFraction = immuneFraction;
        return this;
    }

    public double getIndexReportDelayMean() {
        return indexReportDelayMean;
    }

    public StudyParametersBuilder setIndexReportDelayMean(double indexReportDelayMean) {
        this.indexReportDelayMean = indexReportDelayMean;
        return this;
    }

    public double getIndexReportDelayDispersion() {
        return indexReportDelayDispersion;
    }

    public StudyParametersBuilder setIndexReportDelayDispersion(double indexReportDelayDispersion) {
        this.indexReportDelayDispersion = indexReportDelayDispersion;
        return this;
    }

    public double getReportDelayBeforeMean() {
        return reportDelayBeforeMean;
    }

    public StudyParametersBuilder setReportDelayBeforeMean(double reportDelayBeforeMean) {
        this.reportDelayBeforeMean = reportDelayBeforeMean;
        return this;
    }

    public double getReportDelayBeforeDispersion() {
        return reportDelayBeforeDispersion;
    }

    public StudyParametersBuilder setReportDelayBeforeDispersion(double reportDelayBeforeDispersion) {
        this.reportDelayBeforeDispersion = reportDelayBeforeDispersion;
        return this;
    }

    public double getReportDelayAfterMean() {
        return reportDelayAfterMean;
    }

    public StudyParametersBuilder setReportDelayAfterMean(double reportDelayAfterMean) {
        this.reportDelayAfterMean = reportDelayAfterMean;
        return this;
    }

    public double getReportDelayAfterDispersion() {
        return reportDelayAfterDispersion;
    }

    public StudyParametersBuilder setReportDelayAfterDispersion(double reportDelayAfterDispersion) {
        this.reportDelayAfterDispersion = reportDelayAfterDispersion;
        return this;
    }

    public int getImplementationDelayMinDays() {
        return implementationDelayMinDays;
    }

    public StudyParametersBuilder setImplementationDelayMinDays(int implementationDelayMinDays) {
        this.implementationDelayMinDays = implementationDelayMinDays;
        return this;
    }

    public int getImplementationDelayMaxDays() {
        return implementationDelayMaxDays;
    }

    public StudyParametersBuilder setImplementationDelayMaxDays(int implementationDelayMaxDays) {
        this.implementationDelayMaxDays = implementationDelayMaxDays;
        return this;
    }

    public double getInterventionDurationDays() {
        return interventionDurationDays;
    }

    public StudyParametersBuilder setInterventionDurationDays(double interventionDurationDays) {
        this.interventionDurationDays = interventionDurationDays;
        return this;
    }

    public double getWashOnlyDelayDays() {
        return washOnlyDelayDays;
    }

    public StudyParametersBuilder setWashOnlyDelayDays(double washOnlyDelayDays) {
        this.washOnlyDelayDays = washOnlyDelayDays;
        return this;
    }

    public double getVaccineDelayDays() {
        return vaccineDelayDays;
    }

    public StudyParametersBuilder setVaccineDelayDays(double vaccineDelayDays) {
        this.vaccineDelayDays = vaccineDelayDays;
        return this;
    }

    public double getAntibioticEfficacy() {
        return antibioticEfficacy;
    }

    public StudyParametersBuilder setAntibioticEfficacy(double antibioticEfficacy) {
        this.antibioticEfficacy = antibioticEfficacy;
        return this;
    }

    public double getWashEfficacy() {
        return washEfficacy;
    }

    public StudyParametersBuilder setWashEfficacy(double washEfficacy) {
        this.washEfficacy = washEfficacy;
        return this;
    }

    public double getVaccineEfficacy() {
        return vaccineEfficacy;
    }

    public StudyParametersBuilder setVaccineEfficacy(double vaccineEfficacy) {
        this.vaccineEfficacy = vaccineEfficacy;
        return this;
    }

    public double getCoverage() {
        return coverage;
    }

    public StudyParametersBuilder setCoverage(double coverage) {
        this.coverage = coverage;
        return this;
    }

    public double getFollowUpDays() {
        return followUpDays;
    }

    public StudyParametersBuilder setFollowUpDays(double followUpDays) {
        this.followUpDays = followUpDays;
        return this;
    }

    public double getHeterogeneityMean() {
        return heterogeneityMean;
    }

    public StudyParametersBuilder setHeterogeneityMean(double heterogeneityMean) {
        this.heterogeneityMean = heterogeneityMean;
        return this;
    }

    public double getHeterogeneityDispersion() {
        return heterogeneityDispersion;
    }

    public StudyParametersBuilder setHeterogeneityDispersion(double heterogeneityDispersion) {
        this.heterogeneityDispersion = heterogeneityDispersion;
        return this;
    }
}
