package catisim.model;

import java.util.List;

/**
 * Кольцо передачи вокруг одного индексного случая.
 * Живёт в пределах одной симуляции; дальше сохраняется только RingSummary.
 */
public final class Ring {

    private final int ringId;

    /** Размер популяции (вещественный, как выбран). */
    private final double population;

    /** Исходно иммунные. */
    private final int initialImmune;

    /** Задержка сообщения об индексном случае, целые сутки. */
    private final int indexReportDelay;

    /** Задержка "сообщение об индексном -> старт CATI", целые сутки. */
    private final int implementationDelay;

    private final double interventionStart;
    private final double interventionEnd;

    /** Сколько случаев сгенерировала цепочка (до окна). */
    private final int generatedCaseCount;

    /** Случаи внутри окна наблюдения, индексный первым. */
    private final List<Case> cases;

    public Ring(int ringId,
                double population,
                int initialImmune,
                int indexReportDelay,
                int implementationDelay,
                double interventionDurationDays,
                int generatedCaseCount,
                List<Case> cases) {
        this.ringId = ringId;
        this.population = population;
        this.initialImmune = initialImmune;
        this.indexReportDelay = indexReportDelay;
        this.implementationDelay = implementationDelay;
        this.interventionStart = indexReportDelay + (double) implementationDelay;
        this.interventionEnd = interventionStart + interventionDurationDays;
        this.generatedCaseCount = generatedCaseCount;
        this.cases = List.copyOf(cases);
    }

    public int getRingId() {
        return ringId;
    }

    public double getPopulation() {
        return population;
    }

    public int getInitialImmune() {
        return initialImmune;
    }

    public int getIndexReportDelay() {
        return indexReportDelay;
    }

    /** Индексный случай начинает болеть в 0, поэтому время сообщения равно задержке. */
    public double getIndexReportTime() {
        return indexReportDelay;
    }

    public int getImplementationDelay() {
        return implementationDelay;
    }

    public double getInterventionStart() {
        return interventionStart;
    }

    public double getInterventionEnd() {
        return interventionEnd;
    }

    public int getGeneratedCaseCount() {
        return generatedCaseCount;
    }

    public List<Case> getCases() {
        return cases;
    }
}
