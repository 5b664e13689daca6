package catisim.power;

import java.util.List;

/**
 * Итог Monte Carlo для одного размера выборки.
 */
public final class PowerEstimate {

    /** Размер пилотной выборки (колец). */
    public final int sampleSize;

    /** Сколько реплик запущено. */
    public final int replicates;

    /** Реплики со сошедшейся подгонкой — знаменатель мощности. */
    public final int validReplicates;

    /** Несошедшиеся реплики: исключены из знаменателя. */
    public final int failedReplicates;

    /** Реплики с p-value коэффициента задержки < 0.05. */
    public final int significantReplicates;

    /** significant / valid; NaN, если валидных реплик нет. */
    public final double power;

    /** Интервал Уилсона для мощности (95%). */
    public final double powerCiLow;
    public final double powerCiHigh;

    /** Сводка оценок коэффициента задержки по валидным репликам. */
    public final SlopeSummary slopeSummary;

    /** Строки по репликам, по возрастанию номера реплики. */
    public final List<PilotEstimate> replicateRows;

    public PowerEstimate(int sampleSize,
                         int replicates,
                         int validReplicates,
                         int failedReplicates,
                         int significantReplicates,
                         double power,
                         double powerCiLow,
                         double powerCiHigh,
                         SlopeSummary slopeSummary,
                         List<PilotEstimate> replicateRows) {
        this.sampleSize = sampleSize;
        this.replicates = replicates;
        this.validReplicates = validReplicates;
        this.failedReplicates = failedReplicates;
        this.significantReplicates = significantReplicates;
        this.power = power;
        this.powerCiLow = powerCiLow;
        this.powerCiHigh = powerCiHigh;
        this.slopeSummary = slopeSummary;
        this.replicateRows = List.copyOf(replicateRows);
    }
}
