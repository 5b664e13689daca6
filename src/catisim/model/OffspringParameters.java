package catisim.model;

/**
 * Параметры генерации потомства для текущего шага цепочки.
 * Не мутируется: график эффекта возвращает новое значение.
 *
 * @param meanOffspring        среднее число вторичных случаев (R)
 * @param dispersion           size отрицательного биномиального (infinity для Пуассона)
 * @param remainingSusceptible оставшиеся восприимчивые, >= 0
 */
public record OffspringParameters(double meanOffspring,
                                  double dispersion,
                                  int remainingSusceptible) {

    public OffspringParameters {
        if (remainingSusceptible < 0) {
            throw new IllegalArgumentException("remainingSusceptible must be >= 0, got " + remainingSusceptible);
        }
    }

    public OffspringParameters withRemainingSusceptible(int remaining) {
        return new OffspringParameters(meanOffspring, dispersion, remaining);
    }
}
