package catisim.power;

import java.util.List;
import java.util.OptionalInt;

/**
 * Мощность по возрастающим размерам выборки.
 */
public final class PowerCurve {

    private final List<PowerEstimate> points;

    public PowerCurve(List<PowerEstimate> points) {
        this.points = List.copyOf(points);
    }

    public List<PowerEstimate> getPoints() {
        return points;
    }

    /**
     * Наименьший из оценённых размеров, на котором мощность достигает target.
     */
    public OptionalInt minimumSampleSizeFor(double target) {
        for (PowerEstimate p : points) {
            if (!Double.isNaN(p.power) && p.power >= target) {
                return OptionalInt.of(p.sampleSize);
            }
        }
        return OptionalInt.empty();
    }
}
