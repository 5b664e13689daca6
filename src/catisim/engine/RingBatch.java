package catisim.engine;

import catisim.model.Case;
import catisim.model.Ring;

import java.util.ArrayList;
import java.util.List;

/**
 * Итог генерации колец: успешные кольца по возрастанию id и число прерванных предохранителем.
 */
public final class RingBatch {

    private final List<Ring> rings;
    private final int requestedRings;
    private final int abortedRings;

    public RingBatch(List<Ring> rings, int requestedRings, int abortedRings) {
        this.rings = List.copyOf(rings);
        this.requestedRings = requestedRings;
        this.abortedRings = abortedRings;
    }

    public List<Ring> getRings() {
        return rings;
    }

    public int getRequestedRings() {
        return requestedRings;
    }

    public int getAbortedRings() {
        return abortedRings;
    }

    /** Таблица случаев всех колец (только в окне наблюдения). */
    public List<Case> allCases() {
        List<Case> out = new ArrayList<>();
        for (Ring r : rings) out.addAll(r.getCases());
        return out;
    }
}
