package catisim.engine;

/**
 * Цепочка превысила предохранитель по числу случаев или поколений.
 * Кольцо считается прерванным и исключается из агрегации.
 */
public class StochasticDegeneracyException extends Exception {

    private static final long serialVersionUID = 1L;

    private final int ringId;

    public StochasticDegeneracyException(int ringId, String message) {
        super("ring " + ringId + ": " + message);
        this.ringId = ringId;
    }

    public int getRingId() {
        return ringId;
    }
}
