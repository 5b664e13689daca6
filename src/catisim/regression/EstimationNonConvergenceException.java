package catisim.regression;

/**
 * Подгонка не сошлась или дала вырожденный результат.
 */
public class EstimationNonConvergenceException extends Exception {

    private static final long serialVersionUID = 1L;

    public EstimationNonConvergenceException(String message) {
        super(message);
    }
}
