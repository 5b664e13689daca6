package catisim.regression;

/**
 * Регрессия счётчиков со случайным intercept: y ~ offset + b0 + b1 * x + u[group].
 */
public interface CountRegression {

    RegressionFit fit(CountData data) throws EstimationNonConvergenceException;
}
