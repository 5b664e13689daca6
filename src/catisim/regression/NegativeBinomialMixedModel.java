package catisim.regression;

import catisim.config.SimulationConstants;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.special.Gamma;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Отрицательная биномиальная (NB2) регрессия со случайным intercept по группам, PQL.
 * <p>
 * Одна внешняя итерация:
 * - шаг penalized IRLS по [1, x, индикаторы групп] со штрафом 1/sigma2 на эффекты групп;
 * - обновление sigma2 (EM): (sum u^2 + tr(A^-1)_uu) / G, убывающая ниже 1e-3 фиксируется на границе;
 * - несколько шагов Ньютона по theta при текущих mu.
 * Ковариация фиксированных эффектов — блок A^-1, p-value по нормальному приближению (Wald).
 */
public final class NegativeBinomialMixedModel implements CountRegression {

    private static final Logger LOG = LoggerFactory.getLogger(NegativeBinomialMixedModel.class);

    private static final int THETA_NEWTON_STEPS = 3;
    private static final double INITIAL_THETA = 1.0;
    private static final double INITIAL_SIGMA2 = 0.1;
    private static final double SIGMA2_TOLERANCE = 1e-5;

    /** Ниже этого значения убывающую sigma2 считаем граничной оценкой (= 0). */
    private static final double SIGMA2_BOUNDARY = 1e-3;

    /** 2 фикс. эффекта + sigma2 + theta */
    private static final int MODEL_DF = 4;

    private static final NormalDistribution STD_NORMAL = new NormalDistribution(null, 0.0, 1.0);

    private final int maxIterations;
    private final double tolerance;

    public NegativeBinomialMixedModel() {
        this(SimulationConstants.REGRESSION_MAX_ITERATIONS, SimulationConstants.REGRESSION_TOLERANCE);
    }

    public NegativeBinomialMixedModel(int maxIterations, double tolerance) {
        if (maxIterations <= 0) throw new IllegalArgumentException("maxIterations must be > 0");
        if (!(tolerance > 0.0)) throw new IllegalArgumentException("tolerance must be > 0");
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
    }

    @Override
    public RegressionFit fit(CountData data) throws EstimationNonConvergenceException {
        final int n = data.size();
        final int groups = data.groupCount();
        final int p = 2 + groups;

        if (n <= MODEL_DF) {
            throw new EstimationNonConvergenceException("too few observations: n=" + n);
        }

        final int[] y = data.response();
        final double[] x = data.covariate();
        final double[] off = data.offset();
        final int[] grp = data.group();

        double sumY = 0.0;
        double sumExpOff = 0.0;
        for (int i = 0; i < n; i++) {
            if (y[i] < 0) throw new IllegalArgumentException("negative count at row " + i);
            sumY += y[i];
            sumExpOff += Math.exp(off[i]);
        }
        if (sumY == 0.0) {
            throw new EstimationNonConvergenceException("degenerate response: all counts are zero");
        }

        double[] beta = new double[p];
        beta[0] = Math.log(sumY / sumExpOff);
        double theta = INITIAL_THETA;
        double sigma2 = INITIAL_SIGMA2;

        final double[] mu = new double[n];
        RealMatrix inverse = null;
        boolean converged = false;
        boolean atBoundary = false;
        int iter = 0;

        while (iter < maxIterations) {
            iter++;
            fillMu(beta, x, off, grp, mu);

            // ===== penalized IRLS =====
            double[][] a = new double[p][p];
            double[] b = new double[p];
            for (int i = 0; i < n; i++) {
                double m = mu[i];
                double w = m / (1.0 + m / theta);
                double eta = Math.log(m) - off[i];
                double z = eta + (y[i] - m) / m;
                int gc = 2 + grp[i];

                a[0][0] += w;
                a[0][1] += w * x[i];
                a[1][1] += w * x[i] * x[i];
                a[0][gc] += w;
                a[1][gc] += w * x[i];
                a[gc][gc] += w;

                b[0] += w * z;
                b[1] += w * x[i] * z;
                b[gc] += w * z;
            }
            for (int j = 0; j < p; j++) {
                for (int k = 0; k < j; k++) a[j][k] = a[k][j];
            }
            for (int g = 0; g < groups; g++) a[2 + g][2 + g] += 1.0 / sigma2;

            DecompositionSolver solver = new LUDecomposition(new Array2DRowRealMatrix(a, false)).getSolver();
            if (!solver.isNonSingular()) {
                throw new EstimationNonConvergenceException("singular system at iteration " + iter);
            }
            double[] next = solver.solve(new ArrayRealVector(b, false)).toArray();
            inverse = solver.getInverse();
            requireFinite(next, iter);

            // ===== sigma2 (EM) =====
            double nextSigma2 = sigma2;
            if (!atBoundary) {
                double ss = 0.0;
                double tr = 0.0;
                for (int g = 0; g < groups; g++) {
                    double u = next[2 + g];
                    ss += u * u;
                    tr += inverse.getEntry(2 + g, 2 + g);
                }
                nextSigma2 = Math.max(SimulationConstants.MIN_RANDOM_EFFECT_VARIANCE, (ss + tr) / groups);
                // у нуля EM сходится сублинейно: фиксируем границу и дальше считаем только beta и theta
                if (nextSigma2 < SIGMA2_BOUNDARY && nextSigma2 < sigma2) {
                    nextSigma2 = SimulationConstants.MIN_RANDOM_EFFECT_VARIANCE;
                    atBoundary = true;
                }
            }

            // ===== theta =====
            fillMu(next, x, off, grp, mu);
            double nextTheta = updateTheta(y, mu, theta);

            double dBeta = maxAbsDiff(beta, next);
            double dAlpha = Math.abs(1.0 / nextTheta - 1.0 / theta);
            double dSigma2 = Math.abs(nextSigma2 - sigma2);

            beta = next;
            theta = nextTheta;
            sigma2 = nextSigma2;

            if (dBeta < tolerance
                    && dAlpha < tolerance * Math.max(1.0, 1.0 / theta)
                    && dSigma2 < SIGMA2_TOLERANCE * Math.max(1.0, sigma2)) {
                converged = true;
                break;
            }
        }

        if (!converged) {
            throw new EstimationNonConvergenceException("no convergence after " + maxIterations + " iterations");
        }

        double interceptSe = Math.sqrt(inverse.getEntry(0, 0));
        double slopeSe = Math.sqrt(inverse.getEntry(1, 1));
        if (!Double.isFinite(interceptSe) || !Double.isFinite(slopeSe) || slopeSe <= 0.0) {
            throw new EstimationNonConvergenceException("degenerate standard errors");
        }

        fillMu(beta, x, off, grp, mu);
        double pearson = 0.0;
        for (int i = 0; i < n; i++) {
            double m = mu[i];
            double r = (y[i] - m) / Math.sqrt(m + m * m / theta);
            pearson += r * r;
        }
        double overdispersion = pearson / (n - MODEL_DF);

        double zCrit = STD_NORMAL.inverseCumulativeProbability(
                1.0 - (1.0 - SimulationConstants.CONFIDENCE_LEVEL) / 2.0);

        LOG.debug("NB GLMM converged in {} iterations: b0={}, b1={}, theta={}, sigma2={}",
                iter, beta[0], beta[1], theta, sigma2);

        return new RegressionFit(
                beta[0],
                beta[1],
                interceptSe,
                slopeSe,
                twoSidedP(beta[0] / interceptSe),
                twoSidedP(beta[1] / slopeSe),
                beta[0] - zCrit * interceptSe,
                beta[0] + zCrit * interceptSe,
                beta[1] - zCrit * slopeSe,
                beta[1] + zCrit * slopeSe,
                overdispersion,
                theta,
                sigma2,
                iter
        );
    }

    private static void fillMu(double[] beta, double[] x, double[] off, int[] grp, double[] mu) {
        for (int i = 0; i < mu.length; i++) {
            double eta = off[i] + beta[0] + beta[1] * x[i] + beta[2 + grp[i]];
            // защита от переполнения exp на расходящихся шагах
            mu[i] = Math.exp(Math.max(-30.0, Math.min(30.0, eta)));
        }
    }

    /**
     * Шаги Ньютона по theta для NB2 log-likelihood при фиксированных mu.
     */
    static double updateTheta(int[] y, double[] mu, double theta) {
        double t = theta;
        for (int step = 0; step < THETA_NEWTON_STEPS; step++) {
            double score = 0.0;
            double info = 0.0;
            for (int i = 0; i < y.length; i++) {
                double yt = y[i] + t;
                double tm = t + mu[i];
                score += Gamma.digamma(yt) - Gamma.digamma(t) + Math.log(t) + 1.0 - Math.log(tm) - yt / tm;
                info += -Gamma.trigamma(yt) + Gamma.trigamma(t) - 1.0 / t + 2.0 / tm - yt / (tm * tm);
            }

            double candidate;
            if (info > 0.0 && Double.isFinite(info) && Double.isFinite(score)) {
                candidate = t + score / info;
                if (candidate <= 0.0) candidate = t / 2.0;
            } else {
                candidate = (score > 0.0) ? t * 2.0 : t / 2.0;
            }
            t = Math.max(SimulationConstants.MIN_THETA, Math.min(SimulationConstants.MAX_THETA, candidate));
        }
        return t;
    }

    private static double twoSidedP(double z) {
        return 2.0 * STD_NORMAL.cumulativeProbability(-Math.abs(z));
    }

    private static double maxAbsDiff(double[] a, double[] b) {
        double d = 0.0;
        for (int i = 0; i < a.length; i++) d = Math.max(d, Math.abs(a[i] - b[i]));
        return d;
    }

    private static void requireFinite(double[] v, int iter) throws EstimationNonConvergenceException {
        for (double d : v) {
            if (!Double.isFinite(d)) {
                throw new EstimationNonConvergenceException("non-finite coefficients at iteration " + iter);
            }
        }
    }
}
