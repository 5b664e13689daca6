package catisim.power;

import catisim.config.ConfigurationException;
import catisim.config.SimulationConstants;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.apache.commons.math3.stat.interval.ConfidenceInterval;
import org.apache.commons.math3.stat.interval.WilsonScoreInterval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;

/**
 * Многопоточный Monte Carlo по пилотным исследованиям.
 * <p>
 * ВАЖНО:
 * - у каждой реплики свой генератор, сид зависит только от (sampleSize, replicate);
 * - несошедшиеся реплики не входят в знаменатель мощности, но считаются в failedReplicates;
 * - агрегация — чистая свёртка по строкам, от порядка выполнения не зависит.
 */
public final class PowerEstimationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(PowerEstimationEngine.class);

    /** z для интервала среднего коэффициента */
    private static final double Z_SCORE = 1.96;

    /** Относительная ошибка среднего коэффициента для оценки нужного числа реплик */
    private static final double RELATIVE_ERROR = 0.10;

    private final ExecutorService executor;
    private final PilotStudyEstimator estimator;
    private final long baseSeed;

    public PowerEstimationEngine(ExecutorService executor, PilotStudyEstimator estimator, long baseSeed) {
        this.executor = executor;
        this.estimator = estimator;
        this.baseSeed = baseSeed;
    }

    public PowerEstimate estimatePower(int sampleSize, int replicates)
            throws InterruptedException, ExecutionException {

        if (replicates <= 0) {
            throw new ConfigurationException("replicates must be > 0");
        }
        estimator.validateSampleSize(sampleSize);

        int parallelism = estimateParallelism(executor);
        int chunks = Math.min(replicates, Math.max(1, parallelism * 2));
        int chunkSize = (int) Math.ceil(replicates / (double) chunks);

        List<Future<PilotEstimate[]>> futures = new ArrayList<>(chunks);
        for (int c = 0; c < chunks; c++) {
            int from = c * chunkSize;
            int to = Math.min(replicates, from + chunkSize);
            if (from >= to) break;
            futures.add(executor.submit(() -> runChunk(sampleSize, from, to)));
        }

        PilotEstimate[] rows = new PilotEstimate[replicates];
        for (Future<PilotEstimate[]> f : futures) {
            PilotEstimate[] part = f.get();
            for (PilotEstimate e : part) rows[e.replicate()] = e;
        }

        PowerEstimate estimate = aggregate(sampleSize, Arrays.asList(rows));

        if (estimate.failedReplicates > 0) {
            LOG.warn("n={}: {} of {} replicates did not converge and were excluded from the denominator",
                    sampleSize, estimate.failedReplicates, replicates);
        }
        LOG.info("n={}: power={} ({} / {} valid replicates)",
                sampleSize, estimate.power, estimate.significantReplicates, estimate.validReplicates);
        return estimate;
    }

    /**
     * Размеры считаются по возрастанию; каждый — независимый прогон estimatePower.
     */
    public PowerCurve estimatePowerCurve(int[] sampleSizes, int replicates)
            throws InterruptedException, ExecutionException {

        if (sampleSizes == null || sampleSizes.length == 0) {
            throw new ConfigurationException("sampleSizes must not be empty");
        }
        int[] sorted = sampleSizes.clone();
        Arrays.sort(sorted);

        List<PowerEstimate> points = new ArrayList<>(sorted.length);
        for (int n : sorted) {
            points.add(estimatePower(n, replicates));
        }
        return new PowerCurve(points);
    }

    private PilotEstimate[] runChunk(int sampleSize, int fromInclusive, int toExclusive) {
        PilotEstimate[] out = new PilotEstimate[toExclusive - fromInclusive];
        for (int r = fromInclusive; r < toExclusive; r++) {
            Well19937c rng = new Well19937c(seedFor(baseSeed, sampleSize, r));
            out[r - fromInclusive] = estimator.run(sampleSize, r, rng);
        }
        return out;
    }

    /**
     * Свёртка строк реплик в одну строку мощности.
     */
    public static PowerEstimate aggregate(int sampleSize, List<PilotEstimate> rows) {
        int valid = 0;
        int significant = 0;
        SummaryStatistics slopes = new SummaryStatistics();

        for (PilotEstimate e : rows) {
            if (!e.converged()) continue;
            valid++;
            if (e.isSignificant()) significant++;
            if (Double.isFinite(e.slope())) slopes.addValue(e.slope());
        }

        int failed = rows.size() - valid;
        double power = Double.NaN;
        double ciLow = Double.NaN;
        double ciHigh = Double.NaN;
        if (valid > 0) {
            power = significant / (double) valid;
            ConfidenceInterval ci = new WilsonScoreInterval()
                    .createInterval(valid, significant, SimulationConstants.CONFIDENCE_LEVEL);
            ciLow = Math.max(0.0, ci.getLowerBound());
            ciHigh = Math.min(1.0, ci.getUpperBound());
        }

        return new PowerEstimate(sampleSize, rows.size(), valid, failed, significant,
                power, ciLow, ciHigh, SlopeSummary.of(slopes, Z_SCORE, RELATIVE_ERROR), rows);
    }

    private static int estimateParallelism(ExecutorService executor) {
        if (executor instanceof ForkJoinPool fjp) return Math.max(1, fjp.getParallelism());
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    static long seedFor(long baseSeed, int sampleSize, int replicate) {
        return baseSeed
                + (long) sampleSize * SimulationConstants.SAMPLE_SIZE_SEED_STRIDE
                + (long) replicate * SimulationConstants.REPLICATE_SEED_STRIDE;
    }
}
