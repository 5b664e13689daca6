package catisim.engine;

import catisim.config.ConfigurationException;
import catisim.config.SimulationConstants;
import catisim.config.StudyParameters;
import catisim.model.Case;
import catisim.model.Ring;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;

/**
 * Генерация N независимых колец.
 * <p>
 * Каждое кольцо получает свой генератор (сид = baseSeed + ringId * stride), поэтому
 * результат не зависит от числа потоков и порядка завершения задач.
 */
public final class RingBatchGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(RingBatchGenerator.class);

    private final ExecutorService executor;
    private final StudyParameters params;
    private final ChainSimulator simulator;
    private final ReportingDelayModel reportingModel;
    private final InterventionEffects effects;
    private final CountDistribution indexReportDelay;

    public RingBatchGenerator(ExecutorService executor, StudyParameters params) {
        this(executor, params, ChainSimulator.from(params));
    }

    public RingBatchGenerator(ExecutorService executor, StudyParameters params, ChainSimulator simulator) {
        this.executor = executor;
        this.params = params;
        this.simulator = simulator;
        this.reportingModel = ReportingDelayModel.from(params);
        this.effects = InterventionEffects.from(params);
        this.indexReportDelay = new CountDistribution(
                params.getIndexReportDelayMean(), params.getIndexReportDelayDispersion());
    }

    public RingBatch generate(int ringCount, long baseSeed)
            throws InterruptedException, ExecutionException {

        if (ringCount <= 0) {
            throw new ConfigurationException("ringCount must be > 0");
        }

        int parallelism = estimateParallelism(executor);
        int chunks = Math.min(ringCount, Math.max(1, parallelism * 2));
        int chunkSize = (int) Math.ceil(ringCount / (double) chunks);

        List<Future<ChunkResult>> futures = new ArrayList<>(chunks);
        for (int c = 0; c < chunks; c++) {
            int from = c * chunkSize;
            int to = Math.min(ringCount, from + chunkSize);
            if (from >= to) break;
            futures.add(executor.submit(() -> runChunk(baseSeed, from, to)));
        }

        List<Ring> rings = new ArrayList<>(ringCount);
        int aborted = 0;
        // чанки идут по возрастанию id, поэтому порядок колец сохраняется
        for (Future<ChunkResult> f : futures) {
            ChunkResult r = f.get();
            rings.addAll(r.rings);
            aborted += r.aborted;
        }

        if (aborted > 0) {
            LOG.warn("{} of {} rings aborted by safety caps and excluded", aborted, ringCount);
        }
        LOG.info("Generated {} rings ({} cases in window)", rings.size(),
                rings.stream().mapToInt(r -> r.getCases().size()).sum());

        return new RingBatch(rings, ringCount, aborted);
    }

    private ChunkResult runChunk(long baseSeed, int fromInclusive, int toExclusive) {
        List<Ring> rings = new ArrayList<>(toExclusive - fromInclusive);
        int aborted = 0;
        for (int ringId = fromInclusive; ringId < toExclusive; ringId++) {
            try {
                rings.add(simulateRing(ringId, seedFor(baseSeed, ringId)));
            } catch (StochasticDegeneracyException e) {
                aborted++;
                LOG.warn("Ring aborted: {}", e.getMessage());
            }
        }
        return new ChunkResult(rings, aborted);
    }

    /**
     * Одно кольцо: параметры кольца, цепочка, сообщения, окно наблюдения.
     */
    public Ring simulateRing(int ringId, long seed) throws StochasticDegeneracyException {
        RandomGenerator rng = new Well19937c(seed);

        double population = Sampling.gamma(rng, params.getPopulationMean(), params.getPopulationSd());
        int immune = (int) Math.round(population * params.getImmuneFraction());
        int indexDelay = indexReportDelay.sample(rng);
        int implementationDelay = Sampling.uniformInt(rng,
                params.getImplementationDelayMinDays(), params.getImplementationDelayMaxDays());

        // шкала: начало болезни индексного = 0
        double interventionEnd = indexDelay + implementationDelay + params.getInterventionDurationDays();
        EffectSchedule schedule = EffectSchedule.forRing(params, effects, interventionEnd);

        double followUp = params.getFollowUpDays();
        double tEnd = indexDelay + followUp;

        List<Case> chain = simulator.simulate(ringId, population, immune, 0.0, tEnd, schedule, rng);
        List<Case> reported = reportingModel.reportAll(chain, interventionEnd, indexDelay, rng);
        List<Case> retained = applyWindow(reported, followUp);

        return new Ring(ringId, population, immune, indexDelay, implementationDelay,
                params.getInterventionDurationDays(), chain.size(), retained);
    }

    /**
     * Оставляет случаи с 0 <= sinceIndexReport <= followUp. Идемпотентно.
     * Случай может сообщиться раньше индексного при более позднем начале болезни, такие отсекаются.
     */
    public static List<Case> applyWindow(List<Case> cases, double followUp) {
        List<Case> out = new ArrayList<>(cases.size());
        for (Case c : cases) {
            double s = c.sinceIndexReport();
            if (s >= 0.0 && s <= followUp) out.add(c);
        }
        return out;
    }

    private static final class ChunkResult {
        final List<Ring> rings;
        final int aborted;

        ChunkResult(List<Ring> rings, int aborted) {
            this.rings = rings;
            this.aborted = aborted;
        }
    }

    static int estimateParallelism(ExecutorService executor) {
        if (executor instanceof ForkJoinPool fjp) return Math.max(1, fjp.getParallelism());
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    static long seedFor(long baseSeed, int ringId) {
        return baseSeed + (long) ringId * SimulationConstants.RING_SEED_STRIDE;
    }
}
