package catisim;

import catisim.config.SimulationConfig;
import catisim.config.StudyParameters;
import catisim.engine.RingBatch;
import catisim.engine.RingBatchGenerator;
import catisim.engine.RingSummarizer;
import catisim.model.RingSummary;
import catisim.power.PilotStudyEstimator;
import catisim.power.PowerCurve;
import catisim.power.PowerEstimationEngine;
import catisim.regression.NegativeBinomialMixedModel;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;

/**
 * Полный прогон: кольца -> сводка -> Monte Carlo по размерам выборки.
 * Пул потоков принадлежит вызывающему.
 */
public final class StudyRunner {

    private StudyRunner() {}

    public static StudyResult run(SimulationConfig cfg,
                                  StudyParameters params,
                                  int[] sampleSizes,
                                  ExecutorService executor)
            throws InterruptedException, ExecutionException {

        RingBatch batch = new RingBatchGenerator(executor, params)
                .generate(cfg.getRingCount(), cfg.getBaseSeed());

        List<RingSummary> summaries = RingSummarizer.from(params)
                .summarizeAll(batch.getRings(), cfg.getBaseSeed());

        PilotStudyEstimator estimator = new PilotStudyEstimator(summaries, new NegativeBinomialMixedModel());
        PowerEstimationEngine engine = new PowerEstimationEngine(executor, estimator, cfg.getBaseSeed());
        PowerCurve curve = engine.estimatePowerCurve(sampleSizes, cfg.getReplicates());

        return new StudyResult(batch, summaries, curve);
    }

    public record StudyResult(RingBatch batch,
                              List<RingSummary> summaries,
                              PowerCurve curve) {}
}
