package catisim.engine;

import catisim.config.SimulationConstants;
import catisim.config.StudyParameters;
import catisim.model.Case;
import catisim.model.DelayBucket;
import catisim.model.Ring;
import catisim.model.RingSummary;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.util.ArrayList;
import java.util.List;

/**
 * Сводка по кольцу: число случаев в окне, последнее сообщение, ковариаты и синтетические случайные эффекты.
 */
public final class RingSummarizer {

    private final double coverage;
    private final CountDistribution heterogeneity;

    public RingSummarizer(double coverage, CountDistribution heterogeneity) {
        this.coverage = coverage;
        this.heterogeneity = heterogeneity;
    }

    public static RingSummarizer from(StudyParameters p) {
        return new RingSummarizer(p.getCoverage(),
                new CountDistribution(p.getHeterogeneityMean(), p.getHeterogeneityDispersion()));
    }

    /**
     * Гетерогенность берётся из отдельного потока, не связанного с потоком симуляции кольца.
     */
    public List<RingSummary> summarizeAll(List<Ring> rings, long baseSeed) {
        List<RingSummary> out = new ArrayList<>(rings.size());
        for (Ring ring : rings) {
            long seed = baseSeed + SimulationConstants.HETEROGENEITY_SALT
                    + (long) ring.getRingId() * SimulationConstants.RING_SEED_STRIDE;
            out.add(summarize(ring, new Well19937c(seed)));
        }
        return out;
    }

    public RingSummary summarize(Ring ring, RandomGenerator heterogeneityRng) {
        List<Case> cases = ring.getCases();

        double lastReport = 0.0;
        for (Case c : cases) {
            if (c.sinceIndexReport() > lastReport) lastReport = c.sinceIndexReport();
        }

        int delay = ring.getImplementationDelay();
        return new RingSummary(
                ring.getRingId(),
                cases.size(),
                lastReport,
                ring.getPopulation(),
                delay,
                DelayBucket.of(delay),
                coverage,
                surveillanceCategory(ring.getIndexReportDelay()),
                heterogeneity.sample(heterogeneityRng),
                ring.getIndexReportDelay()
        );
    }

    /**
     * Категория возможностей надзора по задержке сообщения об индексном случае.
     * Условия "2" (задержка 1) и "3" (задержка >= 1) перекрываются; выигрывает первое совпадение.
     */
    public static String surveillanceCategory(int indexReportDelay) {
        if (indexReportDelay == 0) return "1";
        if (indexReportDelay == 1) return "2";
        return "3";
    }
}
