package catisim.engine;

import catisim.config.StudyParameters;
import catisim.model.Case;
import org.apache.commons.math3.random.RandomGenerator;

import java.util.ArrayList;
import java.util.List;

/**
 * Задержка "начало болезни -> сообщение".
 * До окончания вмешательства задержка длиннее, после — короче (активный поиск случаев).
 * Индексный случай не пересэмплируется: у него задержка кольца.
 */
public final class ReportingDelayModel {

    private final CountDistribution beforeIntervention;
    private final CountDistribution afterIntervention;

    public ReportingDelayModel(CountDistribution beforeIntervention, CountDistribution afterIntervention) {
        this.beforeIntervention = beforeIntervention;
        this.afterIntervention = afterIntervention;
    }

    public static ReportingDelayModel from(StudyParameters p) {
        return new ReportingDelayModel(
                new CountDistribution(p.getReportDelayBeforeMean(), p.getReportDelayBeforeDispersion()),
                new CountDistribution(p.getReportDelayAfterMean(), p.getReportDelayAfterDispersion())
        );
    }

    public int sampleDelay(double onsetTime, double interventionEnd, RandomGenerator rng) {
        return (onsetTime < interventionEnd)
                ? beforeIntervention.sample(rng)
                : afterIntervention.sample(rng);
    }

    /**
     * Проставляет время сообщения всем случаям цепочки, включая индексный.
     *
     * @param cases            случаи цепочки, индексный первым
     * @param interventionEnd  окончание вмешательства (та же шкала, что onset)
     * @param indexReportDelay заранее выбранная задержка индексного случая
     */
    public List<Case> reportAll(List<Case> cases,
                                double interventionEnd,
                                int indexReportDelay,
                                RandomGenerator rng) {
        if (cases.isEmpty() || !cases.get(0).isIndex()) {
            throw new IllegalArgumentException("chain must start with the index case");
        }
        Case index = cases.get(0);
        double indexReportTime = index.onsetTime() + indexReportDelay;

        List<Case> out = new ArrayList<>(cases.size());
        out.add(index.withReport(indexReportTime, indexReportTime));

        for (int i = 1; i < cases.size(); i++) {
            Case c = cases.get(i);
            int delay = sampleDelay(c.onsetTime(), interventionEnd, rng);
            out.add(c.withReport(c.onsetTime() + delay, indexReportTime));
        }
        return out;
    }
}
