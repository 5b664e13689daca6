package catisim.power;

import catisim.config.ConfigurationException;
import catisim.config.SimulationConstants;
import catisim.model.RingSummary;
import catisim.regression.CountData;
import catisim.regression.CountRegression;
import catisim.regression.EstimationNonConvergenceException;
import org.apache.commons.math3.random.RandomDataGenerator;
import org.apache.commons.math3.random.RandomGenerator;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Пилотное исследование: случайная подвыборка колец без возвращения и подгонка
 * caseCount ~ interventionDelay + offset(log(population)) + (1 | surveillanceCategory).
 */
public final class PilotStudyEstimator {

    private final List<RingSummary> table;
    private final CountRegression regression;

    public PilotStudyEstimator(List<RingSummary> table, CountRegression regression) {
        if (table == null || table.isEmpty()) {
            throw new ConfigurationException("ring summary table must not be empty");
        }
        this.table = List.copyOf(table);
        this.regression = regression;
    }

    public void validateSampleSize(int sampleSize) {
        if (sampleSize < SimulationConstants.MIN_SAMPLE_SIZE) {
            throw new ConfigurationException("sample size " + sampleSize
                    + " is below minimum " + SimulationConstants.MIN_SAMPLE_SIZE);
        }
        if (sampleSize > table.size()) {
            throw new ConfigurationException("sample size " + sampleSize
                    + " exceeds available rings " + table.size());
        }
    }

    public PilotEstimate run(int sampleSize, int replicate, RandomGenerator rng) {
        validateSampleSize(sampleSize);

        int[] picked = new RandomDataGenerator(rng).nextPermutation(table.size(), sampleSize);
        CountData data = toCountData(picked);

        try {
            return PilotEstimate.fitted(sampleSize, replicate, regression.fit(data));
        } catch (EstimationNonConvergenceException e) {
            return PilotEstimate.failed(sampleSize, replicate, e.getMessage());
        }
    }

    private CountData toCountData(int[] picked) {
        int n = picked.length;

        // уровни группы нумеруем по тем, что попали в выборку
        Map<String, Integer> levels = new TreeMap<>();
        for (int idx : picked) levels.putIfAbsent(table.get(idx).surveillanceCategory(), 0);
        int level = 0;
        for (Map.Entry<String, Integer> e : levels.entrySet()) e.setValue(level++);

        int[] y = new int[n];
        double[] x = new double[n];
        double[] offset = new double[n];
        int[] group = new int[n];
        for (int i = 0; i < n; i++) {
            RingSummary s = table.get(picked[i]);
            y[i] = s.caseCount();
            x[i] = s.interventionDelay();
            offset[i] = Math.log(s.population());
            group[i] = levels.get(s.surveillanceCategory());
        }
        return new CountData(y, x, offset, group, levels.size());
    }

    public int tableSize() {
        return table.size();
    }
}
