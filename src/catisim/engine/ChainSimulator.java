package catisim.engine;

import catisim.config.ConfigurationException;
import catisim.config.OffspringFamily;
import catisim.config.SimulationConstants;
import catisim.config.StudyParameters;
import catisim.model.Case;
import catisim.model.OffspringParameters;
import org.apache.commons.math3.random.RandomGenerator;

import java.util.ArrayList;
import java.util.List;

/**
 * Ветвящийся процесс с истощением восприимчивых.
 * <p>
 * ВАЖНО:
 * - график эффекта применяется один раз на поколение, во время самого раннего начала болезни среди его родителей;
 * - потомки списываются с восприимчивых сразу, поэтому суммарное потомство не превышает population - immune;
 * - случаи позже tEnd записываются, но дальше не ветвятся.
 */
public final class ChainSimulator {

    private final OffspringFamily family;
    private final double meanOffspring;
    private final double dispersion;
    private final SerialIntervalSampler serialInterval;
    private final int maxGenerations;
    private final int maxCases;

    public ChainSimulator(OffspringFamily family,
                          double meanOffspring,
                          double dispersion,
                          SerialIntervalSampler serialInterval) {
        this(family, meanOffspring, dispersion, serialInterval,
                SimulationConstants.MAX_GENERATIONS, SimulationConstants.MAX_CASES_PER_RING);
    }

    public ChainSimulator(OffspringFamily family,
                          double meanOffspring,
                          double dispersion,
                          SerialIntervalSampler serialInterval,
                          int maxGenerations,
                          int maxCases) {
        if (dispersion < 0.0) {
            throw new ConfigurationException("dispersion must not be negative, got " + dispersion);
        }
        if (family == OffspringFamily.NEGATIVE_BINOMIAL && !(dispersion > 0.0 && Double.isFinite(dispersion))) {
            throw new ConfigurationException("negative binomial needs finite dispersion > 0, got " + dispersion);
        }
        if (!(meanOffspring >= 0.0)) {
            throw new ConfigurationException("meanOffspring must be >= 0, got " + meanOffspring);
        }
        if (maxGenerations <= 0 || maxCases <= 0) {
            throw new IllegalArgumentException("safety caps must be > 0");
        }
        this.family = family;
        this.meanOffspring = meanOffspring;
        this.dispersion = dispersion;
        this.serialInterval = serialInterval;
        this.maxGenerations = maxGenerations;
        this.maxCases = maxCases;
    }

    public static ChainSimulator from(StudyParameters p) {
        return new ChainSimulator(
                p.getOffspringFamily(),
                p.getMeanOffspring(),
                p.getOffspringDispersion(),
                SerialIntervalSampler.gamma(p.getSerialIntervalMean(), p.getSerialIntervalSd())
        );
    }

    /**
     * Одна стохастическая цепочка.
     *
     * @return все случаи по поколениям, индексный первым; поля сообщения ещё не заполнены
     */
    public List<Case> simulate(int ringId,
                               double population,
                               int initialImmune,
                               double tStart,
                               double tEnd,
                               EffectSchedule schedule,
                               RandomGenerator rng) throws StochasticDegeneracyException {

        if (!(population > 0.0)) {
            throw new ConfigurationException("population must be > 0, got " + population);
        }
        if (initialImmune < 0) {
            throw new ConfigurationException("initialImmune must be >= 0, got " + initialImmune);
        }

        int budget = Math.max(0, (int) Math.floor(population) - initialImmune);
        OffspringParameters params = new OffspringParameters(meanOffspring, dispersion, budget);

        List<Case> cases = new ArrayList<>();
        Case index = Case.unreported(ringId, 0, 0, tStart);
        cases.add(index);

        List<Case> current = new ArrayList<>();
        current.add(index);
        int generation = 0;

        while (!current.isEmpty() && params.remainingSusceptible() > 0) {
            if (generation >= maxGenerations) {
                throw new StochasticDegeneracyException(ringId, "generation cap " + maxGenerations + " exceeded");
            }

            double stepTime = earliestBranchingOnset(current, tEnd);
            if (Double.isNaN(stepTime)) break;

            // один шаг графика на поколение, бюджет дальше общий для всех родителей поколения
            params = schedule.apply(stepTime - tStart, params);

            List<Case> next = new ArrayList<>();
            for (Case parent : current) {
                if (parent.onsetTime() >= tEnd) continue;
                if (params.remainingSusceptible() == 0) break;

                int remaining = params.remainingSusceptible();
                double effectiveMean = params.meanOffspring() * remaining / population;
                int offspring = Math.min(drawOffspring(rng, effectiveMean), remaining);
                params = params.withRemainingSusceptible(remaining - offspring);

                for (int k = 0; k < offspring; k++) {
                    double onset = parent.onsetTime() + serialInterval.sample(rng);
                    Case child = Case.unreported(ringId, cases.size(), generation + 1, onset);
                    cases.add(child);
                    next.add(child);
                }
                if (cases.size() > maxCases) {
                    throw new StochasticDegeneracyException(ringId, "case cap " + maxCases + " exceeded");
                }
            }

            current = next;
            generation++;
        }

        return cases;
    }

    /**
     * Время шага поколения: самое раннее начало болезни среди родителей, которые ещё ветвятся.
     *
     * @return NaN, если ветвящихся родителей нет
     */
    static double earliestBranchingOnset(List<Case> generation, double tEnd) {
        double t = Double.NaN;
        for (Case c : generation) {
            double onset = c.onsetTime();
            if (onset < tEnd && (Double.isNaN(t) || onset < t)) t = onset;
        }
        return t;
    }

    private int drawOffspring(RandomGenerator rng, double mean) {
        return switch (family) {
            case POISSON -> Sampling.poisson(rng, mean);
            case NEGATIVE_BINOMIAL -> Sampling.negativeBinomial(rng, mean, dispersion);
        };
    }

    public OffspringFamily getFamily() {
        return family;
    }
}
