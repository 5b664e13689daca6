package catisim.engine;

import catisim.config.ConfigurationException;
import catisim.config.StudyParameters;
import catisim.model.OffspringParameters;

/**
 * График действия CATI для одного кольца.
 * Фазы (первое совпадение): до конца вмешательства эффекта нет; затем WASH + антибиотик;
 * затем только WASH (антибиотик закончился); затем WASH + вакцина.
 * Время — сутки от начала болезни индексного случая.
 */
public final class EffectSchedule {

    private final double interventionEnd;
    private final double washOnlyDelay;
    private final double vaccineDelay;
    private final InterventionEffects effects;

    public EffectSchedule(double interventionEnd,
                          double washOnlyDelay,
                          double vaccineDelay,
                          InterventionEffects effects) {
        if (Double.isNaN(interventionEnd) || Double.isInfinite(interventionEnd)) {
            throw new ConfigurationException("interventionEnd must be finite, got " + interventionEnd);
        }
        if (!(washOnlyDelay >= 0.0) || !(vaccineDelay >= washOnlyDelay)) {
            throw new ConfigurationException("phase boundaries must satisfy 0 <= washOnlyDelay <= vaccineDelay, got "
                    + washOnlyDelay + " / " + vaccineDelay);
        }
        if (effects == null) throw new ConfigurationException("effects must not be null");
        this.interventionEnd = interventionEnd;
        this.washOnlyDelay = washOnlyDelay;
        this.vaccineDelay = vaccineDelay;
        this.effects = effects;
    }

    public static EffectSchedule forRing(StudyParameters p, InterventionEffects effects, double interventionEnd) {
        return new EffectSchedule(interventionEnd, p.getWashOnlyDelayDays(), p.getVaccineDelayDays(), effects);
    }

    public double multiplier(double elapsed) {
        if (elapsed <= interventionEnd) return 1.0;
        if (elapsed <= interventionEnd + washOnlyDelay) return effects.washAndAntibiotic();
        if (elapsed <= interventionEnd + vaccineDelay) return effects.washOnly();
        return effects.washPlusVaccine();
    }

    /**
     * Новое значение параметров: remaining = round(remaining * x), остальное без изменений.
     */
    public OffspringParameters apply(double elapsed, OffspringParameters params) {
        double x = multiplier(elapsed);
        if (x == 1.0) return params;
        int reduced = (int) Math.round(params.remainingSusceptible() * x);
        return params.withRemainingSusceptible(Math.min(reduced, params.remainingSusceptible()));
    }

    public double getInterventionEnd() {
        return interventionEnd;
    }
}
