package catisim.engine;

import catisim.model.Case;
import catisim.model.DelayBucket;
import catisim.model.Ring;
import catisim.model.RingSummary;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RingSummarizer}.
 */
class RingSummarizerTest {

    private final RingSummarizer summarizer = new RingSummarizer(0.8, new CountDistribution(1.0, 1.0));

    @Test
    @DisplayName("Index-only ring has one case and last report zero")
    void indexOnlyRing() {
        Case index = Case.unreported(5, 0, 0, 0.0).withReport(2.0, 2.0);
        Ring ring = new Ring(5, 420.0, 42, 2, 4, 3.0, 1, List.of(index));

        RingSummary s = summarizer.summarize(ring, new Well19937c(1L));

        assertThat(s.ringId()).isEqualTo(5);
        assertThat(s.caseCount()).isEqualTo(1);
        assertThat(s.lastReport()).isEqualTo(0.0);
        assertThat(s.interventionDelay()).isEqualTo(4);
        assertThat(s.delayBucket()).isEqualTo(DelayBucket.MID);
        assertThat(s.surveillanceCategory()).isEqualTo("3");
        assertThat(s.coverage()).isEqualTo(0.8);
        assertThat(s.population()).isEqualTo(420.0);
    }

    @Test
    @DisplayName("Last report is the latest time since index report")
    void lastReport() {
        Case index = Case.unreported(0, 0, 0, 0.0).withReport(1.0, 1.0);
        Case a = Case.unreported(0, 1, 1, 4.0).withReport(9.0, 1.0);
        Case b = Case.unreported(0, 2, 1, 5.0).withReport(6.0, 1.0);
        Ring ring = new Ring(0, 300.0, 0, 1, 0, 3.0, 3, List.of(index, a, b));

        RingSummary s = summarizer.summarize(ring, new Well19937c(1L));

        assertThat(s.caseCount()).isEqualTo(3);
        assertThat(s.lastReport()).isEqualTo(8.0);
        assertThat(s.surveillanceCategory()).isEqualTo("2");
        assertThat(s.delayBucket()).isEqualTo(DelayBucket.EARLY);
    }

    @Test
    @DisplayName("Surveillance category: first matching rule wins")
    void surveillanceCategory() {
        assertThat(RingSummarizer.surveillanceCategory(0)).isEqualTo("1");
        assertThat(RingSummarizer.surveillanceCategory(1)).isEqualTo("2");
        assertThat(RingSummarizer.surveillanceCategory(2)).isEqualTo("3");
        assertThat(RingSummarizer.surveillanceCategory(9)).isEqualTo("3");
    }

    @Test
    @DisplayName("Delay buckets split at 2 and 6 days")
    void delayBuckets() {
        assertThat(DelayBucket.of(0)).isEqualTo(DelayBucket.EARLY);
        assertThat(DelayBucket.of(2)).isEqualTo(DelayBucket.EARLY);
        assertThat(DelayBucket.of(3)).isEqualTo(DelayBucket.MID);
        assertThat(DelayBucket.of(6)).isEqualTo(DelayBucket.MID);
        assertThat(DelayBucket.of(7)).isEqualTo(DelayBucket.LATE);
        assertThat(DelayBucket.LATE.getLabel()).isEqualTo("7+");
        assertThatThrownBy(() -> DelayBucket.of(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Heterogeneity draws are reproducible per ring")
    void heterogeneityReproducible() {
        Case index = Case.unreported(0, 0, 0, 0.0).withReport(0.0, 0.0);
        List<Ring> rings = List.of(
                new Ring(0, 100.0, 0, 0, 1, 3.0, 1, List.of(index)),
                new Ring(1, 100.0, 0, 0, 1, 3.0, 1, List.of(index)));

        List<RingSummary> first = summarizer.summarizeAll(rings, 77L);
        List<RingSummary> second = summarizer.summarizeAll(rings, 77L);

        assertThat(second).isEqualTo(first);
    }
}
