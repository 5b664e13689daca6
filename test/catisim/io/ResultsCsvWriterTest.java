package catisim.io;

import catisim.model.Case;
import catisim.model.DelayBucket;
import catisim.model.RingSummary;
import catisim.power.PilotEstimate;
import catisim.power.PowerCurve;
import catisim.power.PowerEstimationEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ResultsCsvWriter}.
 */
class ResultsCsvWriterTest {

    @Test
    @DisplayName("Case table uses ';' and decimal comma")
    void casesTable() throws IOException {
        StringWriter w = new StringWriter();

        ResultsCsvWriter.writeCases(w, List.of(new Case(1, 0, 0, 0.0, 2.0, 0.0),
                new Case(1, 1, 1, 4.5, 7.0, 5.0)));

        String[] lines = w.toString().split("\n");
        assertThat(lines).hasSize(3);
        assertThat(lines[0]).isEqualTo("ring;case;generation;onset;report;sinceIndexReport");
        assertThat(lines[2]).isEqualTo("1;1;1;4,5000;7,0000;5,0000");
    }

    @Test
    @DisplayName("Ring summary row carries bucket label and category")
    void ringSummaryTable() throws IOException {
        StringWriter w = new StringWriter();

        ResultsCsvWriter.writeRingSummaries(w, List.of(
                new RingSummary(3, 12, 9.0, 512.25, 8, DelayBucket.LATE, 0.8, "3", 2, 4)));

        String[] lines = w.toString().split("\n");
        assertThat(lines[1]).isEqualTo("3;12;9,00;512,25;8;\"7+\";0,80;\"3\";2;4");
    }

    @Test
    @DisplayName("Power table has one row per sample size and replicates one row per replicate")
    void powerTables() throws IOException {
        PowerCurve curve = new PowerCurve(List.of(
                PowerEstimationEngine.aggregate(50, List.of(
                        PilotEstimate.failed(50, 0, "singular system"),
                        PilotEstimate.failed(50, 1, "singular system")))));
        StringWriter power = new StringWriter();
        StringWriter reps = new StringWriter();

        ResultsCsvWriter.writePower(power, curve);
        ResultsCsvWriter.writeReplicates(reps, curve);

        assertThat(power.toString().split("\n")).hasSize(2);
        assertThat(power.toString().split("\n")[1]).startsWith("50;2;0;2;0;NaN;");
        String[] repLines = reps.toString().split("\n");
        assertThat(repLines).hasSize(3);
        assertThat(repLines[1]).startsWith("50;0;false;").endsWith("\"singular system\"");
    }
}
