package catisim.io;

import catisim.model.Case;
import catisim.model.RingSummary;
import catisim.power.PilotEstimate;
import catisim.power.PowerCurve;
import catisim.power.PowerEstimate;
import catisim.power.SlopeSummary;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Три выходные таблицы (случаи, сводки колец, мощность) в CSV с разделителем ';'.
 */
public final class ResultsCsvWriter {

    private static final Locale RU = new Locale("ru", "RU");

    private ResultsCsvWriter() {}

    // ---- cases ----

    public static void writeCases(Path path, List<Case> cases) throws IOException {
        try (BufferedWriter w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writeCases(w, cases);
        }
    }

    public static void writeCases(Writer w, List<Case> cases) throws IOException {
        w.write("ring;case;generation;onset;report;sinceIndexReport\n");
        for (Case c : cases) {
            w.write(c.ringId() + ";"
                    + c.caseId() + ";"
                    + c.generation() + ";"
                    + fmt4(c.onsetTime()) + ";"
                    + fmt4(c.reportTime()) + ";"
                    + fmt4(c.sinceIndexReport()) + "\n");
        }
    }

    // ---- ring summaries ----

    public static void writeRingSummaries(Path path, List<RingSummary> rows) throws IOException {
        try (BufferedWriter w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writeRingSummaries(w, rows);
        }
    }

    public static void writeRingSummaries(Writer w, List<RingSummary> rows) throws IOException {
        w.write("ring;cases;lastReport;population;delay;delayBucket;coverage;surveillance;heterogeneity;indexDelay\n");
        for (RingSummary s : rows) {
            w.write(s.ringId() + ";"
                    + s.caseCount() + ";"
                    + fmt2(s.lastReport()) + ";"
                    + fmt2(s.population()) + ";"
                    + s.interventionDelay() + ";"
                    + csvCell(s.delayBucket().getLabel()) + ";"
                    + fmt2(s.coverage()) + ";"
                    + csvCell(s.surveillanceCategory()) + ";"
                    + s.heterogeneity() + ";"
                    + s.indexReportDelay() + "\n");
        }
    }

    // ---- power ----

    public static void writePower(Path path, PowerCurve curve) throws IOException {
        try (BufferedWriter w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writePower(w, curve);
        }
    }

    public static void writePower(Writer w, PowerCurve curve) throws IOException {
        w.write("n;replicates;valid;failed;significant;power;power_ciLo;power_ciHi;slope_mean;slope_ciLo;slope_ciHi;slope_reqN\n");
        for (PowerEstimate e : curve.getPoints()) {
            SlopeSummary s = e.slopeSummary;
            w.write(e.sampleSize + ";"
                    + e.replicates + ";"
                    + e.validReplicates + ";"
                    + e.failedReplicates + ";"
                    + e.significantReplicates + ";"
                    + fmt4(e.power) + ";"
                    + fmt4(e.powerCiLow) + ";"
                    + fmt4(e.powerCiHigh) + ";"
                    + fmt4(s.mean()) + ";"
                    + fmt4(s.ciLow()) + ";"
                    + fmt4(s.ciHigh()) + ";"
                    + s.requiredReplicates() + "\n");
        }
    }

    public static void writeReplicates(Path path, PowerCurve curve) throws IOException {
        try (BufferedWriter w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writeReplicates(w, curve);
        }
    }

    public static void writeReplicates(Writer w, PowerCurve curve) throws IOException {
        w.write("n;replicate;converged;b0;b1;p_b0;p_b1;b0_ciLo;b0_ciHi;b1_ciLo;b1_ciHi;overdisp;theta;sigma2;reason\n");
        for (PowerEstimate e : curve.getPoints()) {
            for (PilotEstimate r : e.replicateRows) {
                w.write(r.sampleSize() + ";"
                        + r.replicate() + ";"
                        + r.converged() + ";"
                        + fmt4(r.intercept()) + ";"
                        + fmt4(r.slope()) + ";"
                        + fmtP(r.interceptPValue()) + ";"
                        + fmtP(r.slopePValue()) + ";"
                        + fmt4(r.interceptCiLow()) + ";"
                        + fmt4(r.interceptCiHigh()) + ";"
                        + fmt4(r.slopeCiLow()) + ";"
                        + fmt4(r.slopeCiHigh()) + ";"
                        + fmt4(r.overdispersionRatio()) + ";"
                        + fmt4(r.theta()) + ";"
                        + fmt4(r.randomEffectVariance()) + ";"
                        + (r.failureReason() == null ? "" : csvCell(r.failureReason())) + "\n");
            }
        }
    }

    private static String csvCell(String s) {
        return "\"" + s.replace("\"", "\"\"") + "\"";
    }

    private static String fmt2(double v) { return String.format(RU, "%.2f", v); }
    private static String fmt4(double v) { return String.format(RU, "%.4f", v); }
    private static String fmtP(double v) { return String.format(RU, "%.6g", v); }
}
