package catisim.io;

import catisim.config.SimulationConfig;
import catisim.config.StudyParameters;
import catisim.power.PilotEstimate;
import catisim.power.PowerCurve;
import catisim.power.PowerEstimate;
import catisim.power.SlopeSummary;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Книга Excel по кривой мощности: лист POWER (строка на размер выборки) и REPLICATES (строка на реплику).
 */
public final class PowerResultsExcelWriter {

    static final String POWER_SHEET = "POWER";
    static final String REPLICATES_SHEET = "REPLICATES";

    private static final int COLUMN_WIDTH = 14 * 256;

    private PowerResultsExcelWriter() {}

    public static void writeXlsx(Path path,
                                 SimulationConfig cfg,
                                 StudyParameters params,
                                 PowerCurve curve) throws IOException {
        try (OutputStream out = Files.newOutputStream(path)) {
            writeXlsx(out, cfg, params, curve);
        }
    }

    public static void writeXlsx(OutputStream out,
                                 SimulationConfig cfg,
                                 StudyParameters params,
                                 PowerCurve curve) throws IOException {

        try (Workbook wb = new XSSFWorkbook()) {

            // ===== Styles =====
            DataFormat df = wb.createDataFormat();

            CellStyle passportStyle = wb.createCellStyle();
            passportStyle.setWrapText(false);
            passportStyle.setVerticalAlignment(VerticalAlignment.TOP);

            CellStyle headerStyle = wb.createCellStyle();
            headerStyle.setAlignment(HorizontalAlignment.CENTER);
            headerStyle.setVerticalAlignment(VerticalAlignment.CENTER);

            CellStyle numberStyle = wb.createCellStyle();
            numberStyle.setAlignment(HorizontalAlignment.CENTER);
            numberStyle.setVerticalAlignment(VerticalAlignment.CENTER);
            numberStyle.setDataFormat(df.getFormat("0.0000"));

            CellStyle intStyle = wb.createCellStyle();
            intStyle.setAlignment(HorizontalAlignment.CENTER);
            intStyle.setVerticalAlignment(VerticalAlignment.CENTER);
            intStyle.setDataFormat(df.getFormat("0"));

            // ===== POWER sheet =====
            Sheet power = wb.createSheet(POWER_SHEET);
            int r = 0;

            Row row0 = power.createRow(r++);
            Cell passportCell = row0.createCell(0);
            passportCell.setCellValue(buildPassport(cfg, params));
            passportCell.setCellStyle(passportStyle);

            Row hdr = power.createRow(r++);
            int c = 0;
            c = writeHeader(hdr, c, "n", headerStyle);
            c = writeHeader(hdr, c, "replicates", headerStyle);
            c = writeHeader(hdr, c, "valid", headerStyle);
            c = writeHeader(hdr, c, "failed", headerStyle);
            c = writeHeader(hdr, c, "significant", headerStyle);
            c = writeHeader(hdr, c, "power", headerStyle);
            c = writeHeader(hdr, c, "power_ciLo", headerStyle);
            c = writeHeader(hdr, c, "power_ciHi", headerStyle);
            c = writeHeader(hdr, c, "slope_mean", headerStyle);
            c = writeHeader(hdr, c, "slope_ciLo", headerStyle);
            c = writeHeader(hdr, c, "slope_ciHi", headerStyle);
            c = writeHeader(hdr, c, "slope_reqN", headerStyle);

            for (PowerEstimate e : curve.getPoints()) {
                SlopeSummary s = e.slopeSummary;
                Row rr = power.createRow(r++);
                int cc = 0;
                writeInt(rr, cc++, e.sampleSize, intStyle);
                writeInt(rr, cc++, e.replicates, intStyle);
                writeInt(rr, cc++, e.validReplicates, intStyle);
                writeInt(rr, cc++, e.failedReplicates, intStyle);
                writeInt(rr, cc++, e.significantReplicates, intStyle);
                writeNumber(rr, cc++, e.power, numberStyle);
                writeNumber(rr, cc++, e.powerCiLow, numberStyle);
                writeNumber(rr, cc++, e.powerCiHigh, numberStyle);
                writeNumber(rr, cc++, s.mean(), numberStyle);
                writeNumber(rr, cc++, s.ciLow(), numberStyle);
                writeNumber(rr, cc++, s.ciHigh(), numberStyle);
                writeInt(rr, cc++, s.requiredReplicates(), intStyle);
            }
            setWidths(power, c);

            // ===== REPLICATES sheet =====
            Sheet reps = wb.createSheet(REPLICATES_SHEET);
            int rr0 = 0;
            Row rh = reps.createRow(rr0++);
            c = 0;
            c = writeHeader(rh, c, "n", headerStyle);
            c = writeHeader(rh, c, "replicate", headerStyle);
            c = writeHeader(rh, c, "converged", headerStyle);
            c = writeHeader(rh, c, "b0", headerStyle);
            c = writeHeader(rh, c, "b1", headerStyle);
            c = writeHeader(rh, c, "p_b1", headerStyle);
            c = writeHeader(rh, c, "b1_ciLo", headerStyle);
            c = writeHeader(rh, c, "b1_ciHi", headerStyle);
            c = writeHeader(rh, c, "overdisp", headerStyle);

            for (PowerEstimate e : curve.getPoints()) {
                for (PilotEstimate p : e.replicateRows) {
                    Row row = reps.createRow(rr0++);
                    int cc = 0;
                    writeInt(row, cc++, p.sampleSize(), intStyle);
                    writeInt(row, cc++, p.replicate(), intStyle);
                    row.createCell(cc++).setCellValue(p.converged());
                    // несошедшиеся реплики оставляем пустыми ячейками, не NaN
                    if (p.converged()) {
                        writeNumber(row, cc++, p.intercept(), numberStyle);
                        writeNumber(row, cc++, p.slope(), numberStyle);
                        writeNumber(row, cc++, p.slopePValue(), numberStyle);
                        writeNumber(row, cc++, p.slopeCiLow(), numberStyle);
                        writeNumber(row, cc++, p.slopeCiHigh(), numberStyle);
                        writeNumber(row, cc++, p.overdispersionRatio(), numberStyle);
                    }
                }
            }
            setWidths(reps, c);

            wb.write(out);
        }
    }

    private static int writeHeader(Row hdr, int col, String text, CellStyle headerStyle) {
        Cell cell = hdr.createCell(col);
        cell.setCellValue(text);
        cell.setCellStyle(headerStyle);
        return col + 1;
    }

    private static void writeNumber(Row row, int col, double value, CellStyle numStyle) {
        Cell cell = row.createCell(col);
        if (Double.isFinite(value)) {
            cell.setCellValue(value);
        }
        cell.setCellStyle(numStyle);
    }

    private static void writeInt(Row row, int col, long value, CellStyle intStyle) {
        Cell cell = row.createCell(col);
        cell.setCellValue(value);
        cell.setCellStyle(intStyle);
    }

    private static void setWidths(Sheet sh, int cols) {
        for (int i = 0; i < cols; i++) sh.setColumnWidth(i, COLUMN_WIDTH);
    }

    private static String buildPassport(SimulationConfig cfg, StudyParameters p) {
        return String.format(Locale.US,
                "rings=%d; MC=%d; seed=%d; R=%.2f; k=%.2f; pop=%.0f±%.0f; impl=%d..%d d; dur=%.1f d; follow-up=%.0f d; cov=%.2f",
                cfg.getRingCount(),
                cfg.getReplicates(),
                cfg.getBaseSeed(),
                p.getMeanOffspring(),
                p.getOffspringDispersion(),
                p.getPopulationMean(),
                p.getPopulationSd(),
                p.getImplementationDelayMinDays(),
                p.getImplementationDelayMaxDays(),
                p.getInterventionDurationDays(),
                p.getFollowUpDays(),
                p.getCoverage()
        );
    }
}
