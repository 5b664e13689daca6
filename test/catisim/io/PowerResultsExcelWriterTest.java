package catisim.io;

import catisim.ScenarioFactory;
import catisim.power.PilotEstimate;
import catisim.power.PowerCurve;
import catisim.power.PowerEstimationEngine;
import catisim.regression.RegressionFit;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link PowerResultsExcelWriter}.
 */
class PowerResultsExcelWriterTest {

    @Test
    @DisplayName("Workbook has a power sheet and a replicates sheet")
    void writesBothSheets() throws Exception {
        RegressionFit fit = new RegressionFit(-4.0, 0.05, 0.1, 0.02, 0.001, 0.01,
                -4.2, -3.8, 0.01, 0.09, 1.0, 2.0, 0.01, 10);
        PowerCurve curve = new PowerCurve(List.of(
                PowerEstimationEngine.aggregate(50, List.of(
                        PilotEstimate.fitted(50, 0, fit),
                        PilotEstimate.failed(50, 1, "no convergence"))),
                PowerEstimationEngine.aggregate(75, List.of(
                        PilotEstimate.fitted(75, 0, fit)))));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        PowerResultsExcelWriter.writeXlsx(out, ScenarioFactory.defaultConfig(1),
                ScenarioFactory.defaultParams(), curve);

        try (Workbook wb = new XSSFWorkbook(new ByteArrayInputStream(out.toByteArray()))) {
            Sheet power = wb.getSheet(PowerResultsExcelWriter.POWER_SHEET);
            Sheet reps = wb.getSheet(PowerResultsExcelWriter.REPLICATES_SHEET);

            assertThat(power).isNotNull();
            assertThat(reps).isNotNull();
            assertThat(power.getRow(0).getCell(0).getStringCellValue()).contains("rings=1000");
            assertThat(power.getLastRowNum()).isEqualTo(3);
            assertThat(power.getRow(2).getCell(0).getNumericCellValue()).isEqualTo(50.0);
            assertThat(power.getRow(2).getCell(5).getNumericCellValue()).isEqualTo(1.0);
            assertThat(reps.getLastRowNum()).isEqualTo(3);
            assertThat(reps.getRow(2).getCell(2).getBooleanCellValue()).isFalse();
        }
    }
}
