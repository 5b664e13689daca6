package catisim;

import catisim.config.RunMode;
import catisim.config.SimulationConfig;
import catisim.config.StudyParameters;
import catisim.io.PowerResultsExcelWriter;
import catisim.io.ResultsCsvWriter;
import catisim.io.StudyParametersLoader;
import catisim.power.PowerEstimate;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Аргументы: [файл .properties] [каталог результатов] [базовый сид] [SINGLE|SWEEP].
 * Режим из аргумента важнее ключа mode в .properties; по умолчанию SWEEP.
 */
public class Main {

    /** Целевая мощность для подбора минимального размера выборки. */
    private static final double TARGET_POWER = 0.8;

    public static void main(String[] args) {

        String propertiesPath = args.length > 0 ? args[0] : null;
        Path outDir = Path.of(args.length > 1 ? args[1] : "results");

        int threads = Runtime.getRuntime().availableProcessors();

        try {
            // 1) параметры
            StudyParameters params = ScenarioFactory.defaultParams();
            SimulationConfig cfg = ScenarioFactory.defaultConfig(threads);
            StudyParametersLoader loader = new StudyParametersLoader();
            Properties props = (propertiesPath != null)
                    ? loader.load(Path.of(propertiesPath))
                    : loader.loadResource("study.properties");
            params = loader.applyStudy(props, params);
            cfg = loader.applyConfig(props, cfg);
            if (args.length > 2) {
                cfg = cfg.withBaseSeed(Long.parseLong(args[2]));
            }
            RunMode mode = args.length > 3
                    ? RunMode.parse(args[3])
                    : loader.applyMode(props, RunMode.SWEEP);

            // 2) какие размеры выборки считаем
            int[] sampleSizes = mode.sampleSizes(cfg);

            // 3) общий пул
            ExecutorService ex = Executors.newFixedThreadPool(cfg.getThreads());
            try {
                StudyRunner.StudyResult result = StudyRunner.run(cfg, params, sampleSizes, ex);

                Files.createDirectories(outDir);
                Path casesCsv = outDir.resolve("cases.csv");
                Path ringsCsv = outDir.resolve("rings.csv");
                Path powerCsv = outDir.resolve("power.csv");
                Path replicatesCsv = outDir.resolve("replicates.csv");
                Path xlsx = outDir.resolve("power.xlsx");

                ResultsCsvWriter.writeCases(casesCsv, result.batch().allCases());
                ResultsCsvWriter.writeRingSummaries(ringsCsv, result.summaries());
                ResultsCsvWriter.writePower(powerCsv, result.curve());
                ResultsCsvWriter.writeReplicates(replicatesCsv, result.curve());
                PowerResultsExcelWriter.writeXlsx(xlsx, cfg, params, result.curve());

                for (PowerEstimate e : result.curve().getPoints()) {
                    System.out.printf(Locale.US, "n=%d power=%.3f [%.3f; %.3f] failed=%d%n",
                            e.sampleSize, e.power, e.powerCiLow, e.powerCiHigh, e.failedReplicates);
                }
                OptionalInt minN = result.curve().minimumSampleSizeFor(TARGET_POWER);
                if (minN.isPresent()) {
                    System.out.println("Min sample size for power " + TARGET_POWER + ": " + minN.getAsInt());
                } else {
                    System.out.println("Power " + TARGET_POWER + " not reached on the evaluated sizes");
                }
                if (result.batch().getAbortedRings() > 0) {
                    System.out.println("Aborted rings: " + result.batch().getAbortedRings());
                }
                System.out.println("Saved: " + outDir.toAbsolutePath());

            } finally {
                ex.shutdown();
            }
        } catch (Exception e) {
            System.err.println("Ошибка: " + e.getMessage());
            e.printStackTrace();
        }
    }
}
