package catisim.io;

import catisim.config.ConfigurationException;
import catisim.config.RunMode;
import catisim.config.SimulationConfig;
import catisim.config.StudyParameters;
import catisim.config.StudyParametersBuilder;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Properties;

/**
 * Загрузка переопределений параметров из .properties.
 * <p>
 * Ключи совпадают с именами полей StudyParameters (meanOffspring, coverage, ...)
 * и SimulationConfig (ringCount, replicates, sampleSizes, threads, baseSeed);
 * mode выбирает режим запуска (SINGLE / SWEEP).
 * Отсутствующий ключ оставляет значение по умолчанию, неизвестный ключ — ошибка.
 */
public class StudyParametersLoader {

    public Properties load(Path path) throws IOException {
        try (Reader r = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Properties props = new Properties();
            props.load(r);
            return props;
        }
    }

    public Properties loadResource(String name) throws IOException {
        InputStream in = StudyParametersLoader.class.getClassLoader().getResourceAsStream(name);
        if (in == null) {
            throw new IOException("Ресурс не найден: " + name);
        }
        try (Reader r = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            Properties props = new Properties();
            props.load(r);
            return props;
        }
    }

    public StudyParameters applyStudy(Properties props, StudyParameters defaults) {
        StudyParametersBuilder b = StudyParametersBuilder.from(defaults);

        for (String key : props.stringPropertyNames()) {
            if (isConfigKey(key)) continue;
            String raw = props.getProperty(key).trim();

            switch (key) {
                case "meanOffspring" -> b.setMeanOffspring(parseDouble(key, raw));
                case "offspringDispersion" -> b.setOffspringDispersion(parseDouble(key, raw));
                case "serialIntervalMean" -> b.setSerialIntervalMean(parseDouble(key, raw));
                case "serialIntervalSd" -> b.setSerialIntervalSd(parseDouble(key, raw));
                case "populationMean" -> b.setPopulationMean(parseDouble(key, raw));
                case "populationSd" -> b.setPopulationSd(parseDouble(key, raw));
                case "immuneFraction" -> b.setImmuneFraction(parseDouble(key, raw));
                case "indexReportDelayMean" -> b.setIndexReportDelayMean(parseDouble(key, raw));
                case "indexReportDelayDispersion" -> b.setIndexReportDelayDispersion(parseDouble(key, raw));
                case "reportDelayBeforeMean" -> b.setReportDelayBeforeMean(parseDouble(key, raw));
                case "reportDelayBeforeDispersion" -> b.setReportDelayBeforeDispersion(parseDouble(key, raw));
                case "reportDelayAfterMean" -> b.setReportDelayAfterMean(parseDouble(key, raw));
                case "reportDelayAfterDispersion" -> b.setReportDelayAfterDispersion(parseDouble(key, raw));
                case "implementationDelayMinDays" -> b.setImplementationDelayMinDays(parseInt(key, raw));
                case "implementationDelayMaxDays" -> b.setImplementationDelayMaxDays(parseInt(key, raw));
                case "interventionDurationDays" -> b.setInterventionDurationDays(parseDouble(key, raw));
                case "washOnlyDelayDays" -> b.setWashOnlyDelayDays(parseDouble(key, raw));
                case "vaccineDelayDays" -> b.setVaccineDelayDays(parseDouble(key, raw));
                case "antibioticEfficacy" -> b.setAntibioticEfficacy(parseDouble(key, raw));
                case "washEfficacy" -> b.setWashEfficacy(parseDouble(key, raw));
                case "vaccineEfficacy" -> b.setVaccineEfficacy(parseDouble(key, raw));
                case "coverage" -> b.setCoverage(parseDouble(key, raw));
                case "followUpDays" -> b.setFollowUpDays(parseDouble(key, raw));
                case "heterogeneityMean" -> b.setHeterogeneityMean(parseDouble(key, raw));
                case "heterogeneityDispersion" -> b.setHeterogeneityDispersion(parseDouble(key, raw));
                default -> throw new ConfigurationException("Неизвестный ключ: " + key);
            }
        }
        return b.build();
    }

    public SimulationConfig applyConfig(Properties props, SimulationConfig defaults) {
        int ringCount = defaults.getRingCount();
        int replicates = defaults.getReplicates();
        int[] sampleSizes = defaults.getSampleSizes();
        int threads = defaults.getThreads();
        long baseSeed = defaults.getBaseSeed();

        String v;
        if ((v = props.getProperty("ringCount")) != null) ringCount = parseInt("ringCount", v.trim());
        if ((v = props.getProperty("replicates")) != null) replicates = parseInt("replicates", v.trim());
        if ((v = props.getProperty("threads")) != null) threads = parseInt("threads", v.trim());
        if ((v = props.getProperty("baseSeed")) != null) baseSeed = parseLong("baseSeed", v.trim());
        if ((v = props.getProperty("sampleSizes")) != null) {
            sampleSizes = Arrays.stream(v.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .mapToInt(s -> parseInt("sampleSizes", s))
                    .toArray();
        }
        return new SimulationConfig(ringCount, replicates, sampleSizes, threads, baseSeed);
    }

    public RunMode applyMode(Properties props, RunMode defaultMode) {
        String v = props.getProperty("mode");
        return v == null ? defaultMode : RunMode.parse(v);
    }

    private static boolean isConfigKey(String key) {
        return switch (key) {
            case "ringCount", "replicates", "sampleSizes", "threads", "baseSeed", "mode" -> true;
            default -> false;
        };
    }

    // запятая как десятичный разделитель допускается, как во входных файлах
    private static double parseDouble(String key, String raw) {
        try {
            return Double.parseDouble(raw.replace(",", "."));
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + ": не число '" + raw + "'", e);
        }
    }

    private static int parseInt(String key, String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + ": не целое '" + raw + "'", e);
        }
    }

    private static long parseLong(String key, String raw) {
        try {
            return Long.parseLong(raw.replace("_", ""));
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + ": не целое '" + raw + "'", e);
        }
    }
}
