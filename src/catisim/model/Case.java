package catisim.model;

/**
 * Один случай заражения в кольце.
 * Поля сообщения (reportTime, sinceIndexReport) равны NaN, пока не отработала модель задержек.
 *
 * @param ringId           кольцо-владелец
 * @param caseId           номер случая в кольце (0 — индексный)
 * @param generation       поколение (0 — индексный)
 * @param onsetTime        начало болезни, сут. от начала болезни индексного случая
 * @param reportTime       время сообщения, сут. (та же шкала)
 * @param sinceIndexReport reportTime минус время сообщения об индексном случае
 */
public record Case(int ringId,
                   int caseId,
                   int generation,
                   double onsetTime,
                   double reportTime,
                   double sinceIndexReport) {

    public static Case unreported(int ringId, int caseId, int generation, double onsetTime) {
        return new Case(ringId, caseId, generation, onsetTime, Double.NaN, Double.NaN);
    }

    public boolean isIndex() {
        return generation == 0;
    }

    public boolean isReported() {
        return !Double.isNaN(reportTime);
    }

    public Case withReport(double reportTime, double indexReportTime) {
        return new Case(ringId, caseId, generation, onsetTime, reportTime, reportTime - indexReportTime);
    }
}
