package catisim.model;

/**
 * Одна строка на кольцо — единственный вход пилотной оценки.
 *
 * @param ringId                 номер кольца
 * @param caseCount              число случаев в окне наблюдения (индексный включён)
 * @param lastReport             последнее сообщение относительно сообщения об индексном, сут.
 * @param population             размер популяции кольца
 * @param interventionDelay      задержка "сообщение об индексном -> старт CATI", сут.
 * @param delayBucket            категория задержки
 * @param coverage               охват вмешательством
 * @param surveillanceCategory   синтетический эффект возможностей надзора ("1".."3")
 * @param heterogeneity          синтетический эффект гетерогенности
 * @param indexReportDelay       задержка сообщения об индексном случае, сут.
 */
public record RingSummary(int ringId,
                          int caseCount,
                          double lastReport,
                          double population,
                          int interventionDelay,
                          DelayBucket delayBucket,
                          double coverage,
                          String surveillanceCategory,
                          int heterogeneity,
                          int indexReportDelay) {
}
