package catisim.model;

/**
 * Категория задержки "сообщение об индексном -> старт CATI", сут.
 */
public enum DelayBucket {
    EARLY("0-2"),
    MID("3-6"),
    LATE("7+");

    private final String label;

    DelayBucket(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static DelayBucket of(int delayDays) {
        if (delayDays < 0) throw new IllegalArgumentException("delayDays must be >= 0, got " + delayDays);
        if (delayDays <= 2) return EARLY;
        if (delayDays <= 6) return MID;
        return LATE;
    }
}
