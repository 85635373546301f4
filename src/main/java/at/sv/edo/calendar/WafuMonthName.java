package at.sv.edo.calendar;

/**
 * Traditional names of the lunar months (和風月名).
 */
public enum WafuMonthName {
    MUTSUKI("睦月", "むつき"),
    KISARAGI("如月", "きさらぎ"),
    YAYOI("弥生", "やよい"),
    UZUKI("卯月", "うづき"),
    SATSUKI("皐月", "さつき"),
    MINAZUKI("水無月", "みなづき"),
    FUMIZUKI("文月", "ふみづき"),
    HAZUKI("葉月", "はづき"),
    NAGATSUKI("長月", "ながつき"),
    KANNAZUKI("神無月", "かんなづき"),
    SHIMOTSUKI("霜月", "しもつき"),
    SHIWASU("師走", "しわす");

    private final String label;
    private final String reading;

    WafuMonthName(String label, String reading) {
        this.label = label;
        this.reading = reading;
    }

    public static WafuMonthName ofMonth(int month) {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("Invalid lunar month '" + month + "'. Allowed range: [1,12]");
        }
        return values()[month - 1];
    }

    public String getLabel() {
        return label;
    }

    public String getReading() {
        return reading;
    }
}
