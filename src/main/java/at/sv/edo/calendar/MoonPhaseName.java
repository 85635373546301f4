package at.sv.edo.calendar;

/**
 * Traditional names of the moon by age in days. Each name covers {@code [startAge, endAge)}; together they cover one
 * synodic month.
 */
public enum MoonPhaseName {
    SHINGETSU("新月", "しんげつ", 0, 1.5),
    FUTSUKAZUKI("二日月", "ふつかづき", 1.5, 2.5),
    MIKAZUKI("三日月", "みかづき", 2.5, 4.5),
    ITSUKAZUKI("五日月", "いつかづき", 4.5, 6.5),
    JOGEN("上弦の月", "じょうげんのつき", 6.5, 8.5),
    TOKANYA("十日夜", "とおかんや", 8.5, 12.5),
    JUSANYA("十三夜", "じゅうさんや", 12.5, 13.5),
    KOMOCHIZUKI("小望月", "こもちづき", 13.5, 14.5),
    MANGETSU("満月", "まんげつ", 14.5, 15.5),
    IZAYOI("十六夜", "いざよい", 15.5, 16.5),
    TACHIMACHIZUKI("立待月", "たちまちづき", 16.5, 17.5),
    IMACHIZUKI("居待月", "いまちづき", 17.5, 18.5),
    NEMACHIZUKI("臥待月", "ねまちづき", 18.5, 19.5),
    FUKEMACHIZUKI("更待月", "ふけまちづき", 19.5, 20.5),
    HATSUKA_AMARI("二十日余りの月", "はつかあまりのつき", 20.5, 21.5),
    KAGEN("下弦の月", "かげんのつき", 21.5, 23.5),
    NIJUSANYA("二十三夜", "にじゅうさんや", 23.5, 25.5),
    ARIAKE("有明の月", "ありあけのつき", 25.5, 27.5),
    NIJUKUYA("二十九夜", "にじゅうくや", 27.5, 28.5),
    MISOKAZUKI("三十日月", "みそかづき", 28.5, MoonAgeCalculator.SYNODIC_MONTH);

    private final String label;
    private final String reading;
    private final double startAge;
    private final double endAge;

    MoonPhaseName(String label, String reading, double startAge, double endAge) {
        this.label = label;
        this.reading = reading;
        this.startAge = startAge;
        this.endAge = endAge;
    }

    /**
     * @param moonAge age in days, wrapped into one synodic month first
     */
    public static MoonPhaseName forAge(double moonAge) {
        double age = moonAge % MoonAgeCalculator.SYNODIC_MONTH;
        if (age < 0) {
            age += MoonAgeCalculator.SYNODIC_MONTH;
        }
        for (MoonPhaseName name : values()) {
            if (age >= name.startAge && age < name.endAge) {
                return name;
            }
        }
        return SHINGETSU;
    }

    public String getLabel() {
        return label;
    }

    public String getReading() {
        return reading;
    }

    public double getStartAge() {
        return startAge;
    }

    public double getEndAge() {
        return endAge;
    }
}
