package at.sv.edo.temporal;

/**
 * Traditional names of the twelve temporal hours. The count runs down from six at dawn and dusk (六, 五, 四) and
 * restarts at nine (九, 八, 七) at noon and midnight; every koku is tied to one of the twelve earthly branches.
 */
public enum KokuName {
    AKE_MUTSU(Period.DAY, 1, "明け六つ", "六", "卯"),
    ASA_ITSUTSU(Period.DAY, 2, "朝五つ", "五", "辰"),
    HIRU_YOTSU(Period.DAY, 3, "昼四つ", "四", "巳"),
    HIRU_KOKONOTSU(Period.DAY, 4, "昼九つ", "九", "午"),
    HIRU_YATSU(Period.DAY, 5, "昼八つ", "八", "未"),
    YU_NANATSU(Period.DAY, 6, "夕七つ", "七", "申"),
    KURE_MUTSU(Period.NIGHT, 1, "暮れ六つ", "六", "酉"),
    YOI_ITSUTSU(Period.NIGHT, 2, "宵五つ", "五", "戌"),
    YO_YOTSU(Period.NIGHT, 3, "夜四つ", "四", "亥"),
    YO_KOKONOTSU(Period.NIGHT, 4, "夜九つ", "九", "子"),
    AKATSUKI_YATSU(Period.NIGHT, 5, "暁八つ", "八", "丑"),
    AKATSUKI_NANATSU(Period.NIGHT, 6, "暁七つ", "七", "寅");

    private final Period period;
    private final int koku;
    private final String label;
    private final String number;
    private final String branch;

    KokuName(Period period, int koku, String label, String number, String branch) {
        this.period = period;
        this.koku = koku;
        this.label = label;
        this.number = number;
        this.branch = branch;
    }

    public static KokuName of(Period period, int koku) {
        if (koku < 1 || koku > 6) {
            throw new IllegalArgumentException("Invalid koku '" + koku + "'. Allowed range: 1-6");
        }
        int offset = period == Period.DAY ? 0 : 6;
        return values()[offset + koku - 1];
    }

    public Period getPeriod() {
        return period;
    }

    public int getKoku() {
        return koku;
    }

    public String getLabel() {
        return label;
    }

    public String getNumber() {
        return number;
    }

    public String getBranch() {
        return branch;
    }
}
