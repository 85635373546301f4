package at.sv.edo.season;

/**
 * The 24 solar terms (二十四節気), in order of their starting solar longitude from the vernal equinox. Each term owns
 * the half-open band [longitude, longitude + 15).
 */
public enum SolarTerm {
    VERNAL_EQUINOX(0, "春分", "しゅんぶん"),
    CLEAR_AND_BRIGHT(15, "清明", "せいめい"),
    GRAIN_RAIN(30, "穀雨", "こくう"),
    START_OF_SUMMER(45, "立夏", "りっか"),
    GRAIN_BUDS(60, "小満", "しょうまん"),
    GRAIN_IN_EAR(75, "芒種", "ぼうしゅ"),
    SUMMER_SOLSTICE(90, "夏至", "げし"),
    MINOR_HEAT(105, "小暑", "しょうしょ"),
    MAJOR_HEAT(120, "大暑", "たいしょ"),
    START_OF_AUTUMN(135, "立秋", "りっしゅう"),
    END_OF_HEAT(150, "処暑", "しょしょ"),
    WHITE_DEW(165, "白露", "はくろ"),
    AUTUMN_EQUINOX(180, "秋分", "しゅうぶん"),
    COLD_DEW(195, "寒露", "かんろ"),
    FROST_DESCENT(210, "霜降", "そうこう"),
    START_OF_WINTER(225, "立冬", "りっとう"),
    MINOR_SNOW(240, "小雪", "しょうせつ"),
    MAJOR_SNOW(255, "大雪", "たいせつ"),
    WINTER_SOLSTICE(270, "冬至", "とうじ"),
    MINOR_COLD(285, "小寒", "しょうかん"),
    MAJOR_COLD(300, "大寒", "だいかん"),
    START_OF_SPRING(315, "立春", "りっしゅん"),
    RAIN_WATER(330, "雨水", "うすい"),
    AWAKENING_OF_INSECTS(345, "啓蟄", "けいちつ");

    public static final double BAND_WIDTH = 15.0;

    private final double startLongitude;
    private final String label;
    private final String reading;

    SolarTerm(double startLongitude, String label, String reading) {
        this.startLongitude = startLongitude;
        this.label = label;
        this.reading = reading;
    }

    public double getStartLongitude() {
        return startLongitude;
    }

    public double getEndLongitude() {
        return startLongitude + BAND_WIDTH;
    }

    public String getLabel() {
        return label;
    }

    public String getReading() {
        return reading;
    }

    public SolarTerm next() {
        SolarTerm[] values = values();
        return values[(ordinal() + 1) % values.length];
    }

    /**
     * @param longitude solar longitude in [0,360)
     * @return if the longitude lies in this term's band, wrapping at the 360/0 seam
     */
    public boolean contains(double longitude) {
        double end = next().startLongitude;
        if (end < startLongitude) {
            end += 360;
        }
        double value = longitude;
        if (value < startLongitude) {
            value += 360;
        }
        return value >= startLongitude && value < end;
    }
}
