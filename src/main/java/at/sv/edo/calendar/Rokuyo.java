package at.sv.edo.calendar;

import java.text.Normalizer;

/**
 * The six folk-calendar day labels (六曜), in the order of {@code (lunarMonth + lunarDay) % 6}.
 */
public enum Rokuyo {
    TAIAN("大安", "たいあん"),
    SHAKKO("赤口", "しゃっこう"),
    SENSHO("先勝", "せんしょう"),
    TOMOBIKI("友引", "ともびき"),
    SENBU("先負", "せんぶ"),
    BUTSUMETSU("仏滅", "ぶつめつ");

    private final String label;
    private final String reading;

    Rokuyo(String label, String reading) {
        this.label = label;
        this.reading = reading;
    }

    public String getLabel() {
        return label;
    }

    public String getReading() {
        return reading;
    }

    /**
     * Resolves a label, mapping Kangxi radical and other compatibility glyphs (e.g. {@code ⼤安}) onto the canonical
     * form first.
     *
     * @throws IllegalArgumentException if the label is none of the six
     */
    public static Rokuyo parse(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Missing rokuyo label");
        }
        String normalized = Normalizer.normalize(label.trim(), Normalizer.Form.NFKC);
        for (Rokuyo rokuyo : values()) {
            if (rokuyo.label.equals(normalized)) {
                return rokuyo;
            }
        }
        throw new IllegalArgumentException("Unknown rokuyo label '" + label + "'");
    }

    /**
     * The conventional rule the reference tables are built with.
     */
    public static Rokuyo forLunarDate(int month, int day) {
        return values()[(month + day) % values().length];
    }
}
