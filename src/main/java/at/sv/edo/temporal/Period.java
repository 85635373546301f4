package at.sv.edo.temporal;

public enum Period {
    DAY("昼"),
    NIGHT("夜");

    private final String label;

    Period(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
