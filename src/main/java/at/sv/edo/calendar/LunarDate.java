package at.sv.edo.calendar;

/**
 * A date of the traditional lunisolar calendar. A leap month repeats the number of the month before it.
 */
public record LunarDate(int year, int month, int day, boolean leapMonth) {

    public LunarDate {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("Invalid lunar month '" + month + "'. Allowed range: [1,12]");
        }
        if (day < 1 || day > 30) {
            throw new IllegalArgumentException("Invalid lunar day '" + day + "'. Allowed range: [1,30]");
        }
    }

    public WafuMonthName monthName() {
        return WafuMonthName.ofMonth(month);
    }

    @Override
    public String toString() {
        return year + "/" + (leapMonth ? "閏" : "") + month + "/" + day;
    }
}
