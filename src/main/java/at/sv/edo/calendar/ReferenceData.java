package at.sv.edo.calendar;

/**
 * The two process-lifetime reference tables, loaded once and shared read-only.
 */
public record ReferenceData(LunarCalendarTable lunarCalendar, NewMoonTable newMoons) {
}
