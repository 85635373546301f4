package at.sv.edo.calendar;

import java.time.LocalDate;

public record LunarCalendarEntry(LocalDate date, LunarDate lunarDate, Rokuyo rokuyo) {
}
