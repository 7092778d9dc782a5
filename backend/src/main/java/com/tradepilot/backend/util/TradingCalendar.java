package com.tradepilot.backend.util;

import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * Weekday calendar. Exchange holidays are not modelled.
 */
public final class TradingCalendar {

    private TradingCalendar() {
    }

    public static boolean isTradingDay(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY;
    }

    /**
     * Trading days in {@code (from, to]}; zero when {@code to} is not after {@code from}.
     */
    public static int tradingDaysBetween(LocalDate from, LocalDate to) {
        int count = 0;
        for (LocalDate day = from.plusDays(1); !day.isAfter(to); day = day.plusDays(1)) {
            if (isTradingDay(day)) {
                count++;
            }
        }
        return count;
    }
}
