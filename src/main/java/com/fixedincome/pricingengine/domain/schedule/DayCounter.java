package com.fixedincome.pricingengine.domain.schedule;

import com.fixedincome.pricingengine.domain.model.DayCountConvention;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

public final class DayCounter {

    private DayCounter() {
    }

    /**
     * Year fraction between two dates, order-insensitive.
     * THIRTY_360 follows the US (NASD) day adjustments.
     */
    public static double yearFraction(LocalDate start, LocalDate end, DayCountConvention convention) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(convention, "convention");

        LocalDate d0 = start.isAfter(end) ? end : start;
        LocalDate d1 = start.isAfter(end) ? start : end;

        return switch (convention) {
            case ACT_365F -> ChronoUnit.DAYS.between(d0, d1) / 365.0;
            case THIRTY_360 -> thirty360Days(d0, d1) / 360.0;
        };
    }

    private static int thirty360Days(LocalDate d0, LocalDate d1) {
        int day0 = d0.getDayOfMonth();
        int day1 = d1.getDayOfMonth();
        if (day0 == 31) {
            day0 = 30;
        }
        if (day1 == 31 && day0 == 30) {
            day1 = 30;
        }
        return 360 * (d1.getYear() - d0.getYear())
                + 30 * (d1.getMonthValue() - d0.getMonthValue())
                + (day1 - day0);
    }
}
