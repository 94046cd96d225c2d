package com.salescrm.backend.services.dashboard;

import com.salescrm.backend.exceptions.CrmValidationException;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAdjusters;

/**
 * Reporting windows. Every window ends at the end of the current day, except
 * CUSTOM which ends at the end of its {@code to} day.
 */
public enum DateRange {
    TODAY,
    WEEK,
    MONTH,
    QUARTER,
    YEAR,
    CUSTOM;

    public record Window(OffsetDateTime from, OffsetDateTime to) {
    }

    public Window resolve(LocalDate today, LocalDate customFrom, LocalDate customTo) {
        LocalDate start = switch (this) {
            case TODAY -> today;
            case WEEK -> today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTH -> today.withDayOfMonth(1);
            case QUARTER -> today.withMonth(((today.getMonthValue() - 1) / 3) * 3 + 1).withDayOfMonth(1);
            case YEAR -> today.withDayOfYear(1);
            case CUSTOM -> customFrom;
        };
        LocalDate end = this == CUSTOM ? customTo : today;

        if (start == null || end == null) {
            throw new CrmValidationException("A custom range needs both a start and an end date");
        }
        if (end.isBefore(start)) {
            throw new CrmValidationException("Range end must not be before its start");
        }
        return new Window(start.atStartOfDay().atOffset(ZoneOffset.UTC),
                end.plusDays(1).atStartOfDay().atOffset(ZoneOffset.UTC));
    }

    public static DateRange parse(String value) {
        if (value == null || value.isBlank()) {
            return MONTH;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new CrmValidationException("Unknown date range: " + value);
        }
    }
}
