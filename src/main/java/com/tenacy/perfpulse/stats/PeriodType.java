package com.tenacy.perfpulse.stats;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/**
 * 집계 구간 단위. 모든 구간 경계는 UTC 기준으로 계산한다.
 *
 * <p>조회는 반개구간 {@code [periodStart, nextPeriodStart)} 로 하고,
 * {@link #periodEnd(LocalDateTime)} 는 구간에 포함되는 마지막 시각(마이크로초 단위)을 돌려준다.
 */
public enum PeriodType {
    HOUR("hour"),
    DAY("day"),
    WEEK("week"),
    MONTH("month");

    private final String value;

    PeriodType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static PeriodType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("period type is required");
        }
        String trimmed = value.trim().toLowerCase(Locale.ROOT);
        for (PeriodType type : values()) {
            if (type.value.equals(trimmed)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown period type: " + value);
    }

    public LocalDateTime periodStart(LocalDateTime time) {
        switch (this) {
            case HOUR:
                return time.truncatedTo(ChronoUnit.HOURS);
            case DAY:
                return time.truncatedTo(ChronoUnit.DAYS);
            case WEEK:
                return time.truncatedTo(ChronoUnit.DAYS)
                        .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTH:
                return time.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1);
            default:
                throw new IllegalStateException("Unsupported period type: " + this);
        }
    }

    public LocalDateTime periodStart(Instant instant) {
        return periodStart(LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
    }

    public LocalDateTime advance(LocalDateTime time) {
        switch (this) {
            case HOUR:
                return time.plusHours(1);
            case DAY:
                return time.plusDays(1);
            case WEEK:
                return time.plusWeeks(1);
            case MONTH:
                return time.plusMonths(1);
            default:
                throw new IllegalStateException("Unsupported period type: " + this);
        }
    }

    /**
     * 구간의 배타적 상한 (다음 구간 시작).
     */
    public LocalDateTime nextPeriodStart(LocalDateTime time) {
        return advance(periodStart(time));
    }

    /**
     * 구간에 포함되는 마지막 시각. DB 정밀도에 맞춰 마이크로초 단위로 자른다.
     */
    public LocalDateTime periodEnd(LocalDateTime start) {
        return nextPeriodStart(start).minus(1, ChronoUnit.MICROS);
    }
}
