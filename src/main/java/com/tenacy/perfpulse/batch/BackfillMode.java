package com.tenacy.perfpulse.batch;

import java.util.Locale;

public enum BackfillMode {
    SUMMARY,    // Summary 재집계
    DAILY;      // DailyStat 시간 병합 + 일 확정

    public static BackfillMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return SUMMARY;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown backfill mode: " + value, e);
        }
    }
}
