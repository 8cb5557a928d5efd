package com.tenacy.perfpulse.stats;

import com.tenacy.perfpulse.config.PerfPulseProperties.Thresholds;

public enum PerformanceStatus {
    FAST,
    SLOW,
    VERY_SLOW,
    CRITICAL;

    public static PerformanceStatus classify(Double avgDuration, Thresholds thresholds) {
        double value = avgDuration != null ? avgDuration : 0.0;

        if (value < thresholds.getSlow()) {
            return FAST;
        }
        if (value < thresholds.getVerySlow()) {
            return SLOW;
        }
        if (value < thresholds.getCritical()) {
            return VERY_SLOW;
        }
        return CRITICAL;
    }
}
