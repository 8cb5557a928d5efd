package com.tenacy.perfpulse.stats;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.List;

public final class StatisticsCalculator {

    private StatisticsCalculator() {
    }

    /**
     * 정렬된 값에서 선형 보간 백분위수를 구한다.
     *
     * @param sortedValues 오름차순 정렬된 값
     * @param percentile   0 ~ 1
     * @return 값이 없으면 {@code null}
     */
    public static Double percentile(List<Double> sortedValues, double percentile) {
        if (sortedValues == null || sortedValues.isEmpty()) {
            return null;
        }
        if (percentile < 0.0 || percentile > 1.0) {
            throw new IllegalArgumentException("percentile must be between 0 and 1: " + percentile);
        }

        int n = sortedValues.size();
        double rank = percentile * (n - 1);
        int k = (int) Math.floor(rank);
        double f = rank - k;

        if (f == 0 || k + 1 >= n) {
            return sortedValues.get(k);
        }

        double lower = sortedValues.get(k);
        double upper = sortedValues.get(k + 1);
        return lower + (upper - lower) * f;
    }

    /**
     * nearest-rank 방식 백분위수 ({@code sorted[ceil(p * n) - 1]}). 일별 통계의 p95 에 사용한다.
     */
    public static double nearestRank(List<Double> sortedValues, double percentile) {
        if (sortedValues == null || sortedValues.isEmpty()) {
            return 0.0;
        }
        int index = (int) Math.ceil(sortedValues.size() * percentile) - 1;
        return sortedValues.get(Math.max(index, 0));
    }

    /**
     * 표본 표준편차 (Bessel 보정, n - 1). 값이 하나 이하면 {@code null}.
     */
    public static Double stddev(Collection<Double> values, double mean) {
        if (values == null || values.size() <= 1) {
            return null;
        }
        double sumOfSquares = 0.0;
        for (double value : values) {
            double diff = value - mean;
            sumOfSquares += diff * diff;
        }
        return Math.sqrt(sumOfSquares / (values.size() - 1));
    }

    public static double sum(Collection<Double> values) {
        double total = 0.0;
        for (double value : values) {
            total += value;
        }
        return total;
    }

    public static Double mean(Collection<Double> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        return sum(values) / values.size();
    }

    public static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
