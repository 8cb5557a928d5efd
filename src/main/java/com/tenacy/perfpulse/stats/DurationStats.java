package com.tenacy.perfpulse.stats;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 한 그룹의 duration 통계 묶음.
 */
@Value
@Builder
public class DurationStats {

    int count;
    double avg;
    double min;
    double max;
    double total;
    Double p50;
    Double p95;
    Double p99;
    Double stddev;

    /**
     * @return 값이 하나도 없으면 {@code null} (빈 그룹은 통계를 만들지 않는다)
     */
    public static DurationStats of(Collection<Double> durations) {
        List<Double> sorted = durations.stream()
                .filter(Objects::nonNull)
                .sorted()
                .collect(Collectors.toCollection(ArrayList::new));

        if (sorted.isEmpty()) {
            return null;
        }

        List<Double> values = Collections.unmodifiableList(sorted);
        double total = StatisticsCalculator.sum(values);
        double avg = total / values.size();

        return DurationStats.builder()
                .count(values.size())
                .avg(avg)
                .min(values.get(0))
                .max(values.get(values.size() - 1))
                .total(total)
                .p50(StatisticsCalculator.percentile(values, 0.5))
                .p95(StatisticsCalculator.percentile(values, 0.95))
                .p99(StatisticsCalculator.percentile(values, 0.99))
                .stddev(StatisticsCalculator.stddev(values, avg))
                .build();
    }
}
