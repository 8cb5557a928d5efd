package com.tenacy.perfpulse.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

@Service
@RequiredArgsConstructor
public class PulseMetricsService {

    private final Counter summariesWrittenCounter;
    private final Counter aggregationFailuresCounter;
    private final Counter samplesIngestedCounter;
    private final Timer aggregationTimer;

    public void recordSummariesWritten(int count) {
        if (count > 0) {
            summariesWrittenCounter.increment(count);
        }
    }

    public void recordAggregationFailure() {
        aggregationFailuresCounter.increment();
    }

    public void recordSampleIngested() {
        samplesIngestedCounter.increment();
    }

    public <T> T timeAggregation(Supplier<T> aggregation) {
        return aggregationTimer.record(aggregation);
    }
}
