package com.tenacy.perfpulse.stats;

import com.tenacy.perfpulse.config.PerfPulseProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class DurationStatsTest {

    @Test
    @DisplayName("정렬되지 않은 duration 에서 전체 통계를 계산한다")
    void computesFullStatisticSet() {
        // when
        DurationStats stats = DurationStats.of(List.of(200.0, 100.0, 150.0));

        // then
        assertThat(stats.getCount()).isEqualTo(3);
        assertThat(stats.getAvg()).isEqualTo(150.0);
        assertThat(stats.getMin()).isEqualTo(100.0);
        assertThat(stats.getMax()).isEqualTo(200.0);
        assertThat(stats.getTotal()).isEqualTo(450.0);
        assertThat(stats.getP50()).isEqualTo(150.0);
        assertThat(stats.getStddev()).isCloseTo(50.0, within(1e-9));
    }

    @Test
    @DisplayName("값이 없으면 통계를 만들지 않는다")
    void returnsNullWhenNoValues() {
        assertThat(DurationStats.of(List.of())).isNull();
        assertThat(DurationStats.of(Arrays.asList(null, null))).isNull();
    }

    @Test
    @DisplayName("값이 하나면 표준편차는 비어 있다")
    void singleValueHasNoStddev() {
        DurationStats stats = DurationStats.of(List.of(42.0));

        assertThat(stats.getP99()).isEqualTo(42.0);
        assertThat(stats.getStddev()).isNull();
    }

    @Test
    @DisplayName("상태 코드 분포: 400 이상은 에러, 상태 없는 샘플은 제외")
    void breaksDownStatuses() {
        StatusBreakdown breakdown = StatusBreakdown.of(Arrays.asList(200, 201, 302, 404, 500, 503, null));

        assertThat(breakdown.getErrorCount()).isEqualTo(3);
        assertThat(breakdown.getSuccessCount()).isEqualTo(3);
        assertThat(breakdown.getStatus2xx()).isEqualTo(2);
        assertThat(breakdown.getStatus3xx()).isEqualTo(1);
        assertThat(breakdown.getStatus4xx()).isEqualTo(1);
        assertThat(breakdown.getStatus5xx()).isEqualTo(2);
    }

    @Test
    @DisplayName("평균 응답시간을 임계값 기준으로 분류한다")
    void classifiesPerformance() {
        PerfPulseProperties.Thresholds thresholds = new PerfPulseProperties.Thresholds(500, 1500, 3000);

        assertThat(PerformanceStatus.classify(499.9, thresholds)).isEqualTo(PerformanceStatus.FAST);
        assertThat(PerformanceStatus.classify(500.0, thresholds)).isEqualTo(PerformanceStatus.SLOW);
        assertThat(PerformanceStatus.classify(1500.0, thresholds)).isEqualTo(PerformanceStatus.VERY_SLOW);
        assertThat(PerformanceStatus.classify(3000.0, thresholds)).isEqualTo(PerformanceStatus.CRITICAL);
        assertThat(PerformanceStatus.classify(null, thresholds)).isEqualTo(PerformanceStatus.FAST);
    }
}
