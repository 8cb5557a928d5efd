package com.tenacy.perfpulse.config;

import com.tenacy.perfpulse.domain.GroupType;
import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * perfpulse.* 설정. 생성자 바인딩으로 만들어지는 불변 객체이며, 임계값이 필요한 빈에 명시적으로 주입한다.
 */
@Getter
@ConfigurationProperties(prefix = "perfpulse")
public class PerfPulseProperties {

    private final boolean enabled;
    private final Thresholds routeThresholds;
    private final Thresholds requestThresholds;
    private final Thresholds queryThresholds;
    private final Backfill backfill;

    public PerfPulseProperties(@DefaultValue("true") boolean enabled,
                               Thresholds routeThresholds,
                               Thresholds requestThresholds,
                               Thresholds queryThresholds,
                               Backfill backfill) {
        this.enabled = enabled;
        this.routeThresholds = routeThresholds != null ? routeThresholds : new Thresholds(500, 1500, 3000);
        this.requestThresholds = requestThresholds != null ? requestThresholds : new Thresholds(700, 2000, 4000);
        this.queryThresholds = queryThresholds != null ? queryThresholds : new Thresholds(100, 500, 1000);
        this.backfill = backfill != null ? backfill : new Backfill(100L);
    }

    public Thresholds thresholdsFor(GroupType groupType) {
        switch (groupType) {
            case ROUTE:
                return routeThresholds;
            case QUERY:
                return queryThresholds;
            default:
                return requestThresholds;
        }
    }

    @Getter
    public static class Thresholds {
        private final double slow;
        private final double verySlow;
        private final double critical;

        public Thresholds(double slow, double verySlow, double critical) {
            if (!(slow <= verySlow && verySlow <= critical)) {
                throw new IllegalArgumentException(
                        "thresholds must be ordered: slow <= very-slow <= critical");
            }
            this.slow = slow;
            this.verySlow = verySlow;
            this.critical = critical;
        }
    }

    @Getter
    public static class Backfill {
        private final long stepDelayMs; // 단계 사이 대기 시간 (샘플 저장소 부하 완화)

        public Backfill(@DefaultValue("100") long stepDelayMs) {
            this.stepDelayMs = Math.max(stepDelayMs, 0L);
        }
    }
}
