package com.tenacy.perfpulse.stats;

import lombok.Builder;
import lombok.Value;

import java.util.Collection;

/**
 * HTTP 상태 코드 분포. 상태 코드가 없는 샘플은 집계하지 않는다.
 */
@Value
@Builder
public class StatusBreakdown {

    public static final StatusBreakdown EMPTY = StatusBreakdown.builder().build();

    int errorCount;
    int successCount;
    int status2xx;
    int status3xx;
    int status4xx;
    int status5xx;

    public static StatusBreakdown of(Collection<Integer> statuses) {
        int errors = 0;
        int successes = 0;
        int s2xx = 0;
        int s3xx = 0;
        int s4xx = 0;
        int s5xx = 0;

        for (Integer status : statuses) {
            if (status == null) {
                continue;
            }
            if (status >= 400) {
                errors++;
            } else {
                successes++;
            }

            if (status >= 500) {
                s5xx++;
            } else if (status >= 400) {
                s4xx++;
            } else if (status >= 300) {
                s3xx++;
            } else if (status >= 200) {
                s2xx++;
            }
        }

        return StatusBreakdown.builder()
                .errorCount(errors)
                .successCount(successes)
                .status2xx(s2xx)
                .status3xx(s3xx)
                .status4xx(s4xx)
                .status5xx(s5xx)
                .build();
    }
}
