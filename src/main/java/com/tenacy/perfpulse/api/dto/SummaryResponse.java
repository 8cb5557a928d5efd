package com.tenacy.perfpulse.api.dto;

import com.tenacy.perfpulse.domain.GroupKey;
import com.tenacy.perfpulse.domain.Summary;
import com.tenacy.perfpulse.stats.PerformanceStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SummaryResponse {
    private Long id;
    private String groupType;
    private Long groupId;           // overall 은 null
    private String periodType;
    private LocalDateTime periodStart;
    private LocalDateTime periodEnd;
    private Integer count;
    private Double avgDuration;
    private Double minDuration;
    private Double maxDuration;
    private Double p50Duration;
    private Double p95Duration;
    private Double p99Duration;
    private Double stddevDuration;
    private Integer errorCount;
    private Integer successCount;
    private Integer status2xx;
    private Integer status3xx;
    private Integer status4xx;
    private Integer status5xx;
    private PerformanceStatus performanceStatus;

    public static SummaryResponse of(Summary summary, PerformanceStatus performanceStatus) {
        GroupKey key = summary.getGroupKey();
        return SummaryResponse.builder()
                .id(summary.getId())
                .groupType(key.getType().name())
                .groupId(key.getId())
                .periodType(summary.getPeriodType().getValue())
                .periodStart(summary.getPeriodStart())
                .periodEnd(summary.getPeriodEnd())
                .count(summary.getCount())
                .avgDuration(summary.getAvgDuration())
                .minDuration(summary.getMinDuration())
                .maxDuration(summary.getMaxDuration())
                .p50Duration(summary.getP50Duration())
                .p95Duration(summary.getP95Duration())
                .p99Duration(summary.getP99Duration())
                .stddevDuration(summary.getStddevDuration())
                .errorCount(summary.getErrorCount())
                .successCount(summary.getSuccessCount())
                .status2xx(summary.getStatus2xx())
                .status3xx(summary.getStatus3xx())
                .status4xx(summary.getStatus4xx())
                .status5xx(summary.getStatus5xx())
                .performanceStatus(performanceStatus)
                .build();
    }
}
