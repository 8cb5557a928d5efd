package com.tenacy.perfpulse.api.dto;

import com.tenacy.perfpulse.domain.DailyStat;
import com.tenacy.perfpulse.domain.HourlyStat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyStatResponse {
    private LocalDate date;
    private String entityType;
    private Long entityId;          // overall 은 null
    private boolean finalized;
    private Integer totalRequests;
    private Double avgDuration;
    private Double maxDuration;
    private Integer errorCount;
    private Double p95Duration;
    private Map<String, HourlyStat> hourlyData;

    public static DailyStatResponse of(DailyStat dailyStat) {
        return DailyStatResponse.builder()
                .date(dailyStat.getStatDate())
                .entityType(dailyStat.getEntityType().name())
                .entityId(dailyStat.getGroupKey().getId())
                .finalized(dailyStat.isFinalized())
                .totalRequests(dailyStat.getTotalRequests())
                .avgDuration(dailyStat.getAvgDuration())
                .maxDuration(dailyStat.getMaxDuration())
                .errorCount(dailyStat.getErrorCount())
                .p95Duration(dailyStat.getP95Duration())
                .hourlyData(dailyStat.getHourlyData() != null
                        ? new LinkedHashMap<>(dailyStat.getHourlyData())
                        : new LinkedHashMap<>())
                .build();
    }
}
