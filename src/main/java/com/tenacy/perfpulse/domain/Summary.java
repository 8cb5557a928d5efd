package com.tenacy.perfpulse.domain;

import com.tenacy.perfpulse.stats.DurationStats;
import com.tenacy.perfpulse.stats.PeriodType;
import com.tenacy.perfpulse.stats.StatusBreakdown;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * (그룹, 구간 단위, 구간 시작) 하나에 대한 통계 요약. 자연키 기준으로 upsert 되며 재집계 시 통째로 덮어쓴다.
 */
@Entity
@Table(name = "perfpulse_summaries", uniqueConstraints = {
        @UniqueConstraint(name = "uk_summaries_natural_key",
                columnNames = {"summarizableType", "summarizableId", "periodType", "periodStart"})
}, indexes = {
        @Index(name = "idx_summaries_period", columnList = "periodType,periodStart")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Summary {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private GroupType summarizableType;

    @Column(nullable = false)
    private Long summarizableId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private PeriodType periodType;

    @Column(nullable = false)
    private LocalDateTime periodStart;

    @Column(nullable = false)
    private LocalDateTime periodEnd;     // 구간에 포함되는 마지막 시각

    @Column(name = "sample_count", nullable = false)
    private Integer count;

    private Double avgDuration;
    private Double minDuration;
    private Double maxDuration;
    private Double totalDuration;
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

    @CreationTimestamp
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public static Summary newSummary(GroupKey key, PeriodType periodType, LocalDateTime periodStart) {
        return Summary.builder()
                .summarizableType(key.getType())
                .summarizableId(key.getStorageId())
                .periodType(periodType)
                .periodStart(periodStart)
                .build();
    }

    public GroupKey getGroupKey() {
        return GroupKey.fromStorage(summarizableType, summarizableId);
    }

    /**
     * 키가 아닌 필드를 모두 새 값으로 덮어쓴다 (병합하지 않음).
     */
    public void overwrite(LocalDateTime periodEnd, DurationStats stats, StatusBreakdown statuses) {
        this.periodEnd = periodEnd;
        this.count = stats.getCount();
        this.avgDuration = stats.getAvg();
        this.minDuration = stats.getMin();
        this.maxDuration = stats.getMax();
        this.totalDuration = stats.getTotal();
        this.p50Duration = stats.getP50();
        this.p95Duration = stats.getP95();
        this.p99Duration = stats.getP99();
        this.stddevDuration = stats.getStddev();
        this.errorCount = statuses.getErrorCount();
        this.successCount = statuses.getSuccessCount();
        this.status2xx = statuses.getStatus2xx();
        this.status3xx = statuses.getStatus3xx();
        this.status4xx = statuses.getStatus4xx();
        this.status5xx = statuses.getStatus5xx();
    }
}
