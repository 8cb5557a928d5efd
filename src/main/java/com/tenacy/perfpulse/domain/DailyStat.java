package com.tenacy.perfpulse.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 시간 단위로 채워지고 하루가 끝나면 확정되는 일별 통계.
 * totalRequests == 0 이면 아직 확정(finalize)되지 않은 레코드이다.
 */
@Entity
@Table(name = "perfpulse_daily_stats", uniqueConstraints = {
        @UniqueConstraint(name = "uk_daily_stats_date_entity",
                columnNames = {"statDate", "entityType", "entityId"})
}, indexes = {
        @Index(name = "idx_daily_stats_date_type", columnList = "statDate,entityType"),
        @Index(name = "idx_daily_stats_entity", columnList = "entityType,entityId")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyStat {

    static final Comparator<String> HOUR_KEY_ORDER = Comparator.comparingInt(Integer::parseInt);

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private LocalDate statDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private GroupType entityType;

    @Column(nullable = false)
    private Long entityId;

    @Column(nullable = false)
    private Integer totalRequests;

    private Double avgDuration;
    private Double maxDuration;

    @Column(nullable = false)
    private Integer errorCount;

    private Double p95Duration;

    @Convert(converter = HourlyDataConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, HourlyStat> hourlyData;

    // 같은 날짜/엔티티에 대한 동시 시간 병합을 직렬화
    @Version
    private Long version;

    @CreationTimestamp
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public static DailyStat unfinalized(LocalDate date, GroupKey key) {
        return DailyStat.builder()
                .statDate(date)
                .entityType(key.getType())
                .entityId(key.getStorageId())
                .totalRequests(0)
                .errorCount(0)
                .hourlyData(HourlyDataConverter.sorted(Map.of()))
                .build();
    }

    public GroupKey getGroupKey() {
        return GroupKey.fromStorage(entityType, entityId);
    }

    public boolean isFinalized() {
        return totalRequests != null && totalRequests > 0;
    }

    /**
     * 해당 시간 조각만 교체한다. 다른 시간 데이터는 유지된다.
     */
    public void mergeHour(int hour, HourlyStat stat) {
        Map<String, HourlyStat> merged = HourlyDataConverter.sorted(
                hourlyData != null ? hourlyData : Map.of());
        merged.put(String.valueOf(hour), stat);
        // 새 인스턴스로 교체해야 dirty checking 에 잡힌다
        this.hourlyData = merged;
    }

    public HourlyStat hourlyBreakdownFor(int hour) {
        return hourlyData != null ? hourlyData.get(String.valueOf(hour)) : null;
    }

    public List<Integer> completedHours() {
        if (hourlyData == null) {
            return Collections.emptyList();
        }
        return hourlyData.keySet().stream()
                .map(Integer::parseInt)
                .sorted()
                .collect(Collectors.toList());
    }
}
