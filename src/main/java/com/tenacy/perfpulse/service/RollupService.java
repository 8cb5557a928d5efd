package com.tenacy.perfpulse.service;

import com.tenacy.perfpulse.domain.DailyStat;
import com.tenacy.perfpulse.domain.DailyStatRepository;
import com.tenacy.perfpulse.domain.GroupKey;
import com.tenacy.perfpulse.domain.GroupType;
import com.tenacy.perfpulse.domain.HourlyStat;
import com.tenacy.perfpulse.domain.Sample;
import com.tenacy.perfpulse.stats.PeriodType;
import com.tenacy.perfpulse.stats.StatisticsCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 시간 -> 일 롤업. 매시간 직전 시간 조각을 일별 통계에 병합하고, 하루가 지나면 일별 값을 확정한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RollupService {

    private static final int UNFINALIZED = 0;

    private final SampleStore sampleStore;
    private final DailyStatService dailyStatService;
    private final DailyStatRepository dailyStatRepository;

    /**
     * @return 그룹 타입별로 병합된 엔티티 수
     */
    public Map<GroupType, Integer> processHour(LocalDateTime time) {
        LocalDateTime hourStart = PeriodType.HOUR.periodStart(time);
        LocalDateTime hourEnd = hourStart.plusHours(1);
        LocalDate date = hourStart.toLocalDate();
        int hour = hourStart.getHour();

        log.info("시간별 통계 생성 시작: {}", hourStart);

        Map<GroupType, Integer> processed = new EnumMap<>(GroupType.class);
        for (GroupType groupType : GroupType.values()) {
            Map<GroupKey, List<Sample>> groups = sampleStore.fetchGroups(groupType, hourStart, hourEnd);
            groups.forEach((key, samples) ->
                    dailyStatService.recordHour(key, date, hour, hourlyStatOf(groupType, samples)));
            processed.put(groupType, groups.size());
        }

        log.info("시간별 통계 생성 완료: hour={}, overall={}, routes={}, queries={}",
                hourStart, processed.get(GroupType.OVERALL), processed.get(GroupType.ROUTE),
                processed.get(GroupType.QUERY));
        return processed;
    }

    /**
     * 해당 일자의 미확정 레코드만 확정한다.
     *
     * @return 그룹 타입별로 확정된 레코드 수
     */
    public Map<GroupType, Integer> finalizeDate(LocalDate date) {
        log.info("일별 통계 확정 시작: {}", date);

        Map<GroupType, Integer> finalized = new EnumMap<>(GroupType.class);
        for (GroupType groupType : GroupType.values()) {
            List<DailyStat> pending = dailyStatRepository
                    .findByStatDateAndEntityTypeAndTotalRequestsOrderByEntityId(date, groupType, UNFINALIZED);

            int count = 0;
            for (DailyStat dailyStat : pending) {
                if (dailyStatService.finalizeDay(dailyStat.getGroupKey(), date)) {
                    count++;
                }
            }
            finalized.put(groupType, count);
        }

        log.info("일별 통계 확정 완료: date={}, overall={}, routes={}, queries={}",
                date, finalized.get(GroupType.OVERALL), finalized.get(GroupType.ROUTE),
                finalized.get(GroupType.QUERY));
        return finalized;
    }

    static HourlyStat hourlyStatOf(GroupType groupType, List<Sample> samples) {
        List<Double> durations = samples.stream()
                .map(Sample::getDuration)
                .filter(Objects::nonNull)
                .sorted()
                .collect(Collectors.toList());

        return HourlyStat.builder()
                .requests(samples.size())
                .avgDuration(durations.isEmpty() ? 0.0
                        : StatisticsCalculator.round(StatisticsCalculator.mean(durations), 3))
                .maxDuration(durations.isEmpty() ? 0.0 : durations.get(durations.size() - 1))
                // 쿼리 실행에는 에러 개념이 없다
                .errors(groupType.carriesStatus() ? DailyStatService.countErrors(samples) : 0)
                .p95Duration(StatisticsCalculator.nearestRank(durations, 0.95))
                .build();
    }
}
