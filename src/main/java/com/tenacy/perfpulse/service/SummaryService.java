package com.tenacy.perfpulse.service;

import com.tenacy.perfpulse.domain.GroupKey;
import com.tenacy.perfpulse.domain.GroupType;
import com.tenacy.perfpulse.domain.Sample;
import com.tenacy.perfpulse.domain.Summary;
import com.tenacy.perfpulse.domain.SummaryRepository;
import com.tenacy.perfpulse.exception.AggregationException;
import com.tenacy.perfpulse.stats.DurationStats;
import com.tenacy.perfpulse.stats.PeriodType;
import com.tenacy.perfpulse.stats.StatusBreakdown;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class SummaryService {

    private final SampleStore sampleStore;
    private final SummaryRepository summaryRepository;
    private final PulseMetricsService metricsService;

    /**
     * 한 구간의 모든 그룹(전체, 라우트별, 쿼리별) 요약을 다시 계산해 자연키 기준으로 덮어쓴다.
     * 한 트랜잭션으로 실행되므로 실패 시 해당 구간의 요약은 하나도 바뀌지 않는다.
     *
     * @param time 구간 안의 임의 시각. 구간 시작으로 정규화된다.
     * @return 이번 실행에서 저장된 요약 목록
     */
    @Transactional
    public List<Summary> aggregate(PeriodType periodType, LocalDateTime time) {
        LocalDateTime periodStart = periodType.periodStart(time);
        LocalDateTime nextStart = periodType.advance(periodStart);
        LocalDateTime periodEnd = periodType.periodEnd(periodStart);

        log.debug("요약 집계 시작: period={}, start={}", periodType.getValue(), periodStart);

        try {
            List<Summary> written = metricsService.timeAggregation(() -> {
                List<Summary> result = new ArrayList<>();
                for (GroupType groupType : GroupType.values()) {
                    Map<GroupKey, List<Sample>> groups = sampleStore.fetchGroups(groupType, periodStart, nextStart);
                    groups.forEach((key, samples) -> {
                        Summary summary = upsert(key, periodType, periodStart, periodEnd, samples);
                        if (summary != null) {
                            result.add(summary);
                        }
                    });
                }
                return result;
            });

            metricsService.recordSummariesWritten(written.size());
            log.info("요약 집계 완료: period={}, start={}, summaries={}",
                    periodType.getValue(), periodStart, written.size());
            return written;
        } catch (Exception e) {
            metricsService.recordAggregationFailure();
            log.error("요약 집계 실패: period={}, start={}, error={}",
                    periodType.getValue(), periodStart, e.getMessage(), e);
            throw new AggregationException(
                    "Failed to aggregate " + periodType.getValue() + " summaries for " + periodStart, e);
        }
    }

    private Summary upsert(GroupKey key, PeriodType periodType, LocalDateTime periodStart,
                           LocalDateTime periodEnd, List<Sample> samples) {
        DurationStats stats = DurationStats.of(samples.stream()
                .map(Sample::getDuration)
                .collect(Collectors.toList()));

        // 샘플이 없는 그룹은 0 으로 채운 행을 만들지 않는다
        if (stats == null) {
            return null;
        }

        StatusBreakdown statuses = key.getType().carriesStatus()
                ? StatusBreakdown.of(samples.stream().map(Sample::getStatus).collect(Collectors.toList()))
                : StatusBreakdown.EMPTY;

        Summary summary = summaryRepository
                .findBySummarizableTypeAndSummarizableIdAndPeriodTypeAndPeriodStart(
                        key.getType(), key.getStorageId(), periodType, periodStart)
                .orElseGet(() -> Summary.newSummary(key, periodType, periodStart));

        summary.overwrite(periodEnd, stats, statuses);
        log.debug("요약 저장: group={}, period={}, start={}, count={}",
                key, periodType.getValue(), periodStart, stats.getCount());
        return summaryRepository.save(summary);
    }
}
