package com.tenacy.perfpulse.service;

import com.tenacy.perfpulse.config.PerfPulseProperties;
import com.tenacy.perfpulse.stats.PeriodType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Service
@RequiredArgsConstructor
@Slf4j
public class StatsScheduler {

    private final SummaryService summaryService;
    private final RollupService rollupService;
    private final Clock clock;
    private final PerfPulseProperties properties;

    // 매시간 5분에 직전 시간 요약
    @Scheduled(cron = "0 5 * * * *", zone = "UTC")
    public void summarizePreviousHour() {
        if (!properties.isEnabled()) {
            log.debug("perfpulse 비활성화 상태, 요약 스케줄 건너뜀");
            return;
        }
        runSummariesFor(previousHour());
    }

    // 매시간 10분에 직전 시간 조각을 일별 통계에 병합
    @Scheduled(cron = "0 10 * * * *", zone = "UTC")
    public void updateHourlyStats() {
        if (!properties.isEnabled()) {
            log.debug("perfpulse 비활성화 상태, 시간별 통계 스케줄 건너뜀");
            return;
        }
        LocalDateTime targetHour = previousHour();
        try {
            rollupService.processHour(targetHour);
        } catch (Exception e) {
            log.error("시간별 통계 업데이트 실패: {}, error={}", targetHour, e.getMessage(), e);
        }
    }

    // 매일 00:30 에 전날 일별 통계 확정
    @Scheduled(cron = "0 30 0 * * *", zone = "UTC")
    public void finalizeYesterday() {
        if (!properties.isEnabled()) {
            log.debug("perfpulse 비활성화 상태, 일별 확정 스케줄 건너뜀");
            return;
        }
        LocalDate yesterday = LocalDate.now(clock).minusDays(1);
        try {
            rollupService.finalizeDate(yesterday);
        } catch (Exception e) {
            log.error("일별 통계 확정 실패: {}, error={}", yesterday, e.getMessage(), e);
        }
    }

    /**
     * 대상 시간의 요약을 만든다. 대상이 자정이면 전날, 월요일 자정이면 지난주, 1일 자정이면 지난달도 함께 만든다.
     */
    public void runSummariesFor(LocalDateTime targetHour) {
        LocalDateTime hour = PeriodType.HOUR.periodStart(targetHour);

        summarize(PeriodType.HOUR, hour);

        if (hour.getHour() == 0) {
            summarize(PeriodType.DAY, hour.minusDays(1));

            if (hour.getDayOfWeek() == DayOfWeek.MONDAY) {
                summarize(PeriodType.WEEK, hour.minusWeeks(1));
            }
            if (hour.getDayOfMonth() == 1) {
                summarize(PeriodType.MONTH, hour.minusMonths(1));
            }
        }
    }

    private void summarize(PeriodType periodType, LocalDateTime time) {
        log.info("{} 요약 처리: {}", periodType.getValue(), periodType.periodStart(time));
        try {
            summaryService.aggregate(periodType, time);
        } catch (Exception e) {
            // 다음 실행에서 같은 구간을 다시 집계할 수 있다
            log.error("{} 요약 실패: {}, error={}", periodType.getValue(), time, e.getMessage(), e);
        }
    }

    private LocalDateTime previousHour() {
        return PeriodType.HOUR.periodStart(LocalDateTime.now(clock).minusHours(1));
    }
}
