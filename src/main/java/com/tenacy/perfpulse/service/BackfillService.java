package com.tenacy.perfpulse.service;

import com.tenacy.perfpulse.config.PerfPulseProperties;
import com.tenacy.perfpulse.exception.BackfillException;
import com.tenacy.perfpulse.stats.PeriodType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 과거 구간 재집계. 모든 단계가 멱등이므로 중단된 범위를 그대로 다시 실행해도 안전하다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BackfillService {

    private final SummaryService summaryService;
    private final RollupService rollupService;
    private final PerfPulseProperties properties;

    /**
     * 구간 단위별로 start 가 속한 구간부터 end 가 속한 구간까지 한 구간씩 요약을 다시 만든다.
     */
    public BackfillResult backfillSummaries(LocalDateTime start, LocalDateTime end, List<PeriodType> periodTypes) {
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("start must not be after end: " + start + " > " + end);
        }
        if (periodTypes == null || periodTypes.isEmpty()) {
            throw new IllegalArgumentException("At least one period type is required");
        }

        log.info("요약 백필 시작: {} ~ {}, periods={}", start, end, periodTypes);
        BackfillResult result = new BackfillResult();

        for (PeriodType periodType : periodTypes) {
            LocalDateTime current = periodType.periodStart(start);
            LocalDateTime last = periodType.periodStart(end);

            while (!current.isAfter(last)) {
                log.debug("요약 백필: period={}, start={}", periodType.getValue(), current);
                try {
                    summaryService.aggregate(periodType, current);
                    result.stepSucceeded();
                } catch (RuntimeException e) {
                    log.error("요약 백필 단계 실패: period={}, start={}, error={}",
                            periodType.getValue(), current, e.getMessage(), e);
                    result.stepFailed(periodType.getValue() + " " + current + ": " + e.getMessage());
                }

                current = periodType.advance(current);
                pause();
            }
        }

        log.info("요약 백필 완료: steps={}, failures={}", result.getStepsProcessed(), result.getFailures().size());
        return result;
    }

    /**
     * 날짜마다 0~23 시를 병합한 뒤 그날을 확정한다. now 이후의 시간은 건너뛴다.
     * 하루 단위로 실패를 모으며 나머지 날짜는 계속 처리한다.
     */
    public BackfillResult backfillDailyStats(LocalDate startDate, LocalDate endDate, LocalDateTime now) {
        if (startDate.isAfter(endDate)) {
            throw new IllegalArgumentException("startDate must not be after endDate: " + startDate + " > " + endDate);
        }

        log.info("일별 통계 백필 시작: {} ~ {}", startDate, endDate);
        BackfillResult result = new BackfillResult();

        for (LocalDate date = startDate; !date.isAfter(endDate); date = date.plusDays(1)) {
            try {
                for (int hour = 0; hour < 24; hour++) {
                    LocalDateTime hourStart = date.atTime(hour, 0);
                    if (hourStart.isAfter(now)) {
                        continue;
                    }
                    rollupService.processHour(hourStart);
                }
                rollupService.finalizeDate(date);
                result.stepSucceeded();
            } catch (RuntimeException e) {
                log.error("날짜 {} 일별 통계 백필 실패: {}", date, e.getMessage(), e);
                result.stepFailed(date + ": " + e.getMessage());
            }
            pause();
        }

        log.info("일별 통계 백필 완료: days={}, failures={}", result.getStepsProcessed(), result.getFailures().size());
        return result;
    }

    private void pause() {
        long delay = properties.getBackfill().getStepDelayMs();
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackfillException("Backfill interrupted", e);
        }
    }
}
