package com.tenacy.perfpulse.service;

import com.tenacy.perfpulse.domain.DailyStat;
import com.tenacy.perfpulse.domain.DailyStatRepository;
import com.tenacy.perfpulse.domain.GroupKey;
import com.tenacy.perfpulse.domain.HourlyStat;
import com.tenacy.perfpulse.domain.Sample;
import com.tenacy.perfpulse.exception.AggregationException;
import com.tenacy.perfpulse.stats.StatisticsCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 일별 통계의 시간 단위 병합과 일 단위 확정.
 */
@Service
@Slf4j
public class DailyStatService {

    static final int MAX_MERGE_ATTEMPTS = 5;
    private static final long RETRY_BACKOFF_MS = 50L;

    private final DailyStatRepository dailyStatRepository;
    private final SampleStore sampleStore;
    private final TransactionTemplate transactionTemplate;

    public DailyStatService(DailyStatRepository dailyStatRepository,
                            SampleStore sampleStore,
                            PlatformTransactionManager transactionManager) {
        this.dailyStatRepository = dailyStatRepository;
        this.sampleStore = sampleStore;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * 해당 시간 조각만 hourlyData 에 병합한다. 레코드가 없으면 미확정 상태(totalRequests = 0)로 만든다.
     * 기존 레코드는 행 잠금을 잡은 뒤 병합하므로 같은 날짜/엔티티의 다른 시간 병합과 겹치지 않는다.
     * 첫 행을 동시에 만들다 유니크 키 충돌이 나면 다시 읽어서 잠금 경로로 병합한다.
     */
    public DailyStat recordHour(GroupKey key, LocalDate date, int hour, HourlyStat hourlyStat) {
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("hour must be between 0 and 23: " + hour);
        }
        Objects.requireNonNull(hourlyStat, "hourlyStat");

        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= MAX_MERGE_ATTEMPTS; attempt++) {
            try {
                return transactionTemplate.execute(status -> mergeHour(key, date, hour, hourlyStat));
            } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
                lastFailure = e;
                log.warn("시간별 통계 병합 충돌, 재시도 {}/{}: key={}, date={}, hour={}, error={}",
                        attempt, MAX_MERGE_ATTEMPTS, key, date, hour, e.getClass().getSimpleName());
                backoff(attempt);
            }
        }

        throw new AggregationException(
                "Failed to merge hour " + hour + " of " + date + " for " + key, lastFailure);
    }

    private DailyStat mergeHour(GroupKey key, LocalDate date, int hour, HourlyStat hourlyStat) {
        DailyStat dailyStat = dailyStatRepository
                .findForUpdate(date, key.getType(), key.getStorageId())
                .orElseGet(() -> DailyStat.unfinalized(date, key));

        dailyStat.mergeHour(hour, hourlyStat);
        return dailyStatRepository.saveAndFlush(dailyStat);
    }

    private void backoff(int attempt) {
        if (attempt >= MAX_MERGE_ATTEMPTS) {
            return;
        }
        try {
            Thread.sleep(RETRY_BACKOFF_MS * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AggregationException("Interrupted while retrying hourly merge", e);
        }
    }

    /**
     * 원시 샘플에서 하루 전체 값을 다시 계산해 확정한다. hourlyData 는 건드리지 않는다.
     *
     * @return 실제로 값을 덮어썼으면 true, 레코드나 샘플이 없어 건너뛰었으면 false
     */
    @Transactional
    public boolean finalizeDay(GroupKey key, LocalDate date) {
        DailyStat dailyStat = dailyStatRepository
                .findForUpdate(date, key.getType(), key.getStorageId())
                .orElse(null);
        if (dailyStat == null) {
            log.debug("확정할 일별 통계 없음: key={}, date={}", key, date);
            return false;
        }

        LocalDateTime dayStart = date.atStartOfDay();
        List<Sample> samples = sampleStore.fetchSamples(key, dayStart, dayStart.plusDays(1));
        if (samples.isEmpty()) {
            log.debug("해당 일자 샘플 없음, 확정 건너뜀: key={}, date={}", key, date);
            return false;
        }

        List<Double> durations = samples.stream()
                .map(Sample::getDuration)
                .filter(Objects::nonNull)
                .sorted()
                .collect(Collectors.toList());

        dailyStat.setTotalRequests(samples.size());
        dailyStat.setAvgDuration(durations.isEmpty() ? 0.0
                : StatisticsCalculator.round(StatisticsCalculator.mean(durations), 3));
        dailyStat.setMaxDuration(durations.isEmpty() ? 0.0 : durations.get(durations.size() - 1));
        dailyStat.setErrorCount(key.getType().carriesStatus() ? countErrors(samples) : 0);
        dailyStat.setP95Duration(StatisticsCalculator.nearestRank(durations, 0.95));

        dailyStatRepository.save(dailyStat);
        log.debug("일별 통계 확정: key={}, date={}, total={}", key, date, samples.size());
        return true;
    }

    static int countErrors(List<Sample> samples) {
        return (int) samples.stream().filter(Sample::isError).count();
    }
}
