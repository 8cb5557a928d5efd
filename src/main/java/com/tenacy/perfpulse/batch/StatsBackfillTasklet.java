package com.tenacy.perfpulse.batch;

import com.tenacy.perfpulse.service.BackfillResult;
import com.tenacy.perfpulse.service.BackfillService;
import com.tenacy.perfpulse.stats.PeriodType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.ExitStatus;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.repeat.RepeatStatus;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 잡 파라미터로 받은 범위를 한 번에 백필한다. 일부 단계가 실패해도 스텝은 끝까지 진행하고
 * 종료 상태를 {@value #COMPLETED_WITH_FAILURES} 로 남긴다.
 */
@Slf4j
public class StatsBackfillTasklet implements Tasklet {

    public static final String COMPLETED_WITH_FAILURES = "COMPLETED_WITH_FAILURES";

    private final BackfillService backfillService;
    private final Clock clock;
    private final String start;
    private final String end;
    private final String periodTypes;
    private final String mode;

    public StatsBackfillTasklet(BackfillService backfillService, Clock clock,
                                String start, String end, String periodTypes, String mode) {
        this.backfillService = backfillService;
        this.clock = clock;
        this.start = start;
        this.end = end;
        this.periodTypes = periodTypes;
        this.mode = mode;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        LocalDateTime startTime = LocalDateTime.parse(start);
        LocalDateTime endTime = LocalDateTime.parse(end);
        BackfillMode backfillMode = BackfillMode.fromValue(mode);

        log.info("통계 백필 배치 시작: mode={}, {} ~ {}", backfillMode, startTime, endTime);

        BackfillResult result;
        if (backfillMode == BackfillMode.DAILY) {
            result = backfillService.backfillDailyStats(
                    startTime.toLocalDate(), endTime.toLocalDate(), LocalDateTime.now(clock));
        } else {
            result = backfillService.backfillSummaries(startTime, endTime, parsePeriodTypes(periodTypes));
        }

        ExecutionContext stepContext = contribution.getStepExecution().getExecutionContext();
        stepContext.putInt("stepsProcessed", result.getStepsProcessed());
        stepContext.putInt("failures", result.getFailures().size());

        if (result.hasFailures()) {
            log.warn("통계 백필 일부 실패: {}", result.getFailures());
            contribution.setExitStatus(new ExitStatus(COMPLETED_WITH_FAILURES));
        }

        log.info("통계 백필 배치 완료: steps={}, failures={}",
                result.getStepsProcessed(), result.getFailures().size());
        return RepeatStatus.FINISHED;
    }

    static List<PeriodType> parsePeriodTypes(String value) {
        if (value == null || value.isBlank()) {
            return List.of(PeriodType.HOUR, PeriodType.DAY);
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(PeriodType::fromValue)
                .collect(Collectors.toList());
    }
}
