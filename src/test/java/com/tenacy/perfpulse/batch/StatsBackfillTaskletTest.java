package com.tenacy.perfpulse.batch;

import com.tenacy.perfpulse.service.BackfillResult;
import com.tenacy.perfpulse.service.BackfillService;
import com.tenacy.perfpulse.stats.PeriodType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.batch.core.ExitStatus;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.repeat.RepeatStatus;
import org.springframework.batch.test.MetaDataInstanceFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StatsBackfillTaskletTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-20T12:00:00Z"), ZoneOffset.UTC);

    @Mock
    private BackfillService backfillService;

    @Mock
    private BackfillResult result;

    private StepExecution stepExecution;
    private StepContribution contribution;

    @BeforeEach
    void setUp() {
        stepExecution = MetaDataInstanceFactory.createStepExecution();
        contribution = new StepContribution(stepExecution);
    }

    @Test
    @DisplayName("요약 모드는 지정한 구간 단위로 요약 백필을 실행한다")
    void summaryModeShouldBackfillRequestedPeriods() {
        // given
        when(result.getStepsProcessed()).thenReturn(4);
        when(result.getFailures()).thenReturn(List.of());
        when(backfillService.backfillSummaries(any(), any(), anyList())).thenReturn(result);

        StatsBackfillTasklet tasklet = new StatsBackfillTasklet(backfillService, CLOCK,
                "2024-03-14T10:00:00", "2024-03-14T12:00:00", "hour, week", "summary");

        // when
        RepeatStatus status = tasklet.execute(contribution, null);

        // then
        assertThat(status).isEqualTo(RepeatStatus.FINISHED);
        verify(backfillService).backfillSummaries(
                LocalDateTime.of(2024, 3, 14, 10, 0),
                LocalDateTime.of(2024, 3, 14, 12, 0),
                List.of(PeriodType.HOUR, PeriodType.WEEK));
        verify(backfillService, never()).backfillDailyStats(any(), any(), any());
        assertThat(contribution.getExitStatus()).isEqualTo(ExitStatus.EXECUTING);
        assertThat(stepExecution.getExecutionContext().getInt("stepsProcessed")).isEqualTo(4);
        assertThat(stepExecution.getExecutionContext().getInt("failures")).isZero();
    }

    @Test
    @DisplayName("일별 모드는 날짜 범위와 현재 시각으로 일별 백필을 실행한다")
    void dailyModeShouldUseDatesAndClock() {
        // given
        when(result.getFailures()).thenReturn(List.of());
        when(backfillService.backfillDailyStats(any(), any(), any())).thenReturn(result);

        StatsBackfillTasklet tasklet = new StatsBackfillTasklet(backfillService, CLOCK,
                "2024-03-14T00:00:00", "2024-03-16T00:00:00", null, "DAILY");

        // when
        tasklet.execute(contribution, null);

        // then
        verify(backfillService).backfillDailyStats(
                LocalDate.of(2024, 3, 14), LocalDate.of(2024, 3, 16), LocalDateTime.of(2024, 3, 20, 12, 0));
        verify(backfillService, never()).backfillSummaries(any(), any(), anyList());
    }

    @Test
    @DisplayName("일부 단계가 실패하면 종료 코드에 실패를 남긴다")
    void failuresShouldBeReflectedInExitStatus() {
        // given
        when(result.getFailures()).thenReturn(List.of("hour 2024-03-14T11:00: boom"));
        when(result.hasFailures()).thenReturn(true);
        when(backfillService.backfillSummaries(any(), any(), anyList())).thenReturn(result);

        StatsBackfillTasklet tasklet = new StatsBackfillTasklet(backfillService, CLOCK,
                "2024-03-14T10:00:00", "2024-03-14T12:00:00", "hour", null);

        // when
        tasklet.execute(contribution, null);

        // then
        assertThat(contribution.getExitStatus().getExitCode())
                .isEqualTo(StatsBackfillTasklet.COMPLETED_WITH_FAILURES);
        assertThat(stepExecution.getExecutionContext().getInt("failures")).isEqualTo(1);
    }

    @Test
    @DisplayName("구간 단위를 비워두면 hour, day 로 실행하고 모르는 값은 거부한다")
    void parsePeriodTypes() {
        assertThat(StatsBackfillTasklet.parsePeriodTypes(null)).containsExactly(PeriodType.HOUR, PeriodType.DAY);
        assertThat(StatsBackfillTasklet.parsePeriodTypes(" ")).containsExactly(PeriodType.HOUR, PeriodType.DAY);
        assertThat(StatsBackfillTasklet.parsePeriodTypes("month,,day"))
                .containsExactly(PeriodType.MONTH, PeriodType.DAY);

        assertThatThrownBy(() -> StatsBackfillTasklet.parsePeriodTypes("hour,year"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("year");
    }
}
