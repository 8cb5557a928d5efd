package com.tenacy.perfpulse.batch;

import com.tenacy.perfpulse.domain.DailyStat;
import com.tenacy.perfpulse.domain.DailyStatRepository;
import com.tenacy.perfpulse.domain.GroupType;
import com.tenacy.perfpulse.domain.Route;
import com.tenacy.perfpulse.domain.SummaryRepository;
import com.tenacy.perfpulse.stats.PeriodType;
import com.tenacy.perfpulse.util.StatsTestSupport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.test.JobLauncherTestUtils;
import org.springframework.batch.test.JobRepositoryTestUtils;
import org.springframework.batch.test.context.SpringBatchTest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@SpringBatchTest
@ActiveProfiles("test")
class StatsBackfillJobTest {

    private static final LocalDate DATE = LocalDate.of(2024, 3, 14);

    @Autowired
    private JobLauncherTestUtils jobLauncherTestUtils;

    @Autowired
    private JobRepositoryTestUtils jobRepositoryTestUtils;

    @Autowired
    private SummaryRepository summaryRepository;

    @Autowired
    private DailyStatRepository dailyStatRepository;

    @Autowired
    private StatsTestSupport testSupport;

    private Route route;

    @BeforeEach
    void setUp() {
        jobRepositoryTestUtils.removeJobExecutions();
        testSupport.cleanup();

        route = testSupport.route("GET", "/orders");
        testSupport.request(route, DATE.atTime(9, 15), 100.0, 200);
        testSupport.request(route, DATE.atTime(9, 45), 300.0, 200);
        testSupport.request(route, DATE.atTime(13, 5), 500.0, 503);
    }

    @AfterEach
    void tearDown() {
        testSupport.cleanup();
    }

    @Test
    @DisplayName("요약 모드 - 범위 안의 모든 시간/일 요약을 만든다")
    void summaryModeShouldCreateHourAndDaySummaries() throws Exception {
        // given
        JobParameters parameters = new JobParametersBuilder()
                .addString("start", DATE.atTime(9, 0).toString())
                .addString("end", DATE.atTime(13, 30).toString())
                .addString("periodTypes", "hour,day")
                .addString("mode", BackfillMode.SUMMARY.name())
                .toJobParameters();

        // when
        JobExecution execution = jobLauncherTestUtils.launchJob(parameters);

        // then
        assertThat(execution.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(execution.getExitStatus().getExitCode()).isEqualTo("COMPLETED");

        StepExecution step = execution.getStepExecutions().iterator().next();
        // 09, 10, 11, 12, 13 시 다섯 구간 + 하루
        assertThat(step.getExecutionContext().getInt("stepsProcessed")).isEqualTo(6);
        assertThat(step.getExecutionContext().getInt("failures")).isZero();

        assertThat(summaryRepository.findByPeriodTypeAndPeriodStart(PeriodType.HOUR, DATE.atTime(9, 0)))
                .hasSize(2);
        assertThat(summaryRepository.findByPeriodTypeAndPeriodStart(PeriodType.HOUR, DATE.atTime(10, 0)))
                .isEmpty();
        assertThat(summaryRepository.findByPeriodTypeAndPeriodStart(PeriodType.DAY, DATE.atStartOfDay()))
                .allSatisfy(summary -> assertThat(summary.getCount()).isEqualTo(3));
    }

    @Test
    @DisplayName("일별 모드 - 시간 조각을 채우고 날짜를 확정한다")
    void dailyModeShouldRollUpAndFinalize() throws Exception {
        // given
        JobParameters parameters = new JobParametersBuilder()
                .addString("start", DATE.atStartOfDay().toString())
                .addString("end", DATE.atStartOfDay().toString())
                .addString("mode", BackfillMode.DAILY.name())
                .toJobParameters();

        // when
        JobExecution execution = jobLauncherTestUtils.launchJob(parameters);

        // then
        assertThat(execution.getStatus()).isEqualTo(BatchStatus.COMPLETED);

        List<DailyStat> stats = dailyStatRepository.findByStatDateAndEntityTypeOrderByEntityId(DATE, GroupType.ROUTE);
        assertThat(stats).hasSize(1);

        DailyStat stat = stats.get(0);
        assertThat(stat.getHourlyData()).containsOnlyKeys("9", "13");
        assertThat(stat.hourlyBreakdownFor(9).getRequests()).isEqualTo(2);
        assertThat(stat.getTotalRequests()).isEqualTo(3);
        assertThat(stat.getMaxDuration()).isEqualTo(500.0);
        assertThat(stat.getErrorCount()).isEqualTo(1);
    }
}
