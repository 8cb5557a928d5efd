package com.tenacy.perfpulse.batch;

import com.tenacy.perfpulse.exception.BackfillException;
import com.tenacy.perfpulse.stats.PeriodType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

@Component
@Slf4j
public class BackfillJobLauncher {

    private final JobLauncher jobLauncher;
    private final Job statsBackfillJob;
    private final Clock clock;

    public BackfillJobLauncher(JobLauncher jobLauncher,
                               @Qualifier("statsBackfillJob") Job statsBackfillJob,
                               Clock clock) {
        this.jobLauncher = jobLauncher;
        this.statsBackfillJob = statsBackfillJob;
        this.clock = clock;
    }

    /**
     * 파라미터를 검증한 뒤 백필 잡을 실행한다. 잘못된 범위나 구간 단위는 잡을 만들기 전에 거부된다.
     */
    public JobExecution launch(LocalDateTime start, LocalDateTime end, List<String> periodTypes, String mode) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("start and end are required");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("start must not be after end: " + start + " > " + end);
        }
        BackfillMode backfillMode = BackfillMode.fromValue(mode);
        String periods = periodTypes == null || periodTypes.isEmpty()
                ? PeriodType.HOUR.getValue() + "," + PeriodType.DAY.getValue()
                : periodTypes.stream()
                        .map(PeriodType::fromValue)
                        .map(PeriodType::getValue)
                        .collect(Collectors.joining(","));

        JobParameters jobParameters = new JobParametersBuilder()
                .addString("start", start.toString())
                .addString("end", end.toString())
                .addString("periodTypes", periods)
                .addString("mode", backfillMode.name())
                .addString("requestedAt", LocalDateTime.now(clock).toString())
                .toJobParameters();

        try {
            JobExecution execution = jobLauncher.run(statsBackfillJob, jobParameters);
            log.info("통계 백필 잡 실행: id={}, status={}, exit={}",
                    execution.getId(), execution.getStatus(), execution.getExitStatus().getExitCode());
            return execution;
        } catch (Exception e) {
            log.error("통계 백필 잡 실행 중 오류 발생", e);
            throw new BackfillException("Failed to launch " + statsBackfillJob.getName(), e);
        }
    }
}
