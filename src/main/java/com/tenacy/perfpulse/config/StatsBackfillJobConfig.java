package com.tenacy.perfpulse.config;

import com.tenacy.perfpulse.batch.StatsBackfillTasklet;
import com.tenacy.perfpulse.service.BackfillService;
import lombok.RequiredArgsConstructor;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.support.transaction.ResourcelessTransactionManager;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@RequiredArgsConstructor
public class StatsBackfillJobConfig {

    public static final String JOB_NAME = "statsBackfillJob";

    private final JobRepository jobRepository;

    @Bean
    public Job statsBackfillJob(Step statsBackfillStep) {
        return new JobBuilder(JOB_NAME, jobRepository)
                .start(statsBackfillStep)
                .build();
    }

    @Bean
    public Step statsBackfillStep(StatsBackfillTasklet statsBackfillTasklet) {
        // 구간마다 서비스 트랜잭션으로 따로 커밋한다. 스텝 전체를 하나의 JPA 트랜잭션으로 묶지 않는다
        return new StepBuilder("statsBackfillStep", jobRepository)
                .tasklet(statsBackfillTasklet, new ResourcelessTransactionManager())
                .build();
    }

    @Bean
    @StepScope
    public StatsBackfillTasklet statsBackfillTasklet(
            BackfillService backfillService,
            Clock clock,
            @Value("#{jobParameters['start']}") String start,
            @Value("#{jobParameters['end']}") String end,
            @Value("#{jobParameters['periodTypes']}") String periodTypes,
            @Value("#{jobParameters['mode']}") String mode) {
        return new StatsBackfillTasklet(backfillService, clock, start, end, periodTypes, mode);
    }
}
