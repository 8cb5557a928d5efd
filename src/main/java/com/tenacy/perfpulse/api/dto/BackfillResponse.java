package com.tenacy.perfpulse.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.batch.core.JobExecution;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackfillResponse {
    private Long jobExecutionId;
    private String status;
    private String exitCode;

    public static BackfillResponse of(JobExecution execution) {
        return BackfillResponse.builder()
                .jobExecutionId(execution.getId())
                .status(execution.getStatus().name())
                .exitCode(execution.getExitStatus().getExitCode())
                .build();
    }
}
