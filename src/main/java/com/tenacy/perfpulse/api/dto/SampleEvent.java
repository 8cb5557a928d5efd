package com.tenacy.perfpulse.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 수집기가 보내는 요청 한 건과 그 안에서 실행된 작업들.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SampleEvent {
    private String requestUuid;
    private String method;
    private String path;
    private LocalDateTime occurredAt;
    private Double duration;
    private Integer status;

    @Builder.Default
    private List<OperationEvent> operations = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OperationEvent {
        private String operationType;
        private String label;
        private Double duration;
        private String codebaseLocation;
        private Double startTime;
        private LocalDateTime occurredAt;
    }
}
