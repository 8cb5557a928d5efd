package com.tenacy.perfpulse.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackfillRequest {
    @NotNull
    private LocalDateTime start;

    @NotNull
    private LocalDateTime end;

    private List<String> periodTypes;   // 기본값 hour, day

    private String mode;                // summary | daily, 기본값 summary
}
