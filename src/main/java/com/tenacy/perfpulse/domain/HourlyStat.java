package com.tenacy.perfpulse.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DailyStat.hourlyData 의 한 시간 조각.
 * JSON 형식: {"requests": 45, "avg_duration": 234.0, "max_duration": 812.5, "errors": 2, "p95_duration": 640.0}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class HourlyStat {

    @JsonProperty("requests")
    private Integer requests;

    @JsonProperty("avg_duration")
    private Double avgDuration;

    @JsonProperty("max_duration")
    private Double maxDuration;

    @JsonProperty("errors")
    private Integer errors;

    @JsonProperty("p95_duration")
    private Double p95Duration;
}
