package com.tenacy.perfpulse.api;

import com.tenacy.perfpulse.api.dto.BackfillRequest;
import com.tenacy.perfpulse.api.dto.BackfillResponse;
import com.tenacy.perfpulse.api.dto.DailyStatResponse;
import com.tenacy.perfpulse.api.dto.SummaryResponse;
import com.tenacy.perfpulse.batch.BackfillJobLauncher;
import com.tenacy.perfpulse.config.PerfPulseProperties;
import com.tenacy.perfpulse.domain.DailyStatRepository;
import com.tenacy.perfpulse.domain.GroupType;
import com.tenacy.perfpulse.domain.SummaryRepository;
import com.tenacy.perfpulse.stats.PerformanceStatus;
import com.tenacy.perfpulse.stats.PeriodType;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.JobExecution;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class StatsController {

    private final SummaryRepository summaryRepository;
    private final DailyStatRepository dailyStatRepository;
    private final BackfillJobLauncher backfillJobLauncher;
    private final PerfPulseProperties properties;

    @GetMapping("/summaries")
    public ResponseEntity<List<SummaryResponse>> getSummaries(
            @RequestParam String periodType,
            @RequestParam(defaultValue = "overall") String groupType,
            @RequestParam(required = false) Long groupId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime end) {

        if (start.isAfter(end)) {
            throw new IllegalArgumentException("start must not be after end");
        }

        PeriodType period = PeriodType.fromValue(periodType);
        GroupType type = parseGroupType(groupType);
        Long storageId = type == GroupType.OVERALL ? Long.valueOf(0L) : groupId;

        List<SummaryResponse> responses = summaryRepository.search(period, type, storageId, start, end).stream()
                .map(summary -> SummaryResponse.of(summary, PerformanceStatus.classify(
                        summary.getAvgDuration(), properties.thresholdsFor(type))))
                .collect(Collectors.toList());

        return ResponseEntity.ok(responses);
    }

    @GetMapping("/daily-stats")
    public ResponseEntity<List<DailyStatResponse>> getDailyStats(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) String entityType) {

        List<DailyStatResponse> responses = (entityType == null
                ? dailyStatRepository.findByStatDateOrderByEntityTypeAscEntityIdAsc(date)
                : dailyStatRepository.findByStatDateAndEntityTypeOrderByEntityId(date, parseGroupType(entityType)))
                .stream()
                .map(DailyStatResponse::of)
                .collect(Collectors.toList());

        return ResponseEntity.ok(responses);
    }

    @PostMapping("/stats/backfill")
    public ResponseEntity<BackfillResponse> backfill(@Valid @RequestBody BackfillRequest request) {
        log.info("통계 백필 요청: {}", request);
        JobExecution execution = backfillJobLauncher.launch(
                request.getStart(), request.getEnd(), request.getPeriodTypes(), request.getMode());
        return ResponseEntity.ok(BackfillResponse.of(execution));
    }

    private GroupType parseGroupType(String value) {
        try {
            return GroupType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown group type: " + value, e);
        }
    }
}
