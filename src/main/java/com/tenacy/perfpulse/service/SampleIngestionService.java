package com.tenacy.perfpulse.service;

import com.tenacy.perfpulse.api.dto.SampleEvent;
import com.tenacy.perfpulse.api.dto.SampleEvent.OperationEvent;
import com.tenacy.perfpulse.domain.NormalizedQuery;
import com.tenacy.perfpulse.domain.Operation;
import com.tenacy.perfpulse.domain.OperationRepository;
import com.tenacy.perfpulse.domain.Request;
import com.tenacy.perfpulse.domain.RequestRepository;
import com.tenacy.perfpulse.domain.Route;
import com.tenacy.perfpulse.domain.RouteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class SampleIngestionService {

    // 모니터 자신의 테이블에 대한 쿼리는 기록하지 않는다
    static final String OWN_TABLE_PREFIX = "perfpulse_";

    private static final Set<String> SQL_OPERATION_TYPES = Set.of("sql", "db");

    private final RouteRepository routeRepository;
    private final RequestRepository requestRepository;
    private final OperationRepository operationRepository;
    private final QueryFingerprintService queryFingerprintService;
    private final PulseMetricsService metricsService;

    /**
     * 요청 한 건과 그 작업들을 저장한다. 5xx 응답은 에러 요청으로 표시된다.
     */
    @Transactional
    public Request recordRequest(SampleEvent event) {
        validate(event);

        Route route = findOrCreateRoute(event.getMethod().toUpperCase(Locale.ROOT), event.getPath());

        Request request = requestRepository.save(Request.builder()
                .route(route)
                .occurredAt(event.getOccurredAt())
                .duration(event.getDuration())
                .status(event.getStatus())
                .error(event.getStatus() != null && event.getStatus() >= 500)
                .requestUuid(event.getRequestUuid() != null ? event.getRequestUuid() : UUID.randomUUID().toString())
                .build());

        int recorded = 0;
        List<OperationEvent> operations = event.getOperations();
        if (operations != null) {
            for (OperationEvent operationEvent : operations) {
                if (recordOperation(request, operationEvent)) {
                    recorded++;
                }
            }
        }

        metricsService.recordSampleIngested();
        log.debug("요청 저장: route={} {}, duration={}, status={}, operations={}",
                route.getMethod(), route.getPath(), request.getDuration(), request.getStatus(), recorded);
        return request;
    }

    private boolean recordOperation(Request request, OperationEvent event) {
        if (event.getOperationType() == null || event.getLabel() == null || event.getDuration() == null) {
            log.warn("유효하지 않은 작업 데이터 무시: {}", event);
            return false;
        }

        String operationType = event.getOperationType().toLowerCase(Locale.ROOT);
        NormalizedQuery query = null;

        if (SQL_OPERATION_TYPES.contains(operationType)) {
            if (event.getLabel().contains(OWN_TABLE_PREFIX)) {
                return false;
            }
            query = queryFingerprintService.resolve(event.getLabel()).orElse(null);
        }

        operationRepository.save(Operation.builder()
                .request(request)
                .query(query)
                .operationType(operationType)
                .label(event.getLabel())
                .duration(event.getDuration())
                .codebaseLocation(event.getCodebaseLocation())
                .startTime(event.getStartTime())
                .occurredAt(event.getOccurredAt() != null ? event.getOccurredAt() : request.getOccurredAt())
                .build());
        return true;
    }

    private Route findOrCreateRoute(String method, String path) {
        return routeRepository.findByMethodAndPath(method, path)
                .orElseGet(() -> {
                    log.debug("새 라우트 등록: {} {}", method, path);
                    return routeRepository.save(Route.builder().method(method).path(path).build());
                });
    }

    private void validate(SampleEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("Sample event must not be null");
        }
        if (event.getMethod() == null || event.getPath() == null) {
            throw new IllegalArgumentException("Sample event requires method and path");
        }
        if (event.getOccurredAt() == null) {
            throw new IllegalArgumentException("Sample event requires occurredAt");
        }
        if (event.getDuration() == null || event.getDuration() < 0) {
            throw new IllegalArgumentException("Sample event requires a non-negative duration: " + event.getDuration());
        }
    }
}
