package com.tenacy.perfpulse.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenacy.perfpulse.api.dto.SampleEvent;
import com.tenacy.perfpulse.config.PerfPulseProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "perfpulse.kafka.enabled", havingValue = "true", matchIfMissing = true)
public class SampleEventListener {

    private final SampleIngestionService sampleIngestionService;
    private final ObjectMapper objectMapper;
    private final PerfPulseProperties properties;

    @KafkaListener(topics = "${perfpulse.kafka.topics.samples}", groupId = "${spring.kafka.consumer.group-id}")
    public void consumeSample(String message) {
        // 비활성화 중에는 메시지를 소비만 하고 저장하지 않는다
        if (!properties.isEnabled()) {
            log.debug("perfpulse 비활성화 상태, 샘플 이벤트 무시");
            return;
        }

        SampleEvent event;
        try {
            event = objectMapper.readValue(message, SampleEvent.class);
        } catch (JsonProcessingException e) {
            log.error("샘플 이벤트 역직렬화 실패, 메시지 버림: {}", message, e);
            return;
        }

        try {
            sampleIngestionService.recordRequest(event);
        } catch (IllegalArgumentException e) {
            log.warn("유효하지 않은 샘플 이벤트 버림: {}, reason={}", message, e.getMessage());
        }
    }
}
