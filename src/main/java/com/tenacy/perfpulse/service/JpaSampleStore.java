package com.tenacy.perfpulse.service;

import com.tenacy.perfpulse.domain.GroupKey;
import com.tenacy.perfpulse.domain.GroupType;
import com.tenacy.perfpulse.domain.OperationRepository;
import com.tenacy.perfpulse.domain.RequestRepository;
import com.tenacy.perfpulse.domain.Sample;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Component
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaSampleStore implements SampleStore {

    private final RequestRepository requestRepository;
    private final OperationRepository operationRepository;

    @Override
    public Map<GroupKey, List<Sample>> fetchGroups(GroupType groupType, LocalDateTime start, LocalDateTime end) {
        switch (groupType) {
            case OVERALL: {
                List<Sample> samples = requestRepository.findSamplesBetween(start, end);
                return samples.isEmpty()
                        ? Collections.emptyMap()
                        : Collections.singletonMap(GroupKey.overall(), samples);
            }
            case ROUTE:
                return groupById(requestRepository.findSamplesBetween(start, end), GroupType.ROUTE);
            case QUERY:
                return groupById(operationRepository.findQuerySamplesBetween(start, end), GroupType.QUERY);
            default:
                throw new IllegalArgumentException("Unsupported group type: " + groupType);
        }
    }

    @Override
    public List<Sample> fetchSamples(GroupKey key, LocalDateTime start, LocalDateTime end) {
        switch (key.getType()) {
            case OVERALL:
                return requestRepository.findSamplesBetween(start, end);
            case ROUTE:
                return requestRepository.findSamplesByRouteBetween(key.getId(), start, end);
            case QUERY:
                return operationRepository.findSamplesByQueryBetween(key.getId(), start, end);
            default:
                throw new IllegalArgumentException("Unsupported group type: " + key.getType());
        }
    }

    private Map<GroupKey, List<Sample>> groupById(List<Sample> samples, GroupType type) {
        // id 순으로 처리해 실행마다 같은 순서를 보장
        Map<Long, List<Sample>> byId = new TreeMap<>();
        for (Sample sample : samples) {
            byId.computeIfAbsent(sample.getGroupId(), k -> new ArrayList<>()).add(sample);
        }

        Map<GroupKey, List<Sample>> result = new LinkedHashMap<>();
        byId.forEach((id, group) -> result.put(GroupKey.of(type, id), group));
        return result;
    }
}
