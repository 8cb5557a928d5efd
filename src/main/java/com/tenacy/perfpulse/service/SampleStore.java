package com.tenacy.perfpulse.service;

import com.tenacy.perfpulse.domain.GroupKey;
import com.tenacy.perfpulse.domain.GroupType;
import com.tenacy.perfpulse.domain.Sample;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 원시 샘플 저장소에 대한 읽기 전용 조회. 모든 구간은 반개구간 {@code [start, end)}.
 */
public interface SampleStore {

    /**
     * 구간 내 샘플을 그룹별로 묶어 돌려준다. 샘플이 없는 그룹은 포함되지 않는다.
     */
    Map<GroupKey, List<Sample>> fetchGroups(GroupType groupType, LocalDateTime start, LocalDateTime end);

    List<Sample> fetchSamples(GroupKey key, LocalDateTime start, LocalDateTime end);
}
