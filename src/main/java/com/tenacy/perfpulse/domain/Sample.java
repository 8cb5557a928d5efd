package com.tenacy.perfpulse.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * 집계에 쓰이는 원시 측정값 하나 (요청 또는 SQL 실행). JPQL 생성자 표현식으로 만들어진다.
 */
@Getter
@ToString
@AllArgsConstructor
public class Sample {

    private final Long groupId;       // route id 또는 query id
    private final Double duration;    // 밀리초
    private final LocalDateTime occurredAt;
    private final Integer status;     // HTTP 상태, SQL 샘플은 null
    private final boolean error;

    // SQL 실행 샘플용
    public Sample(Long groupId, Double duration, LocalDateTime occurredAt) {
        this(groupId, duration, occurredAt, null, false);
    }
}
