package com.tenacy.perfpulse.service;

import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 백필 실행 결과. 실패한 단계는 중단 없이 모아서 마지막에 보고한다.
 */
@Getter
@ToString
public class BackfillResult {

    private int stepsProcessed;
    private final List<String> failures = new ArrayList<>();

    void stepSucceeded() {
        stepsProcessed++;
    }

    void stepFailed(String failure) {
        failures.add(failure);
    }

    public List<String> getFailures() {
        return Collections.unmodifiableList(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
