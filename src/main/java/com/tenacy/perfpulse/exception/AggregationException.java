package com.tenacy.perfpulse.exception;

/**
 * 한 구간의 집계 또는 일별 통계 병합이 실패했을 때 발생. 호출자는 같은 구간을 처음부터 다시 실행할 수 있다.
 */
public class AggregationException extends RuntimeException {

    public AggregationException(String message) {
        super(message);
    }

    public AggregationException(String message, Throwable cause) {
        super(message, cause);
    }
}
