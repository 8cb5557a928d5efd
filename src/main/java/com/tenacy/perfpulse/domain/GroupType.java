package com.tenacy.perfpulse.domain;

/**
 * 요약 통계를 계산하는 차원. OVERALL 은 전체 요청, ROUTE 는 라우트별, QUERY 는 정규화된 쿼리별.
 */
public enum GroupType {
    OVERALL,
    ROUTE,
    QUERY;

    public boolean carriesStatus() {
        return this != QUERY;
    }
}
