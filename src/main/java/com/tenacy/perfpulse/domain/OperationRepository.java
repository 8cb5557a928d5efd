package com.tenacy.perfpulse.domain;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface OperationRepository extends JpaRepository<Operation, Long> {

    // 쿼리와 연결되지 않은 operation (뷰 렌더링 등) 은 쿼리 집계에서 제외

    @Query("SELECT new com.tenacy.perfpulse.domain.Sample(o.query.id, o.duration, o.occurredAt) " +
            "FROM Operation o " +
            "WHERE o.query IS NOT NULL AND o.occurredAt >= :start AND o.occurredAt < :end")
    List<Sample> findQuerySamplesBetween(
            @Param("start") LocalDateTime start,
            @Param("end") LocalDateTime end);

    @Query("SELECT new com.tenacy.perfpulse.domain.Sample(o.query.id, o.duration, o.occurredAt) " +
            "FROM Operation o " +
            "WHERE o.query.id = :queryId AND o.occurredAt >= :start AND o.occurredAt < :end")
    List<Sample> findSamplesByQueryBetween(
            @Param("queryId") Long queryId,
            @Param("start") LocalDateTime start,
            @Param("end") LocalDateTime end);
}
