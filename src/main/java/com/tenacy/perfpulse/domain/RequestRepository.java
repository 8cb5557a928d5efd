package com.tenacy.perfpulse.domain;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface RequestRepository extends JpaRepository<Request, Long> {

    // 구간은 모두 반개구간 [start, end)

    @Query("SELECT new com.tenacy.perfpulse.domain.Sample(r.route.id, r.duration, r.occurredAt, r.status, r.error) " +
            "FROM Request r " +
            "WHERE r.occurredAt >= :start AND r.occurredAt < :end")
    List<Sample> findSamplesBetween(
            @Param("start") LocalDateTime start,
            @Param("end") LocalDateTime end);

    @Query("SELECT new com.tenacy.perfpulse.domain.Sample(r.route.id, r.duration, r.occurredAt, r.status, r.error) " +
            "FROM Request r " +
            "WHERE r.route.id = :routeId AND r.occurredAt >= :start AND r.occurredAt < :end")
    List<Sample> findSamplesByRouteBetween(
            @Param("routeId") Long routeId,
            @Param("start") LocalDateTime start,
            @Param("end") LocalDateTime end);
}
