package com.tenacy.perfpulse.domain;

import com.tenacy.perfpulse.stats.PeriodType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface SummaryRepository extends JpaRepository<Summary, Long> {

    // 자연키 조회 (upsert 용)
    Optional<Summary> findBySummarizableTypeAndSummarizableIdAndPeriodTypeAndPeriodStart(
            GroupType summarizableType, Long summarizableId, PeriodType periodType, LocalDateTime periodStart);

    List<Summary> findByPeriodTypeAndPeriodStart(PeriodType periodType, LocalDateTime periodStart);

    @Query("SELECT s FROM Summary s " +
            "WHERE s.periodType = :periodType " +
            "AND s.summarizableType = :type " +
            "AND (:id IS NULL OR s.summarizableId = :id) " +
            "AND s.periodStart >= :start AND s.periodStart < :end " +
            "ORDER BY s.periodStart DESC")
    List<Summary> search(
            @Param("periodType") PeriodType periodType,
            @Param("type") GroupType type,
            @Param("id") Long id,
            @Param("start") LocalDateTime start,
            @Param("end") LocalDateTime end);
}
