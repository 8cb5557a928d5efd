package com.tenacy.perfpulse.domain;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface DailyStatRepository extends JpaRepository<DailyStat, Long> {

    Optional<DailyStat> findByStatDateAndEntityTypeAndEntityId(LocalDate statDate, GroupType entityType, Long entityId);

    // 같은 날짜/엔티티의 시간 병합과 확정을 행 잠금으로 직렬화
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM DailyStat d " +
            "WHERE d.statDate = :statDate AND d.entityType = :entityType AND d.entityId = :entityId")
    Optional<DailyStat> findForUpdate(
            @Param("statDate") LocalDate statDate,
            @Param("entityType") GroupType entityType,
            @Param("entityId") Long entityId);

    List<DailyStat> findByStatDateAndEntityTypeOrderByEntityId(LocalDate statDate, GroupType entityType);

    // 아직 확정되지 않은 레코드 (totalRequests == 0)
    List<DailyStat> findByStatDateAndEntityTypeAndTotalRequestsOrderByEntityId(
            LocalDate statDate, GroupType entityType, Integer totalRequests);

    List<DailyStat> findByStatDateOrderByEntityTypeAscEntityIdAsc(LocalDate statDate);
}
