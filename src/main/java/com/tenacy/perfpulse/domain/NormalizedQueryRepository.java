package com.tenacy.perfpulse.domain;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface NormalizedQueryRepository extends JpaRepository<NormalizedQuery, Long> {

    Optional<NormalizedQuery> findByNormalizedSql(String normalizedSql);
}
