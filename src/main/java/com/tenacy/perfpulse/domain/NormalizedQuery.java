package com.tenacy.perfpulse.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * 정규화된 SQL 형태. 처음 보는 형태일 때 한 번 만들어지고 이후 변경되지 않는다.
 */
@Entity
@Table(name = "perfpulse_queries", uniqueConstraints = {
        @UniqueConstraint(name = "uk_queries_normalized_sql", columnNames = "normalizedSql")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NormalizedQuery {

    // 인덱스 호환성을 위한 길이 제한
    public static final int MAX_SQL_LENGTH = 1000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = MAX_SQL_LENGTH)
    private String normalizedSql;

    @CreationTimestamp
    private LocalDateTime createdAt;
}
