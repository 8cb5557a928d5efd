package com.tenacy.perfpulse.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "perfpulse_operations", indexes = {
        @Index(name = "idx_operations_query_time", columnList = "query_id,occurredAt"),
        @Index(name = "idx_operations_time_query", columnList = "occurredAt,query_id"),
        @Index(name = "idx_operations_type", columnList = "operationType")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Operation {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ToString.Exclude
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "request_id", nullable = false)
    private Request request;

    @ToString.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "query_id")
    private NormalizedQuery query;

    @Column(nullable = false, length = 32)
    private String operationType;   // sql, controller, template ...

    @Column(nullable = false, columnDefinition = "TEXT")
    private String label;

    @Column(nullable = false)
    private Double duration;        // 밀리초

    private String codebaseLocation;

    private Double startTime;       // 요청 시작 기준 오프셋 (밀리초)

    @Column(nullable = false)
    private LocalDateTime occurredAt;

    @CreationTimestamp
    private LocalDateTime createdAt;
}
