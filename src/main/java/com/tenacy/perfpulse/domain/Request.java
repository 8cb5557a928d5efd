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
@Table(name = "perfpulse_requests", indexes = {
        @Index(name = "idx_requests_occurred_at", columnList = "occurredAt"),
        @Index(name = "idx_requests_occurred_at_route", columnList = "occurredAt,route_id")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uk_requests_uuid", columnNames = "requestUuid")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Request {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ToString.Exclude
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "route_id", nullable = false)
    private Route route;

    @Column(nullable = false)
    private LocalDateTime occurredAt;

    @Column(nullable = false)
    private Double duration;      // 밀리초

    private Integer status;

    @Column(name = "is_error", nullable = false)
    private boolean error;

    @Column(nullable = false, length = 36)
    private String requestUuid;

    @CreationTimestamp
    private LocalDateTime createdAt;
}
