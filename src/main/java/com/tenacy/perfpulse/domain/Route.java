package com.tenacy.perfpulse.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "perfpulse_routes", uniqueConstraints = {
        @UniqueConstraint(name = "uk_routes_method_path", columnNames = {"method", "path"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Route {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 16)
    private String method;

    @Column(nullable = false, length = 500)
    private String path;

    @CreationTimestamp
    private LocalDateTime createdAt;
}
