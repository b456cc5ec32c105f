package com.contractorscheduling.scheduling.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * A bookable service offered by a contractor.
 */
@Entity
@Table(name = "service_definitions", indexes = {
        @Index(name = "idx_service_contractor", columnList = "contractor_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceDefinition {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "contractor_id", nullable = false)
    private Long contractorId;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "description", length = 2000)
    private String description;

    @Column(name = "duration_minutes", nullable = false)
    private Integer durationMinutes;

    @Column(name = "price", nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "preparation_minutes", nullable = false)
    private Integer preparationMinutes;

    @Column(name = "cleanup_minutes", nullable = false)
    private Integer cleanupMinutes;

    /**
     * Null inherits the schedule's deposit flag.
     */
    @Column(name = "requires_deposit")
    private Boolean requiresDeposit;

    /**
     * Null inherits the schedule's deposit percentage.
     */
    @Column(name = "deposit_percentage", precision = 5, scale = 2)
    private BigDecimal depositPercentage;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Preparation, duration and cleanup: the calendar time one booking of this service occupies.
     */
    public Duration blockLength() {
        return Duration.ofMinutes((long) preparationMinutes + durationMinutes + cleanupMinutes);
    }
}
