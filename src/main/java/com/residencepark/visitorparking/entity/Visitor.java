package com.residencepark.visitorparking.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Visitor parking registration.
 *
 * Uniqueness of identityNumber and licensePlate is enforced by the two unique
 * constraints below. VisitorService pre-checks them only to report which field
 * collided; the constraints are the authority when two registrations race.
 *
 * Both unique fields are stored upper-cased.
 */
@Entity
@Table(
    name = "visitors",
    uniqueConstraints = {
        @UniqueConstraint(name = Visitor.UK_IDENTITY_NUMBER, columnNames = "identity_number"),
        @UniqueConstraint(name = Visitor.UK_LICENSE_PLATE,   columnNames = "license_plate")
    },
    indexes = {
        @Index(name = "idx_visitors_unit_number", columnList = "unit_number")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Visitor {

    public static final String UK_IDENTITY_NUMBER = "uk_visitors_identity_number";
    public static final String UK_LICENSE_PLATE   = "uk_visitors_license_plate";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(name = "identity_number", nullable = false)
    private String identityNumber;

    @Column(name = "license_plate", nullable = false)
    private String licensePlate;

    @Column(name = "unit_number", nullable = false)
    private String unitNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private VisitorStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    // Set on every status change, including no-op ones
    @Column(name = "last_updated")
    private LocalDateTime lastUpdated;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
        if (this.status == null) {
            this.status = VisitorStatus.ACTIVE;
        }
    }
}
