package com.bloodforecast.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "inventory_levels",
    uniqueConstraints = @UniqueConstraint(name = "uk_inventory_hospital_blood_type",
                                           columnNames = {"hospital_id", "blood_type"}),
    indexes = {
        @Index(name = "idx_inv_blood_type", columnList = "blood_type"),
        @Index(name = "idx_inv_region",     columnList = "region"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InventoryLevel {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "hospital_id", nullable = false)
    private Long hospitalId;

    @Column(name = "hospital_name", length = 120)
    private String hospitalName;

    @Column(length = 50)
    private String region;

    @Column(name = "blood_type", nullable = false, length = 3)
    private String bloodType;

    @Column(name = "current_units", nullable = false)
    private int currentUnits;

    @Column(name = "min_required", nullable = false)
    private int minRequired;

    @Column(name = "max_capacity", nullable = false)
    private int maxCapacity;

    @Version
    private Long version;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
