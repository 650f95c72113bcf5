package com.bloodforecast.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(
    name = "demand_history",
    indexes = {
        @Index(name = "idx_hist_date",       columnList = "demand_date"),
        @Index(name = "idx_hist_blood_type", columnList = "blood_type"),
        @Index(name = "idx_hist_region",     columnList = "region"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DemandHistoryRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "blood_type", nullable = false, length = 3)
    private String bloodType;

    @Column(nullable = false, length = 50)
    private String region;

    @Column(name = "demand_date", nullable = false)
    private LocalDate date;

    @Column(name = "units_consumed", nullable = false)
    private int unitsConsumed;

    @Column(length = 20)
    private String season;

    @Column(name = "disease_outbreak")
    private boolean diseaseOutbreak;
}
