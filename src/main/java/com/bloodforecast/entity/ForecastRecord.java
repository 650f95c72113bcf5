package com.bloodforecast.entity;

import com.bloodforecast.dto.RiskLevel;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(
    name = "demand_forecasts",
    indexes = {
        @Index(name = "idx_fc_date",       columnList = "forecast_date"),
        @Index(name = "idx_fc_blood_type", columnList = "blood_type"),
        @Index(name = "idx_fc_region",     columnList = "region"),
        @Index(name = "idx_fc_created",    columnList = "created_at"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ForecastRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "blood_type", nullable = false, length = 3)
    private String bloodType;

    @Column(nullable = false, length = 50)
    private String region;

    @Column(name = "forecast_date", nullable = false)
    private LocalDateTime forecastDate;

    @Column(name = "predicted_demand", nullable = false)
    private double predictedDemand;

    private double confidence;

    @Enumerated(EnumType.STRING)
    @Column(name = "shortage_risk", nullable = false, length = 10)
    private RiskLevel shortageRisk;

    @Column(name = "current_inventory")
    private int currentInventory;

    @Column(name = "alert_sent")
    private boolean alertSent;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
