package com.bloodforecast.repository;

import com.bloodforecast.dto.RiskLevel;
import com.bloodforecast.entity.ForecastRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface ForecastRecordRepository extends JpaRepository<ForecastRecord, UUID> {

    @Query("""
        SELECT f FROM ForecastRecord f
        WHERE (:bloodType IS NULL OR f.bloodType = :bloodType)
          AND (:region IS NULL OR f.region = :region)
          AND f.shortageRisk IN :risks
        ORDER BY f.createdAt DESC
    """)
    List<ForecastRecord> findRecent(
        @Param("bloodType") String bloodType,
        @Param("region") String region,
        @Param("risks") Collection<RiskLevel> risks,
        Pageable pageable);

    List<ForecastRecord> findByCreatedAtGreaterThanEqual(Instant cutoff);

    List<ForecastRecord> findByForecastDateAfterOrderByForecastDateAsc(LocalDateTime now);

    @Query("""
        SELECT f FROM ForecastRecord f
        WHERE f.alertSent = false
          AND f.shortageRisk IN :risks
          AND f.forecastDate > :now
        ORDER BY f.forecastDate ASC
    """)
    List<ForecastRecord> findPendingAlerts(
        @Param("risks") Collection<RiskLevel> risks,
        @Param("now") LocalDateTime now);
}
