package com.bloodforecast.repository;

import com.bloodforecast.entity.InventoryLevel;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface InventoryLevelRepository extends JpaRepository<InventoryLevel, UUID> {

    @Query("""
        SELECT i FROM InventoryLevel i
        WHERE (:bloodType IS NULL OR i.bloodType = :bloodType)
          AND (:hospitalId IS NULL OR i.hospitalId = :hospitalId)
        ORDER BY i.hospitalId ASC, i.bloodType ASC
    """)
    List<InventoryLevel> findFiltered(
        @Param("bloodType") String bloodType,
        @Param("hospitalId") Long hospitalId);

    Optional<InventoryLevel> findByHospitalIdAndBloodType(Long hospitalId, String bloodType);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
        SELECT i FROM InventoryLevel i
        WHERE i.hospitalId = :hospitalId AND i.bloodType = :bloodType
    """)
    Optional<InventoryLevel> findForUpdate(
        @Param("hospitalId") Long hospitalId,
        @Param("bloodType") String bloodType);

    @Query("""
        SELECT SUM(i.currentUnits) FROM InventoryLevel i
        WHERE i.region = :region AND i.bloodType = :bloodType
    """)
    Long sumCurrentUnits(@Param("region") String region, @Param("bloodType") String bloodType);
}
