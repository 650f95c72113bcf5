package com.bloodforecast.repository;

import com.bloodforecast.entity.DemandHistoryRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public interface DemandHistoryRepository extends JpaRepository<DemandHistoryRecord, UUID> {

    List<DemandHistoryRecord> findByDateBetweenOrderByDateAsc(LocalDate from, LocalDate to);
}
