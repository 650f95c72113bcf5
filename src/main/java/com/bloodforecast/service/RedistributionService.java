package com.bloodforecast.service;

import com.bloodforecast.dto.InventoryStatus;
import com.bloodforecast.dto.InventoryStatusLevel;
import com.bloodforecast.dto.RedistributionOpportunity;
import com.bloodforecast.dto.RedistributionResult;
import com.bloodforecast.dto.RedistributionSummary;
import com.bloodforecast.entity.InventoryLevel;
import com.bloodforecast.exception.CapacityExceededException;
import com.bloodforecast.exception.ConcurrentRedistributionException;
import com.bloodforecast.exception.InsufficientInventoryException;
import com.bloodforecast.exception.InvalidRedistributionException;
import com.bloodforecast.ml.BloodTypes;
import com.bloodforecast.repository.InventoryLevelRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Matches hospitals holding surplus stock against hospitals short of the same
 * blood type, and executes the resulting transfers.
 * <p>
 * Proposals are advisory and non-exclusive: the same surplus may be offered to
 * several destinations. Only {@link #executeRedistribution} mutates inventory.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RedistributionService {

    private static final double CRITICAL_FRACTION = 0.5;
    private static final double EXCESS_FRACTION = 0.9;
    private static final double SURPLUS_FACTOR = 1.5;

    private final InventoryLevelRepository inventoryRepository;

    @Value("${redistribution.default-min-required:10}")
    private int defaultMinRequired;

    @Value("${redistribution.default-max-capacity:100}")
    private int defaultMaxCapacity;

    @Transactional(readOnly = true)
    public List<InventoryStatus> inventoryStatus(String bloodType, Long hospitalId) {
        return inventoryRepository.findFiltered(bloodType, hospitalId).stream()
            .map(this::toStatus)
            .toList();
    }

    public InventoryStatusLevel classify(InventoryLevel cell) {
        if (cell.getCurrentUnits() < cell.getMinRequired() * CRITICAL_FRACTION) {
            return InventoryStatusLevel.CRITICAL;
        }
        if (cell.getCurrentUnits() < cell.getMinRequired()) {
            return InventoryStatusLevel.LOW;
        }
        if (cell.getCurrentUnits() > cell.getMaxCapacity() * EXCESS_FRACTION) {
            return InventoryStatusLevel.EXCESS;
        }
        return InventoryStatusLevel.ADEQUATE;
    }

    @Transactional(readOnly = true)
    public List<RedistributionOpportunity> identifyOpportunities(String bloodType) {
        List<InventoryStatus> cells = inventoryStatus(bloodType, null);
        List<InventoryStatus> surplusCells = cells.stream().filter(c -> c.getSurplus() > 0).toList();
        List<InventoryStatus> shortageCells = cells.stream().filter(c -> c.getShortage() > 0).toList();

        List<RedistributionOpportunity> opportunities = new ArrayList<>();
        for (InventoryStatus shortage : shortageCells) {
            for (InventoryStatus surplus : surplusCells) {
                if (!shortage.getBloodType().equals(surplus.getBloodType())
                        || shortage.getHospitalId().equals(surplus.getHospitalId())) {
                    continue;
                }
                int transferUnits = (int) Math.floor(Math.min(shortage.getShortage(), surplus.getSurplus()));
                if (transferUnits > 0) {
                    opportunities.add(RedistributionOpportunity.builder()
                        .fromHospitalId(surplus.getHospitalId())
                        .fromHospitalName(surplus.getHospitalName())
                        .toHospitalId(shortage.getHospitalId())
                        .toHospitalName(shortage.getHospitalName())
                        .bloodType(shortage.getBloodType())
                        .transferUnits(transferUnits)
                        .priority(priority(shortage, surplus))
                        .reason(reason(shortage, surplus))
                        .build());
                }
            }
        }

        opportunities.sort(Comparator.comparingDouble(RedistributionOpportunity::getPriority).reversed());
        log.debug("Redistribution opportunities identified | bloodType={} | count={}", bloodType, opportunities.size());
        return opportunities;
    }

    /**
     * Moves {@code units} of {@code bloodType} between two hospitals. Both cells are
     * locked for the duration of the transaction and every check runs before either
     * cell is touched, so a rejected transfer leaves inventory unchanged.
     */
    @Transactional
    public RedistributionResult executeRedistribution(Long fromHospitalId, Long toHospitalId, String bloodType, int units) {
        if (units <= 0) {
            throw new InvalidRedistributionException("units must be >= 1, got " + units);
        }
        if (fromHospitalId == null || toHospitalId == null || fromHospitalId.equals(toHospitalId)) {
            throw new InvalidRedistributionException("Source and destination hospitals must be two different hospitals");
        }
        if (!BloodTypes.isValid(bloodType)) {
            throw new InvalidRedistributionException("Unknown blood type '" + bloodType + "'");
        }

        // Lock in hospital-id order so two opposite transfers cannot deadlock.
        Optional<InventoryLevel> sourceCell;
        Optional<InventoryLevel> destCell;
        if (fromHospitalId < toHospitalId) {
            sourceCell = inventoryRepository.findForUpdate(fromHospitalId, bloodType);
            destCell = inventoryRepository.findForUpdate(toHospitalId, bloodType);
        } else {
            destCell = inventoryRepository.findForUpdate(toHospitalId, bloodType);
            sourceCell = inventoryRepository.findForUpdate(fromHospitalId, bloodType);
        }

        InventoryLevel source = sourceCell.orElse(null);
        int available = source != null ? source.getCurrentUnits() : 0;
        if (source == null || available < units) {
            throw new InsufficientInventoryException(fromHospitalId, bloodType, available, units);
        }

        InventoryLevel dest = destCell.orElseGet(() -> InventoryLevel.builder()
            .hospitalId(toHospitalId)
            .bloodType(bloodType)
            .currentUnits(0)
            .minRequired(defaultMinRequired)
            .maxCapacity(defaultMaxCapacity)
            .build());
        if (dest.getCurrentUnits() + units > dest.getMaxCapacity()) {
            throw new CapacityExceededException(toHospitalId, bloodType, dest.getCurrentUnits(), units, dest.getMaxCapacity());
        }

        source.setCurrentUnits(source.getCurrentUnits() - units);
        dest.setCurrentUnits(dest.getCurrentUnits() + units);
        inventoryRepository.save(source);
        if (destCell.isPresent()) {
            inventoryRepository.save(dest);
        } else {
            // No row to lock for a new cell: a concurrent insert surfaces here as a unique-key violation.
            try {
                inventoryRepository.saveAndFlush(dest);
            } catch (DataIntegrityViolationException ex) {
                log.warn("Concurrent creation of destination cell | hospitalId={} | bloodType={}", toHospitalId, bloodType);
                throw new ConcurrentRedistributionException(toHospitalId, bloodType, ex);
            }
        }

        log.info("Redistribution executed | from={} | to={} | bloodType={} | units={} | sourceRemaining={} | destLevel={}",
                 fromHospitalId, toHospitalId, bloodType, units, source.getCurrentUnits(), dest.getCurrentUnits());
        return RedistributionResult.builder()
            .success(true)
            .fromHospitalId(fromHospitalId)
            .toHospitalId(toHospitalId)
            .bloodType(bloodType)
            .unitsTransferred(units)
            .sourceRemaining(source.getCurrentUnits())
            .destNewLevel(dest.getCurrentUnits())
            .build();
    }

    @Transactional(readOnly = true)
    public RedistributionSummary summary() {
        List<InventoryStatus> cells = inventoryStatus(null, null);

        long totalShortage = cells.stream().mapToLong(InventoryStatus::getShortage).sum();
        double totalSurplus = cells.stream().mapToDouble(InventoryStatus::getSurplus).sum();

        return RedistributionSummary.builder()
            .totalHospitals((int) cells.stream().map(InventoryStatus::getHospitalId).distinct().count())
            .totalInventoryRecords(cells.size())
            .criticalCount(count(cells, InventoryStatusLevel.CRITICAL))
            .lowCount(count(cells, InventoryStatusLevel.LOW))
            .adequateCount(count(cells, InventoryStatusLevel.ADEQUATE))
            .excessCount(count(cells, InventoryStatusLevel.EXCESS))
            .totalShortageUnits(totalShortage)
            .totalSurplusUnits(totalSurplus)
            .redistributionPotential(Math.min(totalShortage, totalSurplus))
            .bloodTypesTracked((int) cells.stream().map(InventoryStatus::getBloodType).distinct().count())
            .build();
    }

    private InventoryStatus toStatus(InventoryLevel cell) {
        return InventoryStatus.builder()
            .hospitalId(cell.getHospitalId())
            .hospitalName(cell.getHospitalName())
            .region(cell.getRegion())
            .bloodType(cell.getBloodType())
            .currentUnits(cell.getCurrentUnits())
            .minRequired(cell.getMinRequired())
            .maxCapacity(cell.getMaxCapacity())
            .shortage(Math.max(0, cell.getMinRequired() - cell.getCurrentUnits()))
            .surplus(Math.max(0.0, cell.getCurrentUnits() - cell.getMinRequired() * SURPLUS_FACTOR))
            .status(classify(cell))
            .build();
    }

    private double priority(InventoryStatus shortage, InventoryStatus surplus) {
        double priority = 0.0;
        if (shortage.getStatus() == InventoryStatusLevel.CRITICAL) {
            priority += 100;
        } else if (shortage.getStatus() == InventoryStatusLevel.LOW) {
            priority += 50;
        }
        priority += shortage.getShortage() * 2.0;
        priority += surplus.getSurplus() * 0.5;
        return priority;
    }

    private String reason(InventoryStatus shortage, InventoryStatus surplus) {
        return String.format("%s has %d unit shortage while %s has %d unit surplus",
            displayName(shortage), shortage.getShortage(), displayName(surplus), (int) surplus.getSurplus());
    }

    private String displayName(InventoryStatus cell) {
        return cell.getHospitalName() != null ? cell.getHospitalName() : "Hospital " + cell.getHospitalId();
    }

    private int count(List<InventoryStatus> cells, InventoryStatusLevel level) {
        return (int) cells.stream().filter(c -> c.getStatus() == level).count();
    }
}
