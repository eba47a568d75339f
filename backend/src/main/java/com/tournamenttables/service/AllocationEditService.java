package com.tournamenttables.service;

import com.tournamenttables.allocation.AllocationConflict;
import com.tournamenttables.allocation.AuditRecord;
import com.tournamenttables.allocation.CompetitorSnapshot;
import com.tournamenttables.allocation.CostBreakdown;
import com.tournamenttables.allocation.CostCalculator;
import com.tournamenttables.allocation.HistoryProvider;
import com.tournamenttables.allocation.ReuseAssessment;
import com.tournamenttables.allocation.TableOption;
import com.tournamenttables.allocation.TournamentHistory;
import com.tournamenttables.model.Allocation;
import com.tournamenttables.model.AllocationAuditAction;
import com.tournamenttables.model.AllocationAuditEntry;
import com.tournamenttables.model.AuditRecordJsonCodec;
import com.tournamenttables.model.GameTable;
import com.tournamenttables.model.Player;
import com.tournamenttables.model.Round;
import com.tournamenttables.repository.AllocationAuditEntryRepository;
import com.tournamenttables.repository.AllocationRepository;
import com.tournamenttables.repository.GameTableRepository;
import com.tournamenttables.repository.RoundRepository;
import com.tournamenttables.web.AllocationRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Manual reassign and swap of generated allocations.
 *
 * <p>Every edit runs in one transaction that first takes a write lock on the round row, then
 * checks occupancy and writes. Concurrent edits of the same round therefore serialize; anything
 * that still slips past (a stale version or a deferred unique-index violation) is reported as a
 * concurrent modification and rolled back.
 */
@Service
public class AllocationEditService {

    private static final Logger log = LoggerFactory.getLogger(AllocationEditService.class);

    private final AllocationRepository allocationRepository;
    private final RoundRepository roundRepository;
    private final GameTableRepository gameTableRepository;
    private final AllocationAuditEntryRepository allocationAuditEntryRepository;
    private final CostCalculator costCalculator;

    public AllocationEditService(
            AllocationRepository allocationRepository,
            RoundRepository roundRepository,
            GameTableRepository gameTableRepository,
            AllocationAuditEntryRepository allocationAuditEntryRepository,
            CostCalculator costCalculator
    ) {
        this.allocationRepository = allocationRepository;
        this.roundRepository = roundRepository;
        this.gameTableRepository = gameTableRepository;
        this.allocationAuditEntryRepository = allocationAuditEntryRepository;
        this.costCalculator = costCalculator;
    }

    @Transactional
    public AdjustmentResult reassign(Long allocationId, int newTableNumber) {
        Long roundId = requireRoundId(allocationId);
        Round round = lockRound(roundId);
        Allocation allocation = lockAllocation(allocationId);

        if (allocation.isBye()) {
            throw AllocationRequestException.byeHasNoTable(
                    "Allocation " + allocationId + " is a bye and cannot be given a table");
        }

        Long tournamentId = round.getTournament().getId();
        GameTable table = gameTableRepository.findByTournamentIdAndTableNumber(tournamentId, newTableNumber)
                .orElseThrow(() -> AllocationRequestException.tableNotInTournament(
                        "Table " + newTableNumber + " does not belong to tournament " + tournamentId));

        Optional<Allocation> occupant = allocationRepository.findByRoundIdAndTableId(roundId, table.getId());
        if (occupant.isPresent() && !occupant.get().getId().equals(allocationId)) {
            throw AllocationRequestException.tableOccupied(
                    "Table " + newTableNumber + " is already assigned in round " + round.getRoundNumber());
        }

        HistoryProvider history = new TournamentHistory(allocationRepository, tournamentId, round.getRoundNumber());
        AdjustmentResult.AdjustedAllocation adjusted = applyTable(
                allocation,
                round,
                table,
                history,
                AllocationAuditAction.REASSIGNED,
                OffsetDateTime.now()
        );
        flushEdits(roundId);

        log.info("Reassigned allocation {} in round {} from table {} to table {} with {} conflict(s)",
                allocationId, round.getRoundNumber(), adjusted.previousTableNumber(), adjusted.tableNumber(),
                adjusted.conflicts().size());
        return new AdjustmentResult(List.of(adjusted));
    }

    @Transactional
    public AdjustmentResult swap(Long allocationId1, Long allocationId2) {
        if (allocationId1.equals(allocationId2)) {
            throw AllocationRequestException.selfSwap("Cannot swap allocation " + allocationId1 + " with itself");
        }

        Long roundId1 = requireRoundId(allocationId1);
        Long roundId2 = requireRoundId(allocationId2);
        if (!roundId1.equals(roundId2)) {
            throw AllocationRequestException.crossRoundSwap(
                    "Allocations " + allocationId1 + " and " + allocationId2 + " belong to different rounds");
        }

        Round round = lockRound(roundId1);
        Allocation first = lockAllocation(Math.min(allocationId1, allocationId2));
        Allocation second = lockAllocation(Math.max(allocationId1, allocationId2));
        if (!first.getId().equals(allocationId1)) {
            Allocation swapped = first;
            first = second;
            second = swapped;
        }

        if (first.isBye() || second.isBye()) {
            throw AllocationRequestException.byeHasNoTable("Bye allocations hold no table and cannot be swapped");
        }

        GameTable firstTable = first.getTable();
        GameTable secondTable = second.getTable();
        HistoryProvider history = new TournamentHistory(
                allocationRepository,
                round.getTournament().getId(),
                round.getRoundNumber()
        );
        OffsetDateTime now = OffsetDateTime.now();

        AdjustmentResult.AdjustedAllocation adjustedFirst =
                applyTable(first, round, secondTable, history, AllocationAuditAction.SWAPPED, now);
        AdjustmentResult.AdjustedAllocation adjustedSecond =
                applyTable(second, round, firstTable, history, AllocationAuditAction.SWAPPED, now);
        flushEdits(roundId1);

        log.info("Swapped tables {} and {} between allocations {} and {} in round {}",
                adjustedFirst.previousTableNumber(), adjustedSecond.previousTableNumber(),
                allocationId1, allocationId2, round.getRoundNumber());
        return new AdjustmentResult(List.of(adjustedFirst, adjustedSecond));
    }

    private AdjustmentResult.AdjustedAllocation applyTable(
            Allocation allocation,
            Round round,
            GameTable table,
            HistoryProvider history,
            AllocationAuditAction action,
            OffsetDateTime now
    ) {
        Integer previousTableNumber = allocation.getTableNumber();
        Integer newTableNumber = table != null ? table.getTableNumber() : null;
        String editReason = describeEdit(action, previousTableNumber, newTableNumber);

        AuditRecord audit;
        if (table == null) {
            audit = new AuditRecord(
                    now,
                    0,
                    CostBreakdown.zero(),
                    List.of(editReason),
                    Map.of(),
                    round.isRoundOne(),
                    false,
                    List.of(AllocationConflict.noTableAvailable(
                            "No available tables for pairing " + describePairing(allocation)))
            );
        } else {
            TableOption option = table.toTableOption();
            ReuseAssessment reuse = costCalculator.assessReuse(competitorsOf(allocation), option, history);
            CostBreakdown breakdown = CostBreakdown.edited(
                    reuse.tableReuseCost(),
                    reuse.terrainReuseCost(),
                    costCalculator.suggestionMismatchCost(allocation.getSuggestedTableNumber(), option.tableNumber())
            );

            List<String> reasons = new ArrayList<>();
            reasons.add(editReason);
            reasons.addAll(reuse.reasons());
            audit = new AuditRecord(
                    now,
                    breakdown.total(),
                    breakdown,
                    reasons,
                    Map.of(),
                    round.isRoundOne(),
                    false,
                    reuse.conflicts()
            );
        }

        allocation.setTable(table);
        allocation.setAllocationReason(AuditRecordJsonCodec.toJson(audit));
        allocation.setUpdatedAt(now);

        AllocationAuditEntry entry = new AllocationAuditEntry();
        entry.setAllocationId(allocation.getId());
        entry.setRoundId(round.getId());
        entry.setAction(action);
        entry.setReasonJson(AuditRecordJsonCodec.toJson(audit));
        entry.setRecordedAt(now);
        allocationAuditEntryRepository.save(entry);

        if (!audit.conflicts().isEmpty()) {
            log.warn("Allocation {} now has {} conflict(s) at table {}",
                    allocation.getId(), audit.conflicts().size(), newTableNumber);
        }
        return new AdjustmentResult.AdjustedAllocation(allocation.getId(), previousTableNumber, newTableNumber, audit);
    }

    private void flushEdits(Long roundId) {
        try {
            allocationRepository.flush();
        } catch (ObjectOptimisticLockingFailureException | DataIntegrityViolationException ex) {
            log.warn("Concurrent edit detected in round {}: {}", roundId, ex.getMessage());
            throw AllocationRequestException.concurrentModification(
                    "Allocations in this round were modified concurrently; reload and retry");
        }
    }

    private Long requireRoundId(Long allocationId) {
        return allocationRepository.findRoundIdById(allocationId)
                .orElseThrow(() -> AllocationRequestException.notFound("Allocation " + allocationId + " not found"));
    }

    private Round lockRound(Long roundId) {
        return roundRepository.findByIdForUpdate(roundId)
                .orElseThrow(() -> AllocationRequestException.notFound("Round " + roundId + " not found"));
    }

    private Allocation lockAllocation(Long allocationId) {
        return allocationRepository.findByIdForUpdate(allocationId)
                .orElseThrow(() -> AllocationRequestException.notFound("Allocation " + allocationId + " not found"));
    }

    private static List<CompetitorSnapshot> competitorsOf(Allocation allocation) {
        List<CompetitorSnapshot> competitors = new ArrayList<>(2);
        competitors.add(snapshot(allocation.getPlayer1(), allocation.getPlayer1Score()));
        if (!allocation.isBye()) {
            competitors.add(snapshot(allocation.getPlayer2(), allocation.getPlayer2Score()));
        }
        return competitors;
    }

    private static CompetitorSnapshot snapshot(Player player, Integer score) {
        return new CompetitorSnapshot(player.getExternalPlayerId(), player.getName(), score != null ? score : 0);
    }

    private static String describePairing(Allocation allocation) {
        return allocation.getPlayer1().getName() + " vs " + allocation.getPlayer2().getName();
    }

    private static String describeEdit(AllocationAuditAction action, Integer from, Integer to) {
        String verb = action == AllocationAuditAction.SWAPPED ? "Swapped" : "Manually reassigned";
        return verb + " from " + describeTable(from) + " to " + describeTable(to);
    }

    private static String describeTable(Integer tableNumber) {
        return tableNumber != null ? "table " + tableNumber : "no table";
    }
}
