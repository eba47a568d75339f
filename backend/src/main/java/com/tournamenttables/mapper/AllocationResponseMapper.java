package com.tournamenttables.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.tournamenttables.allocation.AllocationConflict;
import com.tournamenttables.allocation.Pairing;
import com.tournamenttables.controller.dto.AllocationRequests;
import com.tournamenttables.controller.dto.AllocationResponses;
import com.tournamenttables.controller.dto.TournamentResponses;
import com.tournamenttables.model.Allocation;
import com.tournamenttables.model.AuditRecordJsonCodec;
import com.tournamenttables.model.GameTable;
import com.tournamenttables.model.Player;
import com.tournamenttables.model.Round;
import com.tournamenttables.model.TerrainType;
import com.tournamenttables.model.Tournament;
import com.tournamenttables.service.AdjustmentResult;
import com.tournamenttables.service.GenerationOutcome;
import com.tournamenttables.service.TableCollisionDetector;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

@Component
public class AllocationResponseMapper {

    public List<Pairing> toPairings(List<AllocationRequests.PairingRequest> requests) {
        if (requests == null) {
            return null;
        }
        return requests.stream()
                .map(this::toPairing)
                .toList();
    }

    public Pairing toPairing(AllocationRequests.PairingRequest request) {
        return new Pairing(
                request.competitorAId().trim(),
                request.competitorAName().trim(),
                request.competitorAScore(),
                request.competitorATotalScore(),
                request.competitorBId() != null ? request.competitorBId().trim() : null,
                request.competitorBName() != null ? request.competitorBName().trim() : null,
                request.competitorBScore(),
                request.competitorBTotalScore(),
                request.suggestedTableNumber()
        );
    }

    public AllocationResponses.GenerationResponse toGenerationResponse(Long tournamentId, GenerationOutcome outcome) {
        return new AllocationResponses.GenerationResponse(
                tournamentId,
                outcome.round().getRoundNumber(),
                toAllocationViews(outcome.allocations()),
                toConflictViews(outcome.result().conflicts()),
                outcome.result().summary()
        );
    }

    public AllocationResponses.RoundView toRoundView(
            Long tournamentId,
            Round round,
            Collection<Allocation> allocations,
            List<TableCollisionDetector.TableCollision> collisions
    ) {
        List<AllocationResponses.AllocationView> allocationViews = toAllocationViews(allocations);
        List<AllocationResponses.ConflictView> conflicts = new ArrayList<>();
        allocationViews.forEach(view -> conflicts.addAll(view.conflicts()));

        return new AllocationResponses.RoundView(
                tournamentId,
                round.getRoundNumber(),
                Boolean.TRUE.equals(round.getIsPublished()),
                allocationViews,
                conflicts,
                collisions.stream()
                        .map(collision -> new AllocationResponses.TableCollisionView(
                                collision.tableNumber(),
                                collision.allocationIds()
                        ))
                        .toList()
        );
    }

    public List<AllocationResponses.AllocationView> toAllocationViews(Collection<Allocation> allocations) {
        return allocations.stream()
                .map(this::toAllocationView)
                .toList();
    }

    public AllocationResponses.AllocationView toAllocationView(Allocation allocation) {
        GameTable table = allocation.getTable();
        TerrainType terrainType = table != null ? table.getTerrainType() : null;
        return new AllocationResponses.AllocationView(
                allocation.getId(),
                allocation.getTableNumber(),
                terrainType != null ? terrainType.getName() : null,
                toCompetitorView(allocation.getPlayer1(), allocation.getPlayer1Score()),
                allocation.isBye() ? null : toCompetitorView(allocation.getPlayer2(), allocation.getPlayer2Score()),
                allocation.getSuggestedTableNumber(),
                allocation.isBye(),
                allocation.getAllocationReason(),
                conflictsOf(allocation.getAllocationReason())
        );
    }

    public AllocationResponses.AdjustmentResponse toAdjustmentResponse(AdjustmentResult result) {
        return new AllocationResponses.AdjustmentResponse(
                result.allocations().stream()
                        .map(adjusted -> new AllocationResponses.AdjustedAllocationView(
                                adjusted.allocationId(),
                                adjusted.previousTableNumber(),
                                adjusted.tableNumber(),
                                AuditRecordJsonCodec.toJson(adjusted.audit()),
                                toConflictViews(adjusted.conflicts())
                        ))
                        .toList(),
                toConflictViews(result.conflicts())
        );
    }

    public List<AllocationResponses.ConflictView> toConflictViews(Collection<AllocationConflict> conflicts) {
        return conflicts.stream()
                .map(conflict -> new AllocationResponses.ConflictView(
                        conflict.type().name(),
                        conflict.message(),
                        conflict.competitorId()
                ))
                .toList();
    }

    public TournamentResponses.TournamentDetail toTournamentDetail(Tournament tournament, Collection<GameTable> tables) {
        return new TournamentResponses.TournamentDetail(
                tournament.getId(),
                tournament.getName(),
                tournament.getTableCount(),
                tables.stream()
                        .map(this::toTableSummary)
                        .toList(),
                tournament.getCreatedAt(),
                tournament.getUpdatedAt()
        );
    }

    public TournamentResponses.TableSummary toTableSummary(GameTable table) {
        TerrainType terrainType = table.getTerrainType();
        return new TournamentResponses.TableSummary(
                table.getTableNumber(),
                terrainType != null ? terrainType.getId() : null,
                terrainType != null ? terrainType.getName() : null
        );
    }

    public TournamentResponses.TerrainTypeSummary toTerrainTypeSummary(TerrainType terrainType) {
        return new TournamentResponses.TerrainTypeSummary(
                terrainType.getId(),
                terrainType.getName(),
                terrainType.getDescription(),
                terrainType.getEmoji(),
                terrainType.getSortOrder()
        );
    }

    private AllocationResponses.CompetitorView toCompetitorView(Player player, Integer score) {
        return new AllocationResponses.CompetitorView(
                player.getExternalPlayerId(),
                player.getName(),
                score,
                player.getTotalScore()
        );
    }

    private List<AllocationResponses.ConflictView> conflictsOf(JsonNode allocationReason) {
        if (allocationReason == null || allocationReason.isNull()) {
            return List.of();
        }
        return toConflictViews(AuditRecordJsonCodec.fromJson(allocationReason).conflicts());
    }
}
