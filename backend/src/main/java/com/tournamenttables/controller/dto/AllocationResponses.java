package com.tournamenttables.controller.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public final class AllocationResponses {

    private AllocationResponses() {
    }

    public record CompetitorView(
            String competitorId,
            String name,
            Integer score,
            Integer totalScore
    ) {
    }

    public record ConflictView(
            String type,
            String message,
            String competitorId
    ) {
    }

    public record AllocationView(
            Long allocationId,
            Integer tableNumber,
            String terrainTypeName,
            CompetitorView competitorA,
            CompetitorView competitorB,
            Integer suggestedTableNumber,
            boolean bye,
            JsonNode reason,
            List<ConflictView> conflicts
    ) {
    }

    public record GenerationResponse(
            Long tournamentId,
            Integer roundNumber,
            List<AllocationView> allocations,
            List<ConflictView> conflicts,
            String summary
    ) {
    }

    public record TableCollisionView(
            Integer tableNumber,
            List<Long> allocationIds
    ) {
    }

    public record RoundView(
            Long tournamentId,
            Integer roundNumber,
            boolean published,
            List<AllocationView> allocations,
            List<ConflictView> conflicts,
            List<TableCollisionView> collisions
    ) {
    }

    public record AdjustedAllocationView(
            Long allocationId,
            Integer previousTableNumber,
            Integer tableNumber,
            JsonNode reason,
            List<ConflictView> conflicts
    ) {
    }

    public record AdjustmentResponse(
            List<AdjustedAllocationView> allocations,
            List<ConflictView> conflicts
    ) {
    }
}
