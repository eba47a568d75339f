package com.tournamenttables.controller.dto;

import java.time.OffsetDateTime;
import java.util.List;

public final class TournamentResponses {

    private TournamentResponses() {
    }

    public record TournamentDetail(
            Long tournamentId,
            String name,
            Integer tableCount,
            List<TableSummary> tables,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt
    ) {
    }

    public record TableSummary(
            Integer tableNumber,
            Long terrainTypeId,
            String terrainTypeName
    ) {
    }

    public record TerrainTypeSummary(
            Long terrainTypeId,
            String name,
            String description,
            String emoji,
            Integer sortOrder
    ) {
    }
}
