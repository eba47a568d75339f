package com.tournamenttables.controller.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public final class TournamentRequests {

    private TournamentRequests() {
    }

    public record CreateTournamentRequest(
            @NotBlank(message = "name is required")
            @Size(max = 255, message = "name must be at most 255 characters")
            String name,

            @NotNull(message = "tableCount is required")
            @Min(value = 1, message = "tableCount must be at least 1")
            Integer tableCount
    ) {
    }

    /**
     * A null {@code terrainTypeId} clears the table's terrain.
     */
    public record SetTableTerrainRequest(
            Long terrainTypeId
    ) {
    }
}
