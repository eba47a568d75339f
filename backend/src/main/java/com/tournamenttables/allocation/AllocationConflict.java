package com.tournamenttables.allocation;

import java.util.Objects;

/**
 * Soft, reported violation of a seating preference. Never blocks generation.
 *
 * @param competitorId competitor that triggered the conflict, null for {@link ConflictType#NO_TABLE_AVAILABLE}
 */
public record AllocationConflict(
        ConflictType type,
        String message,
        String competitorId
) {
    public AllocationConflict {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(message, "message");
    }

    public static AllocationConflict tableReuse(String competitorId, String message) {
        return new AllocationConflict(ConflictType.TABLE_REUSE, message, competitorId);
    }

    public static AllocationConflict terrainReuse(String competitorId, String message) {
        return new AllocationConflict(ConflictType.TERRAIN_REUSE, message, competitorId);
    }

    public static AllocationConflict noTableAvailable(String message) {
        return new AllocationConflict(ConflictType.NO_TABLE_AVAILABLE, message, null);
    }
}
