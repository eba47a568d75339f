package com.tournamenttables.allocation;

import java.util.List;

/**
 * History-only part of the cost model: table and terrain reuse for the competitors at one table.
 */
public record ReuseAssessment(
        int tableReuseCost,
        int terrainReuseCost,
        List<String> reasons,
        List<AllocationConflict> conflicts
) {
    public ReuseAssessment {
        reasons = List.copyOf(reasons);
        conflicts = List.copyOf(conflicts);
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
