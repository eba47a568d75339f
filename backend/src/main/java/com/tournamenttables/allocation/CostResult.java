package com.tournamenttables.allocation;

import java.util.List;

public record CostResult(
        int totalCost,
        CostBreakdown breakdown,
        List<String> reasons,
        List<AllocationConflict> conflicts
) {
    public CostResult {
        reasons = List.copyOf(reasons);
        conflicts = List.copyOf(conflicts);
    }
}
