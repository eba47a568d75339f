package com.tournamenttables.allocation;

import java.util.List;

public record AllocationResult(
        List<AllocationDecision> decisions,
        List<AllocationConflict> conflicts,
        String summary
) {
    public AllocationResult {
        decisions = List.copyOf(decisions);
        conflicts = List.copyOf(conflicts);
    }

    public long countConflicts(ConflictType type) {
        return conflicts.stream().filter(conflict -> conflict.type() == type).count();
    }
}
