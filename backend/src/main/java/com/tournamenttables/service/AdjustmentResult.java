package com.tournamenttables.service;

import com.tournamenttables.allocation.AllocationConflict;
import com.tournamenttables.allocation.AuditRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a manual reassign (one allocation) or swap (two allocations).
 */
public record AdjustmentResult(
        List<AdjustedAllocation> allocations
) {
    public AdjustmentResult {
        allocations = List.copyOf(allocations);
    }

    public List<AllocationConflict> conflicts() {
        List<AllocationConflict> conflicts = new ArrayList<>();
        for (AdjustedAllocation allocation : allocations) {
            conflicts.addAll(allocation.conflicts());
        }
        return conflicts;
    }

    /**
     * @param previousTableNumber table before the edit, null if the allocation had none
     * @param tableNumber         table after the edit, null if the allocation was left without one
     */
    public record AdjustedAllocation(
            Long allocationId,
            Integer previousTableNumber,
            Integer tableNumber,
            AuditRecord audit
    ) {
        public List<AllocationConflict> conflicts() {
            return audit.conflicts();
        }
    }
}
