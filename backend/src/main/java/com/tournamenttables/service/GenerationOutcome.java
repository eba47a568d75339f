package com.tournamenttables.service;

import com.tournamenttables.allocation.AllocationResult;
import com.tournamenttables.model.Allocation;
import com.tournamenttables.model.Round;

import java.util.List;

/**
 * Persisted allocations of a freshly generated round, in the order the engine produced them.
 */
public record GenerationOutcome(
        Round round,
        List<Allocation> allocations,
        AllocationResult result
) {
    public GenerationOutcome {
        allocations = List.copyOf(allocations);
    }
}
