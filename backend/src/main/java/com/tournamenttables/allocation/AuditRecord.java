package com.tournamenttables.allocation;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable rationale attached to every allocation write. A later edit produces a new record;
 * this one is never mutated.
 *
 * @param alternativesConsidered cost of every other table that was free at decision time,
 *                               keyed by table number in ascending order
 */
public record AuditRecord(
        OffsetDateTime timestamp,
        int totalCost,
        CostBreakdown costBreakdown,
        List<String> reasons,
        Map<Integer, Integer> alternativesConsidered,
        boolean round1,
        boolean bye,
        List<AllocationConflict> conflicts
) {
    public AuditRecord {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(costBreakdown, "costBreakdown");
        reasons = List.copyOf(reasons);
        alternativesConsidered = Collections.unmodifiableMap(new TreeMap<>(alternativesConsidered));
        conflicts = List.copyOf(conflicts);
    }
}
