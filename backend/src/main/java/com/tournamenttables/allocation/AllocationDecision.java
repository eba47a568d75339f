package com.tournamenttables.allocation;

import java.util.List;
import java.util.Objects;

/**
 * Engine output for one pairing.
 *
 * @param tableNumber assigned table, null for byes and for round-1 pairings left without a table
 */
public record AllocationDecision(
        Integer tableNumber,
        String terrainName,
        CompetitorSnapshot competitorA,
        CompetitorSnapshot competitorB,
        Integer suggestedTableNumber,
        AuditRecord audit
) {
    public AllocationDecision {
        Objects.requireNonNull(competitorA, "competitorA");
        Objects.requireNonNull(audit, "audit");
        if (competitorB == null && tableNumber != null) {
            throw new IllegalArgumentException("A bye never receives a table");
        }
    }

    public boolean isBye() {
        return competitorB == null;
    }

    public List<AllocationConflict> conflicts() {
        return audit.conflicts();
    }
}
