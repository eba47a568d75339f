package com.tournamenttables.allocation;

/**
 * Per-tier cost contributions.
 *
 * <p>Greedy generation fills {@code tableNumber}; round-1 pass-through, byes and manual edits
 * fill {@code bcpMismatch} instead. Exactly one of the two is non-null.
 */
public record CostBreakdown(
        int tableReuse,
        int terrainReuse,
        Integer tableNumber,
        Integer bcpMismatch
) {
    public CostBreakdown {
        if ((tableNumber == null) == (bcpMismatch == null)) {
            throw new IllegalArgumentException("Exactly one of tableNumber and bcpMismatch must be set");
        }
    }

    public static CostBreakdown generated(int tableReuse, int terrainReuse, int tableNumber) {
        return new CostBreakdown(tableReuse, terrainReuse, tableNumber, null);
    }

    public static CostBreakdown edited(int tableReuse, int terrainReuse, int bcpMismatch) {
        return new CostBreakdown(tableReuse, terrainReuse, null, bcpMismatch);
    }

    public static CostBreakdown zero() {
        return edited(0, 0, 0);
    }

    public int total() {
        int total = tableReuse + terrainReuse;
        if (tableNumber != null) {
            total += tableNumber;
        }
        if (bcpMismatch != null) {
            total += bcpMismatch;
        }
        return total;
    }
}
