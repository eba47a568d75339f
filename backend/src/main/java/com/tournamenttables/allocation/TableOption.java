package com.tournamenttables.allocation;

/**
 * A physical table as seen by the allocation core.
 */
public record TableOption(
        int tableNumber,
        Long terrainTypeId,
        String terrainTypeName
) {
    public TableOption {
        if (tableNumber <= 0) {
            throw new IllegalArgumentException("Table number must be positive: " + tableNumber);
        }
    }

    public static TableOption withoutTerrain(int tableNumber) {
        return new TableOption(tableNumber, null, null);
    }

    public boolean hasTerrain() {
        return terrainTypeId != null;
    }

    String terrainLabel() {
        return terrainTypeName != null ? terrainTypeName : "terrain #" + terrainTypeId;
    }
}
