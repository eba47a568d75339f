package com.tournamenttables.allocation;

public enum ConflictType {
    TABLE_REUSE,
    TERRAIN_REUSE,
    NO_TABLE_AVAILABLE
}
