package com.tournamenttables.model;

public enum AllocationAuditAction {
    GENERATED,
    REASSIGNED,
    SWAPPED
}
