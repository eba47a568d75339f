package com.tournamenttables.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;

/**
 * Append-only copy of every audit record written to an allocation. Rows are never updated and
 * survive regeneration of the round.
 */
@Getter
@Setter
@Entity
@Table(name = "allocation_audit_log")
public class AllocationAuditEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "allocation_id", nullable = false, updatable = false)
    private Long allocationId;

    @Column(name = "round_id", nullable = false, updatable = false)
    private Long roundId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, updatable = false, length = 32)
    private AllocationAuditAction action;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "reason_json", nullable = false, updatable = false, columnDefinition = "jsonb")
    private JsonNode reasonJson;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private OffsetDateTime recordedAt = OffsetDateTime.now();
}
