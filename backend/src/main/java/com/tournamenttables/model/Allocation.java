package com.tournamenttables.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;

/**
 * Durable seating of one pairing (or bye) for a round. Reassign and swap replace the table and
 * the reason in place; earlier reasons live on in {@link AllocationAuditEntry}.
 */
@Getter
@Setter
@Entity
@Table(name = "allocations")
public class Allocation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "round_id", nullable = false, updatable = false)
    private Round round;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "table_id")
    private GameTable table;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "player1_id", nullable = false, updatable = false)
    private Player player1;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "player2_id", updatable = false)
    private Player player2;

    @Column(name = "player1_score", nullable = false)
    private Integer player1Score = 0;

    @Column(name = "player2_score", nullable = false)
    private Integer player2Score = 0;

    @Column(name = "suggested_table_number")
    private Integer suggestedTableNumber;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "allocation_reason", columnDefinition = "jsonb")
    private JsonNode allocationReason;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    public boolean isBye() {
        return player2 == null;
    }

    public Integer getTableNumber() {
        return table != null ? table.getTableNumber() : null;
    }
}
