package com.tournamenttables.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(name = "players")
public class Player {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "tournament_id", nullable = false, updatable = false)
    private Tournament tournament;

    /**
     * Identifier assigned by the external pairing source; the competitor id used by the allocation core.
     */
    @Column(name = "external_player_id", nullable = false, updatable = false, length = 64)
    private String externalPlayerId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "total_score", nullable = false)
    private Integer totalScore = 0;
}
