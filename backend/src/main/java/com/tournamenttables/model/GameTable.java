package com.tournamenttables.model;

import com.tournamenttables.allocation.TableOption;
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

/**
 * A physical table at the venue. Numbers are unique within a tournament and stable across rounds.
 */
@Getter
@Setter
@Entity
@Table(name = "tables")
public class GameTable {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "tournament_id", nullable = false, updatable = false)
    private Tournament tournament;

    @Column(name = "table_number", nullable = false, updatable = false)
    private Integer tableNumber;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "terrain_type_id")
    private TerrainType terrainType;

    public TableOption toTableOption() {
        if (terrainType == null) {
            return TableOption.withoutTerrain(tableNumber);
        }
        return new TableOption(tableNumber, terrainType.getId(), terrainType.getName());
    }
}
