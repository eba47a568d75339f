package com.tournamenttables.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Allocation cost weights and venue limits.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "tournament-tables")
public class AllocationProperties {

    private Allocation allocation = new Allocation();

    @Getter
    @Setter
    public static class Allocation {
        /**
         * Largest table count a tournament may be created with. Bounds the table-number tier.
         */
        private int maxTables = 500;

        private Weights weights = new Weights();
    }

    @Getter
    @Setter
    public static class Weights {
        private int tableReuse = 100_000;
        private int terrainReuse = 10_000;
        private int tableNumber = 1;
    }

    /**
     * Fails if a lower cost tier could outweigh a higher one for any table count up to
     * {@code maxTables}.
     */
    public void validateTierDominance() {
        int maxTables = allocation.getMaxTables();
        Weights weights = allocation.getWeights();
        if (maxTables <= 0) {
            throw new IllegalStateException("tournament-tables.allocation.max-tables must be positive");
        }
        if (weights.getTableReuse() <= 0 || weights.getTerrainReuse() <= 0 || weights.getTableNumber() <= 0) {
            throw new IllegalStateException("tournament-tables.allocation.weights must all be positive");
        }

        long maxTableNumberCost = (long) maxTables * weights.getTableNumber();
        long maxTerrainTierCost = 2L * weights.getTerrainReuse() + maxTableNumberCost;
        if ((long) weights.getTableReuse() < 10L * weights.getTerrainReuse()
                || weights.getTableReuse() <= maxTerrainTierCost) {
            throw new IllegalStateException(
                    "tournament-tables.allocation.weights.table-reuse must be at least 10x terrain-reuse and exceed "
                            + maxTerrainTierCost);
        }
        if (weights.getTerrainReuse() <= maxTableNumberCost) {
            throw new IllegalStateException(
                    "tournament-tables.allocation.weights.terrain-reuse must exceed " + maxTableNumberCost);
        }
    }
}
