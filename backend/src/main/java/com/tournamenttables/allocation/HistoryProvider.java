package com.tournamenttables.allocation;

import java.util.Set;

/**
 * Answers what a competitor has already played, in rounds strictly before the round being
 * generated, within one tournament.
 */
public interface HistoryProvider {

    /**
     * Table numbers the competitor was seated at in earlier rounds. Empty for round 1.
     */
    Set<Integer> usedTables(String competitorId);

    /**
     * Terrain type ids the competitor has played on in earlier rounds. Empty for round 1.
     */
    Set<Long> usedTerrains(String competitorId);

    default boolean hasUsedTable(String competitorId, int tableNumber) {
        return usedTables(competitorId).contains(tableNumber);
    }

    default boolean hasExperiencedTerrain(String competitorId, Long terrainTypeId) {
        return terrainTypeId != null && usedTerrains(competitorId).contains(terrainTypeId);
    }
}
