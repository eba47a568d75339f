package com.tournamenttables.allocation;

import com.tournamenttables.repository.AllocationRepository;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Database-backed history for one tournament as seen from one round.
 *
 * <p>Only rounds strictly before {@code currentRound} count. Lookups are cached per competitor for
 * the life of the instance, so create a new instance for every generation or edit; the cache is
 * never shared between calls.
 */
public class TournamentHistory implements HistoryProvider {

    private final AllocationRepository allocationRepository;
    private final Long tournamentId;
    private final int currentRound;

    private final Map<String, Set<Integer>> tableCache = new HashMap<>();
    private final Map<String, Set<Long>> terrainCache = new HashMap<>();

    public TournamentHistory(AllocationRepository allocationRepository, Long tournamentId, int currentRound) {
        if (tournamentId == null) {
            throw new IllegalArgumentException("Tournament id is required");
        }
        this.allocationRepository = allocationRepository;
        this.tournamentId = tournamentId;
        this.currentRound = currentRound;
    }

    @Override
    public Set<Integer> usedTables(String competitorId) {
        if (currentRound <= 1) {
            return Set.of();
        }
        return tableCache.computeIfAbsent(competitorId, id -> Collections.unmodifiableSet(
                allocationRepository.findUsedTableNumbers(tournamentId, currentRound, id)));
    }

    @Override
    public Set<Long> usedTerrains(String competitorId) {
        if (currentRound <= 1) {
            return Set.of();
        }
        return terrainCache.computeIfAbsent(competitorId, id -> Collections.unmodifiableSet(
                allocationRepository.findExperiencedTerrainTypeIds(tournamentId, currentRound, id)));
    }

    public void clearCache() {
        tableCache.clear();
        terrainCache.clear();
    }

    public Long getTournamentId() {
        return tournamentId;
    }

    public int getCurrentRound() {
        return currentRound;
    }
}
