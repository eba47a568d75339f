package com.tournamenttables.allocation;

import com.tournamenttables.repository.AllocationRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TournamentHistoryTest {

    @Mock
    private AllocationRepository allocationRepository;

    @Test
    void roundOneHasNoHistoryAndNeverQueries() {
        TournamentHistory history = new TournamentHistory(allocationRepository, 7L, 1);

        assertTrue(history.usedTables("p1").isEmpty());
        assertTrue(history.usedTerrains("p1").isEmpty());
        assertFalse(history.hasUsedTable("p1", 1));
        verifyNoInteractions(allocationRepository);
    }

    @Test
    void lookupsAreScopedToEarlierRoundsAndCachedPerCompetitor() {
        when(allocationRepository.findUsedTableNumbers(7L, 3, "p1")).thenReturn(Set.of(2, 5));
        when(allocationRepository.findExperiencedTerrainTypeIds(7L, 3, "p1")).thenReturn(Set.of(4L));
        TournamentHistory history = new TournamentHistory(allocationRepository, 7L, 3);

        assertEquals(Set.of(2, 5), history.usedTables("p1"));
        assertTrue(history.hasUsedTable("p1", 5));
        assertTrue(history.hasExperiencedTerrain("p1", 4L));
        assertFalse(history.hasExperiencedTerrain("p1", null));
        assertEquals(Set.of(4L), history.usedTerrains("p1"));

        verify(allocationRepository, times(1)).findUsedTableNumbers(7L, 3, "p1");
        verify(allocationRepository, times(1)).findExperiencedTerrainTypeIds(7L, 3, "p1");
    }

    @Test
    void clearCacheForcesFreshLookup() {
        when(allocationRepository.findUsedTableNumbers(7L, 2, "p1")).thenReturn(Set.of(1));
        TournamentHistory history = new TournamentHistory(allocationRepository, 7L, 2);

        history.usedTables("p1");
        history.clearCache();
        history.usedTables("p1");

        verify(allocationRepository, times(2)).findUsedTableNumbers(7L, 2, "p1");
    }
}
