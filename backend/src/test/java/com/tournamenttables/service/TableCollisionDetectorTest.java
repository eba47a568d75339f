package com.tournamenttables.service;

import com.tournamenttables.model.GameTable;
import com.tournamenttables.model.Player;
import com.tournamenttables.model.Round;
import com.tournamenttables.model.Tournament;
import com.tournamenttables.repository.AllocationRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TableCollisionDetectorTest {

    @Mock
    private AllocationRepository allocationRepository;

    @InjectMocks
    private TableCollisionDetector tableCollisionDetector;

    @Test
    void findCollisionsSkipsLoadingWhenNoTableIsShared() {
        when(allocationRepository.findCollidingTableNumbers(10L)).thenReturn(List.of());

        assertTrue(tableCollisionDetector.findCollisions(10L).isEmpty());
        assertFalse(tableCollisionDetector.hasCollisions(10L));
        verify(allocationRepository, never()).findByRoundIdOrderByTableNumber(10L);
    }

    @Test
    void findCollisionsGroupsAllocationsByTable() {
        Tournament tournament = AllocationFixtures.tournament(1L, 2);
        Round round = AllocationFixtures.round(10L, tournament, 2);
        GameTable table1 = AllocationFixtures.table(101L, tournament, 1, null);
        GameTable table2 = AllocationFixtures.table(102L, tournament, 2, null);
        Player a = AllocationFixtures.player(1L, tournament, "a", "A", 0);
        Player b = AllocationFixtures.player(2L, tournament, "b", "B", 0);

        when(allocationRepository.findCollidingTableNumbers(10L)).thenReturn(List.of(1));
        when(allocationRepository.findByRoundIdOrderByTableNumber(10L)).thenReturn(List.of(
                AllocationFixtures.allocation(500L, round, table1, a, b),
                AllocationFixtures.allocation(501L, round, table1, b, a),
                AllocationFixtures.allocation(502L, round, table2, a, b),
                AllocationFixtures.allocation(503L, round, null, b, null)
        ));

        List<TableCollisionDetector.TableCollision> collisions = tableCollisionDetector.findCollisions(10L);

        assertEquals(1, collisions.size());
        assertEquals(1, collisions.get(0).tableNumber());
        assertEquals(List.of(500L, 501L), collisions.get(0).allocationIds());
    }
}
