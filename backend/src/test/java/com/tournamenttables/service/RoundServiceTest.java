package com.tournamenttables.service;

import com.tournamenttables.allocation.AllocationConflict;
import com.tournamenttables.allocation.AuditRecord;
import com.tournamenttables.allocation.CostBreakdown;
import com.tournamenttables.controller.dto.AllocationResponses;
import com.tournamenttables.mapper.AllocationResponseMapper;
import com.tournamenttables.model.Allocation;
import com.tournamenttables.model.AuditRecordJsonCodec;
import com.tournamenttables.model.GameTable;
import com.tournamenttables.model.Player;
import com.tournamenttables.model.Round;
import com.tournamenttables.model.Tournament;
import com.tournamenttables.repository.AllocationRepository;
import com.tournamenttables.repository.RoundRepository;
import com.tournamenttables.web.AllocationRequestException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RoundServiceTest {

    @Mock
    private RoundRepository roundRepository;

    @Mock
    private AllocationRepository allocationRepository;

    private RoundService roundService;
    private Tournament tournament;
    private Round round;

    @BeforeEach
    void setUp() {
        roundService = new RoundService(
                roundRepository,
                allocationRepository,
                new TableCollisionDetector(allocationRepository),
                new AllocationResponseMapper()
        );
        tournament = AllocationFixtures.tournament(1L, 2);
        round = AllocationFixtures.round(10L, tournament, 2);
        round.setIsPublished(false);
    }

    @Test
    void getRoundAggregatesConflictsAndCollisions() {
        GameTable table1 = AllocationFixtures.table(101L, tournament, 1, null);
        Player alice = AllocationFixtures.player(1L, tournament, "alice", "Alice", 6);
        Player bob = AllocationFixtures.player(2L, tournament, "bob", "Bob", 3);
        Player carol = AllocationFixtures.player(3L, tournament, "carol", "Carol", 4);
        Player dan = AllocationFixtures.player(4L, tournament, "dan", "Dan", 1);

        Allocation first = AllocationFixtures.allocation(500L, round, table1, alice, bob);
        first.setAllocationReason(AuditRecordJsonCodec.toJson(new AuditRecord(
                OffsetDateTime.parse("2026-03-14T10:00:00Z"),
                100_001,
                CostBreakdown.generated(100_000, 0, 1),
                List.of("Table 1 previously used by Alice (alice)"),
                Map.of(),
                false,
                false,
                List.of(AllocationConflict.tableReuse("alice", "Alice (alice) already played on table 1"))
        )));
        Allocation second = AllocationFixtures.allocation(501L, round, table1, carol, dan);

        when(roundRepository.findByTournamentIdAndRoundNumber(1L, 2)).thenReturn(Optional.of(round));
        when(allocationRepository.findByRoundIdOrderByTableNumber(10L)).thenReturn(List.of(first, second));

        AllocationResponses.RoundView view = roundService.getRound(1L, 2);

        assertFalse(view.published());
        assertEquals(2, view.allocations().size());
        assertEquals(1, view.conflicts().size());
        assertEquals("TABLE_REUSE", view.conflicts().get(0).type());
        assertEquals(1, view.collisions().size());
        assertEquals(List.of(500L, 501L), view.collisions().get(0).allocationIds());
    }

    @Test
    void publishMarksRoundOnlyOnce() {
        when(roundRepository.findByTournamentIdAndRoundNumberForUpdate(1L, 2)).thenReturn(Optional.of(round));
        when(allocationRepository.findByRoundIdOrderByTableNumber(10L)).thenReturn(List.of());

        assertTrue(roundService.publish(1L, 2).published());
        verify(roundRepository).save(round);

        assertTrue(roundService.publish(1L, 2).published());
        verify(roundRepository).save(round);
    }

    @Test
    void publishUnknownRoundIsNotFound() {
        when(roundRepository.findByTournamentIdAndRoundNumberForUpdate(1L, 5)).thenReturn(Optional.empty());

        AllocationRequestException ex = assertThrows(
                AllocationRequestException.class,
                () -> roundService.publish(1L, 5)
        );

        assertEquals("not_found", ex.getCode());
        verify(roundRepository, never()).save(round);
    }
}
