package com.tournamenttables.controller;

import com.tournamenttables.allocation.AllocationResult;
import com.tournamenttables.allocation.AuditRecord;
import com.tournamenttables.allocation.CostBreakdown;
import com.tournamenttables.allocation.InsufficientTablesException;
import com.tournamenttables.allocation.Pairing;
import com.tournamenttables.controller.dto.AllocationResponses;
import com.tournamenttables.mapper.AllocationResponseMapper;
import com.tournamenttables.model.Allocation;
import com.tournamenttables.model.AuditRecordJsonCodec;
import com.tournamenttables.model.GameTable;
import com.tournamenttables.model.Player;
import com.tournamenttables.model.Round;
import com.tournamenttables.service.AllocationGenerationService;
import com.tournamenttables.service.GenerationOutcome;
import com.tournamenttables.service.RoundService;
import com.tournamenttables.web.AllocationRequestException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RoundController.class)
@Import(AllocationResponseMapper.class)
class RoundControllerTest {

    private static final OffsetDateTime GENERATED_AT = OffsetDateTime.parse("2026-03-14T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AllocationGenerationService allocationGenerationService;

    @MockitoBean
    private RoundService roundService;

    @Test
    void generate_passesPairingsAndReturnsAllocations() throws Exception {
        when(allocationGenerationService.generate(eq(7L), eq(2), anyList())).thenReturn(outcome());

        mockMvc.perform(post("/api/tournaments/{tournamentId}/rounds/{roundNumber}/generate", 7L, 2)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "pairings": [
                                    {
                                      "competitorAId": " alice ",
                                      "competitorAName": "Alice",
                                      "competitorAScore": 1,
                                      "competitorATotalScore": 6,
                                      "competitorBId": "bob",
                                      "competitorBName": "Bob",
                                      "competitorBScore": 2,
                                      "competitorBTotalScore": 3,
                                      "suggestedTableNumber": 1
                                    },
                                    {
                                      "competitorAId": "eve",
                                      "competitorAName": "Eve",
                                      "competitorAScore": 0
                                    }
                                  ]
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tournamentId").value(7))
                .andExpect(jsonPath("$.roundNumber").value(2))
                .andExpect(jsonPath("$.summary").value("All allocations optimal - no constraint violations."))
                .andExpect(jsonPath("$.allocations[0].tableNumber").value(2))
                .andExpect(jsonPath("$.allocations[0].competitorA.competitorId").value("alice"))
                .andExpect(jsonPath("$.allocations[0].competitorB.competitorId").value("bob"))
                .andExpect(jsonPath("$.allocations[0].bye").value(false))
                .andExpect(jsonPath("$.allocations[0].reason.alternativesConsidered['1']").value(100001));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Pairing>> captor = ArgumentCaptor.forClass(List.class);
        verify(allocationGenerationService).generate(eq(7L), eq(2), captor.capture());
        List<Pairing> pairings = captor.getValue();
        assertEquals(2, pairings.size());
        assertEquals("alice", pairings.get(0).competitorAId());
        assertEquals(9, pairings.get(0).combinedTotalScore());
        assertTrue(pairings.get(1).isBye());
    }

    @Test
    void generate_withoutBodyRegeneratesStoredPairings() throws Exception {
        when(allocationGenerationService.generate(eq(7L), eq(2), isNull())).thenReturn(outcome());

        mockMvc.perform(post("/api/tournaments/{tournamentId}/rounds/{roundNumber}/generate", 7L, 2))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.allocations.length()").value(1));
    }

    @Test
    void generate_mapsInsufficientTablesToUnprocessableEntity() throws Exception {
        when(allocationGenerationService.generate(eq(7L), eq(2), isNull()))
                .thenThrow(new InsufficientTablesException(2, 3, 2));

        mockMvc.perform(post("/api/tournaments/{tournamentId}/rounds/{roundNumber}/generate", 7L, 2))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("insufficient_tables"));
    }

    @Test
    void generate_rejectsHalfFilledOpponent() throws Exception {
        mockMvc.perform(post("/api/tournaments/{tournamentId}/rounds/{roundNumber}/generate", 7L, 2)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "pairings": [
                                    {
                                      "competitorAId": "alice",
                                      "competitorAName": "Alice",
                                      "competitorAScore": 1,
                                      "competitorBId": "bob"
                                    }
                                  ]
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value(containsString("competitorBName and competitorBScore")));

        verifyNoInteractions(allocationGenerationService);
    }

    @Test
    void generate_rejectsSelfPairing() throws Exception {
        mockMvc.perform(post("/api/tournaments/{tournamentId}/rounds/{roundNumber}/generate", 7L, 2)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "pairings": [
                                    {
                                      "competitorAId": "alice",
                                      "competitorAName": "Alice",
                                      "competitorAScore": 1,
                                      "competitorBId": "alice",
                                      "competitorBName": "Alice",
                                      "competitorBScore": 1
                                    }
                                  ]
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Competitor cannot be paired with itself: alice"));

        verifyNoInteractions(allocationGenerationService);
    }

    @Test
    void getRound_returnsRoundView() throws Exception {
        when(roundService.getRound(7L, 2)).thenReturn(new AllocationResponses.RoundView(
                7L,
                2,
                false,
                List.of(),
                List.of(),
                List.of(new AllocationResponses.TableCollisionView(4, List.of(500L, 501L)))
        ));

        mockMvc.perform(get("/api/tournaments/{tournamentId}/rounds/{roundNumber}", 7L, 2))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.published").value(false))
                .andExpect(jsonPath("$.collisions[0].tableNumber").value(4))
                .andExpect(jsonPath("$.collisions[0].allocationIds[1]").value(501));
    }

    @Test
    void publish_returns404ForUnknownRound() throws Exception {
        when(roundService.publish(7L, 9))
                .thenThrow(AllocationRequestException.notFound("Round 9 of tournament 7 not found"));

        mockMvc.perform(post("/api/tournaments/{tournamentId}/rounds/{roundNumber}/publish", 7L, 9))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("not_found"));

        verify(roundService).publish(7L, 9);
    }

    private static GenerationOutcome outcome() {
        Round round = new Round();
        round.setId(10L);
        round.setRoundNumber(2);
        round.setIsPublished(false);

        GameTable table = new GameTable();
        table.setId(102L);
        table.setTableNumber(2);

        Player alice = player(1L, "alice", "Alice", 6);
        Player bob = player(2L, "bob", "Bob", 3);

        AuditRecord audit = new AuditRecord(
                GENERATED_AT,
                2,
                CostBreakdown.generated(0, 0, 2),
                List.of("Table 2 number preference adds 2"),
                Map.of(1, 100_001),
                false,
                false,
                List.of()
        );

        Allocation allocation = new Allocation();
        allocation.setId(500L);
        allocation.setRound(round);
        allocation.setTable(table);
        allocation.setPlayer1(alice);
        allocation.setPlayer2(bob);
        allocation.setPlayer1Score(1);
        allocation.setPlayer2Score(2);
        allocation.setSuggestedTableNumber(1);
        allocation.setAllocationReason(AuditRecordJsonCodec.toJson(audit));

        return new GenerationOutcome(
                round,
                List.of(allocation),
                new AllocationResult(List.of(), List.of(), "All allocations optimal - no constraint violations.")
        );
    }

    private static Player player(long id, String externalPlayerId, String name, int totalScore) {
        Player player = new Player();
        player.setId(id);
        player.setExternalPlayerId(externalPlayerId);
        player.setName(name);
        player.setTotalScore(totalScore);
        return player;
    }
}
