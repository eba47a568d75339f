package com.tournamenttables.service;

import com.tournamenttables.allocation.AllocationDecision;
import com.tournamenttables.allocation.AllocationEngine;
import com.tournamenttables.allocation.AllocationResult;
import com.tournamenttables.allocation.CompetitorSnapshot;
import com.tournamenttables.allocation.Pairing;
import com.tournamenttables.allocation.TableOption;
import com.tournamenttables.allocation.TournamentHistory;
import com.tournamenttables.model.Allocation;
import com.tournamenttables.model.AllocationAuditAction;
import com.tournamenttables.model.AllocationAuditEntry;
import com.tournamenttables.model.AuditRecordJsonCodec;
import com.tournamenttables.model.GameTable;
import com.tournamenttables.model.Player;
import com.tournamenttables.model.Round;
import com.tournamenttables.model.Tournament;
import com.tournamenttables.repository.AllocationAuditEntryRepository;
import com.tournamenttables.repository.AllocationRepository;
import com.tournamenttables.repository.GameTableRepository;
import com.tournamenttables.repository.PlayerRepository;
import com.tournamenttables.repository.RoundRepository;
import com.tournamenttables.repository.TournamentRepository;
import com.tournamenttables.web.AllocationRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Generates and stores the allocations of one round.
 *
 * <p>Pairings are either supplied by the caller (first generation of a round) or rebuilt from the
 * round's current allocations, keeping each pairing's suggested table number. The round row is
 * locked for the whole run and the previous allocations are replaced in the same transaction, so
 * a failed run (for example too few tables) leaves the round untouched.
 */
@Service
public class AllocationGenerationService {

    private static final Logger log = LoggerFactory.getLogger(AllocationGenerationService.class);

    private final TournamentRepository tournamentRepository;
    private final RoundRepository roundRepository;
    private final GameTableRepository gameTableRepository;
    private final PlayerRepository playerRepository;
    private final AllocationRepository allocationRepository;
    private final AllocationAuditEntryRepository allocationAuditEntryRepository;
    private final AllocationEngine allocationEngine;

    public AllocationGenerationService(
            TournamentRepository tournamentRepository,
            RoundRepository roundRepository,
            GameTableRepository gameTableRepository,
            PlayerRepository playerRepository,
            AllocationRepository allocationRepository,
            AllocationAuditEntryRepository allocationAuditEntryRepository,
            AllocationEngine allocationEngine
    ) {
        this.tournamentRepository = tournamentRepository;
        this.roundRepository = roundRepository;
        this.gameTableRepository = gameTableRepository;
        this.playerRepository = playerRepository;
        this.allocationRepository = allocationRepository;
        this.allocationAuditEntryRepository = allocationAuditEntryRepository;
        this.allocationEngine = allocationEngine;
    }

    /**
     * @param suppliedPairings pairings for the round, or null to regenerate from the stored allocations
     */
    @Transactional
    public GenerationOutcome generate(Long tournamentId, int roundNumber, List<Pairing> suppliedPairings) {
        if (roundNumber < 1) {
            throw new IllegalArgumentException("Round number must be at least 1: " + roundNumber);
        }
        Tournament tournament = tournamentRepository.findById(tournamentId)
                .orElseThrow(() -> AllocationRequestException.notFound("Tournament " + tournamentId + " not found"));

        Round round = suppliedPairings != null
                ? lockOrCreateRound(tournament, roundNumber)
                : roundRepository.findByTournamentIdAndRoundNumberForUpdate(tournamentId, roundNumber)
                .orElseThrow(() -> AllocationRequestException.notFound(
                        "Round " + roundNumber + " of tournament " + tournamentId + " not found"));

        List<Allocation> existing = allocationRepository.findByRoundIdOrderByTableNumber(round.getId());
        List<Pairing> pairings;
        if (suppliedPairings != null) {
            upsertPlayers(tournament, suppliedPairings);
            pairings = suppliedPairings;
        } else {
            pairings = reconstructPairings(existing);
        }

        List<GameTable> tables = gameTableRepository.findByTournamentIdOrderByTableNumberAsc(tournamentId);
        List<TableOption> tableOptions = new ArrayList<>(tables.size());
        Map<Integer, GameTable> tablesByNumber = new HashMap<>();
        for (GameTable table : tables) {
            tableOptions.add(table.toTableOption());
            tablesByNumber.put(table.getTableNumber(), table);
        }

        TournamentHistory history = new TournamentHistory(allocationRepository, tournamentId, roundNumber);
        OffsetDateTime generatedAt = OffsetDateTime.now();
        AllocationResult result = allocationEngine.generate(pairings, tableOptions, roundNumber, history, generatedAt);

        allocationRepository.deleteAll(existing);
        allocationRepository.flush();

        Map<String, Player> playersByExternalId = new HashMap<>();
        for (Player player : playerRepository.findByTournamentId(tournamentId)) {
            playersByExternalId.put(player.getExternalPlayerId(), player);
        }

        List<Allocation> saved = new ArrayList<>(result.decisions().size());
        for (AllocationDecision decision : result.decisions()) {
            Allocation allocation = toAllocation(round, decision, playersByExternalId, tablesByNumber, generatedAt);
            Allocation savedAllocation = allocationRepository.save(allocation);
            recordGenerated(savedAllocation, round, generatedAt);
            saved.add(savedAllocation);
        }

        log.info("Generated {} allocation(s) for tournament {} round {} (replaced {}): {}",
                saved.size(), tournamentId, roundNumber, existing.size(), result.summary());
        return new GenerationOutcome(round, saved, result);
    }

    private Round lockOrCreateRound(Tournament tournament, int roundNumber) {
        return roundRepository.findByTournamentIdAndRoundNumberForUpdate(tournament.getId(), roundNumber)
                .orElseGet(() -> {
                    Round round = new Round();
                    round.setTournament(tournament);
                    round.setRoundNumber(roundNumber);
                    round.setIsPublished(false);
                    return roundRepository.saveAndFlush(round);
                });
    }

    private void upsertPlayers(Tournament tournament, List<Pairing> pairings) {
        for (Pairing pairing : pairings) {
            upsertPlayer(tournament, pairing.competitorAId(), pairing.competitorAName(), pairing.competitorATotalScore());
            if (!pairing.isBye()) {
                upsertPlayer(tournament, pairing.competitorBId(), pairing.competitorBName(), pairing.competitorBTotalScore());
            }
        }
    }

    private void upsertPlayer(Tournament tournament, String externalPlayerId, String name, Integer totalScore) {
        Player player = playerRepository.findByTournamentIdAndExternalPlayerId(tournament.getId(), externalPlayerId)
                .orElseGet(() -> {
                    Player created = new Player();
                    created.setTournament(tournament);
                    created.setExternalPlayerId(externalPlayerId);
                    return created;
                });
        player.setName(name);
        if (totalScore != null) {
            player.setTotalScore(totalScore);
        }
        playerRepository.save(player);
    }

    static List<Pairing> reconstructPairings(List<Allocation> allocations) {
        List<Pairing> pairings = new ArrayList<>(allocations.size());
        for (Allocation allocation : allocations) {
            Player player1 = allocation.getPlayer1();
            if (allocation.isBye()) {
                pairings.add(Pairing.bye(
                        player1.getExternalPlayerId(),
                        player1.getName(),
                        allocation.getPlayer1Score(),
                        player1.getTotalScore()
                ));
                continue;
            }

            Player player2 = allocation.getPlayer2();
            pairings.add(Pairing.of(
                    player1.getExternalPlayerId(),
                    player1.getName(),
                    allocation.getPlayer1Score(),
                    player1.getTotalScore(),
                    player2.getExternalPlayerId(),
                    player2.getName(),
                    allocation.getPlayer2Score(),
                    player2.getTotalScore(),
                    allocation.getSuggestedTableNumber()
            ));
        }
        return pairings;
    }

    private static Allocation toAllocation(
            Round round,
            AllocationDecision decision,
            Map<String, Player> playersByExternalId,
            Map<Integer, GameTable> tablesByNumber,
            OffsetDateTime generatedAt
    ) {
        CompetitorSnapshot competitorA = decision.competitorA();
        CompetitorSnapshot competitorB = decision.competitorB();

        Allocation allocation = new Allocation();
        allocation.setRound(round);
        allocation.setPlayer1(requirePlayer(playersByExternalId, competitorA.id()));
        allocation.setPlayer1Score(competitorA.score());
        if (competitorB != null) {
            allocation.setPlayer2(requirePlayer(playersByExternalId, competitorB.id()));
            allocation.setPlayer2Score(competitorB.score());
        }
        if (decision.tableNumber() != null) {
            allocation.setTable(tablesByNumber.get(decision.tableNumber()));
        }
        allocation.setSuggestedTableNumber(decision.suggestedTableNumber());
        allocation.setAllocationReason(AuditRecordJsonCodec.toJson(decision.audit()));
        allocation.setCreatedAt(generatedAt);
        allocation.setUpdatedAt(generatedAt);
        return allocation;
    }

    private static Player requirePlayer(Map<String, Player> playersByExternalId, String externalPlayerId) {
        Player player = playersByExternalId.get(externalPlayerId);
        if (player == null) {
            throw new IllegalStateException("Player " + externalPlayerId + " is not registered in this tournament");
        }
        return player;
    }

    private void recordGenerated(Allocation allocation, Round round, OffsetDateTime generatedAt) {
        AllocationAuditEntry entry = new AllocationAuditEntry();
        entry.setAllocationId(allocation.getId());
        entry.setRoundId(round.getId());
        entry.setAction(AllocationAuditAction.GENERATED);
        entry.setReasonJson(allocation.getAllocationReason().deepCopy());
        entry.setRecordedAt(generatedAt);
        allocationAuditEntryRepository.save(entry);
    }
}
