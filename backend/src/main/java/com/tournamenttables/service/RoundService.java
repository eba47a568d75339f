package com.tournamenttables.service;

import com.tournamenttables.controller.dto.AllocationResponses;
import com.tournamenttables.mapper.AllocationResponseMapper;
import com.tournamenttables.model.Allocation;
import com.tournamenttables.model.Round;
import com.tournamenttables.repository.AllocationRepository;
import com.tournamenttables.repository.RoundRepository;
import com.tournamenttables.web.AllocationRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class RoundService {

    private static final Logger log = LoggerFactory.getLogger(RoundService.class);

    private final RoundRepository roundRepository;
    private final AllocationRepository allocationRepository;
    private final TableCollisionDetector tableCollisionDetector;
    private final AllocationResponseMapper allocationResponseMapper;

    public RoundService(
            RoundRepository roundRepository,
            AllocationRepository allocationRepository,
            TableCollisionDetector tableCollisionDetector,
            AllocationResponseMapper allocationResponseMapper
    ) {
        this.roundRepository = roundRepository;
        this.allocationRepository = allocationRepository;
        this.tableCollisionDetector = tableCollisionDetector;
        this.allocationResponseMapper = allocationResponseMapper;
    }

    @Transactional(readOnly = true)
    public AllocationResponses.RoundView getRound(Long tournamentId, int roundNumber) {
        Round round = roundRepository.findByTournamentIdAndRoundNumber(tournamentId, roundNumber)
                .orElseThrow(() -> roundNotFound(tournamentId, roundNumber));
        return toRoundView(tournamentId, round);
    }

    /**
     * Marks the round visible to players. Allocations stay editable; publishing again is a no-op.
     */
    @Transactional
    public AllocationResponses.RoundView publish(Long tournamentId, int roundNumber) {
        Round round = roundRepository.findByTournamentIdAndRoundNumberForUpdate(tournamentId, roundNumber)
                .orElseThrow(() -> roundNotFound(tournamentId, roundNumber));
        if (!Boolean.TRUE.equals(round.getIsPublished())) {
            round.setIsPublished(true);
            roundRepository.save(round);
            log.info("Published round {} of tournament {}", roundNumber, tournamentId);
        }
        return toRoundView(tournamentId, round);
    }

    private AllocationResponses.RoundView toRoundView(Long tournamentId, Round round) {
        List<Allocation> allocations = allocationRepository.findByRoundIdOrderByTableNumber(round.getId());
        List<TableCollisionDetector.TableCollision> collisions = tableCollisionDetector.findCollisions(allocations);
        if (!collisions.isEmpty()) {
            log.warn("Round {} of tournament {} has {} table collision(s)",
                    round.getRoundNumber(), tournamentId, collisions.size());
        }
        return allocationResponseMapper.toRoundView(tournamentId, round, allocations, collisions);
    }

    private static AllocationRequestException roundNotFound(Long tournamentId, int roundNumber) {
        return AllocationRequestException.notFound(
                "Round " + roundNumber + " of tournament " + tournamentId + " not found");
    }
}
