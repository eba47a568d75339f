package com.tournamenttables.controller;

import com.tournamenttables.controller.dto.AllocationRequests;
import com.tournamenttables.controller.dto.AllocationResponses;
import com.tournamenttables.mapper.AllocationResponseMapper;
import com.tournamenttables.service.AllocationGenerationService;
import com.tournamenttables.service.GenerationOutcome;
import com.tournamenttables.service.RoundService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/tournaments/{tournamentId}/rounds/{roundNumber}")
public class RoundController {

    private final AllocationGenerationService allocationGenerationService;
    private final RoundService roundService;
    private final AllocationResponseMapper allocationResponseMapper;

    public RoundController(
            AllocationGenerationService allocationGenerationService,
            RoundService roundService,
            AllocationResponseMapper allocationResponseMapper
    ) {
        this.allocationGenerationService = allocationGenerationService;
        this.roundService = roundService;
        this.allocationResponseMapper = allocationResponseMapper;
    }

    @PostMapping("/generate")
    public ResponseEntity<AllocationResponses.GenerationResponse> generate(
            @PathVariable Long tournamentId,
            @PathVariable int roundNumber,
            @Valid @RequestBody(required = false) AllocationRequests.GenerateRoundRequest request
    ) {
        GenerationOutcome outcome = allocationGenerationService.generate(
                tournamentId,
                roundNumber,
                request != null ? allocationResponseMapper.toPairings(request.pairings()) : null
        );
        return ResponseEntity.ok(allocationResponseMapper.toGenerationResponse(tournamentId, outcome));
    }

    @GetMapping
    public ResponseEntity<AllocationResponses.RoundView> getRound(
            @PathVariable Long tournamentId,
            @PathVariable int roundNumber
    ) {
        return ResponseEntity.ok(roundService.getRound(tournamentId, roundNumber));
    }

    @PostMapping("/publish")
    public ResponseEntity<AllocationResponses.RoundView> publish(
            @PathVariable Long tournamentId,
            @PathVariable int roundNumber
    ) {
        return ResponseEntity.ok(roundService.publish(tournamentId, roundNumber));
    }
}
