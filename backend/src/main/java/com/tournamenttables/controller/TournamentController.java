package com.tournamenttables.controller;

import com.tournamenttables.controller.dto.TournamentRequests;
import com.tournamenttables.controller.dto.TournamentResponses;
import com.tournamenttables.service.TournamentSetupService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
public class TournamentController {

    private final TournamentSetupService tournamentSetupService;

    public TournamentController(TournamentSetupService tournamentSetupService) {
        this.tournamentSetupService = tournamentSetupService;
    }

    @PostMapping("/api/tournaments")
    public ResponseEntity<TournamentResponses.TournamentDetail> createTournament(
            @Valid @RequestBody TournamentRequests.CreateTournamentRequest request
    ) {
        TournamentResponses.TournamentDetail tournament = tournamentSetupService.createTournament(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(tournament);
    }

    @GetMapping("/api/tournaments/{tournamentId}")
    public ResponseEntity<TournamentResponses.TournamentDetail> getTournament(@PathVariable Long tournamentId) {
        return ResponseEntity.ok(tournamentSetupService.getTournament(tournamentId));
    }

    @PutMapping("/api/tournaments/{tournamentId}/tables/{tableNumber}/terrain")
    public ResponseEntity<TournamentResponses.TableSummary> setTableTerrain(
            @PathVariable Long tournamentId,
            @PathVariable int tableNumber,
            @Valid @RequestBody TournamentRequests.SetTableTerrainRequest request
    ) {
        return ResponseEntity.ok(
                tournamentSetupService.setTableTerrain(tournamentId, tableNumber, request.terrainTypeId()));
    }

    @GetMapping("/api/terrain-types")
    public ResponseEntity<List<TournamentResponses.TerrainTypeSummary>> listTerrainTypes() {
        return ResponseEntity.ok(tournamentSetupService.listTerrainTypes());
    }
}
