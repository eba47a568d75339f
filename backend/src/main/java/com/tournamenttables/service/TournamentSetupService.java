package com.tournamenttables.service;

import com.tournamenttables.config.AllocationProperties;
import com.tournamenttables.controller.dto.TournamentRequests;
import com.tournamenttables.controller.dto.TournamentResponses;
import com.tournamenttables.mapper.AllocationResponseMapper;
import com.tournamenttables.model.GameTable;
import com.tournamenttables.model.TerrainType;
import com.tournamenttables.model.Tournament;
import com.tournamenttables.repository.GameTableRepository;
import com.tournamenttables.repository.TerrainTypeRepository;
import com.tournamenttables.repository.TournamentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Creates tournaments with their numbered tables and assigns terrain to tables.
 */
@Service
public class TournamentSetupService {

    private static final Logger log = LoggerFactory.getLogger(TournamentSetupService.class);

    private final TournamentRepository tournamentRepository;
    private final GameTableRepository gameTableRepository;
    private final TerrainTypeRepository terrainTypeRepository;
    private final AllocationResponseMapper allocationResponseMapper;
    private final AllocationProperties allocationProperties;

    public TournamentSetupService(
            TournamentRepository tournamentRepository,
            GameTableRepository gameTableRepository,
            TerrainTypeRepository terrainTypeRepository,
            AllocationResponseMapper allocationResponseMapper,
            AllocationProperties allocationProperties
    ) {
        this.tournamentRepository = tournamentRepository;
        this.gameTableRepository = gameTableRepository;
        this.terrainTypeRepository = terrainTypeRepository;
        this.allocationResponseMapper = allocationResponseMapper;
        this.allocationProperties = allocationProperties;
    }

    @Transactional
    public TournamentResponses.TournamentDetail createTournament(TournamentRequests.CreateTournamentRequest request) {
        int maxTables = allocationProperties.getAllocation().getMaxTables();
        if (request.tableCount() > maxTables) {
            throw new ResponseStatusException(
                    HttpStatus.BAD_REQUEST,
                    "tableCount must not exceed " + maxTables
            );
        }

        OffsetDateTime now = OffsetDateTime.now();
        Tournament tournament = new Tournament();
        tournament.setName(request.name().trim());
        tournament.setTableCount(request.tableCount());
        tournament.setCreatedAt(now);
        tournament.setUpdatedAt(now);
        Tournament savedTournament = tournamentRepository.save(tournament);

        List<GameTable> tables = new ArrayList<>(request.tableCount());
        for (int tableNumber = 1; tableNumber <= request.tableCount(); tableNumber++) {
            GameTable table = new GameTable();
            table.setTournament(savedTournament);
            table.setTableNumber(tableNumber);
            tables.add(table);
        }
        List<GameTable> savedTables = gameTableRepository.saveAll(tables);

        log.info("Created tournament {} '{}' with {} table(s)",
                savedTournament.getId(), savedTournament.getName(), savedTables.size());
        return allocationResponseMapper.toTournamentDetail(savedTournament, savedTables);
    }

    @Transactional(readOnly = true)
    public TournamentResponses.TournamentDetail getTournament(Long tournamentId) {
        Tournament tournament = requireTournament(tournamentId);
        return allocationResponseMapper.toTournamentDetail(
                tournament,
                gameTableRepository.findByTournamentIdOrderByTableNumberAsc(tournamentId)
        );
    }

    /**
     * @param terrainTypeId terrain to place on the table, or null to clear it
     */
    @Transactional
    public TournamentResponses.TableSummary setTableTerrain(Long tournamentId, int tableNumber, Long terrainTypeId) {
        requireTournament(tournamentId);
        GameTable table = gameTableRepository.findByTournamentIdAndTableNumber(tournamentId, tableNumber)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND,
                        "Table " + tableNumber + " not found in tournament " + tournamentId
                ));

        TerrainType terrainType = null;
        if (terrainTypeId != null) {
            terrainType = terrainTypeRepository.findById(terrainTypeId)
                    .orElseThrow(() -> new ResponseStatusException(
                            HttpStatus.NOT_FOUND,
                            "Terrain type not found: " + terrainTypeId
                    ));
        }
        table.setTerrainType(terrainType);
        GameTable savedTable = gameTableRepository.save(table);

        log.info("Table {} of tournament {} now uses terrain {}",
                tableNumber, tournamentId, terrainType != null ? terrainType.getName() : "none");
        return allocationResponseMapper.toTableSummary(savedTable);
    }

    @Transactional(readOnly = true)
    public List<TournamentResponses.TerrainTypeSummary> listTerrainTypes() {
        return terrainTypeRepository.findAllByOrderBySortOrderAscNameAsc().stream()
                .map(allocationResponseMapper::toTerrainTypeSummary)
                .toList();
    }

    private Tournament requireTournament(Long tournamentId) {
        return tournamentRepository.findById(tournamentId)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND,
                        "Tournament not found: " + tournamentId
                ));
    }
}
