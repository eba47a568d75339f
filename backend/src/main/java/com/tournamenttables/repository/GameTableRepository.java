package com.tournamenttables.repository;

import com.tournamenttables.model.GameTable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface GameTableRepository extends JpaRepository<GameTable, Long> {

    @Query("""
            select t from GameTable t
            left join fetch t.terrainType
            where t.tournament.id = :tournamentId
            order by t.tableNumber asc
            """)
    List<GameTable> findByTournamentIdOrderByTableNumberAsc(@Param("tournamentId") Long tournamentId);

    Optional<GameTable> findByTournamentIdAndTableNumber(Long tournamentId, Integer tableNumber);
}
