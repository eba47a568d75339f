package com.tournamenttables.repository;

import com.tournamenttables.model.Allocation;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.Set;

@Repository
public interface AllocationRepository extends JpaRepository<Allocation, Long> {

    /**
     * Table numbers a player sat at in rounds before {@code roundNumber} of the same tournament.
     */
    @Query("""
            select distinct t.tableNumber
            from Allocation a
            join a.round r
            join a.table t
            join a.player1 p1
            left join a.player2 p2
            where r.tournament.id = :tournamentId
              and r.roundNumber < :roundNumber
              and (p1.externalPlayerId = :playerId or p2.externalPlayerId = :playerId)
            """)
    Set<Integer> findUsedTableNumbers(
            @Param("tournamentId") Long tournamentId,
            @Param("roundNumber") Integer roundNumber,
            @Param("playerId") String playerId
    );

    /**
     * Terrain type ids a player experienced in rounds before {@code roundNumber} of the same tournament.
     */
    @Query("""
            select distinct tt.id
            from Allocation a
            join a.round r
            join a.table t
            join t.terrainType tt
            join a.player1 p1
            left join a.player2 p2
            where r.tournament.id = :tournamentId
              and r.roundNumber < :roundNumber
              and (p1.externalPlayerId = :playerId or p2.externalPlayerId = :playerId)
            """)
    Set<Long> findExperiencedTerrainTypeIds(
            @Param("tournamentId") Long tournamentId,
            @Param("roundNumber") Integer roundNumber,
            @Param("playerId") String playerId
    );

    @Query("""
            select a from Allocation a
            left join fetch a.table t
            left join fetch t.terrainType
            join fetch a.player1
            left join fetch a.player2
            where a.round.id = :roundId
            order by t.tableNumber asc nulls last, a.id asc
            """)
    List<Allocation> findByRoundIdOrderByTableNumber(@Param("roundId") Long roundId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from Allocation a where a.id = :allocationId")
    Optional<Allocation> findByIdForUpdate(@Param("allocationId") Long allocationId);

    Optional<Allocation> findByRoundIdAndTableId(Long roundId, Long tableId);

    @Query("""
            select t.tableNumber
            from Allocation a
            join a.table t
            where a.round.id = :roundId
            group by t.tableNumber
            having count(a) > 1
            order by t.tableNumber asc
            """)
    List<Integer> findCollidingTableNumbers(@Param("roundId") Long roundId);

    @Query("select a.round.id from Allocation a where a.id = :allocationId")
    Optional<Long> findRoundIdById(@Param("allocationId") Long allocationId);
}
