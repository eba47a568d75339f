package com.tournamenttables.repository;

import com.tournamenttables.model.Round;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface RoundRepository extends JpaRepository<Round, Long> {
    Optional<Round> findByTournamentIdAndRoundNumber(Long tournamentId, Integer roundNumber);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from Round r where r.tournament.id = :tournamentId and r.roundNumber = :roundNumber")
    Optional<Round> findByTournamentIdAndRoundNumberForUpdate(
            @Param("tournamentId") Long tournamentId,
            @Param("roundNumber") Integer roundNumber
    );

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from Round r where r.id = :roundId")
    Optional<Round> findByIdForUpdate(@Param("roundId") Long roundId);
}
