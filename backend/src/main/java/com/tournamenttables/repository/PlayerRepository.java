package com.tournamenttables.repository;

import com.tournamenttables.model.Player;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PlayerRepository extends JpaRepository<Player, Long> {
    Optional<Player> findByTournamentIdAndExternalPlayerId(Long tournamentId, String externalPlayerId);

    List<Player> findByTournamentId(Long tournamentId);
}
