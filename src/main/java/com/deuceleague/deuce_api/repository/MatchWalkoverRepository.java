package com.deuceleague.deuce_api.repository;

import com.deuceleague.deuce_api.model.MatchWalkover;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface MatchWalkoverRepository extends JpaRepository<MatchWalkover, UUID> {

    Optional<MatchWalkover> findByMatchId(UUID matchId);
}
