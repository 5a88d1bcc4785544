package com.deuceleague.deuce_api.repository;

import com.deuceleague.deuce_api.model.MatchResult;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface MatchResultRepository extends JpaRepository<MatchResult, UUID> {

    List<MatchResult> findByMatchId(UUID matchId);

    List<MatchResult> findByUserIdAndDivisionIdAndSeasonId(UUID userId, UUID divisionId, UUID seasonId);

    List<MatchResult> findByDivisionIdAndSeasonId(UUID divisionId, UUID seasonId);

    @Modifying
    @Query("DELETE FROM MatchResult r WHERE r.matchId = :matchId")
    int deleteByMatchId(@Param("matchId") UUID matchId);
}
