package com.deuceleague.deuce_api.repository;

import com.deuceleague.deuce_api.model.DivisionStanding;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface DivisionStandingRepository extends JpaRepository<DivisionStanding, UUID> {

    List<DivisionStanding> findByDivisionIdAndSeasonIdOrderByRankAsc(UUID divisionId, UUID seasonId);

    @Modifying
    @Query("DELETE FROM DivisionStanding s WHERE s.divisionId = :divisionId AND s.seasonId = :seasonId")
    int deleteByDivisionAndSeason(@Param("divisionId") UUID divisionId, @Param("seasonId") UUID seasonId);
}
