package com.deuceleague.deuce_api.repository;

import com.deuceleague.deuce_api.model.RatingHistory;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface RatingHistoryRepository extends JpaRepository<RatingHistory, UUID> {

    List<RatingHistory> findByMatchId(UUID matchId);

    boolean existsByMatchId(UUID matchId);

    List<RatingHistory> findByUserIdOrderByCreatedAtDesc(UUID userId);
}
