package com.deuceleague.deuce_api.repository;

import com.deuceleague.deuce_api.model.DisputeStatus;
import com.deuceleague.deuce_api.model.MatchDispute;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface MatchDisputeRepository extends JpaRepository<MatchDispute, UUID> {

    boolean existsByMatchIdAndStatusIn(UUID matchId, Collection<DisputeStatus> statuses);

    Optional<MatchDispute> findFirstByMatchIdAndStatusIn(UUID matchId, Collection<DisputeStatus> statuses);

    List<MatchDispute> findByMatchIdAndStatusIn(UUID matchId, Collection<DisputeStatus> statuses);

    List<MatchDispute> findByMatchIdOrderByCreatedAtDesc(UUID matchId);

    List<MatchDispute> findByStatusInOrderByCreatedAtAsc(Collection<DisputeStatus> statuses);

    List<MatchDispute> findByStatusAndCreatedAtBefore(DisputeStatus status, LocalDateTime cutoff);
}
