package com.deuceleague.deuce_api.repository;

import com.deuceleague.deuce_api.model.Penalty;
import com.deuceleague.deuce_api.model.PenaltyStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface PenaltyRepository extends JpaRepository<Penalty, UUID> {

    List<Penalty> findByUserIdOrderByCreatedAtDesc(UUID userId);

    List<Penalty> findByStatusInAndExpiresAtLessThanEqual(Collection<PenaltyStatus> statuses, LocalDateTime now);
}
