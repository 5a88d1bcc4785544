package com.deuceleague.deuce_api.repository;

import com.deuceleague.deuce_api.model.RecalculationTask;
import com.deuceleague.deuce_api.model.RecalculationTaskStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public interface RecalculationTaskRepository extends JpaRepository<RecalculationTask, UUID> {

    List<RecalculationTask> findByStatusAndNextAttemptAtLessThanEqualOrderByCreatedAtAsc(
            RecalculationTaskStatus status, LocalDateTime now, Pageable pageable);

    List<RecalculationTask> findByMatchId(UUID matchId);
}
