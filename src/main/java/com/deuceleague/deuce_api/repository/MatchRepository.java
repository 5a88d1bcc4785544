package com.deuceleague.deuce_api.repository;

import com.deuceleague.deuce_api.model.InvitationStatus;
import com.deuceleague.deuce_api.model.Match;
import com.deuceleague.deuce_api.model.MatchStatus;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface MatchRepository extends JpaRepository<Match, UUID> {

    /**
     * Load a match with a pessimistic write lock. Every mutating operation
     * starts here so that writes to the same match are serialized.
     */
    @Query("SELECT m FROM Match m WHERE m.id = :id")
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000")})
    Optional<Match> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Matches in the given statuses where the user holds a seat with the given
     * invitation state. Used by the conflict detector.
     */
    @Query("""
        SELECT DISTINCT m FROM Match m
        JOIN m.participants p
        WHERE p.userId = :userId
        AND p.invitationStatus = :invitationStatus
        AND m.status IN :statuses
        """)
    List<Match> findByParticipantAndStatusIn(
            @Param("userId") UUID userId,
            @Param("invitationStatus") InvitationStatus invitationStatus,
            @Param("statuses") Collection<MatchStatus> statuses);

    /** Submitted results still awaiting the other side since before {@code cutoff}. */
    List<Match> findByStatusAndResultSubmittedByIdIsNotNullAndResultSubmittedAtBefore(
            MatchStatus status, LocalDateTime cutoff);

    /** Late cancellations still waiting on an admin decision. */
    List<Match> findByStatusAndLateCancellationTrueAndRequiresAdminReviewTrueOrderByCancelledAtAsc(MatchStatus status);
}
