package com.deuceleague.deuce_api.repository;

import com.deuceleague.deuce_api.model.MatchInvitation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface MatchInvitationRepository extends JpaRepository<MatchInvitation, UUID> {

    /** Ids of matches holding at least one PENDING invitation past its expiry. */
    @Query("""
        SELECT DISTINCT i.match.id FROM MatchInvitation i
        WHERE i.status = com.deuceleague.deuce_api.model.InvitationStatus.PENDING
        AND i.expiresAt <= :now
        """)
    List<UUID> findMatchIdsWithExpiredInvitations(@Param("now") LocalDateTime now);

    @Query("SELECT i.match.id FROM MatchInvitation i WHERE i.id = :id")
    Optional<UUID> findMatchIdById(@Param("id") UUID invitationId);

    List<MatchInvitation> findByInviteeIdOrderByCreatedAtDesc(UUID inviteeId);
}
