package com.deuceleague.deuce_api.repository;

import com.deuceleague.deuce_api.model.PlayerRating;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface PlayerRatingRepository extends JpaRepository<PlayerRating, UUID> {

    Optional<PlayerRating> findByUserIdAndSeasonId(UUID userId, UUID seasonId);

    // =========================================================================
    // Pessimistic locking for rating updates
    // =========================================================================

    /**
     * Load ratings by IDs with pessimistic write lock, ordered by ID ASC.
     * CRITICAL: Always lock in ascending id order to prevent deadlocks.
     */
    @Query("SELECT r FROM PlayerRating r WHERE r.id IN :ids ORDER BY r.id ASC")
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000")})
    List<PlayerRating> findAllByIdWithLock(@Param("ids") Collection<UUID> ids);

    /** Same lock discipline, addressed by player within a season. */
    @Query("""
        SELECT r FROM PlayerRating r
        WHERE r.userId IN :userIds AND r.seasonId = :seasonId
        ORDER BY r.id ASC
        """)
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000")})
    List<PlayerRating> findAllForSeasonWithLock(@Param("userIds") Collection<UUID> userIds,
                                                @Param("seasonId") UUID seasonId);
}
