package com.deuceleague.deuce_api.service;

import com.deuceleague.deuce_api.exception.NotFoundException;
import com.deuceleague.deuce_api.model.*;
import com.deuceleague.deuce_api.repository.*;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read side. Entities are flattened into views while the session is open so
 * nothing lazy reaches the JSON layer.
 */
@Service
@Transactional(readOnly = true)
public class MatchQueryService {

    private final MatchRepository matchRepository;
    private final MatchInvitationRepository invitationRepository;
    private final AdminActionRepository adminActionRepository;
    private final DivisionStandingRepository standingRepository;
    private final PlayerRatingRepository ratingRepository;
    private final RatingHistoryRepository ratingHistoryRepository;

    public MatchQueryService(MatchRepository matchRepository,
                             MatchInvitationRepository invitationRepository,
                             AdminActionRepository adminActionRepository,
                             DivisionStandingRepository standingRepository,
                             PlayerRatingRepository ratingRepository,
                             RatingHistoryRepository ratingHistoryRepository) {
        this.matchRepository = matchRepository;
        this.invitationRepository = invitationRepository;
        this.adminActionRepository = adminActionRepository;
        this.standingRepository = standingRepository;
        this.ratingRepository = ratingRepository;
        this.ratingHistoryRepository = ratingHistoryRepository;
    }

    public MatchView view(UUID matchId) {
        return matchRepository.findById(matchId)
                .map(MatchView::from)
                .orElseThrow(() -> new NotFoundException("Match", matchId));
    }

    public List<MatchView> pendingLateCancellations() {
        return matchRepository.findByStatusAndLateCancellationTrueAndRequiresAdminReviewTrueOrderByCancelledAtAsc(
                MatchStatus.CANCELLED).stream().map(MatchView::from).toList();
    }

    public List<InvitationView> invitationsFor(UUID userId) {
        return invitationRepository.findByInviteeIdOrderByCreatedAtDesc(userId).stream()
                .map(InvitationView::from)
                .toList();
    }

    public List<AdminActionView> adminHistory(UUID matchId) {
        return adminActionRepository.findByMatchIdOrderByCreatedAtDesc(matchId).stream()
                .map(AdminActionView::from)
                .toList();
    }

    public List<DivisionStanding> standings(UUID divisionId, UUID seasonId) {
        return standingRepository.findByDivisionIdAndSeasonIdOrderByRankAsc(divisionId, seasonId);
    }

    public Optional<PlayerRating> rating(UUID userId, UUID seasonId) {
        return ratingRepository.findByUserIdAndSeasonId(userId, seasonId);
    }

    public List<RatingHistory> ratingHistory(UUID userId) {
        return ratingHistoryRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    // =========================================================================
    // Views
    // =========================================================================

    public record ParticipantView(UUID userId, ParticipantRole role, MatchTeam team, InvitationStatus invitationStatus) {
        static ParticipantView from(MatchParticipant p) {
            return new ParticipantView(p.getUserId(), p.getRole(), p.getTeam(), p.getInvitationStatus());
        }
    }

    public record TimeSlotView(
            UUID id,
            LocalDateTime proposedTime,
            String location,
            UUID proposedById,
            TimeSlotStatus status,
            int votes
    ) {
        static TimeSlotView from(TimeSlot s) {
            return new TimeSlotView(s.getId(), s.getProposedTime(), s.getLocation(), s.getProposedById(),
                    s.getStatus(), s.getVotes().size());
        }
    }

    public record MatchView(
            UUID id,
            UUID divisionId,
            UUID seasonId,
            SportType sport,
            MatchType matchType,
            MatchStatus status,
            LocalDateTime scheduledTime,
            String location,
            List<ParticipantView> participants,
            List<SetScore> scores,
            Integer team1Score,
            Integer team2Score,
            MatchTeam outcome,
            UUID resultSubmittedById,
            UUID resultConfirmedById,
            boolean autoApproved,
            boolean disputed,
            boolean walkover,
            WalkoverReason walkoverReason,
            boolean lateCancellation,
            boolean requiresAdminReview,
            int rescheduleCount,
            List<TimeSlotView> timeSlots
    ) {
        public static MatchView from(Match m) {
            return new MatchView(
                    m.getId(), m.getDivisionId(), m.getSeasonId(), m.getSport(), m.getMatchType(), m.getStatus(),
                    m.getScheduledTime(), m.getLocation(),
                    m.getParticipants().stream().map(ParticipantView::from).toList(),
                    m.getSetScores(), m.getTeam1Score(), m.getTeam2Score(), m.getOutcome(),
                    m.getResultSubmittedById(), m.getResultConfirmedById(),
                    m.isAutoApproved(), m.isDisputed(), m.isWalkover(), m.getWalkoverReason(),
                    m.isLateCancellation(), m.isRequiresAdminReview(), m.getRescheduleCount(),
                    m.getTimeSlots().stream().map(TimeSlotView::from).toList()
            );
        }
    }

    public record InvitationView(
            UUID id,
            UUID matchId,
            UUID inviterId,
            UUID inviteeId,
            InvitationStatus status,
            LocalDateTime expiresAt,
            LocalDateTime respondedAt
    ) {
        public static InvitationView from(MatchInvitation i) {
            return new InvitationView(i.getId(), i.getMatch().getId(), i.getInviterId(), i.getInviteeId(),
                    i.getStatus(), i.getExpiresAt(), i.getRespondedAt());
        }
    }

    public record AdminActionView(
            UUID id,
            UUID adminId,
            AdminActionType actionType,
            String oldValue,
            String newValue,
            String reason,
            List<UUID> affectedUserIds,
            boolean triggeredRecalculation,
            LocalDateTime createdAt
    ) {
        static AdminActionView from(AdminAction a) {
            return new AdminActionView(a.getId(), a.getAdminId(), a.getActionType(), a.getOldValue(),
                    a.getNewValue(), a.getReason(), List.copyOf(a.getAffectedUserIds()),
                    a.isTriggeredRecalculation(), a.getCreatedAt());
        }
    }
}
