package com.deuceleague.deuce_api.service;

import com.deuceleague.deuce_api.model.InvitationStatus;
import com.deuceleague.deuce_api.model.Match;
import com.deuceleague.deuce_api.model.MatchStatus;
import com.deuceleague.deuce_api.model.TimeSlot;
import com.deuceleague.deuce_api.repository.MatchRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Advisory double-booking check. A lookup failure is logged and reported as
 * "no conflict": this never blocks an operation on its own.
 *
 * The lookup runs in its own read-only transaction so a failed query cannot
 * mark the caller's transaction rollback-only.
 */
@Component
public class ConflictDetector {

    private static final Logger log = LoggerFactory.getLogger(ConflictDetector.class);

    private static final EnumSet<MatchStatus> ACTIVE = EnumSet.of(MatchStatus.SCHEDULED, MatchStatus.ONGOING);

    private final MatchRepository matchRepository;
    private final TransactionTemplate lookupTemplate;

    public ConflictDetector(MatchRepository matchRepository, PlatformTransactionManager transactionManager) {
        this.matchRepository = matchRepository;
        this.lookupTemplate = new TransactionTemplate(transactionManager);
        this.lookupTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.lookupTemplate.setReadOnly(true);
    }

    /**
     * @return the user's other active match whose scheduled time or confirmed
     *         slot lies within {@code window} of {@code proposedTime}
     */
    public Optional<Match> findConflict(UUID userId, LocalDateTime proposedTime, UUID excludeMatchId, Duration window) {
        if (proposedTime == null) return Optional.empty();
        try {
            Optional<Match> conflict = lookupTemplate.execute(status -> matchRepository
                    .findByParticipantAndStatusIn(userId, InvitationStatus.ACCEPTED, ACTIVE)
                    .stream()
                    .filter(m -> !m.getId().equals(excludeMatchId))
                    .filter(m -> occupiedTimes(m).anyMatch(t -> withinWindow(t, proposedTime, window)))
                    .findFirst());
            return conflict == null ? Optional.empty() : conflict;
        } catch (RuntimeException e) {
            log.warn("Conflict check for user {} failed, treating as no conflict: {}", userId, e.getMessage());
            return Optional.empty();
        }
    }

    private static Stream<LocalDateTime> occupiedTimes(Match match) {
        Stream<LocalDateTime> direct = Stream.ofNullable(match.getScheduledTime());
        Stream<LocalDateTime> confirmed = match.getConfirmedSlot().map(TimeSlot::getProposedTime).stream();
        return Stream.concat(direct, confirmed);
    }

    private static boolean withinWindow(LocalDateTime existing, LocalDateTime proposed, Duration window) {
        return Duration.between(existing, proposed).abs().compareTo(window) <= 0;
    }
}
