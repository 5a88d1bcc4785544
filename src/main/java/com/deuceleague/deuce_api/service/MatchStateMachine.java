package com.deuceleague.deuce_api.service;

import com.deuceleague.deuce_api.exception.AuthorizationException;
import com.deuceleague.deuce_api.exception.ConflictException;
import com.deuceleague.deuce_api.exception.ValidationException;
import com.deuceleague.deuce_api.model.Match;
import com.deuceleague.deuce_api.model.MatchStatus;
import com.deuceleague.deuce_api.model.MatchTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * The only writer of {@code Match.status}. Callers must already hold the
 * match row lock.
 */
@Component
public class MatchStateMachine {

    private static final Logger log = LoggerFactory.getLogger(MatchStateMachine.class);

    public void apply(Match match, MatchTransition transition) {
        MatchStatus from = match.getStatus();
        if (!transition.allowsFrom(from)) {
            log.warn("Rejected {} on match {} in state {}", transition, match.getId(), from);
            throw ConflictException.illegalTransition(match.getId(), from, transition);
        }
        if (transition.target() == MatchStatus.COMPLETED && !match.isRosterComplete()) {
            throw ValidationException.invalidRoster(
                    "A " + match.getMatchType() + " match needs " + match.getMatchType().rosterSize()
                            + " accepted players, two sides, before it can complete");
        }
        match.setStatus(transition.target());
        log.info("Match {}: {} -> {} ({})", match.getId(), from, transition.target(), transition);
    }

    /** Guard shared by every player-initiated transition. */
    public void requireAcceptedParticipant(Match match, UUID userId) {
        if (!match.isAcceptedParticipant(userId)) {
            throw AuthorizationException.notParticipant(userId);
        }
    }
}
