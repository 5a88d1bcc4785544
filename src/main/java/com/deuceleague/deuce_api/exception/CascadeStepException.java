package com.deuceleague.deuce_api.exception;

import com.deuceleague.deuce_api.model.RecalculationStep;
import lombok.Getter;

import java.util.UUID;

/**
 * A derived-data step that failed after the structural edit committed.
 * Never reaches a caller: the cascade logs it and queues a retry.
 */
@Getter
public class CascadeStepException extends RuntimeException {

    private final RecalculationStep step;
    private final UUID matchId;

    public CascadeStepException(RecalculationStep step, UUID matchId, Throwable cause) {
        super(step + " recalculation failed for match " + matchId + ": " + cause.getMessage(), cause);
        this.step = step;
        this.matchId = matchId;
    }
}
