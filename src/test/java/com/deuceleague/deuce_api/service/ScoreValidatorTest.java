package com.deuceleague.deuce_api.service;

import com.deuceleague.deuce_api.exception.ValidationException;
import com.deuceleague.deuce_api.model.Set3Format;
import com.deuceleague.deuce_api.model.SetScore;
import com.deuceleague.deuce_api.model.SportType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Score grammar for player-submitted results, in isolation.
 */
class ScoreValidatorTest {

    private final ScoreValidator validator = new ScoreValidator();

    private static SetScore tb(int set, int g1, int g2, int t1, int t2) {
        return new SetScore(set, g1, g2, t1, t2);
    }

    // =========================================================================
    // 1.1 Tennis and padel sets
    // =========================================================================

    @Nested
    @DisplayName("1.1 Tennis and padel sets")
    class Sets {

        @Test
        @DisplayName("straightSets_areAccepted")
        void straightSets_areAccepted() {
            assertDoesNotThrow(() -> validator.validate(SportType.TENNIS, Set3Format.MATCH_TIEBREAK,
                    List.of(SetScore.of(1, 6, 3), SetScore.of(2, 7, 5))));
        }

        @Test
        @DisplayName("sevenSix_withValidTiebreak_isAccepted")
        void sevenSix_withValidTiebreak_isAccepted() {
            assertDoesNotThrow(() -> validator.validate(SportType.PADEL, Set3Format.MATCH_TIEBREAK,
                    List.of(tb(1, 7, 6, 7, 5), SetScore.of(2, 6, 2))));
        }

        @Test
        @DisplayName("sevenSix_withoutTiebreak_isRejected")
        void sevenSix_withoutTiebreak_isRejected() {
            ValidationException ex = assertThrows(ValidationException.class, () ->
                    validator.validate(SportType.TENNIS, Set3Format.MATCH_TIEBREAK,
                            List.of(SetScore.of(1, 7, 6), SetScore.of(2, 6, 2))));
            assertEquals("invalid_score", ex.getCode());
        }

        @Test
        @DisplayName("tiebreakWonByLoser_isRejected")
        void tiebreakWonByLoser_isRejected() {
            assertThrows(ValidationException.class, () ->
                    validator.validate(SportType.TENNIS, Set3Format.MATCH_TIEBREAK,
                            List.of(tb(1, 7, 6, 4, 7), SetScore.of(2, 6, 2))));
        }

        @Test
        @DisplayName("sixFive_isRejected")
        void sixFive_isRejected() {
            assertThrows(ValidationException.class, () ->
                    validator.validate(SportType.TENNIS, Set3Format.MATCH_TIEBREAK,
                            List.of(SetScore.of(1, 6, 5), SetScore.of(2, 6, 2))));
        }

        @Test
        @DisplayName("everyViolation_isReported")
        void everyViolation_isReported() {
            ValidationException ex = assertThrows(ValidationException.class, () ->
                    validator.validate(SportType.TENNIS, Set3Format.MATCH_TIEBREAK,
                            List.of(SetScore.of(1, 6, 5), SetScore.of(2, 8, 2))));
            assertTrue(ex.getViolations().size() >= 2);
        }

        @Test
        @DisplayName("thirdSet_afterTwoNil_isRejected")
        void thirdSet_afterTwoNil_isRejected() {
            assertThrows(ValidationException.class, () ->
                    validator.validate(SportType.TENNIS, Set3Format.MATCH_TIEBREAK,
                            List.of(SetScore.of(1, 6, 3), SetScore.of(2, 6, 3), SetScore.of(3, 10, 8))));
        }

        @Test
        @DisplayName("oneSetAll_withoutDecider_isRejected")
        void oneSetAll_withoutDecider_isRejected() {
            assertThrows(ValidationException.class, () ->
                    validator.validate(SportType.TENNIS, Set3Format.MATCH_TIEBREAK,
                            List.of(SetScore.of(1, 6, 3), SetScore.of(2, 3, 6))));
        }

        @Test
        @DisplayName("emptyScore_isRejected")
        void emptyScore_isRejected() {
            assertThrows(ValidationException.class, () ->
                    validator.validate(SportType.TENNIS, Set3Format.MATCH_TIEBREAK, List.of()));
        }
    }

    // =========================================================================
    // 1.2 Deciding set
    // =========================================================================

    @Nested
    @DisplayName("1.2 Deciding set")
    class Decider {

        @Test
        @DisplayName("matchTiebreak_enteredAsGames_isAccepted")
        void matchTiebreak_enteredAsGames_isAccepted() {
            assertDoesNotThrow(() -> validator.validate(SportType.TENNIS, Set3Format.MATCH_TIEBREAK,
                    List.of(SetScore.of(1, 6, 3), SetScore.of(2, 3, 6), SetScore.of(3, 10, 8))));
        }

        @Test
        @DisplayName("matchTiebreak_extended_isAccepted")
        void matchTiebreak_extended_isAccepted() {
            assertDoesNotThrow(() -> validator.validate(SportType.TENNIS, Set3Format.MATCH_TIEBREAK,
                    List.of(SetScore.of(1, 6, 3), SetScore.of(2, 3, 6), SetScore.of(3, 12, 10))));
        }

        @Test
        @DisplayName("matchTiebreak_sevenSix_isRejected")
        void matchTiebreak_sevenSix_isRejected() {
            assertThrows(ValidationException.class, () ->
                    validator.validate(SportType.TENNIS, Set3Format.MATCH_TIEBREAK,
                            List.of(SetScore.of(1, 6, 3), SetScore.of(2, 3, 6), SetScore.of(3, 7, 6))));
        }

        @Test
        @DisplayName("fullSet_sixAllWithTenPointTiebreak_isAccepted")
        void fullSet_sixAllWithTenPointTiebreak_isAccepted() {
            assertDoesNotThrow(() -> validator.validate(SportType.TENNIS, Set3Format.FULL_SET,
                    List.of(SetScore.of(1, 6, 3), SetScore.of(2, 3, 6), tb(3, 6, 6, 10, 7))));
        }

        @Test
        @DisplayName("fullSet_ordinaryScore_isAccepted")
        void fullSet_ordinaryScore_isAccepted() {
            assertDoesNotThrow(() -> validator.validate(SportType.TENNIS, Set3Format.FULL_SET,
                    List.of(SetScore.of(1, 6, 3), SetScore.of(2, 3, 6), SetScore.of(3, 7, 5))));
        }
    }

    // =========================================================================
    // 1.3 Pickleball and adjudicated scores
    // =========================================================================

    @Nested
    @DisplayName("1.3 Pickleball and adjudicated scores")
    class PickleballAndStructure {

        @Test
        @DisplayName("pickleball_winByTwo_isAccepted")
        void pickleball_winByTwo_isAccepted() {
            assertDoesNotThrow(() -> validator.validate(SportType.PICKLEBALL, null,
                    List.of(SetScore.of(1, 15, 11), SetScore.of(2, 17, 15))));
        }

        @Test
        @DisplayName("pickleball_winByOne_isRejected")
        void pickleball_winByOne_isRejected() {
            assertThrows(ValidationException.class, () -> validator.validate(SportType.PICKLEBALL, null,
                    List.of(SetScore.of(1, 15, 14), SetScore.of(2, 15, 3))));
        }

        @Test
        @DisplayName("validateStructure_acceptsScoreTheGrammarRefuses")
        void validateStructure_acceptsScoreTheGrammarRefuses() {
            List<SetScore> score = List.of(SetScore.of(1, 6, 3), SetScore.of(2, 3, 6), SetScore.of(3, 7, 6));
            assertDoesNotThrow(() -> validator.validateStructure(score));
        }

        @Test
        @DisplayName("validateStructure_rejectsScoreWithoutWinner")
        void validateStructure_rejectsScoreWithoutWinner() {
            assertThrows(ValidationException.class, () ->
                    validator.validateStructure(List.of(SetScore.of(1, 6, 3), SetScore.of(2, 3, 6))));
        }

        @Test
        @DisplayName("validateStructure_rejectsSetsOutOfSequence")
        void validateStructure_rejectsSetsOutOfSequence() {
            ValidationException ex = assertThrows(ValidationException.class, () ->
                    validator.validateStructure(List.of(SetScore.of(1, 6, 3), SetScore.of(3, 6, 4))));
            assertEquals("invalid_score", ex.getCode());
            assertEquals(List.of("Set numbers must run 1..2 in order"), ex.getViolations());

            assertThrows(ValidationException.class, () ->
                    validator.validateStructure(List.of(SetScore.of(2, 6, 3), SetScore.of(1, 6, 4))));
        }

        @Test
        @DisplayName("nullSet_isRejectedAsInvalidScore")
        void nullSet_isRejectedAsInvalidScore() {
            List<SetScore> withGap = Arrays.asList(SetScore.of(1, 6, 3), null);

            ValidationException structural = assertThrows(ValidationException.class,
                    () -> validator.validateStructure(withGap));
            assertEquals("invalid_score", structural.getCode());

            ValidationException submitted = assertThrows(ValidationException.class,
                    () -> validator.validate(SportType.TENNIS, Set3Format.MATCH_TIEBREAK, withGap));
            assertEquals("invalid_score", submitted.getCode());
        }

        @Test
        @DisplayName("tiebreakRule_firstToTargetByTwo")
        void tiebreakRule_firstToTargetByTwo() {
            assertTrue(ScoreValidator.isTiebreakValid(7, 5, 7));
            assertTrue(ScoreValidator.isTiebreakValid(9, 11, 7));
            assertFalse(ScoreValidator.isTiebreakValid(7, 6, 7));
            assertFalse(ScoreValidator.isTiebreakValid(6, 4, 7));
            assertFalse(ScoreValidator.isTiebreakValid(12, 9, 10));
            assertFalse(ScoreValidator.isTiebreakValid(null, 3, 7));
        }
    }
}
