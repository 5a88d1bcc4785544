package com.deuceleague.deuce_api.service;

import com.deuceleague.deuce_api.exception.ValidationException;
import com.deuceleague.deuce_api.model.Set3Format;
import com.deuceleague.deuce_api.model.SetScore;
import com.deuceleague.deuce_api.model.SportType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Scoring grammar for player-submitted results. All violations are collected
 * and reported together.
 *
 * Tennis and padel: best of three sets. Sets one and two end 6-0..6-4, 7-5 or
 * 7-6 (with a 7-point tiebreak). A third set is either a 10-point match
 * tiebreak or a full set that goes to a 10-point tiebreak at 6-6.
 *
 * Pickleball: best of three games to 15, win by 2.
 */
@Component
public class ScoreValidator {

    static final int STANDARD_TIEBREAK_TARGET = 7;
    static final int MATCH_TIEBREAK_TARGET = 10;
    static final int PICKLEBALL_TARGET = 15;

    public void validate(SportType sport, Set3Format set3Format, List<SetScore> sets) {
        List<String> errors = new ArrayList<>();
        if (sets == null || sets.isEmpty()) {
            throw ValidationException.invalidScore(List.of("At least one set score is required"));
        }
        if (hasNullSet(sets)) {
            throw ValidationException.invalidScore(List.of("Set scores must not be null"));
        }
        if (sport == SportType.PICKLEBALL) {
            validatePickleball(sets, errors);
        } else {
            validateSets(sets, set3Format == null ? Set3Format.MATCH_TIEBREAK : set3Format, errors);
        }
        if (!errors.isEmpty()) {
            throw ValidationException.invalidScore(errors);
        }
    }

    /**
     * Shape-only check for adjudicated scores: sets numbered 1..n, no negative
     * games and a decisive winner. Admins may record results the player
     * grammar would refuse.
     */
    public void validateStructure(List<SetScore> sets) {
        List<String> errors = new ArrayList<>();
        if (sets == null || sets.isEmpty()) {
            errors.add("At least one set score is required");
        } else if (hasNullSet(sets)) {
            errors.add("Set scores must not be null");
        } else {
            for (int i = 0; i < sets.size(); i++) {
                SetScore s = sets.get(i);
                if (s.setNumber() != i + 1) {
                    errors.add("Set numbers must run 1.." + sets.size() + " in order");
                    break;
                }
            }
            for (SetScore s : sets) {
                if (s.team1Games() < 0 || s.team2Games() < 0) {
                    errors.add("Set " + s.setNumber() + ": negative games");
                }
            }
            if (errors.isEmpty() && ScoreSummary.of(sets).winner() == null) {
                errors.add("Score does not produce a winner");
            }
        }
        if (!errors.isEmpty()) {
            throw ValidationException.invalidScore(errors);
        }
    }

    // =========================================================================
    // Tennis / padel
    // =========================================================================

    private void validateSets(List<SetScore> sets, Set3Format format, List<String> errors) {
        if (sets.size() < 2 || sets.size() > 3) {
            errors.add("Must have 2 or 3 sets");
            return;
        }
        for (SetScore s : sets) {
            if (s.setNumber() == 3) {
                validateDecider(s, format, errors);
            } else {
                validateStandardSet(s, errors);
            }
        }
        validateMatchShape(sets, "set", errors);
    }

    private void validateStandardSet(SetScore s, List<String> errors) {
        int hi = Math.max(s.team1Games(), s.team2Games());
        int lo = Math.min(s.team1Games(), s.team2Games());
        String label = "Set " + s.setNumber() + " (" + s + ")";

        if (hi == 7 && lo == 6) {
            if (!s.hasTiebreak()) {
                errors.add(label + ": a 7-6 set requires tiebreak scores");
            } else if (!isTiebreakValid(s.team1Tiebreak(), s.team2Tiebreak(), STANDARD_TIEBREAK_TARGET)) {
                errors.add(label + ": invalid tiebreak, first to 7 by 2");
            } else if (tiebreakWinnerDiffers(s)) {
                errors.add(label + ": tiebreak winner must win the set");
            }
            return;
        }
        if (s.hasTiebreak()) {
            errors.add(label + ": tiebreak scores are only allowed on a 7-6 set");
        }
        boolean valid = (hi == 6 && lo <= 4) || (hi == 7 && lo == 5);
        if (!valid) {
            errors.add(label + ": a set ends 6-0 to 6-4, 7-5 or 7-6");
        }
    }

    private void validateDecider(SetScore s, Set3Format format, List<String> errors) {
        String label = "Set 3 (" + s + ")";
        if (format == Set3Format.MATCH_TIEBREAK) {
            // Entered either as tiebreak points or directly in the game columns.
            boolean ok = s.hasTiebreak()
                    ? isTiebreakValid(s.team1Tiebreak(), s.team2Tiebreak(), MATCH_TIEBREAK_TARGET)
                    : isTiebreakValid(s.team1Games(), s.team2Games(), MATCH_TIEBREAK_TARGET);
            if (!ok) {
                errors.add(label + ": match tiebreak is first to 10 by 2");
            }
            return;
        }
        if (s.team1Games() == 6 && s.team2Games() == 6) {
            if (!s.hasTiebreak() || !isTiebreakValid(s.team1Tiebreak(), s.team2Tiebreak(), MATCH_TIEBREAK_TARGET)) {
                errors.add(label + ": 6-6 in a full third set needs a 10-point tiebreak");
            }
            return;
        }
        validateStandardSet(s, errors);
    }

    // =========================================================================
    // Pickleball
    // =========================================================================

    private void validatePickleball(List<SetScore> games, List<String> errors) {
        if (games.size() < 2 || games.size() > 3) {
            errors.add("Must have 2 or 3 games");
            return;
        }
        for (SetScore g : games) {
            if (!isTiebreakValid(g.team1Games(), g.team2Games(), PICKLEBALL_TARGET)) {
                errors.add("Game " + g.setNumber() + " (" + g + "): first to 15 by 2");
            }
        }
        validateMatchShape(games, "game", errors);
    }

    // =========================================================================
    // Shared
    // =========================================================================

    private void validateMatchShape(List<SetScore> sets, String unit, List<String> errors) {
        for (int i = 0; i < sets.size(); i++) {
            if (sets.get(i).setNumber() != i + 1) {
                errors.add("Set numbers must run 1.." + sets.size() + " in order");
                return;
            }
        }
        if (!errors.isEmpty()) return;

        ScoreSummary summary = ScoreSummary.of(sets);
        if (Math.max(summary.team1Sets(), summary.team2Sets()) != 2) {
            errors.add("One side must win exactly 2 " + unit + "s");
        } else if (sets.size() == 3 && (summary.team1Sets() == 0 || summary.team2Sets() == 0)) {
            errors.add("No third " + unit + " after a 2-0");
        }
    }

    // List.of(...).contains(null) throws, so scan instead
    private static boolean hasNullSet(List<SetScore> sets) {
        return sets.stream().anyMatch(Objects::isNull);
    }

    private boolean tiebreakWinnerDiffers(SetScore s) {
        boolean team1TookSet = s.team1Games() > s.team2Games();
        boolean team1TookTiebreak = s.team1Tiebreak() > s.team2Tiebreak();
        return team1TookSet != team1TookTiebreak;
    }

    static boolean isTiebreakValid(Integer a, Integer b, int target) {
        if (a == null || b == null || a < 0 || b < 0) return false;
        int hi = Math.max(a, b);
        int lo = Math.min(a, b);
        if (hi < target) return false;
        if (hi == target) return lo <= target - 2;
        return hi - lo == 2;
    }
}
