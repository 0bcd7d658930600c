package com.tennis.edge.signal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Games won by each side in a single set, parsed from live score strings
 * such as {@code "6-4, 3-2"}.
 */
public record SetScore(int gamesA, int gamesB) {

    private static final int GAMES_TO_WIN_SET = 6;

    /**
     * Winner of this set, empty while the set is still in progress.
     */
    public Optional<Side> winner() {
        if (gamesA > gamesB && gamesA >= GAMES_TO_WIN_SET) {
            return Optional.of(Side.A);
        }
        if (gamesB > gamesA && gamesB >= GAMES_TO_WIN_SET) {
            return Optional.of(Side.B);
        }
        return Optional.empty();
    }

    /**
     * Parse a comma separated score string. Returns an empty list when the string
     * is blank or any set fails to parse.
     */
    public static List<SetScore> parseAll(String score) {
        if (score == null || score.isBlank()) {
            return Collections.emptyList();
        }

        List<SetScore> sets = new ArrayList<>();
        for (String part : score.split(",")) {
            Optional<SetScore> parsed = parse(part);
            if (parsed.isEmpty()) {
                return Collections.emptyList();
            }
            sets.add(parsed.get());
        }
        return sets;
    }

    public static Optional<SetScore> parse(String set) {
        if (set == null) {
            return Optional.empty();
        }
        String[] games = set.trim().split("-");
        if (games.length != 2) {
            return Optional.empty();
        }
        try {
            int a = Integer.parseInt(games[0].trim());
            int b = Integer.parseInt(games[1].trim());
            if (a < 0 || b < 0) {
                return Optional.empty();
            }
            return Optional.of(new SetScore(a, b));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
