package com.dealengine.condition;

import com.dealengine.game.GameFact;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Domain vocabulary of the condition language.
 *
 * Maps every accepted phrase (one to three words) to its meaning. Stat phrases
 * resolve to the fact key used by {@link GameFact#valueOf(String)}.
 */
final class StatVocabulary {

    enum Kind {
        STAT,
        WIN,
        LOSS,
        HOME,
        AWAY,
        ANY,
        GAME,
        FILLER
    }

    static final class Term {
        final Kind kind;
        final String factKey;

        private Term(Kind kind, String factKey) {
            this.kind = kind;
            this.factKey = factKey;
        }
    }

    static final int MAX_PHRASE_WORDS = 3;

    private static final Map<String, Term> PHRASES = new HashMap<>();

    static {
        stat("runs", "runs", "run", "runs scored", "run scored");
        stat("hits", "hits", "hit");
        stat("strikeouts", "strikeouts", "strikeout", "strike outs", "strike out", "ks", "k");
        stat("stolenBases", "stolen bases", "stolen base", "steals", "steal", "stolen", "sb");
        stat("homeRuns", "home runs", "home run", "homers", "homer", "hr");
        stat("doubles", "doubles", "double");
        stat("walks", "walks", "walk");
        stat("goals", "goals", "goal");
        stat("points", "points", "point");
        stat(GameFact.TEAM_SCORE, "team score", "score");
        stat(GameFact.OPPONENT_SCORE, "opponent score", "opponent runs", "runs allowed");
        stat(GameFact.RUN_DIFFERENTIAL, "run differential", "margin");

        term(Kind.WIN, "win", "wins", "won", "victory");
        term(Kind.LOSS, "loss", "lose", "loses", "lost");
        term(Kind.HOME, "home", "at home");
        term(Kind.AWAY, "away", "road", "on the road");
        term(Kind.ANY, "any");
        term(Kind.GAME, "game", "games");
        term(Kind.FILLER, "a", "an", "the", "with");
    }

    /** Units allowed after a winning margin, as in "win by 5 runs". */
    static final Set<String> MARGIN_UNITS = Set.of("run", "runs", "point", "points");

    private static final Set<String> KNOWN_WORDS = PHRASES.keySet().stream()
        .flatMap(phrase -> Arrays.stream(phrase.split(" ")))
        .collect(Collectors.toUnmodifiableSet());

    private StatVocabulary() {
    }

    static Optional<Term> lookup(String phrase) {
        return Optional.ofNullable(PHRASES.get(phrase));
    }

    static boolean isKnownWord(String word) {
        return KNOWN_WORDS.contains(word);
    }

    private static void stat(String factKey, String... phrases) {
        for (String phrase : phrases) {
            PHRASES.put(phrase, new Term(Kind.STAT, factKey));
        }
    }

    private static void term(Kind kind, String... phrases) {
        for (String phrase : phrases) {
            PHRASES.put(phrase, new Term(kind, null));
        }
    }
}
