package com.dealengine.game;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.OptionalInt;

/**
 * Immutable snapshot of a completed game's result and counted statistics.
 *
 * Produced once per game by the game data service. Trigger conditions address
 * first-class fields by the names declared here; any other name is looked up in
 * {@link #getCountedStats()}.
 */
@Value
@Builder
public class GameFact {

    public static final String IS_HOME = "isHome";
    public static final String IS_COMPLETE = "isComplete";
    public static final String TEAM_SCORE = "teamScore";
    public static final String OPPONENT_SCORE = "opponentScore";
    public static final String RUN_DIFFERENTIAL = "runDifferential";

    String gameId;

    /**
     * Team the fact is reported for; deals are looked up by this team.
     */
    String teamId;

    boolean home;

    boolean complete;

    Integer teamScore;

    Integer opponentScore;

    @Singular("stat")
    Map<String, Integer> countedStats;

    /**
     * Resolve a fact by name. Missing scores or stats resolve to empty rather than zero.
     */
    public OptionalInt valueOf(String fact) {
        if (fact == null) {
            return OptionalInt.empty();
        }
        switch (fact) {
            case IS_HOME:
                return OptionalInt.of(home ? 1 : 0);
            case IS_COMPLETE:
                return OptionalInt.of(complete ? 1 : 0);
            case TEAM_SCORE:
                return teamScore == null ? OptionalInt.empty() : OptionalInt.of(teamScore);
            case OPPONENT_SCORE:
                return opponentScore == null ? OptionalInt.empty() : OptionalInt.of(opponentScore);
            case RUN_DIFFERENTIAL:
                if (teamScore == null || opponentScore == null) {
                    return OptionalInt.empty();
                }
                return OptionalInt.of(teamScore - opponentScore);
            default:
                Integer value = countedStats.get(fact);
                return value == null ? OptionalInt.empty() : OptionalInt.of(value);
        }
    }
}
