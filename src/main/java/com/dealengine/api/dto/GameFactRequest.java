package com.dealengine.api.dto;

import com.dealengine.game.GameFact;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * DTO for a completed (or in-progress) game result reported for one team.
 */
@Data
public class GameFactRequest {

    @NotBlank(message = "Game ID is required")
    private String gameId;

    @NotBlank(message = "Team ID is required")
    private String teamId;

    private boolean home;

    private boolean complete;

    @Min(value = 0, message = "Team score cannot be negative")
    private Integer teamScore;

    @Min(value = 0, message = "Opponent score cannot be negative")
    private Integer opponentScore;

    private Map<String, @Min(value = 0, message = "Stat counts cannot be negative") Integer> countedStats = new HashMap<>();

    public GameFact toFact() {
        GameFact.GameFactBuilder builder = GameFact.builder()
            .gameId(gameId)
            .teamId(teamId)
            .home(home)
            .complete(complete)
            .teamScore(teamScore)
            .opponentScore(opponentScore);
        if (countedStats != null) {
            countedStats.forEach((name, value) -> {
                if (value != null) {
                    builder.stat(name, value);
                }
            });
        }
        return builder.build();
    }
}
