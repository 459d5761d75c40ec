package com.tony.matchForecast.model.dto;

import com.tony.matchForecast.model.Outcome;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Builder
public class PredictionHistoryEntry {
    private Long predictionId;
    private String homeTeam;
    private String awayTeam;
    private LocalDateTime matchDate;

    private Outcome predictedOutcome;
    private double homeWinProbability;
    private double drawProbability;
    private double awayWinProbability;
    private double confidence;

    // Null tant que le match n'est pas joué
    private Outcome actualOutcome;
    private Boolean correct;

    private LocalDateTime createdAt;
}
