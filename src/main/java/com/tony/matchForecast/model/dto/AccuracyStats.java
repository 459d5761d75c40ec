package com.tony.matchForecast.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class AccuracyStats {
    private long totalPredictions;
    private long evaluatedPredictions; // Matchs joués depuis
    private long correctPredictions;
    private double overallAccuracy; // 0-1

    private double avgConfidenceCorrect;
    private double avgConfidenceIncorrect;

    // Précision par issue annoncée
    private double homeWinAccuracy;
    private double drawAccuracy;
    private double awayWinAccuracy;
}
