package com.tony.matchForecast.model.dto;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Contexte historique affiché avec la prédiction : bilan des confrontations et forme récente des deux équipes.
 */
@Data
@Builder
public class HistoricalContext {

    private HeadToHeadRecord headToHeadRecord;
    private FormComparison homeTeamForm;
    private FormComparison awayTeamForm;

    @Data
    @Builder
    public static class HeadToHeadRecord {
        private int totalMatches;
        private int homeTeamWins;
        private int draws;
        private int awayTeamWins;
        // null si les équipes ne se sont jamais affrontées
        private LocalDateTime lastMeeting;
    }

    @Data
    @Builder
    public static class FormComparison {
        private String last5Games;
        private int points;
        // Buts estimés à partir des symboles
        private int goalsFor;
        private int goalsAgainst;
    }
}
