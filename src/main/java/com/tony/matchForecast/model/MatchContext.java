package com.tony.matchForecast.model;

import com.tony.matchForecast.exception.PredictionValidationException;

import java.time.LocalDateTime;

/**
 * Contexte d'un match à prédire. L'équipe à domicile est toujours l'équipe A.
 */
public record MatchContext(Long homeTeamId, Long awayTeamId, String league, LocalDateTime scheduledAt, String venue) {

    public MatchContext {
        if (homeTeamId == null || awayTeamId == null) {
            throw new PredictionValidationException("Les deux équipes sont requises");
        }
        if (homeTeamId.equals(awayTeamId)) {
            throw new PredictionValidationException("Une équipe ne peut pas jouer contre elle-même (ID " + homeTeamId + ")");
        }
        if (scheduledAt == null) {
            throw new PredictionValidationException("Date du match requise");
        }
    }
}
