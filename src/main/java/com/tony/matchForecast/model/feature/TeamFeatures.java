package com.tony.matchForecast.model.feature;

import com.tony.matchForecast.model.StreakType;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Features d'une équipe. Pourcentages en 0-100, moyennes par match.
 * L'ordre de {@link #numericFields()} est figé : il sert d'entrée à la stratégie en couches.
 */
@Value
@Builder
public class TeamFeatures {

    public static final int NUMERIC_SIZE = 25;

    double leaguePosition;
    double pointsPerGame;
    double winsPercentage;
    double drawsPercentage;
    double lossesPercentage;
    double goalsPerGame;
    double goalsConcededPerGame;
    double goalDifferencePerGame;

    // --- FORME (5 derniers) ---
    double formWinsLast5;
    double formDrawsLast5;
    double formLossesLast5;
    double formPointsLast5;
    double formGoalsForLast5;
    double formGoalsAgainstLast5;

    // --- FORME (10 derniers) ---
    double formWinsLast10;
    double formDrawsLast10;
    double formLossesLast10;
    double formPointsLast10;

    // --- SÉRIES ---
    @Builder.Default
    StreakType currentStreakType = StreakType.NONE;
    double currentStreakLength;
    double longestWinStreak;
    double longestLossStreak;

    double performanceTrend5;
    double performanceTrend10;

    // 0-10
    double leagueStrengthRating;
    double relativeStrength;

    // Séquence des 5 derniers résultats, hors entrées du modèle
    @Builder.Default
    String recentForm = "";

    /**
     * Série courante signée : positive pour des victoires, négative pour des défaites.
     */
    public double signedStreak() {
        return switch (currentStreakType) {
            case WIN -> currentStreakLength;
            case LOSS -> -currentStreakLength;
            default -> 0.0;
        };
    }

    public Map<String, Double> numericFields() {
        Map<String, Double> fields = new LinkedHashMap<>();
        fields.put("league_position", leaguePosition);
        fields.put("points_per_game", pointsPerGame);
        fields.put("wins_percentage", winsPercentage);
        fields.put("draws_percentage", drawsPercentage);
        fields.put("losses_percentage", lossesPercentage);
        fields.put("goals_per_game", goalsPerGame);
        fields.put("goals_conceded_per_game", goalsConcededPerGame);
        fields.put("goal_difference_per_game", goalDifferencePerGame);
        fields.put("form_wins_last_5", formWinsLast5);
        fields.put("form_draws_last_5", formDrawsLast5);
        fields.put("form_losses_last_5", formLossesLast5);
        fields.put("form_points_last_5", formPointsLast5);
        fields.put("form_goals_for_last_5", formGoalsForLast5);
        fields.put("form_goals_against_last_5", formGoalsAgainstLast5);
        fields.put("form_wins_last_10", formWinsLast10);
        fields.put("form_draws_last_10", formDrawsLast10);
        fields.put("form_losses_last_10", formLossesLast10);
        fields.put("form_points_last_10", formPointsLast10);
        fields.put("current_streak_length", currentStreakLength);
        fields.put("longest_win_streak", longestWinStreak);
        fields.put("longest_loss_streak", longestLossStreak);
        fields.put("performance_trend_5", performanceTrend5);
        fields.put("performance_trend_10", performanceTrend10);
        fields.put("league_strength_rating", leagueStrengthRating);
        fields.put("relative_strength", relativeStrength);
        return fields;
    }
}
