package com.tony.matchForecast.model.feature;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Confrontations directes vues depuis l'équipe qui reçoit.
 */
@Value
@Builder
public class HeadToHeadFeatures {

    public static final int NUMERIC_SIZE = 13;

    double matchesPlayed;
    double homeWins;
    double draws;
    double awayWins;
    double homeGoalsAvg;
    double awayGoalsAvg;
    double totalGoalsAvg;

    // 5 dernières confrontations
    double recentHomeWins;
    double recentDraws;
    double recentAwayWins;
    // Solde récent - solde global
    double trend;

    // Confrontations jouées chez l'équipe qui reçoit aujourd'hui
    double venueHomeWins;
    double venueMatches;

    // Hors entrées du modèle, null sans confrontation
    LocalDateTime lastMeetingDate;

    public static HeadToHeadFeatures empty() {
        return HeadToHeadFeatures.builder().build();
    }

    public double homeWinRatio() {
        return matchesPlayed > 0 ? homeWins / matchesPlayed : 0.0;
    }

    public Map<String, Double> numericFields() {
        Map<String, Double> fields = new LinkedHashMap<>();
        fields.put("h2h_matches_played", matchesPlayed);
        fields.put("h2h_home_wins", homeWins);
        fields.put("h2h_draws", draws);
        fields.put("h2h_away_wins", awayWins);
        fields.put("h2h_home_goals_avg", homeGoalsAvg);
        fields.put("h2h_away_goals_avg", awayGoalsAvg);
        fields.put("h2h_total_goals_avg", totalGoalsAvg);
        fields.put("h2h_recent_home_wins", recentHomeWins);
        fields.put("h2h_recent_draws", recentDraws);
        fields.put("h2h_recent_away_wins", recentAwayWins);
        fields.put("h2h_trend", trend);
        fields.put("h2h_venue_home_wins", venueHomeWins);
        fields.put("h2h_venue_matches", venueMatches);
        return fields;
    }
}
