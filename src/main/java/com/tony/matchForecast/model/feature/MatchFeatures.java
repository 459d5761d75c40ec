package com.tony.matchForecast.model.feature;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

@Value
@Builder
public class MatchFeatures {

    public static final int NUMERIC_SIZE = 11;

    double homeDaysSinceLastMatch;
    double awayDaysSinceLastMatch;
    // Somme des deux équipes sur les 14 jours précédents
    double matchesInLast14Days;
    boolean weekendMatch;
    boolean evenWeek;
    // 1-5
    double matchImportance;
    double leagueAvgGoalsPerGame;
    double leagueAvgHomeAdvantage;
    double seasonWeek;
    double seasonMatchesPlayed;
    double seasonProgressPercentage;

    public Map<String, Double> numericFields() {
        Map<String, Double> fields = new LinkedHashMap<>();
        fields.put("home_days_since_last_match", homeDaysSinceLastMatch);
        fields.put("away_days_since_last_match", awayDaysSinceLastMatch);
        fields.put("matches_in_last_14_days", matchesInLast14Days);
        fields.put("weekend_match", weekendMatch ? 1.0 : 0.0);
        fields.put("even_week", evenWeek ? 1.0 : 0.0);
        fields.put("match_importance", matchImportance);
        fields.put("league_avg_goals_per_game", leagueAvgGoalsPerGame);
        fields.put("league_avg_home_advantage", leagueAvgHomeAdvantage);
        fields.put("season_week", seasonWeek);
        fields.put("season_matches_played", seasonMatchesPlayed);
        fields.put("season_progress_percentage", seasonProgressPercentage);
        return fields;
    }
}
