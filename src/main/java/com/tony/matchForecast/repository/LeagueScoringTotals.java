package com.tony.matchForecast.repository;

/**
 * Projection des totaux de buts et de victoires d'une ligue.
 */
public interface LeagueScoringTotals {

    Long getMatches();

    Long getTotalGoals();

    Long getHomeWins();

    Long getAwayWins();
}
