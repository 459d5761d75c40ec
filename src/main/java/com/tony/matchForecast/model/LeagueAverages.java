package com.tony.matchForecast.model;

/**
 * @param avgGoalsPerGame   buts par match (les deux équipes)
 * @param avgHomeAdvantage  avantage domicile, ex: 0.15 = +15% de victoires à domicile
 */
public record LeagueAverages(double avgGoalsPerGame, double avgHomeAdvantage) {

    public static final LeagueAverages DEFAULT = new LeagueAverages(2.5, 0.15);
}
