package com.tony.matchForecast.service.strategy;

import com.tony.matchForecast.config.ForecastProperties;
import com.tony.matchForecast.model.OutcomeProbabilities;
import com.tony.matchForecast.model.feature.FeatureVector;
import com.tony.matchForecast.model.feature.TeamFeatures;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Cascade de signaux indépendants (forme, différence de buts, classement, domicile, tendance),
 * chacun ajoutant un score à un des trois paniers.
 */
@Component
@Order(1)
public class RuleCascadeStrategy extends AbstractScoringStrategy {

    private static final double DRAW_BASE = 0.2;
    private static final double FLOOR = 0.05;
    private static final double CEILING = 0.9;

    @Override
    public String name() {
        return ForecastProperties.RULE_CASCADE;
    }

    @Override
    protected OutcomeProbabilities distribution(FeatureVector features) {
        TeamFeatures home = features.getHome();
        TeamFeatures away = features.getAway();

        double homeScore = 0.0;
        double drawScore = 0.0;
        double awayScore = 0.0;

        // 1. Forme (5 derniers)
        double formDiff = home.getFormPointsLast5() - away.getFormPointsLast5();
        if (formDiff > 3) homeScore += 0.3;
        else if (formDiff < -3) awayScore += 0.3;
        else drawScore += 0.1;

        // 2. Différence de buts par match
        double gdDiff = home.getGoalDifferencePerGame() - away.getGoalDifferencePerGame();
        if (gdDiff > 0.5) homeScore += 0.25;
        else if (gdDiff < -0.5) awayScore += 0.25;

        // 3. Classement (positif = domicile mieux classé)
        double positionDiff = away.getLeaguePosition() - home.getLeaguePosition();
        if (positionDiff > 3) homeScore += 0.2;
        else if (positionDiff < -3) awayScore += 0.2;

        // 4. Avantage domicile de la ligue
        homeScore += 0.15 * features.getMatch().getLeagueAvgHomeAdvantage();

        // 5. Dynamique récente
        double trendDiff = home.getPerformanceTrend5() - away.getPerformanceTrend5();
        if (trendDiff > 1) homeScore += 0.15;
        else if (trendDiff < -1) awayScore += 0.15;

        double drawBucket = drawScore + DRAW_BASE;
        double total = homeScore + drawBucket + awayScore;

        return OutcomeProbabilities.normalize(
                clamp(homeScore / total),
                clamp(drawBucket / total),
                clamp(awayScore / total));
    }

    private static double clamp(double p) {
        return Math.max(FLOOR, Math.min(CEILING, p));
    }
}
