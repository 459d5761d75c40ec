package com.tony.matchForecast.service;

import com.tony.matchForecast.model.feature.FeatureVector;
import com.tony.matchForecast.model.feature.HeadToHeadFeatures;
import com.tony.matchForecast.model.feature.TeamFeatures;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Explications lisibles d'une prédiction : raisonnement détaillé et facteurs clés.
 */
@Service
public class MatchInsightService {

    record InsightContext(FeatureVector features, double confidence) {
        TeamFeatures home() { return features.getHome(); }
        TeamFeatures away() { return features.getAway(); }
        HeadToHeadFeatures h2h() { return features.getHeadToHead(); }

        double formDiff() { return home().getFormPointsLast5() - away().getFormPointsLast5(); }
        // Positif = domicile mieux classé
        double positionDiff() { return away().getLeaguePosition() - home().getLeaguePosition(); }
        double goalDiffGap() { return home().getGoalDifferencePerGame() - away().getGoalDifferencePerGame(); }
    }

    record InsightRule(String code, Predicate<InsightContext> applies, Function<InsightContext, String> message) {}

    /**
     * Règles évaluées dans l'ordre ; chaque règle qui s'applique ajoute une ligne.
     */
    static final List<InsightRule> REASONING_RULES = List.of(
            new InsightRule("home-form",
                    c -> c.formDiff() > 3,
                    c -> fmt("Home team is in much better form (%.0f vs %.0f points in last 5 games)",
                            c.home().getFormPointsLast5(), c.away().getFormPointsLast5())),
            new InsightRule("away-form",
                    c -> c.formDiff() < -3,
                    c -> fmt("Away team is in much better form (%.0f vs %.0f points in last 5 games)",
                            c.away().getFormPointsLast5(), c.home().getFormPointsLast5())),
            new InsightRule("home-position",
                    c -> c.positionDiff() > 5,
                    c -> fmt("Significant league position advantage for home team (+%.0f positions)", c.positionDiff())),
            new InsightRule("away-position",
                    c -> c.positionDiff() < -5,
                    c -> fmt("Significant league position advantage for away team (+%.0f positions)", -c.positionDiff())),
            new InsightRule("home-advantage",
                    c -> c.features().getMatch().getLeagueAvgHomeAdvantage() > 0.1,
                    c -> fmt("Strong home advantage in this league (%.1f%% win rate boost)",
                            c.features().getMatch().getLeagueAvgHomeAdvantage() * 100)),
            new InsightRule("home-goal-difference",
                    c -> c.goalDiffGap() > 0.5,
                    c -> fmt("Home team has superior goal difference (%+.2f vs %+.2f per game)",
                            c.home().getGoalDifferencePerGame(), c.away().getGoalDifferencePerGame())),
            new InsightRule("away-goal-difference",
                    c -> c.goalDiffGap() < -0.5,
                    c -> fmt("Away team has superior goal difference (%+.2f vs %+.2f per game)",
                            c.away().getGoalDifferencePerGame(), c.home().getGoalDifferencePerGame())),
            new InsightRule("h2h-home",
                    c -> c.h2h().getMatchesPlayed() > 0 && c.h2h().homeWinRatio() > 0.6,
                    c -> fmt("Home team historically dominant in head-to-head meetings (%.0f%% wins)",
                            c.h2h().homeWinRatio() * 100)),
            new InsightRule("h2h-away",
                    c -> c.h2h().getMatchesPlayed() > 0 && c.h2h().homeWinRatio() < 0.4,
                    c -> "Away team has good head-to-head record against home team"),
            new InsightRule("high-confidence",
                    c -> c.confidence() > 0.7,
                    c -> "High confidence prediction based on multiple strong indicators"),
            new InsightRule("low-confidence",
                    c -> c.confidence() < 0.4,
                    c -> "Low confidence prediction - teams are closely matched"));

    static final List<InsightRule> KEY_FACTOR_RULES = List.of(
            new InsightRule("form-gap", c -> Math.abs(c.formDiff()) > 3,
                    c -> "Significant form difference between teams"),
            new InsightRule("position-gap", c -> Math.abs(c.positionDiff()) > 5,
                    c -> "Large league position gap"),
            new InsightRule("goal-difference-gap", c -> Math.abs(c.goalDiffGap()) > 0.5,
                    c -> "Divergent goal-scoring records"),
            new InsightRule("high-confidence", c -> c.confidence() > 0.8,
                    c -> "High prediction confidence"),
            new InsightRule("close-match", c -> c.confidence() < 0.5,
                    c -> "Close match - difficult to predict"));

    public List<String> generateReasoning(FeatureVector features, double confidence) {
        return apply(REASONING_RULES, new InsightContext(features, confidence));
    }

    public List<String> generateKeyFactors(FeatureVector features, double confidence) {
        return apply(KEY_FACTOR_RULES, new InsightContext(features, confidence));
    }

    private static List<String> apply(List<InsightRule> rules, InsightContext context) {
        List<String> lines = new ArrayList<>();
        for (InsightRule rule : rules) {
            if (rule.applies().test(context)) {
                lines.add(rule.message().apply(context));
            }
        }
        return lines.stream().filter(Objects::nonNull).toList();
    }

    private static String fmt(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
