package com.tony.matchForecast.service.strategy;

import com.tony.matchForecast.config.ForecastProperties;
import com.tony.matchForecast.model.Outcome;
import com.tony.matchForecast.model.OutcomeProbabilities;
import com.tony.matchForecast.model.feature.FeatureVector;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Cinq règles votantes. Chaque règle compare deux scalaires avec une marge fixe ;
 * hors marge, elle vote pour le nul. Probabilité = votes / nombre de règles.
 */
@Component
@Order(2)
public class MajorityVoteStrategy extends AbstractScoringStrategy {

    record VotingRule(String code, Function<FeatureVector, Double> homeValue,
                      Function<FeatureVector, Double> awayValue, double margin) {

        Outcome vote(FeatureVector features) {
            double diff = homeValue.apply(features) - awayValue.apply(features);
            if (diff > margin) return Outcome.HOME_WIN;
            if (diff < -margin) return Outcome.AWAY_WIN;
            return Outcome.DRAW;
        }
    }

    static final List<VotingRule> RULES = List.of(
            new VotingRule("form", f -> f.getHome().getFormPointsLast5(), f -> f.getAway().getFormPointsLast5(), 2.0),
            // Plus petit = mieux classé : on compare les opposés
            new VotingRule("position", f -> -f.getHome().getLeaguePosition(), f -> -f.getAway().getLeaguePosition(), 3.0),
            new VotingRule("attack", f -> f.getHome().getGoalsPerGame(), f -> f.getAway().getGoalsPerGame(), 0.5),
            new VotingRule("home-points",
                    f -> f.getHome().getPointsPerGame() + f.getMatch().getLeagueAvgHomeAdvantage(),
                    f -> f.getAway().getPointsPerGame(), 0.5),
            new VotingRule("streak", f -> f.getHome().signedStreak(), f -> f.getAway().signedStreak(), 3.0));

    @Override
    public String name() {
        return ForecastProperties.MAJORITY_VOTE;
    }

    @Override
    protected OutcomeProbabilities distribution(FeatureVector features) {
        Map<Outcome, Integer> votes = new EnumMap<>(Outcome.class);
        for (VotingRule rule : RULES) {
            votes.merge(rule.vote(features), 1, Integer::sum);
        }

        double n = RULES.size();
        return new OutcomeProbabilities(
                votes.getOrDefault(Outcome.HOME_WIN, 0) / n,
                votes.getOrDefault(Outcome.DRAW, 0) / n,
                votes.getOrDefault(Outcome.AWAY_WIN, 0) / n);
    }
}
