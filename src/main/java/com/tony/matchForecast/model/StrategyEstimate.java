package com.tony.matchForecast.model;

/**
 * Sortie d'une stratégie de scoring pour une prédiction.
 *
 * @param fallback vrai si la stratégie a planté et renvoie l'estimation neutre
 */
public record StrategyEstimate(
        String strategy,
        Outcome outcome,
        double probability,
        OutcomeProbabilities distribution,
        boolean fallback) {

    public static StrategyEstimate of(String strategy, OutcomeProbabilities distribution) {
        Outcome outcome = distribution.mostLikely();
        return new StrategyEstimate(strategy, outcome, distribution.get(outcome), distribution, false);
    }

    public static StrategyEstimate neutral(String strategy) {
        OutcomeProbabilities uniform = OutcomeProbabilities.uniform();
        return new StrategyEstimate(strategy, Outcome.DRAW, uniform.draw(), uniform, true);
    }
}
