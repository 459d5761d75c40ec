package com.tony.matchForecast.service.strategy;

import com.tony.matchForecast.model.StrategyEstimate;
import com.tony.matchForecast.model.feature.FeatureVector;

/**
 * Stratégie de scoring indépendante. Ne doit jamais lever d'exception :
 * en cas de problème interne, elle renvoie l'estimation neutre.
 */
public interface ScoringStrategy {

    String name();

    StrategyEstimate score(FeatureVector features);
}
