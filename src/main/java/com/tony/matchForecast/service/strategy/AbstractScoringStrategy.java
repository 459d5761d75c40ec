package com.tony.matchForecast.service.strategy;

import com.tony.matchForecast.model.OutcomeProbabilities;
import com.tony.matchForecast.model.StrategyEstimate;
import com.tony.matchForecast.model.feature.FeatureVector;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public abstract class AbstractScoringStrategy implements ScoringStrategy {

    @Override
    public final StrategyEstimate score(FeatureVector features) {
        try {
            StrategyEstimate estimate = StrategyEstimate.of(name(), distribution(features));
            log.debug("🧮 {} -> {} ({})", name(), estimate.outcome(), String.format("%.3f", estimate.probability()));
            return estimate;
        } catch (RuntimeException e) {
            log.warn("⚠️ Stratégie {} en échec, estimation neutre : {}", name(), e.getMessage());
            return StrategyEstimate.neutral(name());
        }
    }

    /**
     * Distribution 1N2 normalisée.
     */
    protected abstract OutcomeProbabilities distribution(FeatureVector features);
}
