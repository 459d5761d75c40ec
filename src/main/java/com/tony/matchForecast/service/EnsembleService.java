package com.tony.matchForecast.service;

import com.tony.matchForecast.config.ForecastProperties;
import com.tony.matchForecast.model.EnsembleResult;
import com.tony.matchForecast.model.Outcome;
import com.tony.matchForecast.model.OutcomeProbabilities;
import com.tony.matchForecast.model.StrategyEstimate;
import com.tony.matchForecast.model.feature.FeatureVector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Combine les estimations des stratégies en une distribution unique, puis l'explique.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EnsembleService {

    private final ForecastProperties properties;
    private final FeatureImportanceService featureImportanceService;
    private final MatchInsightService insightService;

    public EnsembleResult combine(List<StrategyEstimate> estimates, FeatureVector features) {
        return combine(estimates, features, properties.getStrategyWeights());
    }

    /**
     * Chaque stratégie verse sa probabilité (x son poids) sur l'issue qu'elle annonce.
     * Bonus domicile = max(0, avantage ligue) x facteur d'ajustement, puis normalisation.
     */
    public EnsembleResult combine(List<StrategyEstimate> estimates, FeatureVector features, Map<String, Double> weights) {
        Map<Outcome, Double> buckets = new EnumMap<>(Outcome.class);
        for (Outcome o : Outcome.values()) buckets.put(o, 0.0);

        for (StrategyEstimate estimate : estimates) {
            double weight = weights.getOrDefault(estimate.strategy(), 0.0);
            buckets.merge(estimate.outcome(), weight * estimate.probability(), Double::sum);
        }

        double homeAdvantage = Math.max(0.0, features.getMatch().getLeagueAvgHomeAdvantage());
        buckets.merge(Outcome.HOME_WIN, homeAdvantage * properties.getHomeAdvantageAdjustment(), Double::sum);

        OutcomeProbabilities probabilities = OutcomeProbabilities.normalize(
                buckets.get(Outcome.HOME_WIN), buckets.get(Outcome.DRAW), buckets.get(Outcome.AWAY_WIN));
        Outcome outcome = probabilities.mostLikely();
        double confidence = probabilities.max();

        int contributing = (int) estimates.stream().filter(e -> !e.fallback()).count();
        boolean degraded = contributing < estimates.size() || features.getExternal().isLookupFailed();

        List<String> strategies = estimates.stream().map(StrategyEstimate::strategy).toList();

        EnsembleResult result = EnsembleResult.builder()
                .predictedOutcome(outcome)
                .probabilities(probabilities)
                .confidence(confidence)
                .featureImportance(featureImportanceService.rank(strategies))
                .reasoning(insightService.generateReasoning(features, confidence))
                .keyFactors(insightService.generateKeyFactors(features, confidence))
                .strategyEstimates(estimates)
                .contributingStrategies(contributing)
                .degraded(degraded)
                .externalFactorsPlaceholder(features.getExternal().isPlaceholder())
                .build();

        log.info("🎯 Ensemble : {} ({}) - {}/{} stratégies{}", outcome.getCode(),
                String.format("%.3f", confidence), contributing, estimates.size(), degraded ? " [dégradé]" : "");
        return result;
    }
}
