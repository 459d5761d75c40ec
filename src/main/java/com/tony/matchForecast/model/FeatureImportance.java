package com.tony.matchForecast.model;

import java.util.Map;

/**
 * Poids statique d'une feature (table de transparence, pas une mesure statistique).
 *
 * @param contributions contribution par stratégie (poids de base x multiplicateur)
 */
public record FeatureImportance(
        String featureName,
        double importanceScore,
        String description,
        Map<String, Double> contributions) {

    public FeatureImportance {
        contributions = Map.copyOf(contributions);
    }
}
