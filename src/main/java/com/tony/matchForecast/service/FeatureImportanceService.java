package com.tony.matchForecast.service;

import com.tony.matchForecast.config.ForecastProperties;
import com.tony.matchForecast.model.FeatureImportance;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Table d'importance statique (configurable), déclinée par stratégie via les multiplicateurs.
 */
@Service
@RequiredArgsConstructor
public class FeatureImportanceService {

    private final ForecastProperties properties;

    public List<FeatureImportance> rank(List<String> strategies) {
        return properties.getFeatureImportance().stream()
                .map(entry -> {
                    Map<String, Double> contributions = new LinkedHashMap<>();
                    for (String strategy : strategies) {
                        contributions.put(strategy, entry.getWeight() * properties.multiplierOf(strategy));
                    }
                    return new FeatureImportance(entry.getName(), entry.getWeight(), entry.getDescription(), contributions);
                })
                // Tri stable : à poids égal, l'ordre de la table est conservé
                .sorted(Comparator.comparingDouble(FeatureImportance::importanceScore).reversed())
                .toList();
    }
}
