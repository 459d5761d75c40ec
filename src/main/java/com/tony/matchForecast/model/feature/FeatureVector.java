package com.tony.matchForecast.model.feature;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Vecteur complet d'un match. Les facteurs externes ne font pas partie des entrées du modèle en couches.
 */
@Value
@Builder
public class FeatureVector {

    public static final int MODEL_INPUT_SIZE =
            2 * TeamFeatures.NUMERIC_SIZE + MatchFeatures.NUMERIC_SIZE + HeadToHeadFeatures.NUMERIC_SIZE;

    @NonNull TeamFeatures home;
    @NonNull TeamFeatures away;
    @NonNull MatchFeatures match;
    @NonNull HeadToHeadFeatures headToHead;
    @NonNull ExternalFactors external;

    /**
     * Entrées du modèle, ordre : domicile, extérieur, match, confrontations.
     */
    public double[] modelInputs() {
        return modelInputFields().values().stream().mapToDouble(Double::doubleValue).toArray();
    }

    public Map<String, Double> modelInputFields() {
        Map<String, Double> fields = new LinkedHashMap<>();
        home.numericFields().forEach((k, v) -> fields.put("home_" + k, v));
        away.numericFields().forEach((k, v) -> fields.put("away_" + k, v));
        fields.putAll(match.numericFields());
        fields.putAll(headToHead.numericFields());
        return fields;
    }

    public Map<String, Double> allNumericFields() {
        Map<String, Double> fields = modelInputFields();
        fields.putAll(external.numericFields());
        return fields;
    }
}
