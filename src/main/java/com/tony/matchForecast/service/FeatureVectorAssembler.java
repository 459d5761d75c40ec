package com.tony.matchForecast.service;

import com.tony.matchForecast.exception.PredictionValidationException;
import com.tony.matchForecast.model.feature.ExternalFactors;
import com.tony.matchForecast.model.feature.FeatureVector;
import com.tony.matchForecast.model.feature.HeadToHeadFeatures;
import com.tony.matchForecast.model.feature.MatchFeatures;
import com.tony.matchForecast.model.feature.TeamFeatures;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class FeatureVectorAssembler {

    /**
     * Fusionne les familles de features. Toute valeur NaN ou infinie est rejetée.
     */
    public FeatureVector assemble(TeamFeatures home, TeamFeatures away, MatchFeatures match,
                                  HeadToHeadFeatures headToHead, ExternalFactors external) {
        FeatureVector vector = FeatureVector.builder()
                .home(home)
                .away(away)
                .match(match)
                .headToHead(headToHead)
                .external(external)
                .build();

        for (Map.Entry<String, Double> field : vector.allNumericFields().entrySet()) {
            if (!Double.isFinite(field.getValue())) {
                throw new PredictionValidationException(
                        "Feature non finie : " + field.getKey() + " = " + field.getValue());
            }
        }
        return vector;
    }
}
