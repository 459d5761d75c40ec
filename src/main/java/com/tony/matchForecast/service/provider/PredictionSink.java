package com.tony.matchForecast.service.provider;

import com.tony.matchForecast.model.EnsembleResult;
import com.tony.matchForecast.model.MatchContext;

/**
 * Archivage des prédictions. Un échec ne doit jamais remonter à l'appelant du moteur.
 */
public interface PredictionSink {

    void store(MatchContext context, EnsembleResult result, boolean highConfidence);
}
