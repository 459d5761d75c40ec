package com.tony.matchForecast.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Résultat final de l'ensemble. C'est l'artefact renvoyé à l'appelant (et archivé).
 */
@Value
@Builder
public class EnsembleResult {
    Outcome predictedOutcome;
    OutcomeProbabilities probabilities;
    double confidence;

    List<FeatureImportance> featureImportance;
    List<String> reasoning;
    List<String> keyFactors;
    List<StrategyEstimate> strategyEstimates;

    // Nombre de stratégies qui n'ont PAS basculé sur l'estimation neutre
    int contributingStrategies;
    // Vrai dès qu'une stratégie ou un collaborateur non critique a dégradé le calcul
    boolean degraded;
    // Les facteurs externes sont des valeurs par défaut (pas de flux réel)
    boolean externalFactorsPlaceholder;
}
