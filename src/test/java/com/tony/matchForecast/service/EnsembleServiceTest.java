package com.tony.matchForecast.service;

import com.tony.matchForecast.config.ForecastProperties;
import com.tony.matchForecast.model.EnsembleResult;
import com.tony.matchForecast.model.FeatureImportance;
import com.tony.matchForecast.model.Outcome;
import com.tony.matchForecast.model.OutcomeProbabilities;
import com.tony.matchForecast.model.StrategyEstimate;
import com.tony.matchForecast.model.feature.ExternalFactors;
import com.tony.matchForecast.model.feature.FeatureVector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tony.matchForecast.ForecastTestData.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

class EnsembleServiceTest {

    private EnsembleService ensembleService;

    @BeforeEach
    void setUp() {
        ForecastProperties properties = new ForecastProperties();
        ensembleService = new EnsembleService(properties, new FeatureImportanceService(properties), new MatchInsightService());
    }

    private static StrategyEstimate estimate(String strategy, Outcome outcome, double probability) {
        return new StrategyEstimate(strategy, outcome, probability, OutcomeProbabilities.uniform(), false);
    }

    private static FeatureVector neutralVector(double homeAdvantage) {
        return vector(averageTeam().build(), averageTeam().build(), homeAdvantage);
    }

    @Test
    void weightsEachStrategyOnItsOutcome() {
        List<StrategyEstimate> estimates = List.of(
                estimate("rule-cascade", Outcome.HOME_WIN, 0.6),
                estimate("majority-vote", Outcome.DRAW, 0.6),
                estimate("layered-weights", Outcome.HOME_WIN, 0.5));

        EnsembleResult result = ensembleService.combine(estimates, neutralVector(0.15));

        // domicile 0.24 + 0.15 + 0.015, nul 0.18
        double home = 0.4 * 0.6 + 0.3 * 0.5 + 0.015;
        double draw = 0.3 * 0.6;
        assertThat(result.getPredictedOutcome()).isEqualTo(Outcome.HOME_WIN);
        assertThat(result.getProbabilities().homeWin()).isCloseTo(home / (home + draw), offset(1e-9));
        assertThat(result.getProbabilities().awayWin()).isZero();
        assertThat(result.getProbabilities().sum()).isCloseTo(1.0, offset(1e-9));
        assertThat(result.getConfidence()).isEqualTo(result.getProbabilities().max());
        assertThat(result.getContributingStrategies()).isEqualTo(3);
        assertThat(result.isDegraded()).isFalse();
        assertThat(result.isExternalFactorsPlaceholder()).isTrue();
    }

    @Test
    @DisplayName("Égalité domicile / extérieur : le nul l'emporte")
    void tieResolvesToDraw() {
        List<StrategyEstimate> estimates = List.of(
                estimate("rule-cascade", Outcome.DRAW, 0.3),
                estimate("majority-vote", Outcome.HOME_WIN, 0.5),
                estimate("layered-weights", Outcome.AWAY_WIN, 0.5));

        EnsembleResult result = ensembleService.combine(estimates, neutralVector(0.0));

        assertThat(result.getProbabilities().homeWin()).isEqualTo(result.getProbabilities().awayWin());
        assertThat(result.getPredictedOutcome()).isEqualTo(Outcome.DRAW);
        assertThat(result.getConfidence()).isCloseTo(0.15 / 0.42, offset(1e-9));
    }

    @Test
    void noMassGivesUniformDraw() {
        EnsembleResult result = ensembleService.combine(List.of(), neutralVector(0.0));

        assertThat(result.getPredictedOutcome()).isEqualTo(Outcome.DRAW);
        assertThat(result.getConfidence()).isCloseTo(1.0 / 3, offset(1e-12));
    }

    @Test
    @DisplayName("Un avantage domicile négatif n'est pas retranché")
    void negativeHomeAdvantageIsClamped() {
        List<StrategyEstimate> estimates = List.of(
                estimate("rule-cascade", Outcome.DRAW, 0.5),
                estimate("majority-vote", Outcome.HOME_WIN, 0.5));

        EnsembleResult result = ensembleService.combine(estimates, neutralVector(-0.5));

        assertThat(result.getProbabilities().homeWin()).isCloseTo(0.15 / 0.35, offset(1e-9));
    }

    @Test
    void fallbackEstimatesMarkResultDegraded() {
        List<StrategyEstimate> estimates = List.of(
                estimate("rule-cascade", Outcome.HOME_WIN, 0.7),
                StrategyEstimate.neutral("majority-vote"),
                StrategyEstimate.neutral("layered-weights"));

        EnsembleResult result = ensembleService.combine(estimates, neutralVector(0.15));

        assertThat(result.getContributingStrategies()).isEqualTo(1);
        assertThat(result.isDegraded()).isTrue();
        assertThat(result.getStrategyEstimates()).hasSize(3);
    }

    @Test
    void failedExternalLookupMarksResultDegraded() {
        FeatureVector features = FeatureVector.builder()
                .home(averageTeam().build())
                .away(averageTeam().build())
                .match(match(0.15))
                .headToHead(neutralVector(0.15).getHeadToHead())
                .external(ExternalFactors.unavailable())
                .build();

        EnsembleResult result = ensembleService.combine(List.of(estimate("rule-cascade", Outcome.DRAW, 0.8)), features);

        assertThat(result.isDegraded()).isTrue();
    }

    @Test
    @DisplayName("Importance triée par score décroissant avec contribution par stratégie")
    void featureImportanceIsRanked() {
        List<StrategyEstimate> estimates = List.of(
                estimate("rule-cascade", Outcome.HOME_WIN, 0.6),
                estimate("majority-vote", Outcome.HOME_WIN, 0.6),
                estimate("layered-weights", Outcome.HOME_WIN, 0.6));

        List<FeatureImportance> importance = ensembleService.combine(estimates, neutralVector(0.15)).getFeatureImportance();

        assertThat(importance).hasSize(8);
        assertThat(importance.get(0).featureName()).isEqualTo("home_form_points_last_5");
        assertThat(importance.get(0).contributions().get("rule-cascade")).isCloseTo(0.18, offset(1e-12));
        assertThat(importance.get(0).contributions().get("layered-weights")).isCloseTo(0.12, offset(1e-12));
        assertThat(importance).extracting(FeatureImportance::importanceScore)
                .isSortedAccordingTo((a, b) -> Double.compare(b, a));
        assertThat(importance.get(importance.size() - 1).featureName()).isEqualTo("h2h_home_wins");
    }
}
