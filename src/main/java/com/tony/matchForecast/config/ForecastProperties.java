package com.tony.matchForecast.config;

import jakarta.annotation.PostConstruct;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "forecast")
@Data
public class ForecastProperties {

    public static final String RULE_CASCADE = "rule-cascade";
    public static final String MAJORITY_VOTE = "majority-vote";
    public static final String LAYERED_WEIGHTS = "layered-weights";

    private static final double WEIGHT_TOLERANCE = 1e-9;

    // --- Pondération de l'ensemble (somme = 1) ---
    private Map<String, Double> strategyWeights = new LinkedHashMap<>(Map.of(
            RULE_CASCADE, 0.4,
            MAJORITY_VOTE, 0.3,
            LAYERED_WEIGHTS, 0.3));

    // Multiplicateurs de la table d'importance, par stratégie
    private Map<String, Double> strategyMultipliers = new LinkedHashMap<>(Map.of(
            RULE_CASCADE, 1.2,
            MAJORITY_VOTE, 1.0,
            LAYERED_WEIGHTS, 0.8));

    // Bonus domicile de l'ensemble = avantage ligue x ce facteur
    private double homeAdvantageAdjustment = 0.1;
    private double highConfidenceThreshold = 0.75;

    // --- Agrégation ---
    private int historyWindow = 10;
    private int headToHeadLimit = 20;
    private int defaultRestDays = 14;

    // --- Ressources ---
    private Duration lookupTimeout = Duration.ofSeconds(5);
    private Batch batch = new Batch();

    private List<ImportanceEntry> featureImportance = new ArrayList<>(List.of(
            new ImportanceEntry("home_form_points_last_5", 0.15, "Home team recent form (last 5 games)"),
            new ImportanceEntry("home_goals_per_game", 0.12, "Home team scoring rate"),
            new ImportanceEntry("away_form_points_last_5", 0.12, "Away team recent form (last 5 games)"),
            new ImportanceEntry("away_goals_per_game", 0.10, "Away team scoring rate"),
            new ImportanceEntry("home_league_position", 0.08, "Home team current league position"),
            new ImportanceEntry("away_league_position", 0.08, "Away team current league position"),
            new ImportanceEntry("h2h_home_wins", 0.04, "Historical head-to-head record"),
            new ImportanceEntry("league_avg_home_advantage", 0.06, "League-specific home advantage factor")));

    @Data
    public static class Batch {
        private int maxSize = 20;
        private int chunkSize = 5;
        private Duration pause = Duration.ofMillis(100);
        private int threads = 5;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ImportanceEntry {
        private String name;
        private double weight;
        private String description;
    }

    @PostConstruct
    public void validate() {
        double sum = strategyWeights.values().stream().mapToDouble(Double::doubleValue).sum();
        if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
            throw new IllegalStateException("La somme des poids des stratégies doit valoir 1 (actuel : " + sum + ")");
        }
        if (batch.chunkSize < 1 || batch.maxSize < 1) {
            throw new IllegalStateException("Paramètres de lot invalides : " + batch);
        }
    }

    public double weightOf(String strategy) {
        return strategyWeights.getOrDefault(strategy, 0.0);
    }

    public double multiplierOf(String strategy) {
        return strategyMultipliers.getOrDefault(strategy, 1.0);
    }
}
