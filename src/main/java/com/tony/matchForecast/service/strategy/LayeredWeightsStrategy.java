package com.tony.matchForecast.service.strategy;

import com.tony.matchForecast.config.ForecastProperties;
import com.tony.matchForecast.model.OutcomeProbabilities;
import com.tony.matchForecast.model.feature.FeatureVector;
import com.tony.matchForecast.model.feature.TeamFeatures;
import org.apache.commons.math3.analysis.function.Sigmoid;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Réseau figé à trois couches : 8 unités logistiques, 4 unités logistiques, softmax sur 3 issues.
 * Les poids sont des constantes : pas d'apprentissage.
 * <p>
 * Entrées = {@link FeatureVector#modelInputs()}. Chaque feature est ramenée à [0, 1] sur sa propre plage
 * {@code [min, max]} : {@code clamp((v - min) / (max - min), 0, 1)}. Les features signées (différence de buts,
 * tendances) ont une plage centrée sur 0, le classement est lu sur 1-20. Les plages sont identiques pour les
 * deux équipes, ce qui garde le réseau symétrique. L'avantage domicile de la ligue est lu sur [0, 1] :
 * un avantage négatif ne pousse pas vers l'extérieur.
 */
@Component
@Order(3)
public class LayeredWeightsStrategy extends AbstractScoringStrategy {

    static final int INPUT_SIZE = FeatureVector.MODEL_INPUT_SIZE;

    // Poids d'une feature d'équipe (ordre de TeamFeatures#numericFields)
    private static final double[] TEAM_WEIGHTS = {
            -0.3, // league_position
            0.8,  // points_per_game
            0.0, 0.0, 0.0, // wins/draws/losses %
            0.5,  // goals_per_game
            -0.5, // goals_conceded_per_game
            0.5,  // goal_difference_per_game
            0.4, 0.0, -0.4, 0.3, 0.1, -0.1, // forme 5
            0.2, 0.0, -0.2, 0.2, // forme 10
            0.0,  // current_streak_length
            0.1, -0.1, // longest win / loss
            0.3, 0.2, // trend 5 / 10
            0.3, 0.3  // strength / relative
    };

    // Plages [min, max] d'une feature d'équipe, même ordre que TEAM_WEIGHTS
    private static final double[][] TEAM_RANGES = {
            {1, 20},   // league_position
            {0, 3},    // points_per_game
            {0, 100}, {0, 100}, {0, 100},
            {0, 4},    // goals_per_game
            {0, 4},    // goals_conceded_per_game
            {-3, 3},   // goal_difference_per_game
            {0, 5}, {0, 5}, {0, 5}, {0, 15}, {0, 10}, {0, 10},
            {0, 10}, {0, 10}, {0, 10}, {0, 30},
            {0, 10},   // current_streak_length
            {0, 10}, {0, 10},
            {-1, 1}, {-1, 1}, // trend 5 / 10
            {0, 10},   // league_strength_rating
            {0, 2.5}   // relative_strength
    };

    // Ordre de MatchFeatures#numericFields
    private static final double[][] MATCH_RANGES = {
            {0, 14}, {0, 14}, // jours de repos
            {0, 8},    // matches_in_last_14_days
            {0, 1}, {0, 1},
            {1, 5},    // match_importance
            {0, 5},    // league_avg_goals_per_game
            {0, 1},    // league_avg_home_advantage
            {0, 40}, {0, 80}, {0, 100}
    };

    // Ordre de HeadToHeadFeatures#numericFields
    private static final double[][] H2H_RANGES = {
            {0, 20}, {0, 20}, {0, 20}, {0, 20},
            {0, 5}, {0, 5}, {0, 10},
            {0, 5}, {0, 5}, {0, 5},
            {-2, 2},   // h2h_trend
            {0, 20}, {0, 20}
    };

    private static final double[][] INPUT_RANGES = concat(TEAM_RANGES, TEAM_RANGES, MATCH_RANGES, H2H_RANGES);

    private static final double[] GAINS = {2.0, 3.0, 4.0, 6.0};

    private static final int HOME_OFFSET = 0;
    private static final int AWAY_OFFSET = TeamFeatures.NUMERIC_SIZE;
    private static final int MATCH_OFFSET = 2 * TeamFeatures.NUMERIC_SIZE;
    private static final int H2H_OFFSET = MATCH_OFFSET + 11;
    private static final int HOME_ADVANTAGE_INDEX = MATCH_OFFSET + 7;
    private static final int H2H_HOME_WINS_INDEX = H2H_OFFSET + 1;
    private static final int H2H_AWAY_WINS_INDEX = H2H_OFFSET + 3;

    private static final Sigmoid SIGMOID = new Sigmoid();

    private final RealMatrix layer1;
    private final RealMatrix layer2;
    private final RealVector bias2;
    private final RealMatrix output;

    public LayeredWeightsStrategy() {
        this(INPUT_SIZE);
    }

    LayeredWeightsStrategy(int inputSize) {
        this.layer1 = buildFirstLayer(inputSize);
        this.layer2 = new Array2DRowRealMatrix(new double[][]{
                {2, 2, 2, 2, -2, -2, -2, -2},
                {-2, -2, -2, -2, 2, 2, 2, 2},
                {1, 1, 1, 1, 1, 1, 1, 1},
                {0, 0, 0, 0, 0, 0, 0, 0}
        });
        this.bias2 = new ArrayRealVector(new double[]{0, 0, -4, 0});
        this.output = new Array2DRowRealMatrix(new double[][]{
                {3, -3, 0, 0},  // domicile
                {0, 0, 1, 1},   // nul
                {-3, 3, 0, 0}   // extérieur
        });
    }

    @Override
    public String name() {
        return ForecastProperties.LAYERED_WEIGHTS;
    }

    @Override
    protected OutcomeProbabilities distribution(FeatureVector features) {
        double[] raw = features.modelInputs();
        if (raw.length != layer1.getColumnDimension()) {
            throw new IllegalStateException("Largeur d'entrée " + raw.length
                    + " incompatible avec la couche 1 (" + layer1.getColumnDimension() + ")");
        }

        RealVector x = new ArrayRealVector(scale(raw));
        RealVector h1 = layer1.operate(x).map(SIGMOID);
        RealVector h2 = layer2.operate(h1).add(bias2).map(SIGMOID);
        double[] logits = output.operate(h2).toArray();

        double[] p = softmax(logits);
        return OutcomeProbabilities.normalize(p[0], p[1], p[2]);
    }

    /**
     * Unités 0-3 : écart domicile - extérieur à gain croissant, unités 4-7 : l'inverse.
     */
    private static RealMatrix buildFirstLayer(int inputSize) {
        RealMatrix w = new Array2DRowRealMatrix(8, inputSize);
        if (inputSize != INPUT_SIZE) return w;

        for (int g = 0; g < GAINS.length; g++) {
            for (int i = 0; i < TEAM_WEIGHTS.length; i++) {
                double weight = GAINS[g] * TEAM_WEIGHTS[i];
                w.setEntry(g, HOME_OFFSET + i, weight);
                w.setEntry(g, AWAY_OFFSET + i, -weight);
                w.setEntry(g + 4, HOME_OFFSET + i, -weight);
                w.setEntry(g + 4, AWAY_OFFSET + i, weight);
            }
            w.setEntry(g, HOME_ADVANTAGE_INDEX, 1.0);
            w.setEntry(g, H2H_HOME_WINS_INDEX, 0.3);
            w.setEntry(g, H2H_AWAY_WINS_INDEX, -0.3);
            w.setEntry(g + 4, HOME_ADVANTAGE_INDEX, -1.0);
            w.setEntry(g + 4, H2H_HOME_WINS_INDEX, -0.3);
            w.setEntry(g + 4, H2H_AWAY_WINS_INDEX, 0.3);
        }
        return w;
    }

    static double[] scale(double[] raw) {
        double[] scaled = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            double min = INPUT_RANGES[i][0];
            double max = INPUT_RANGES[i][1];
            scaled[i] = Math.max(0.0, Math.min(1.0, (raw[i] - min) / (max - min)));
        }
        return scaled;
    }

    private static double[][] concat(double[][]... blocks) {
        int size = 0;
        for (double[][] block : blocks) size += block.length;
        double[][] all = new double[size][];
        int i = 0;
        for (double[][] block : blocks) {
            for (double[] range : block) all[i++] = range;
        }
        return all;
    }

    private static double[] softmax(double[] logits) {
        double max = Math.max(logits[0], Math.max(logits[1], logits[2]));
        double[] exp = new double[logits.length];
        double sum = 0.0;
        for (int i = 0; i < logits.length; i++) {
            exp[i] = Math.exp(logits[i] - max);
            sum += exp[i];
        }
        for (int i = 0; i < exp.length; i++) exp[i] /= sum;
        return exp;
    }
}
