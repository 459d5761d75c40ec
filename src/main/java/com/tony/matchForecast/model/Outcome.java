package com.tony.matchForecast.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Issue d'un match, toujours exprimée du point de vue de l'équipe à domicile (équipe A).
 */
public enum Outcome {
    HOME_WIN("home_win"),
    DRAW("draw"),
    AWAY_WIN("away_win");

    private final String code;

    Outcome(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Règle de départage commune à tout le moteur :
     * seule une probabilité STRICTEMENT supérieure aux deux autres l'emporte,
     * toute égalité retombe sur le nul.
     */
    public static Outcome decide(double home, double draw, double away) {
        if (home > draw && home > away) return HOME_WIN;
        if (away > home && away > draw) return AWAY_WIN;
        return DRAW;
    }

    public static Outcome fromScore(int homeScore, int awayScore) {
        if (homeScore > awayScore) return HOME_WIN;
        if (homeScore < awayScore) return AWAY_WIN;
        return DRAW;
    }
}
