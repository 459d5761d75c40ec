package com.tony.matchForecast.model;

/**
 * Triplet de probabilités 1N2 (0-1).
 */
public record OutcomeProbabilities(double homeWin, double draw, double awayWin) {

    private static final double THIRD = 1.0 / 3.0;

    public static OutcomeProbabilities uniform() {
        return new OutcomeProbabilities(THIRD, THIRD, THIRD);
    }

    /**
     * Normalise pour que la somme vaille 1. Un total nul ou non fini donne un triplet uniforme.
     */
    public static OutcomeProbabilities normalize(double home, double draw, double away) {
        double total = home + draw + away;
        if (!(total > 0.0) || Double.isInfinite(total)) return uniform();
        return new OutcomeProbabilities(home / total, draw / total, away / total);
    }

    public double get(Outcome outcome) {
        return switch (outcome) {
            case HOME_WIN -> homeWin;
            case DRAW -> draw;
            case AWAY_WIN -> awayWin;
        };
    }

    public double max() {
        return Math.max(homeWin, Math.max(draw, awayWin));
    }

    public Outcome mostLikely() {
        return Outcome.decide(homeWin, draw, awayWin);
    }

    public double sum() {
        return homeWin + draw + awayWin;
    }
}
