package com.tony.matchForecast.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Symbole de forme (V/N/D) d'un match terminé.
 */
public enum FormResult {
    WIN('W', 3, 2, 1),
    DRAW('D', 1, 1, 1),
    LOSS('L', 0, 1, 2);

    private final char symbol;
    private final int points;
    // Estimation des buts quand on ne connaît que le symbole (2-1, 1-1, 1-2)
    private final int estimatedGoalsFor;
    private final int estimatedGoalsAgainst;

    FormResult(char symbol, int points, int estimatedGoalsFor, int estimatedGoalsAgainst) {
        this.symbol = symbol;
        this.points = points;
        this.estimatedGoalsFor = estimatedGoalsFor;
        this.estimatedGoalsAgainst = estimatedGoalsAgainst;
    }

    public char getSymbol() { return symbol; }
    public int getPoints() { return points; }
    public int getEstimatedGoalsFor() { return estimatedGoalsFor; }
    public int getEstimatedGoalsAgainst() { return estimatedGoalsAgainst; }

    public static FormResult of(int goalsFor, int goalsAgainst) {
        if (goalsFor > goalsAgainst) return WIN;
        if (goalsFor < goalsAgainst) return LOSS;
        return DRAW;
    }

    /**
     * Accepte "W"/"D"/"L" ou "win"/"draw"/"loss" (insensible à la casse).
     */
    public static FormResult parse(String value) {
        String v = value.trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case "w", "win" -> WIN;
            case "d", "draw" -> DRAW;
            case "l", "loss" -> LOSS;
            default -> throw new IllegalArgumentException("Symbole de forme inconnu : " + value);
        };
    }

    /**
     * Parse une chaîne compacte type "WWDLW" (plus récent en premier). Null ou vide = liste vide.
     */
    public static List<FormResult> parseSequence(String form) {
        List<FormResult> results = new ArrayList<>();
        if (form == null) return results;
        for (char c : form.toCharArray()) {
            if (Character.isWhitespace(c) || c == ',' || c == '-') continue;
            results.add(parse(String.valueOf(c)));
        }
        return results;
    }

    public static String toSequence(List<FormResult> results) {
        StringBuilder sb = new StringBuilder();
        for (FormResult r : results) sb.append(r.symbol);
        return sb.toString();
    }
}
