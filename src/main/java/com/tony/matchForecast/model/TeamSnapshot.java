package com.tony.matchForecast.model;

import com.tony.matchForecast.exception.PredictionValidationException;

import java.util.List;

/**
 * Photo immuable d'une équipe, lue une seule fois par prédiction.
 *
 * @param form derniers résultats, du plus récent au plus ancien (10 au maximum)
 */
public record TeamSnapshot(
        Long id,
        String name,
        String league,
        int rank,
        int points,
        int gamesPlayed,
        int wins,
        int draws,
        int losses,
        int goalsFor,
        int goalsAgainst,
        List<FormResult> form) {

    public static final int MAX_FORM_LENGTH = 10;

    public TeamSnapshot {
        if (id == null) throw new PredictionValidationException("Identifiant d'équipe manquant");
        if (rank < 1) throw new PredictionValidationException("Classement invalide pour l'équipe " + id + " : " + rank);
        if (wins + draws + losses != gamesPlayed) {
            throw new PredictionValidationException(String.format(
                    "Stats incohérentes pour l'équipe %d : %d V + %d N + %d D != %d MJ", id, wins, draws, losses, gamesPlayed));
        }
        form = form == null ? List.of() : List.copyOf(form);
        if (form.size() > MAX_FORM_LENGTH) {
            throw new PredictionValidationException("Forme trop longue pour l'équipe " + id + " : " + form.size());
        }
    }

    public String formSequence() {
        return FormResult.toSequence(form);
    }
}
