package com.tony.matchForecast.model;

import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TeamStats {

    private Integer rank;
    private Integer points = 0;

    // --- STATS GLOBALES (SAISON) ---
    private Integer matchesPlayed = 0;
    private Integer wins = 0;   // V
    private Integer draws = 0;  // N
    private Integer losses = 0; // D
    private Integer goalsFor = 0;
    private Integer goalsAgainst = 0;

    // Forme compacte, plus récent en premier (ex: "WWDLW")
    private String form;
}
