package com.tony.matchForecast.model.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PredictionRequest {
    @NotNull(message = "L'équipe domicile est requise")
    private Long homeTeamId;

    @NotNull(message = "L'équipe extérieur est requise")
    private Long awayTeamId;

    // Optionnels : ligue de l'équipe domicile et "maintenant" par défaut
    private LocalDateTime matchDate;
    private String league;
    private String venue;

    public PredictionRequest(Long homeTeamId, Long awayTeamId) {
        this.homeTeamId = homeTeamId;
        this.awayTeamId = awayTeamId;
    }
}
