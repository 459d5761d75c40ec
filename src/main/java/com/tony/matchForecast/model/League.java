package com.tony.matchForecast.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Data
@NoArgsConstructor
public class League {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String name; // Ex: "Ligue 1", "Premier League"

    private String country;

    // Valeurs de repli quand la ligue n'a pas encore de matchs terminés
    @Column(nullable = false, columnDefinition = "double precision default 2.5")
    private Double averageGoalsPerMatch = 2.5;

    @Column(nullable = false, columnDefinition = "double precision default 0.15")
    private Double averageHomeAdvantage = 0.15;

    // Nombre d'équipes (sert au classement par défaut d'une équipe sans stats)
    private Integer teamCount;

    public League(String name) {
        this.name = name;
    }

    public League(String name, String country) {
        this.name = name;
        this.country = country;
    }
}
