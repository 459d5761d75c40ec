package com.tony.matchForecast.model;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Archive d'une prédiction (historique + calcul de précision).
 */
@Entity
@Table(name = "prediction_record")
@Data
public class PredictionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "match_id")
    private MatchRecord match;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Outcome predictedOutcome;

    // 1N2
    private Double homeWinProbability;
    private Double drawProbability;
    private Double awayWinProbability;

    private Double confidence;
    private boolean highConfidence;
    private boolean degraded;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "prediction_reasoning", joinColumns = @JoinColumn(name = "prediction_id"))
    @Column(name = "reason")
    @OrderColumn(name = "position")
    private List<String> reasoning = new ArrayList<>();

    @Column(nullable = false)
    private LocalDateTime createdAt;
}
