package com.tony.matchForecast.model;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Match joué (scores renseignés) ou programmé (scores null).
 */
@Entity
@Table(name = "match_record")
@Data
public class MatchRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "home_team_id")
    private Team homeTeam;

    @ManyToOne(optional = false)
    @JoinColumn(name = "away_team_id")
    private Team awayTeam;

    @Column(nullable = false)
    private LocalDateTime matchDate;

    private String venue;

    private Integer homeScore;
    private Integer awayScore;

    public boolean isFinished() {
        return homeScore != null && awayScore != null;
    }

    public Long getOpponentId(Long teamId) {
        return homeTeam.getId().equals(teamId) ? awayTeam.getId() : homeTeam.getId();
    }

    public FormResult resultFor(Long teamId) {
        boolean isHome = homeTeam.getId().equals(teamId);
        return isHome ? FormResult.of(homeScore, awayScore) : FormResult.of(awayScore, homeScore);
    }

    public HeadToHeadMeeting toMeeting() {
        return new HeadToHeadMeeting(homeTeam.getId(), awayTeam.getId(), homeScore, awayScore, matchDate);
    }
}
