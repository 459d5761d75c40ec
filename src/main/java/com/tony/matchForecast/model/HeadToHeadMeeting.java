package com.tony.matchForecast.model;

import java.time.LocalDateTime;

/**
 * Confrontation directe terminée, telle qu'elle a été jouée (home/away d'époque).
 */
public record HeadToHeadMeeting(Long homeTeamId, Long awayTeamId, int homeScore, int awayScore, LocalDateTime playedAt) {

    public int goalsFor(Long teamId) {
        return homeTeamId.equals(teamId) ? homeScore : awayScore;
    }

    public int goalsAgainst(Long teamId) {
        return homeTeamId.equals(teamId) ? awayScore : homeScore;
    }

    public boolean hostedBy(Long teamId) {
        return homeTeamId.equals(teamId);
    }
}
