package com.tony.matchForecast.service.provider;

import com.tony.matchForecast.model.FormResult;
import com.tony.matchForecast.model.HeadToHeadMeeting;
import com.tony.matchForecast.model.TeamSnapshot;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Accès aux données d'équipes et à l'historique des matchs.
 */
public interface TeamDataProvider {

    Optional<TeamSnapshot> findTeam(Long teamId);

    /**
     * Derniers résultats d'une équipe, du plus récent au plus ancien (au plus {@code count}).
     */
    List<FormResult> getRecentOutcomes(Long teamId, int count);

    /**
     * Confrontations terminées entre deux équipes, peu importe qui recevait, plus récente en premier.
     */
    List<HeadToHeadMeeting> getHeadToHead(Long homeTeamId, Long awayTeamId, int maxCount);

    Optional<LocalDateTime> findLastCompletedMatchDate(Long teamId, LocalDateTime before);

    /**
     * Matchs terminés dans [from, to[.
     */
    int countCompletedMatches(Long teamId, LocalDateTime from, LocalDateTime to);
}
