package com.tony.matchForecast.service.provider;

import com.tony.matchForecast.model.FormResult;
import com.tony.matchForecast.model.HeadToHeadMeeting;
import com.tony.matchForecast.model.MatchRecord;
import com.tony.matchForecast.model.Team;
import com.tony.matchForecast.model.TeamSnapshot;
import com.tony.matchForecast.model.TeamStats;
import com.tony.matchForecast.repository.MatchRecordRepository;
import com.tony.matchForecast.repository.TeamRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class JpaTeamDataProvider implements TeamDataProvider {

    private final TeamRepository teamRepository;
    private final MatchRecordRepository matchRepository;

    @Override
    public Optional<TeamSnapshot> findTeam(Long teamId) {
        return teamRepository.findById(teamId).map(this::toSnapshot);
    }

    @Override
    public List<FormResult> getRecentOutcomes(Long teamId, int count) {
        if (count <= 0) return List.of();

        List<MatchRecord> finished = matchRepository.findLastFinishedMatchesByTeam(teamId, PageRequest.of(0, count));
        if (!finished.isEmpty()) {
            return finished.stream().map(m -> m.resultFor(teamId)).toList();
        }

        // Pas d'historique en base : on se rabat sur la forme saisie à la main
        return teamRepository.findById(teamId)
                .map(Team::getCurrentStats)
                .map(TeamStats::getForm)
                .map(FormResult::parseSequence)
                .map(form -> form.subList(0, Math.min(count, form.size())))
                .map(List::copyOf)
                .orElse(List.of());
    }

    @Override
    public List<HeadToHeadMeeting> getHeadToHead(Long homeTeamId, Long awayTeamId, int maxCount) {
        if (maxCount <= 0) return List.of();
        return matchRepository.findHeadToHead(homeTeamId, awayTeamId, PageRequest.of(0, maxCount)).stream()
                .map(MatchRecord::toMeeting)
                .toList();
    }

    @Override
    public Optional<LocalDateTime> findLastCompletedMatchDate(Long teamId, LocalDateTime before) {
        return matchRepository.findFinishedMatchesBefore(teamId, before, PageRequest.of(0, 1)).stream()
                .findFirst()
                .map(MatchRecord::getMatchDate);
    }

    @Override
    public int countCompletedMatches(Long teamId, LocalDateTime from, LocalDateTime to) {
        return (int) matchRepository.countFinishedMatchesBetween(teamId, from, to);
    }

    private TeamSnapshot toSnapshot(Team team) {
        TeamStats stats = team.getCurrentStats() != null ? team.getCurrentStats() : new TeamStats();

        int wins = orZero(stats.getWins());
        int draws = orZero(stats.getDraws());
        int losses = orZero(stats.getLosses());
        int played = stats.getMatchesPlayed() != null ? stats.getMatchesPlayed() : wins + draws + losses;

        List<FormResult> form = FormResult.parseSequence(stats.getForm());
        if (form.size() > TeamSnapshot.MAX_FORM_LENGTH) {
            form = form.subList(0, TeamSnapshot.MAX_FORM_LENGTH);
        }

        String league = team.getLeague() != null ? team.getLeague().getName() : null;

        return new TeamSnapshot(
                team.getId(),
                team.getName(),
                league,
                resolveRank(team, stats),
                orZero(stats.getPoints()),
                played,
                wins,
                draws,
                losses,
                orZero(stats.getGoalsFor()),
                orZero(stats.getGoalsAgainst()),
                form);
    }

    // Équipe sans classement : on la place en milieu de tableau
    private int resolveRank(Team team, TeamStats stats) {
        if (stats.getRank() != null && stats.getRank() >= 1) return stats.getRank();

        int leagueSize = 0;
        if (team.getLeague() != null) {
            leagueSize = team.getLeague().getTeamCount() != null
                    ? team.getLeague().getTeamCount()
                    : (int) teamRepository.countByLeagueId(team.getLeague().getId());
        }
        int midTable = Math.max(1, (leagueSize + 1) / 2);
        log.debug("Classement absent pour {} : milieu de tableau ({})", team.getName(), midTable);
        return midTable;
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }
}
