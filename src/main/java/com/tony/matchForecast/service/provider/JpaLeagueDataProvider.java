package com.tony.matchForecast.service.provider;

import com.tony.matchForecast.model.League;
import com.tony.matchForecast.model.LeagueAverages;
import com.tony.matchForecast.repository.LeagueRepository;
import com.tony.matchForecast.repository.LeagueScoringTotals;
import com.tony.matchForecast.repository.MatchRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Moyennes de ligue calculées sur les matchs terminés, sinon valeurs stockées, sinon 2.5 / 0.15.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class JpaLeagueDataProvider implements LeagueDataProvider {

    private final MatchRecordRepository matchRepository;
    private final LeagueRepository leagueRepository;

    @Override
    public LeagueAverages getLeagueAverages(String league) {
        if (league == null || league.isBlank()) return LeagueAverages.DEFAULT;

        LeagueScoringTotals totals = matchRepository.aggregateFinishedMatchesByLeague(league);
        long played = totals != null && totals.getMatches() != null ? totals.getMatches() : 0L;
        if (played > 0) {
            double n = played;
            return new LeagueAverages(
                    orZero(totals.getTotalGoals()) / n,
                    (orZero(totals.getHomeWins()) - orZero(totals.getAwayWins())) / n);
        }

        return leagueRepository.findByName(league)
                .map(this::fromStored)
                .orElseGet(() -> {
                    log.debug("Ligue inconnue '{}' : moyennes par défaut", league);
                    return LeagueAverages.DEFAULT;
                });
    }

    private LeagueAverages fromStored(League league) {
        double goals = league.getAverageGoalsPerMatch() != null
                ? league.getAverageGoalsPerMatch() : LeagueAverages.DEFAULT.avgGoalsPerGame();
        double homeAdv = league.getAverageHomeAdvantage() != null
                ? league.getAverageHomeAdvantage() : LeagueAverages.DEFAULT.avgHomeAdvantage();
        return new LeagueAverages(goals, homeAdv);
    }

    private static long orZero(Long value) {
        return value != null ? value : 0L;
    }
}
