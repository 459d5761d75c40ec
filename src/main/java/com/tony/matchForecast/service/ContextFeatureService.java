package com.tony.matchForecast.service;

import com.tony.matchForecast.config.ForecastProperties;
import com.tony.matchForecast.exception.TeamNotFoundException;
import com.tony.matchForecast.model.HeadToHeadMeeting;
import com.tony.matchForecast.model.LeagueAverages;
import com.tony.matchForecast.model.MatchContext;
import com.tony.matchForecast.model.TeamSnapshot;
import com.tony.matchForecast.model.feature.ContextFeatures;
import com.tony.matchForecast.model.feature.ExternalFactors;
import com.tony.matchForecast.model.feature.HeadToHeadFeatures;
import com.tony.matchForecast.model.feature.MatchFeatures;
import com.tony.matchForecast.service.provider.ExternalFactorsProvider;
import com.tony.matchForecast.service.provider.LeagueDataProvider;
import com.tony.matchForecast.service.provider.TeamDataProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Month;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Contexte du match : calendrier, confrontations directes, facteurs externes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextFeatureService {

    private static final int CONGESTION_DAYS = 14;
    private static final int RECENT_MEETINGS = 5;
    private static final double DAYS_PER_SEASON = 365.0;
    // ~38 semaines de championnat sur 100%
    private static final double PROGRESS_PER_WEEK = 2.6;

    private final TeamDataProvider teamDataProvider;
    private final LeagueDataProvider leagueDataProvider;
    private final ExternalFactorsProvider externalFactorsProvider;
    private final ForecastProperties properties;

    public ContextFeatures build(MatchContext context) {
        TeamSnapshot home = teamDataProvider.findTeam(context.homeTeamId())
                .orElseThrow(() -> new TeamNotFoundException(context.homeTeamId()));
        TeamSnapshot away = teamDataProvider.findTeam(context.awayTeamId())
                .orElseThrow(() -> new TeamNotFoundException(context.awayTeamId()));
        return build(context, home, away);
    }

    public ContextFeatures build(MatchContext context, TeamSnapshot home, TeamSnapshot away) {
        MatchFeatures match = buildMatchFeatures(context, home, away);
        HeadToHeadFeatures h2h = buildHeadToHead(context);
        ExternalFactors external = fetchExternalFactors(context);
        return new ContextFeatures(match, h2h, external);
    }

    MatchFeatures buildMatchFeatures(MatchContext context, TeamSnapshot home, TeamSnapshot away) {
        LocalDateTime reference = context.scheduledAt();
        LocalDateTime congestionStart = reference.minusDays(CONGESTION_DAYS);

        int recentMatches = teamDataProvider.countCompletedMatches(context.homeTeamId(), congestionStart, reference)
                + teamDataProvider.countCompletedMatches(context.awayTeamId(), congestionStart, reference);

        double progress = seasonProgress(reference.toLocalDate());
        int seasonWeek = (int) Math.ceil(progress / PROGRESS_PER_WEEK);

        LeagueAverages league = leagueDataProvider.getLeagueAverages(context.league());
        DayOfWeek day = reference.getDayOfWeek();

        return MatchFeatures.builder()
                .homeDaysSinceLastMatch(restDays(context.homeTeamId(), reference))
                .awayDaysSinceLastMatch(restDays(context.awayTeamId(), reference))
                .matchesInLast14Days(recentMatches)
                .weekendMatch(day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY)
                .evenWeek(seasonWeek % 2 == 0)
                .matchImportance(matchImportance(home.rank(), away.rank()))
                .leagueAvgGoalsPerGame(league.avgGoalsPerGame())
                .leagueAvgHomeAdvantage(league.avgHomeAdvantage())
                .seasonWeek(seasonWeek)
                .seasonMatchesPlayed(seasonWeek * 2)
                .seasonProgressPercentage(progress)
                .build();
    }

    HeadToHeadFeatures buildHeadToHead(MatchContext context) {
        Long homeId = context.homeTeamId();
        List<HeadToHeadMeeting> meetings = teamDataProvider.getHeadToHead(homeId, context.awayTeamId(), properties.getHeadToHeadLimit());
        if (meetings.isEmpty()) return HeadToHeadFeatures.empty();

        int homeWins = 0, draws = 0, awayWins = 0;
        int homeGoals = 0, awayGoals = 0;
        int recentHome = 0, recentDraws = 0, recentAway = 0;
        int venueWins = 0, venueMatches = 0;

        for (int i = 0; i < meetings.size(); i++) {
            HeadToHeadMeeting m = meetings.get(i);
            int gf = m.goalsFor(homeId);
            int ga = m.goalsAgainst(homeId);
            homeGoals += gf;
            awayGoals += ga;

            boolean recent = i < RECENT_MEETINGS;
            if (gf > ga) {
                homeWins++;
                if (recent) recentHome++;
            } else if (gf == ga) {
                draws++;
                if (recent) recentDraws++;
            } else {
                awayWins++;
                if (recent) recentAway++;
            }

            if (m.hostedBy(homeId)) {
                venueMatches++;
                if (gf > ga) venueWins++;
            }
        }

        double n = meetings.size();
        double recentN = Math.min(RECENT_MEETINGS, meetings.size());
        double trend = (recentHome - recentAway) / recentN - (homeWins - awayWins) / n;

        return HeadToHeadFeatures.builder()
                .matchesPlayed(n)
                .homeWins(homeWins)
                .draws(draws)
                .awayWins(awayWins)
                .homeGoalsAvg(homeGoals / n)
                .awayGoalsAvg(awayGoals / n)
                .totalGoalsAvg((homeGoals + awayGoals) / n)
                .recentHomeWins(recentHome)
                .recentDraws(recentDraws)
                .recentAwayWins(recentAway)
                .trend(trend)
                .venueHomeWins(venueWins)
                .venueMatches(venueMatches)
                .lastMeetingDate(meetings.get(0).playedAt())
                .build();
    }

    private ExternalFactors fetchExternalFactors(MatchContext context) {
        try {
            return externalFactorsProvider.getExternalFactors(context);
        } catch (RuntimeException e) {
            log.warn("⚠️ Facteurs externes indisponibles ({}), valeurs neutres utilisées", e.getMessage());
            return ExternalFactors.unavailable();
        }
    }

    private double restDays(Long teamId, LocalDateTime reference) {
        return teamDataProvider.findLastCompletedMatchDate(teamId, reference)
                .map(last -> (double) ChronoUnit.DAYS.between(last, reference))
                .orElse((double) properties.getDefaultRestDays());
    }

    /**
     * La saison démarre au 1er août le plus récent (inclus). Année de 365 jours, borné à [0, 100].
     */
    static double seasonProgress(LocalDate date) {
        LocalDate start = LocalDate.of(date.getYear(), Month.AUGUST, 1);
        if (date.isBefore(start)) start = start.minusYears(1);
        double elapsed = ChronoUnit.DAYS.between(start, date);
        return Math.max(0.0, Math.min(100.0, elapsed / DAYS_PER_SEASON * 100.0));
    }

    /**
     * 1 (sans enjeu) à 5 (choc). Base 3, +1 match serré au classement, +1 choc du haut de tableau,
     * -1 si un gouffre sépare les deux équipes.
     */
    static double matchImportance(int homeRank, int awayRank) {
        int gap = Math.abs(homeRank - awayRank);
        int importance = 3;
        if (gap <= 3) importance++;
        if (homeRank <= 4 && awayRank <= 4) importance++;
        if (gap > 10) importance--;
        return Math.max(1, Math.min(5, importance));
    }
}
