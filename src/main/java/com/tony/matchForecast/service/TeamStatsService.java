package com.tony.matchForecast.service;

import com.tony.matchForecast.exception.TeamNotFoundException;
import com.tony.matchForecast.model.FormResult;
import com.tony.matchForecast.model.StreakType;
import com.tony.matchForecast.model.TeamSnapshot;
import com.tony.matchForecast.model.feature.TeamFeatures;
import com.tony.matchForecast.service.provider.TeamDataProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Agrégateur statistique : stats de saison + forme récente d'une équipe.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TeamStatsService {

    // Points par match moyens d'une ligue "type"
    static final double LEAGUE_AVERAGE_PPG = 1.37;

    private final TeamDataProvider teamDataProvider;

    public TeamFeatures aggregate(Long teamId, int window) {
        TeamSnapshot team = teamDataProvider.findTeam(teamId)
                .orElseThrow(() -> new TeamNotFoundException(teamId));
        return aggregate(team, window);
    }

    public TeamFeatures aggregate(TeamSnapshot team, int window) {
        List<FormResult> recent = teamDataProvider.getRecentOutcomes(team.id(), Math.max(window, 0));
        List<FormResult> last5 = head(recent, 5);
        List<FormResult> last10 = head(recent, 10);

        int games = Math.max(team.gamesPlayed(), 1);
        double ppg = (double) team.points() / games;

        Streaks streaks = computeStreaks(recent);

        TeamFeatures features = TeamFeatures.builder()
                .leaguePosition(team.rank())
                .pointsPerGame(ppg)
                .winsPercentage(100.0 * team.wins() / games)
                .drawsPercentage(100.0 * team.draws() / games)
                .lossesPercentage(100.0 * team.losses() / games)
                .goalsPerGame((double) team.goalsFor() / games)
                .goalsConcededPerGame((double) team.goalsAgainst() / games)
                .goalDifferencePerGame((double) (team.goalsFor() - team.goalsAgainst()) / games)
                .formWinsLast5(count(last5, FormResult.WIN))
                .formDrawsLast5(count(last5, FormResult.DRAW))
                .formLossesLast5(count(last5, FormResult.LOSS))
                .formPointsLast5(points(last5))
                .formGoalsForLast5(last5.stream().mapToInt(FormResult::getEstimatedGoalsFor).sum())
                .formGoalsAgainstLast5(last5.stream().mapToInt(FormResult::getEstimatedGoalsAgainst).sum())
                .formWinsLast10(count(last10, FormResult.WIN))
                .formDrawsLast10(count(last10, FormResult.DRAW))
                .formLossesLast10(count(last10, FormResult.LOSS))
                .formPointsLast10(points(last10))
                .currentStreakType(streaks.type())
                .currentStreakLength(streaks.length())
                .longestWinStreak(streaks.longestWin())
                .longestLossStreak(streaks.longestLoss())
                .performanceTrend5(trend(last5))
                .performanceTrend10(trend(last10))
                .leagueStrengthRating(Math.min(10.0, ppg * 10.0 / 3.0))
                .relativeStrength(ppg / LEAGUE_AVERAGE_PPG)
                .recentForm(FormResult.toSequence(last5))
                .build();

        log.debug("📊 Features {} : {} PPG, forme '{}'", team.name(), String.format("%.2f", ppg), FormResult.toSequence(last5));
        return features;
    }

    record Streaks(StreakType type, int length, int longestWin, int longestLoss) {}

    /**
     * Série courante = suite maximale du symbole le plus récent.
     * Plus longues séries de victoires / défaites sur toute la fenêtre.
     */
    static Streaks computeStreaks(List<FormResult> form) {
        if (form.isEmpty()) return new Streaks(StreakType.NONE, 0, 0, 0);

        FormResult first = form.get(0);
        int current = 0;
        while (current < form.size() && form.get(current) == first) current++;

        int longestWin = 0, longestLoss = 0;
        int runWin = 0, runLoss = 0;
        for (FormResult r : form) {
            runWin = r == FormResult.WIN ? runWin + 1 : 0;
            runLoss = r == FormResult.LOSS ? runLoss + 1 : 0;
            longestWin = Math.max(longestWin, runWin);
            longestLoss = Math.max(longestLoss, runLoss);
        }
        return new Streaks(StreakType.of(first), current, longestWin, longestLoss);
    }

    /**
     * Tendance par paires consécutives (plus récent en premier), moyennée sur n-1. Moins de 2 matchs = 0.
     */
    static double trend(List<FormResult> form) {
        if (form.size() < 2) return 0.0;

        double trend = 0.0;
        for (int i = 0; i < form.size() - 1; i++) {
            FormResult current = form.get(i);
            FormResult next = form.get(i + 1);

            if (current == FormResult.WIN && next != FormResult.LOSS) trend += 1.0;
            else if (current == FormResult.LOSS && next == FormResult.WIN) trend += 1.0;
            else if (current == next) trend += 0.5;
            else trend -= 1.0;
        }
        return trend / (form.size() - 1);
    }

    private static List<FormResult> head(List<FormResult> form, int n) {
        return form.subList(0, Math.min(n, form.size()));
    }

    private static int count(List<FormResult> form, FormResult symbol) {
        return (int) form.stream().filter(r -> r == symbol).count();
    }

    private static int points(List<FormResult> form) {
        return form.stream().mapToInt(FormResult::getPoints).sum();
    }
}
