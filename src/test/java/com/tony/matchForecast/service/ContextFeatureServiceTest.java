package com.tony.matchForecast.service;

import com.tony.matchForecast.config.ForecastProperties;
import com.tony.matchForecast.exception.TeamNotFoundException;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.Optional;

import static com.tony.matchForecast.ForecastTestData.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContextFeatureServiceTest {

    @Mock
    private TeamDataProvider teamDataProvider;
    @Mock
    private LeagueDataProvider leagueDataProvider;
    @Mock
    private ExternalFactorsProvider externalFactorsProvider;

    private ContextFeatureService service;

    // Samedi 19 octobre 2024
    private final MatchContext context = new MatchContext(1L, 2L, LEAGUE, KICK_OFF, null);
    private final TeamSnapshot home = team(1L, "Lens", 2, "WWDWL");
    private final TeamSnapshot away = team(2L, "Lille", 3, "DWWLW");

    @BeforeEach
    void setUp() {
        service = new ContextFeatureService(teamDataProvider, leagueDataProvider, externalFactorsProvider, new ForecastProperties());
        lenient().when(leagueDataProvider.getLeagueAverages(LEAGUE)).thenReturn(new LeagueAverages(2.8, 0.2));
        lenient().when(externalFactorsProvider.getExternalFactors(any())).thenReturn(ExternalFactors.neutral());
    }

    @Test
    void buildsCalendarFeatures() {
        when(teamDataProvider.findLastCompletedMatchDate(1L, KICK_OFF)).thenReturn(Optional.of(KICK_OFF.minusDays(3)));
        when(teamDataProvider.countCompletedMatches(eq(1L), any(), any())).thenReturn(2);
        when(teamDataProvider.countCompletedMatches(eq(2L), any(), any())).thenReturn(1);

        MatchFeatures m = service.build(context, home, away).match();

        assertThat(m.getHomeDaysSinceLastMatch()).isEqualTo(3);
        // Pas de match connu : valeur par défaut
        assertThat(m.getAwayDaysSinceLastMatch()).isEqualTo(14);
        assertThat(m.getMatchesInLast14Days()).isEqualTo(3);
        assertThat(m.isWeekendMatch()).isTrue();
        assertThat(m.getLeagueAvgGoalsPerGame()).isEqualTo(2.8);
        assertThat(m.getLeagueAvgHomeAdvantage()).isEqualTo(0.2);
        // 79 jours depuis le 1er août
        assertThat(m.getSeasonProgressPercentage()).isCloseTo(79 / 365.0 * 100, offset(1e-9));
        assertThat(m.getSeasonWeek()).isEqualTo(9);
        assertThat(m.isEvenWeek()).isFalse();
        assertThat(m.getSeasonMatchesPlayed()).isEqualTo(18);
        // 2e contre 3e : match serré + choc du haut de tableau
        assertThat(m.getMatchImportance()).isEqualTo(5);
    }

    @Test
    @DisplayName("La saison démarre au 1er août le plus récent")
    void seasonProgressAnchorsOnAugustFirst() {
        assertThat(ContextFeatureService.seasonProgress(LocalDate.of(2024, 8, 1))).isZero();
        assertThat(ContextFeatureService.seasonProgress(LocalDate.of(2025, 7, 31))).isCloseTo(364 / 365.0 * 100, offset(1e-9));
        // Mars 2025 appartient à la saison commencée le 1er août 2024 : 212 jours écoulés
        assertThat(ContextFeatureService.seasonProgress(LocalDate.of(2025, 3, 1))).isCloseTo(212 / 365.0 * 100, offset(1e-9));
    }

    @Test
    void matchImportanceStaysBetweenOneAndFive() {
        assertThat(ContextFeatureService.matchImportance(1, 2)).isEqualTo(5);
        assertThat(ContextFeatureService.matchImportance(8, 14)).isEqualTo(3);
        assertThat(ContextFeatureService.matchImportance(1, 20)).isEqualTo(2);
    }

    @Test
    @DisplayName("5 confrontations, 5 victoires du club qui reçoit")
    void headToHeadFromHomePointOfView() {
        when(teamDataProvider.getHeadToHead(1L, 2L, 20)).thenReturn(meetingsWonBy(1L, 2L, 5));

        HeadToHeadFeatures h2h = service.build(context, home, away).headToHead();

        assertThat(h2h.getMatchesPlayed()).isEqualTo(5);
        assertThat(h2h.getHomeWins()).isEqualTo(5);
        assertThat(h2h.getAwayWins()).isZero();
        assertThat(h2h.homeWinRatio()).isEqualTo(1.0);
        assertThat(h2h.getRecentHomeWins()).isEqualTo(5);
        // 3 reçues (3-1), 2 à l'extérieur (0-2)
        assertThat(h2h.getVenueMatches()).isEqualTo(3);
        assertThat(h2h.getVenueHomeWins()).isEqualTo(3);
        assertThat(h2h.getHomeGoalsAvg()).isCloseTo(13 / 5.0, offset(1e-12));
        assertThat(h2h.getAwayGoalsAvg()).isCloseTo(3 / 5.0, offset(1e-12));
        assertThat(h2h.getTrend()).isZero();
        assertThat(h2h.getLastMeetingDate()).isEqualTo(KICK_OFF.minusMonths(6));
    }

    @Test
    void noMeetingsGivesZeros() {
        HeadToHeadFeatures h2h = service.build(context, home, away).headToHead();

        assertThat(h2h).isEqualTo(HeadToHeadFeatures.empty());
        assertThat(h2h.homeWinRatio()).isZero();
    }

    @Test
    @DisplayName("Source externe en panne : valeurs neutres marquées comme non obtenues")
    void externalFailureDegradesToDefaults() {
        when(externalFactorsProvider.getExternalFactors(context)).thenThrow(new IllegalStateException("API down"));

        ContextFeatures features = service.build(context, home, away);

        assertThat(features.external().isLookupFailed()).isTrue();
        assertThat(features.external().getWeatherCondition()).isEqualTo(7.0);
        assertThat(features.match()).isNotNull();
    }

    @Test
    void resolvesTeamsWhenOnlyContextGiven() {
        when(teamDataProvider.findTeam(1L)).thenReturn(Optional.of(home));
        when(teamDataProvider.findTeam(2L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.build(context))
                .isInstanceOf(TeamNotFoundException.class);
        verify(teamDataProvider).findTeam(2L);
    }
}
