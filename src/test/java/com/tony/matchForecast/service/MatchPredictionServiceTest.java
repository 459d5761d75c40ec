package com.tony.matchForecast.service;

import com.tony.matchForecast.config.ForecastProperties;
import com.tony.matchForecast.exception.PredictionValidationException;
import com.tony.matchForecast.exception.TeamNotFoundException;
import com.tony.matchForecast.exception.TransientLookupException;
import com.tony.matchForecast.model.EnsembleResult;
import com.tony.matchForecast.model.MatchContext;
import com.tony.matchForecast.model.Outcome;
import com.tony.matchForecast.model.OutcomeProbabilities;
import com.tony.matchForecast.model.TeamSnapshot;
import com.tony.matchForecast.model.dto.HistoricalContext;
import com.tony.matchForecast.model.dto.PredictionRequest;
import com.tony.matchForecast.model.dto.PredictionResponse;
import com.tony.matchForecast.model.feature.FeatureVector;
import com.tony.matchForecast.model.feature.HeadToHeadFeatures;
import com.tony.matchForecast.service.provider.PredictionSink;
import com.tony.matchForecast.service.provider.TeamDataProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static com.tony.matchForecast.ForecastTestData.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MatchPredictionServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 10, 17, 12, 0);

    @Mock
    private TeamDataProvider teamDataProvider;
    @Mock
    private PredictionEngineService predictionEngine;
    @Mock
    private PredictionSink predictionSink;

    private MatchPredictionService service;

    private final TeamSnapshot home = team(1L, "Lens", 2, "WWDWL");
    private final TeamSnapshot away = team(2L, "Lille", 3, "DWWLW");

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        service = new MatchPredictionService(teamDataProvider, predictionEngine, predictionSink, new ForecastProperties(), clock);
    }

    private static EnsembleResult result(double confidence) {
        double rest = (1.0 - confidence) / 2;
        return EnsembleResult.builder()
                .predictedOutcome(Outcome.HOME_WIN)
                .probabilities(new OutcomeProbabilities(confidence, rest, rest))
                .confidence(confidence)
                .featureImportance(List.of())
                .reasoning(List.of())
                .keyFactors(List.of("Large league position gap"))
                .strategyEstimates(List.of())
                .contributingStrategies(3)
                .externalFactorsPlaceholder(true)
                .build();
    }

    private static final FeatureVector VECTOR = vector(averageTeam().build(), averageTeam().build(), 0.15);

    private static PredictionEngineService.Forecast forecast(double confidence) {
        return new PredictionEngineService.Forecast(VECTOR, result(confidence));
    }

    private static HistoricalContext.FormComparison form(String last5, int points, int goalsFor, int goalsAgainst) {
        return HistoricalContext.FormComparison.builder()
                .last5Games(last5).points(points).goalsFor(goalsFor).goalsAgainst(goalsAgainst)
                .build();
    }

    private void givenBothTeams() {
        when(teamDataProvider.findTeam(1L)).thenReturn(Optional.of(home));
        when(teamDataProvider.findTeam(2L)).thenReturn(Optional.of(away));
    }

    @Test
    @DisplayName("Une équipe contre elle-même est rejetée avant toute lecture")
    void rejectsSelfMatchBeforeAnyLookup() {
        assertThatThrownBy(() -> service.predict(new PredictionRequest(1L, 1L)))
                .isInstanceOf(PredictionValidationException.class);

        verifyNoInteractions(teamDataProvider, predictionEngine, predictionSink);
    }

    @Test
    void rejectsMissingTeamId() {
        assertThatThrownBy(() -> service.predict(new PredictionRequest(1L, null)))
                .isInstanceOf(PredictionValidationException.class);

        verifyNoInteractions(teamDataProvider);
    }

    @Test
    void unknownAwayTeam() {
        when(teamDataProvider.findTeam(1L)).thenReturn(Optional.of(home));
        when(teamDataProvider.findTeam(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.predict(new PredictionRequest(1L, 99L)))
                .isInstanceOf(TeamNotFoundException.class)
                .hasMessageContaining("99");

        verifyNoInteractions(predictionEngine, predictionSink);
    }

    @Test
    @DisplayName("Date et ligue par défaut : maintenant et la ligue du club recevant")
    void defaultsDateAndLeague() {
        givenBothTeams();
        when(predictionEngine.forecast(any(), eq(home), eq(away))).thenReturn(forecast(0.6));

        PredictionResponse response = service.predict(new PredictionRequest(1L, 2L));

        ArgumentCaptor<MatchContext> captor = ArgumentCaptor.forClass(MatchContext.class);
        verify(predictionEngine).forecast(captor.capture(), eq(home), eq(away));
        assertThat(captor.getValue().scheduledAt()).isEqualTo(NOW);
        assertThat(captor.getValue().league()).isEqualTo(LEAGUE);

        assertThat(response.getMatchInfo().getMatchDate()).isEqualTo(NOW);
        assertThat(response.getMatchInfo().getHomeTeam().getName()).isEqualTo("Lens");
        assertThat(response.getMatchInfo().getAwayTeam().getForm()).isEqualTo("DWWLW");
        assertThat(response.getTimestamp()).isEqualTo(NOW);
        assertThat(response.getKeyFactors()).containsExactly("Large league position gap");
        assertThat(response.isHighConfidence()).isFalse();
        verify(predictionSink).store(any(), any(), eq(false));
    }

    @Test
    void keepsRequestedDateAndLeague() {
        givenBothTeams();
        LocalDateTime kickOff = KICK_OFF;
        when(predictionEngine.forecast(any(), eq(home), eq(away))).thenReturn(forecast(0.6));

        service.predict(new PredictionRequest(1L, 2L, kickOff, "Coupe de France", "Bollaert"));

        ArgumentCaptor<MatchContext> captor = ArgumentCaptor.forClass(MatchContext.class);
        verify(predictionEngine).forecast(captor.capture(), eq(home), eq(away));
        assertThat(captor.getValue()).isEqualTo(new MatchContext(1L, 2L, "Coupe de France", kickOff, "Bollaert"));
    }

    @Test
    void flagsHighConfidenceAboveThreshold() {
        givenBothTeams();
        when(predictionEngine.forecast(any(), eq(home), eq(away))).thenReturn(forecast(0.8));

        PredictionResponse response = service.predict(new PredictionRequest(1L, 2L));

        assertThat(response.isHighConfidence()).isTrue();
        verify(predictionSink).store(any(), any(), eq(true));
    }

    @Test
    void thresholdItselfIsNotHighConfidence() {
        givenBothTeams();
        when(predictionEngine.forecast(any(), eq(home), eq(away))).thenReturn(forecast(0.75));

        assertThat(service.predict(new PredictionRequest(1L, 2L)).isHighConfidence()).isFalse();
    }

    @Test
    @DisplayName("Un échec d'archivage ne bloque pas la réponse")
    void sinkFailureIsNotPropagated() {
        givenBothTeams();
        EnsembleResult result = result(0.6);
        when(predictionEngine.forecast(any(), eq(home), eq(away))).thenReturn(new PredictionEngineService.Forecast(VECTOR, result));
        doThrow(new IllegalStateException("Base indisponible")).when(predictionSink).store(any(), any(), anyBoolean());

        PredictionResponse response = service.predict(new PredictionRequest(1L, 2L));

        assertThat(response.getPrediction()).isSameAs(result);
    }

    @Test
    void engineFailureIsPropagatedAndNothingStored() {
        givenBothTeams();
        when(predictionEngine.forecast(any(), eq(home), eq(away)))
                .thenThrow(new PredictionValidationException("Feature non finie : home_goals_per_game = NaN"));

        assertThatThrownBy(() -> service.predict(new PredictionRequest(1L, 2L)))
                .isInstanceOf(PredictionValidationException.class);
        verify(predictionSink, never()).store(any(), any(), anyBoolean());
    }

    @Test
    @DisplayName("Base lente ou indisponible : erreur transitoire, rien n'est calculé")
    void dataAccessFailureIsTransient() {
        when(teamDataProvider.findTeam(1L)).thenThrow(new QueryTimeoutException("db slow"));

        assertThatThrownBy(() -> service.predict(new PredictionRequest(1L, 2L)))
                .isInstanceOf(TransientLookupException.class)
                .hasMessageContaining("db slow")
                .hasCauseInstanceOf(QueryTimeoutException.class);

        verifyNoInteractions(predictionEngine, predictionSink);
    }

    @Test
    void missingTeamIsStillNotFoundAfterLookupWrapping() {
        when(teamDataProvider.findTeam(1L)).thenThrow(new TeamNotFoundException(1L));

        assertThatThrownBy(() -> service.predict(new PredictionRequest(1L, 2L)))
                .isInstanceOf(TeamNotFoundException.class);
    }

    @Test
    @DisplayName("Contexte historique : bilan des confrontations et forme des 5 derniers matchs")
    void historicalContextFromFeatures() {
        givenBothTeams();
        LocalDateTime lastMeeting = KICK_OFF.minusMonths(6);
        HeadToHeadFeatures h2h = HeadToHeadFeatures.builder()
                .matchesPlayed(6).homeWins(3).draws(2).awayWins(1)
                .lastMeetingDate(lastMeeting)
                .build();
        FeatureVector features = vector(
                averageTeam().recentForm("WDLWL").formPointsLast5(7).formGoalsForLast5(7).formGoalsAgainstLast5(7).build(),
                dominantTeam().recentForm("WWWWW").formGoalsForLast5(10).formGoalsAgainstLast5(5).build(),
                0.15, h2h);
        when(predictionEngine.forecast(any(), eq(home), eq(away)))
                .thenReturn(new PredictionEngineService.Forecast(features, result(0.6)));

        HistoricalContext history = service.predict(new PredictionRequest(1L, 2L)).getHistoricalContext();

        assertThat(history.getHeadToHeadRecord()).isEqualTo(HistoricalContext.HeadToHeadRecord.builder()
                .totalMatches(6).homeTeamWins(3).draws(2).awayTeamWins(1).lastMeeting(lastMeeting).build());
        assertThat(history.getHomeTeamForm()).isEqualTo(form("WDLWL", 7, 7, 7));
        assertThat(history.getAwayTeamForm()).isEqualTo(form("WWWWW", 15, 10, 5));
    }

    @Test
    void noMeetingLeavesLastMeetingEmpty() {
        givenBothTeams();
        when(predictionEngine.forecast(any(), eq(home), eq(away))).thenReturn(forecast(0.6));

        HistoricalContext history = service.predict(new PredictionRequest(1L, 2L)).getHistoricalContext();

        assertThat(history.getHeadToHeadRecord().getTotalMatches()).isZero();
        assertThat(history.getHeadToHeadRecord().getLastMeeting()).isNull();
        assertThat(history.getHomeTeamForm().getLast5Games()).isEmpty();
    }
}
