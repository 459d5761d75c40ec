package com.tony.matchForecast.service.provider;

import com.tony.matchForecast.model.FormResult;
import com.tony.matchForecast.model.HeadToHeadMeeting;
import com.tony.matchForecast.model.League;
import com.tony.matchForecast.model.MatchRecord;
import com.tony.matchForecast.model.Team;
import com.tony.matchForecast.model.TeamSnapshot;
import com.tony.matchForecast.model.TeamStats;
import com.tony.matchForecast.repository.MatchRecordRepository;
import com.tony.matchForecast.repository.TeamRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JpaTeamDataProviderTest {

    @Mock
    private TeamRepository teamRepository;
    @Mock
    private MatchRecordRepository matchRepository;

    @InjectMocks
    private JpaTeamDataProvider provider;

    private League ligue1;
    private Team lens;
    private Team lille;

    @BeforeEach
    void setUp() {
        ligue1 = new League("Ligue 1", "France");
        ligue1.setId(10L);
        lens = new Team("Lens", ligue1);
        lens.setId(1L);
        lille = new Team("Lille", ligue1);
        lille.setId(2L);
    }

    private MatchRecord played(Team home, Team away, int homeScore, int awayScore, LocalDateTime date) {
        MatchRecord m = new MatchRecord();
        m.setHomeTeam(home);
        m.setAwayTeam(away);
        m.setHomeScore(homeScore);
        m.setAwayScore(awayScore);
        m.setMatchDate(date);
        return m;
    }

    @Test
    void mapsStoredStatistics() {
        lens.setCurrentStats(new TeamStats(3, 20, 10, 6, 2, 2, 18, 9, "WWDLWWLDWWD"));
        when(teamRepository.findById(1L)).thenReturn(Optional.of(lens));

        TeamSnapshot snapshot = provider.findTeam(1L).orElseThrow();

        assertThat(snapshot.league()).isEqualTo("Ligue 1");
        assertThat(snapshot.rank()).isEqualTo(3);
        assertThat(snapshot.goalsFor()).isEqualTo(18);
        // Forme tronquée à 10 symboles
        assertThat(snapshot.form()).hasSize(TeamSnapshot.MAX_FORM_LENGTH);
        assertThat(snapshot.formSequence()).isEqualTo("WWDLWWLDWW");
    }

    @Test
    @DisplayName("Sans classement, l'équipe est placée en milieu de tableau")
    void missingRankFallsBackToMidTable() {
        lens.setCurrentStats(new TeamStats(null, 4, null, 1, 1, 1, 3, 3, "WDL"));
        when(teamRepository.findById(1L)).thenReturn(Optional.of(lens));
        when(teamRepository.countByLeagueId(10L)).thenReturn(18L);

        TeamSnapshot snapshot = provider.findTeam(1L).orElseThrow();

        assertThat(snapshot.rank()).isEqualTo(9);
        assertThat(snapshot.gamesPlayed()).isEqualTo(3);
    }

    @Test
    void unknownTeam() {
        when(teamRepository.findById(42L)).thenReturn(Optional.empty());

        assertThat(provider.findTeam(42L)).isEmpty();
    }

    @Test
    void recentOutcomesFromPlayedMatches() {
        LocalDateTime date = LocalDateTime.of(2024, 10, 5, 21, 0);
        when(matchRepository.findLastFinishedMatchesByTeam(1L, PageRequest.of(0, 3))).thenReturn(List.of(
                played(lens, lille, 2, 0, date),
                played(lille, lens, 1, 1, date.minusDays(7)),
                played(lille, lens, 3, 1, date.minusDays(14))));

        assertThat(provider.getRecentOutcomes(1L, 3))
                .containsExactly(FormResult.WIN, FormResult.DRAW, FormResult.LOSS);
    }

    @Test
    void recentOutcomesFallBackToStoredForm() {
        lens.setCurrentStats(new TeamStats(3, 20, 10, 6, 2, 2, 18, 9, "LWWDW"));
        when(matchRepository.findLastFinishedMatchesByTeam(1L, PageRequest.of(0, 3))).thenReturn(List.of());
        when(teamRepository.findById(1L)).thenReturn(Optional.of(lens));

        assertThat(provider.getRecentOutcomes(1L, 3))
                .containsExactly(FormResult.LOSS, FormResult.WIN, FormResult.WIN);
    }

    @Test
    void headToHeadMeetings() {
        LocalDateTime date = LocalDateTime.of(2024, 4, 1, 20, 0);
        when(matchRepository.findHeadToHead(1L, 2L, PageRequest.of(0, 20)))
                .thenReturn(List.of(played(lille, lens, 0, 2, date)));

        List<HeadToHeadMeeting> meetings = provider.getHeadToHead(1L, 2L, 20);

        assertThat(meetings).containsExactly(new HeadToHeadMeeting(2L, 1L, 0, 2, date));
        assertThat(meetings.get(0).goalsFor(1L)).isEqualTo(2);
    }

    @Test
    void lastCompletedMatchDate() {
        LocalDateTime before = LocalDateTime.of(2024, 10, 19, 21, 0);
        LocalDateTime last = before.minusDays(6);
        when(matchRepository.findFinishedMatchesBefore(1L, before, PageRequest.of(0, 1)))
                .thenReturn(List.of(played(lens, lille, 1, 0, last)));

        assertThat(provider.findLastCompletedMatchDate(1L, before)).contains(last);
    }
}
