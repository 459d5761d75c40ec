package com.tony.matchForecast.repository;

import com.tony.matchForecast.model.MatchRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface MatchRecordRepository extends JpaRepository<MatchRecord, Long> {

    // Derniers matchs JOUÉS d'une équipe (Dom ou Ext), du plus récent au plus vieux
    @Query("SELECT m FROM MatchRecord m WHERE " +
            "(m.homeTeam.id = :teamId OR m.awayTeam.id = :teamId) " +
            "AND m.homeScore IS NOT NULL AND m.awayScore IS NOT NULL " +
            "ORDER BY m.matchDate DESC")
    List<MatchRecord> findLastFinishedMatchesByTeam(@Param("teamId") Long teamId, Pageable pageable);

    // Dernier match joué AVANT une date donnée
    @Query("SELECT m FROM MatchRecord m WHERE " +
            "(m.homeTeam.id = :teamId OR m.awayTeam.id = :teamId) " +
            "AND m.homeScore IS NOT NULL AND m.matchDate < :before " +
            "ORDER BY m.matchDate DESC")
    List<MatchRecord> findFinishedMatchesBefore(@Param("teamId") Long teamId, @Param("before") LocalDateTime before, Pageable pageable);

    @Query("SELECT COUNT(m) FROM MatchRecord m WHERE " +
            "(m.homeTeam.id = :teamId OR m.awayTeam.id = :teamId) " +
            "AND m.homeScore IS NOT NULL AND m.matchDate >= :from AND m.matchDate < :to")
    long countFinishedMatchesBetween(@Param("teamId") Long teamId, @Param("from") LocalDateTime from, @Param("to") LocalDateTime to);

    // H2H global : peu importe qui recevait
    @Query("SELECT m FROM MatchRecord m WHERE " +
            "((m.homeTeam.id = :t1Id AND m.awayTeam.id = :t2Id) OR " +
            "(m.homeTeam.id = :t2Id AND m.awayTeam.id = :t1Id)) " +
            "AND m.homeScore IS NOT NULL AND m.awayScore IS NOT NULL " +
            "ORDER BY m.matchDate DESC")
    List<MatchRecord> findHeadToHead(@Param("t1Id") Long team1Id, @Param("t2Id") Long team2Id, Pageable pageable);

    /**
     * Totaux des matchs terminés d'une ligue, calculés en base. Les sommes sont nulles si aucun match.
     */
    @Query("SELECT COUNT(m) AS matches, " +
            "SUM(m.homeScore + m.awayScore) AS totalGoals, " +
            "SUM(CASE WHEN m.homeScore > m.awayScore THEN 1 ELSE 0 END) AS homeWins, " +
            "SUM(CASE WHEN m.homeScore < m.awayScore THEN 1 ELSE 0 END) AS awayWins " +
            "FROM MatchRecord m WHERE m.homeTeam.league.name = :leagueName " +
            "AND m.homeScore IS NOT NULL AND m.awayScore IS NOT NULL")
    LeagueScoringTotals aggregateFinishedMatchesByLeague(@Param("leagueName") String leagueName);

    Optional<MatchRecord> findFirstByHomeTeamIdAndAwayTeamIdAndMatchDate(Long homeTeamId, Long awayTeamId, LocalDateTime matchDate);
}
