package com.tony.matchForecast.repository;

import com.tony.matchForecast.model.Team;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TeamRepository extends JpaRepository<Team, Long> {

    List<Team> findByLeagueId(Long leagueId);

    long countByLeagueId(Long leagueId);
}
