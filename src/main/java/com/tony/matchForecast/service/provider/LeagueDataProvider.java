package com.tony.matchForecast.service.provider;

import com.tony.matchForecast.model.LeagueAverages;

public interface LeagueDataProvider {

    LeagueAverages getLeagueAverages(String league);
}
