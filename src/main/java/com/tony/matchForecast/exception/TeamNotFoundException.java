package com.tony.matchForecast.exception;

import lombok.Getter;

@Getter
public class TeamNotFoundException extends ForecastException {

    private final Long teamId;

    public TeamNotFoundException(Long teamId) {
        super("Équipe introuvable ID: " + teamId);
        this.teamId = teamId;
    }
}
