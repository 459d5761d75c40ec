package com.tony.matchForecast.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StreakType {
    WIN("win"),
    DRAW("draw"),
    LOSS("loss"),
    NONE("none");

    private final String code;

    StreakType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static StreakType of(FormResult result) {
        return switch (result) {
            case WIN -> WIN;
            case DRAW -> DRAW;
            case LOSS -> LOSS;
        };
    }
}
