package com.tony.matchForecast.model.feature;

public record ContextFeatures(MatchFeatures match, HeadToHeadFeatures headToHead, ExternalFactors external) {
}
