package com.tony.matchForecast.service.provider;

import com.tony.matchForecast.model.MatchContext;
import com.tony.matchForecast.model.feature.ExternalFactors;

public interface ExternalFactorsProvider {

    ExternalFactors getExternalFactors(MatchContext context);
}
