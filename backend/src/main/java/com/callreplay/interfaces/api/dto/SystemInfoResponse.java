package com.callreplay.interfaces.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SystemInfoResponse(
        String model,
        double temperature,
        int maxRetries,
        int frustrationKeywordsCount,
        int botConfusionPatternsCount,
        int shortResponseThreshold
) {}
