package com.callreplay.interfaces.api.dto;

import com.callreplay.domain.analysis.model.PrefilterVerdict;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PrefilterCheckResponse(
        String callId,
        boolean wouldAnalyze,
        double confidence,
        List<String> reasons,
        int callLength
) {
    public static PrefilterCheckResponse of(String callId, PrefilterVerdict verdict) {
        return new PrefilterCheckResponse(callId, verdict.failed(), verdict.confidence(),
                verdict.reasons(), verdict.callLength());
    }
}
