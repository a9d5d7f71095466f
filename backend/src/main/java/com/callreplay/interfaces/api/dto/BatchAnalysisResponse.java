package com.callreplay.interfaces.api.dto;

import com.callreplay.domain.analysis.model.AnalysisResponse;
import com.callreplay.domain.analysis.model.AnalysisStatistics;

import java.util.List;

public record BatchAnalysisResponse(
        List<AnalysisResponse> results,
        AnalysisStatistics summary
) {}
