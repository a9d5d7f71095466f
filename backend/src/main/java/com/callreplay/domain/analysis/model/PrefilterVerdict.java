package com.callreplay.domain.analysis.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Outcome of the heuristic prefilter for one call.
 *
 * @param failed     true if the call should go to LLM analysis
 * @param confidence reported confidence, clamped to [0, 1]
 * @param reasons    reasons of every triggered detector, in detector order
 * @param callLength number of turns in the dialog
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PrefilterVerdict(
        boolean failed,
        double confidence,
        List<String> reasons,
        int callLength
) {
    public PrefilterVerdict {
        reasons = List.copyOf(reasons);
    }
}
