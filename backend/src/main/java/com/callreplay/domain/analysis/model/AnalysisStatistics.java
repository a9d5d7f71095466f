package com.callreplay.domain.analysis.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Aggregate counts and ratios over a set of analysis responses.
 * Every ratio is 0 when its denominator is 0.
 *
 * @param processingEfficiency (analyzed + skipped) / total; only reported for pipeline runs
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AnalysisStatistics(
        int total,
        int analyzed,
        int skipped,
        int errors,
        int issuesDetected,
        double issueRate,
        double averageConfidence,
        double successRate,
        Double processingEfficiency
) {

    public static AnalysisStatistics forBatch(List<AnalysisResponse> responses) {
        return compute(responses, false);
    }

    public static AnalysisStatistics forPipeline(List<AnalysisResponse> responses) {
        return compute(responses, true);
    }

    private static AnalysisStatistics compute(List<AnalysisResponse> responses, boolean includeEfficiency) {
        int total = responses.size();
        int analyzed = 0;
        int skipped = 0;
        int errors = 0;
        int issuesDetected = 0;
        int scored = 0;
        double confidenceSum = 0.0;

        for (AnalysisResponse response : responses) {
            switch (response.status()) {
                case ANALYZED -> analyzed++;
                case SKIPPED -> skipped++;
                case ERROR -> errors++;
            }
            if (response.hasAnalysis()) {
                if (response.analysis().issueDetected()) {
                    issuesDetected++;
                }
                confidenceSum += response.analysis().confidenceScore();
                scored++;
            }
        }

        return new AnalysisStatistics(
                total,
                analyzed,
                skipped,
                errors,
                issuesDetected,
                ratio(issuesDetected, analyzed),
                scored > 0 ? confidenceSum / scored : 0.0,
                ratio(analyzed, total),
                includeEfficiency ? ratio(analyzed + skipped, total) : null
        );
    }

    private static double ratio(int numerator, int denominator) {
        return denominator > 0 ? (double) numerator / denominator : 0.0;
    }
}
