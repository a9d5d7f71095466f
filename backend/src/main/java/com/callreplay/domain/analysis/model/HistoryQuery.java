package com.callreplay.domain.analysis.model;

import java.time.Instant;

/**
 * Filters for reading persisted analysis records. Every field is optional.
 * {@code limit} truncates the filtered set before it is sorted newest first.
 */
public record HistoryQuery(
        Instant startDate,
        Instant endDate,
        String callId,
        AnalysisStatus status,
        Integer limit
) {
    public static HistoryQuery all() {
        return new HistoryQuery(null, null, null, null, null);
    }

    public static HistoryQuery byCallId(String callId) {
        return new HistoryQuery(null, null, callId, null, null);
    }

    public boolean hasDateRange() {
        return startDate != null || endDate != null;
    }
}
