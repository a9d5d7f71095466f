package com.callreplay.domain.analysis.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Map;

/**
 * Summary of the persisted analysis records.
 *
 * @param dateRange null when no record carries a parseable timestamp
 * @param callIds   first 10 distinct call ids in storage order
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StoreStats(
        int total,
        DateRange dateRange,
        Map<String, Long> statusBreakdown,
        int uniqueCalls,
        List<String> callIds
) {
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record DateRange(String earliest, String latest, long spanDays) {}

    public static StoreStats empty() {
        return new StoreStats(0, null, Map.of(), 0, List.of());
    }
}
