package com.callreplay.domain.analysis.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Immediate answer to a single-transcript ingestion. The background analysis,
 * if any, is not reflected here.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IngestAck(
        String status,
        String callId,
        String message,
        String error
) {
    public static final String RECEIVED = "received";
    public static final String RECEIVED_AND_ANALYZING = "received_and_analyzing";

    public static IngestAck received(String callId) {
        return new IngestAck(RECEIVED, callId, "Transcript stored for batch processing", null);
    }

    public static IngestAck analyzing(String callId) {
        return new IngestAck(RECEIVED_AND_ANALYZING, callId, "Transcript received and analysis started", null);
    }

    public static IngestAck failed(String callId, String error) {
        return new IngestAck(null, callId, null, error);
    }
}
