package com.callreplay.domain.analysis.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Map;

/**
 * Full recorded exchange of one call. The call id is opaque and is not
 * guaranteed to be unique across ingestions.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CallTranscript(
        String callId,
        List<DialogueTurn> dialog,
        Map<String, Object> metadata
) {
    public CallTranscript {
        dialog = dialog == null ? List.of() : List.copyOf(dialog);
    }

    public CallTranscript(String callId, List<DialogueTurn> dialog) {
        this(callId, dialog, null);
    }

    public CallTranscript withMetadata(Map<String, Object> metadata) {
        return new CallTranscript(callId, dialog, metadata);
    }
}
