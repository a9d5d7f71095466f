package com.callreplay.interfaces.api.dto;

import com.callreplay.domain.analysis.model.CallTranscript;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TranscriptRequest(
        @NotBlank(message = "Call id is required")
        String callId,

        @NotEmpty(message = "Dialog must contain at least one turn")
        List<@Valid TurnRequest> dialog,

        Map<String, Object> metadata
) {
    public CallTranscript toTranscript() {
        return new CallTranscript(callId, dialog.stream().map(TurnRequest::toTurn).toList(), metadata);
    }
}
