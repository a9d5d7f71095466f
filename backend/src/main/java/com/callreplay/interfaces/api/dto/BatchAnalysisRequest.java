package com.callreplay.interfaces.api.dto;

import com.callreplay.domain.analysis.model.CallTranscript;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record BatchAnalysisRequest(
        @NotEmpty(message = "At least one transcript is required")
        List<@Valid TranscriptRequest> transcripts
) {
    public List<CallTranscript> toTranscripts() {
        return transcripts.stream().map(TranscriptRequest::toTranscript).toList();
    }
}
