package com.callreplay.interfaces.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

public record IngestRequest(
        @NotNull(message = "Transcript is required")
        @Valid
        TranscriptRequest transcript,

        Map<String, Object> metadata
) {}
