package com.callreplay.interfaces.api.dto;

import com.callreplay.domain.analysis.model.DialogueTurn;
import com.callreplay.domain.analysis.model.Speaker;
import jakarta.validation.constraints.NotNull;

public record TurnRequest(
        @NotNull(message = "Speaker is required")
        Speaker speaker,

        @NotNull(message = "Turn text is required")
        String text,

        String timestamp
) {
    public DialogueTurn toTurn() {
        return new DialogueTurn(speaker, text, timestamp);
    }
}
