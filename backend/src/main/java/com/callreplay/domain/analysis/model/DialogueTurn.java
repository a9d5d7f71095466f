package com.callreplay.domain.analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One utterance of a call, attributed to the customer or the bot.
 *
 * @param speaker   who spoke
 * @param text      what was said
 * @param timestamp optional wall-clock marker from the recording (nullable)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DialogueTurn(
        Speaker speaker,
        String text,
        String timestamp
) {
    public DialogueTurn(Speaker speaker, String text) {
        this(speaker, text, null);
    }

    public static DialogueTurn user(String text) {
        return new DialogueTurn(Speaker.USER, text);
    }

    public static DialogueTurn bot(String text) {
        return new DialogueTurn(Speaker.BOT, text);
    }

    @JsonIgnore
    public boolean isUser() {
        return speaker == Speaker.USER;
    }

    @JsonIgnore
    public boolean isBot() {
        return speaker == Speaker.BOT;
    }
}
