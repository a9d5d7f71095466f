package com.callreplay.domain.analysis.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Speaker {
    USER("user"),
    BOT("bot");

    private final String value;

    Speaker(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Speaker from(String value) {
        for (Speaker speaker : values()) {
            if (speaker.value.equalsIgnoreCase(value)) {
                return speaker;
            }
        }
        throw new IllegalArgumentException("Unknown speaker: " + value);
    }
}
