package com.callreplay.domain.analysis.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AnalysisStatus {
    ANALYZED("analyzed"),
    SKIPPED("skipped"),
    ERROR("error");

    private final String value;

    AnalysisStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AnalysisStatus from(String value) {
        for (AnalysisStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown analysis status: " + value);
    }
}
