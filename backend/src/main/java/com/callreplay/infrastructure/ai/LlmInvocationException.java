package com.callreplay.infrastructure.ai;

import lombok.Getter;

@Getter
public class LlmInvocationException extends RuntimeException {

    private final int attempts;

    public LlmInvocationException(String message) {
        this(message, 1);
    }

    public LlmInvocationException(String message, int attempts) {
        super(message);
        this.attempts = attempts;
    }

    public LlmInvocationException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }
}
