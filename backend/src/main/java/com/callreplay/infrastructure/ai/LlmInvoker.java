package com.callreplay.infrastructure.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Turns a prompt into a parsed JSON object reply.
 * <p>
 * Transport failures and unparsable replies are treated alike: both consume
 * one attempt. A reply must be exactly one JSON object; trailing text after it
 * counts as unparsable. Once {@code maxRetries} attempts are used up the last failure
 * is reported as an {@link LlmInvocationException}.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmInvoker {

    static final String SYSTEM_INSTRUCTION = "You are a helpful assistant that always responds with valid JSON.";
    static final int REPLY_EXCERPT_LENGTH = 200;

    private final CompletionClient completionClient;
    private final ObjectMapper objectMapper;

    @Value("${openai.temperature:0.2}")
    private double temperature = 0.2;

    @Value("${openai.max-tokens:2000}")
    private int maxTokens = 2000;

    @Value("${openai.max-retries:3}")
    private int maxRetries = 3;

    @Value("${openai.retry-delay-ms:0}")
    private long retryDelayMs = 0;

    public JsonNode invoke(String prompt) {
        String lastReply = null;
        RuntimeException lastFailure = null;

        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            if (attempt > 1) {
                pause();
            }

            String reply;
            try {
                reply = completionClient.complete(SYSTEM_INSTRUCTION, prompt, temperature, maxTokens)
                        .content()
                        .trim();
            } catch (RuntimeException e) {
                log.warn("LLM call failed on attempt {}/{}: {}", attempt, maxRetries, e.getMessage());
                lastFailure = e;
                lastReply = null;
                continue;
            }

            try {
                JsonNode node = objectMapper.reader()
                        .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                        .readTree(reply);
                if (node != null && node.isObject()) {
                    return node;
                }
                log.warn("Non-object JSON reply on attempt {}/{}", attempt, maxRetries);
            } catch (JsonProcessingException e) {
                log.warn("Invalid JSON reply on attempt {}/{}: {}", attempt, maxRetries, e.getOriginalMessage());
            }
            lastReply = reply;
            lastFailure = null;
        }

        if (lastFailure == null && lastReply != null) {
            throw new LlmInvocationException(
                    "Failed to parse JSON response: " + excerpt(lastReply) + "...", maxRetries);
        }
        String cause = lastFailure != null ? lastFailure.getMessage() : "no attempt was made";
        throw new LlmInvocationException(
                "LLM call failed after " + maxRetries + " attempts: " + cause, maxRetries, lastFailure);
    }

    public String getModelName() {
        return completionClient.modelName();
    }

    public double getTemperature() {
        return temperature;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    static String excerpt(String reply) {
        return reply.length() <= REPLY_EXCERPT_LENGTH ? reply : reply.substring(0, REPLY_EXCERPT_LENGTH);
    }

    private void pause() {
        if (retryDelayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(retryDelayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmInvocationException("Interrupted while waiting to retry LLM call", maxRetries, e);
        }
    }
}
