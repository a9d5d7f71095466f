package com.callreplay.infrastructure.ai;

/**
 * Single round trip to a chat completion endpoint.
 * Implementations throw on transport or endpoint failure; they never retry.
 */
public interface CompletionClient {

    LlmCallResult complete(String systemPrompt, String userMessage, double temperature, int maxTokens);

    String modelName();
}
