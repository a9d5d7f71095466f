package com.callreplay.infrastructure.ai;

/**
 * Raw completion text plus token usage of one LLM API call.
 */
public record LlmCallResult(String content, long promptTokens, long completionTokens) {}
