package com.callreplay.infrastructure.ai;

import com.openai.client.OpenAIClient;
import com.openai.models.ResponseFormatJsonObject;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * OpenAI chat completion call with JSON response format.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenAiCompletionClient implements CompletionClient {

    private final OpenAIClient openAIClient;

    @Value("${openai.model}")
    private String model;

    @Override
    public LlmCallResult complete(String systemPrompt, String userMessage, double temperature, int maxTokens) {
        ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                .model(model)
                .temperature(temperature)
                .maxCompletionTokens(maxTokens)
                .addSystemMessage(systemPrompt)
                .addUserMessage(userMessage)
                .responseFormat(ResponseFormatJsonObject.builder().build())
                .build();

        ChatCompletion completion = openAIClient.chat().completions().create(params);

        long promptTokens = 0;
        long completionTokens = 0;
        if (completion.usage().isPresent()) {
            var usage = completion.usage().get();
            promptTokens = usage.promptTokens();
            completionTokens = usage.completionTokens();
            log.info("Token usage [{}] - prompt: {}, completion: {}, total: {}",
                    model, promptTokens, completionTokens, usage.totalTokens());
        }

        String content = completion.choices().stream()
                .findFirst()
                .flatMap(choice -> choice.message().content())
                .orElseThrow(() -> new LlmInvocationException("OpenAI response has no content"));

        return new LlmCallResult(content, promptTokens, completionTokens);
    }

    @Override
    public String modelName() {
        return model;
    }
}
