package com.changeguard.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.stereotype.Service;

/**
 * Wraps Spring AI's {@link ChatClient} for plain, non-streaming text completions.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;

    public LlmService(ChatClient.Builder builder) {
        this.chatClient = builder.build();
    }

    /**
     * Sends a system + user prompt and returns the model's text answer.
     *
     * @param model        model id to request, or blank for the configured default
     * @param systemPrompt instructions for the model's role / behaviour
     * @param userPrompt   the request text
     * @return the non-blank response text
     * @throws LlmEmptyResponseException if the model returns no content
     */
    public String textCall(String model, String systemPrompt, String userPrompt) {
        log.info("LLM call started (model {})", model == null || model.isBlank() ? "default" : model);
        long start = System.currentTimeMillis();
        var request = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt);
        if (model != null && !model.isBlank()) {
            request = request.options(ChatOptions.builder().model(model).build());
        }
        String response = request.call().content();
        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete ({}s)", String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content. Check that the model is running.");
        }
        return response;
    }
}
