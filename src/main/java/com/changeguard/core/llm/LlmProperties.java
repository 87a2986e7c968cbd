package com.changeguard.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "changeguard.llm")
public class LlmProperties {

    /** Model id sent with each request; blank uses the chat model's configured default. */
    private String model = "";
    private int timeoutSeconds = 120;
    private String systemPrompt = """
            You are a careful software engineer. You are given a file and an instruction.
            Reply with the complete new content of the file and nothing else: no explanation,
            no surrounding prose. Preserve formatting and unrelated code exactly.""";

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }

    public boolean hasModel() {
        return model != null && !model.isBlank();
    }
}
