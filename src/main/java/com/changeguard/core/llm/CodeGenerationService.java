package com.changeguard.core.llm;

import com.changeguard.core.exception.ExternalServiceException;
import com.changeguard.core.exception.FileAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Asks the code-generation model for the new content of one file.
 * <p>
 * The call runs on a dedicated executor and is bounded by {@code changeguard.llm.timeout-seconds}.
 * Any failure surfaces as {@link ExternalServiceException} before a change record exists. The
 * answer is untrusted text; it only reaches disk after passing the risk gate as a proposed change.
 */
@Service
public class CodeGenerationService {

    private static final Logger log = LoggerFactory.getLogger(CodeGenerationService.class);

    private static final Pattern FENCED = Pattern.compile("^```[\\w.+-]*\\R(.*?)\\R?```\\s*$", Pattern.DOTALL);

    private final LlmService llmService;
    private final LlmProperties properties;
    private final ExecutorService executor;

    public CodeGenerationService(LlmService llmService, LlmProperties properties,
                                 @Qualifier("generationExecutor") ExecutorService executor) {
        this.llmService = llmService;
        this.properties = properties;
        this.executor = executor;
    }

    /**
     * Generates the full new content of {@code target} following {@code instruction}.
     *
     * @param target      file to generate content for; may not exist yet
     * @param instruction what the new content should do
     * @param model       model id, or blank for the configured one
     * @return generated content with any surrounding markdown fence removed
     * @throws ExternalServiceException on timeout, interruption or model failure
     */
    public String generate(Path target, String instruction, String model) {
        String current = readCurrent(target);
        String userPrompt = current == null
                ? "File: %s (new file)%n%nInstruction:%n%s".formatted(target, instruction)
                : "File: %s%n%nCurrent content:%n%s%n%nInstruction:%n%s".formatted(target, current, instruction);
        String effectiveModel = model == null || model.isBlank() ? properties.getModel() : model;

        Future<String> call = executor.submit(
                () -> llmService.textCall(effectiveModel, properties.getSystemPrompt(), userPrompt));
        try {
            String answer = call.get(properties.getTimeoutSeconds(), TimeUnit.SECONDS);
            return stripFence(answer);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Code generation for {} timed out after {}s", target, properties.getTimeoutSeconds());
            throw new ExternalServiceException("llm",
                    "Timed out after %ds generating %s".formatted(properties.getTimeoutSeconds(), target), e);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExternalServiceException("llm", "Interrupted while generating " + target, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ExternalServiceException ese) {
                throw ese;
            }
            throw new ExternalServiceException("llm", "Generation failed: " + cause.getMessage(), cause);
        }
    }

    /** Identifier recorded as the origin of generated changes. */
    public String modelId(String model) {
        if (model != null && !model.isBlank()) {
            return model;
        }
        return properties.hasModel() ? properties.getModel() : "default-chat-model";
    }

    static String stripFence(String answer) {
        String trimmed = answer.strip();
        Matcher m = FENCED.matcher(trimmed);
        String body = m.matches() ? m.group(1) : answer;
        return body.endsWith("\n") ? body : body + "\n";
    }

    private static String readCurrent(Path target) {
        if (!Files.exists(target)) {
            return null;
        }
        try {
            return Files.readString(target);
        } catch (IOException e) {
            throw new FileAccessException(target, "Cannot read file for generation", e);
        }
    }
}
