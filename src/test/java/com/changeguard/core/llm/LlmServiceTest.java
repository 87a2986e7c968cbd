package com.changeguard.core.llm;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;
import org.springframework.ai.chat.prompt.ChatOptions;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link LlmService}.
 * <p>
 * Mocks the entire {@link ChatClient} chain so no real LLM calls are made.
 */
class LlmServiceTest {

    private ChatClientRequestSpec mockRequestSpec;
    private CallResponseSpec mockCallResponse;
    private LlmService llmService;

    @BeforeEach
    void setUp() {
        ChatClient mockChatClient = mock(ChatClient.class);
        mockRequestSpec = mock(ChatClientRequestSpec.class);
        mockCallResponse = mock(CallResponseSpec.class);

        // Wire up the fluent API chain
        when(mockChatClient.prompt()).thenReturn(mockRequestSpec);
        when(mockRequestSpec.system(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.user(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.options(any(ChatOptions.class))).thenReturn(mockRequestSpec);
        when(mockRequestSpec.call()).thenReturn(mockCallResponse);

        ChatClient.Builder mockBuilder = mock(ChatClient.Builder.class);
        when(mockBuilder.build()).thenReturn(mockChatClient);

        llmService = new LlmService(mockBuilder);
    }

    @Test
    @DisplayName("textCall sends system and user prompts and returns the content")
    void textCallSendsPrompts() {
        when(mockCallResponse.content()).thenReturn("export const x = 1;\n");

        String result = llmService.textCall("", "System prompt", "User prompt");

        assertEquals("export const x = 1;\n", result);
        verify(mockRequestSpec).system("System prompt");
        verify(mockRequestSpec).user("User prompt");
        verify(mockRequestSpec, never()).options(any(ChatOptions.class));
    }

    @Test
    @DisplayName("textCall requests a specific model when one is given")
    void textCallWithModel() {
        when(mockCallResponse.content()).thenReturn("ok");

        llmService.textCall("gpt-4o", "s", "u");

        verify(mockRequestSpec).options(argThat((ChatOptions options) -> "gpt-4o".equals(options.getModel())));
    }

    @Test
    @DisplayName("textCall throws LlmEmptyResponseException on null or blank content")
    void emptyResponse() {
        when(mockCallResponse.content()).thenReturn(null);
        assertThrows(LlmEmptyResponseException.class, () -> llmService.textCall("", "s", "u"));

        when(mockCallResponse.content()).thenReturn("   ");
        assertThrows(LlmEmptyResponseException.class, () -> llmService.textCall("", "s", "u"));
    }
}
