package com.changeguard.core.llm;

import com.changeguard.core.exception.ExternalServiceException;

/**
 * Thrown when the LLM returns null or blank content instead of a valid response.
 */
public class LlmEmptyResponseException extends ExternalServiceException {

    public LlmEmptyResponseException(String message) {
        super("llm", message);
    }
}
