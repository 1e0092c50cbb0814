package dev.jobdigest.ai;

/**
 * The LLM answered, but not with something the pipeline can use.
 */
public class LlmResponseException extends RuntimeException {

    public LlmResponseException(String message) {
        super(message);
    }

    public LlmResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
