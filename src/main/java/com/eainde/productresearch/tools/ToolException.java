package com.eainde.productresearch.tools;

/**
 * Transient failure of an external tool call. Callers may retry.
 */
public class ToolException extends RuntimeException {

    public ToolException(String message) {
        super(message);
    }

    public ToolException(String message, Throwable cause) {
        super(message, cause);
    }
}
