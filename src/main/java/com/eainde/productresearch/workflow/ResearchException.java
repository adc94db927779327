package com.eainde.productresearch.workflow;

/**
 * The research graph could not be built or run. Stage failures never surface as this.
 */
public class ResearchException extends RuntimeException {

    public ResearchException(String message) {
        super(message);
    }

    public ResearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
