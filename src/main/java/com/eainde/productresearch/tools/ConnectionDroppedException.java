package com.eainde.productresearch.tools;

/**
 * The connection behind a shared tool session went away. The session must be
 * invalidated in the {@link ToolSessionPool} before the next try.
 */
public class ConnectionDroppedException extends ToolException {

    public ConnectionDroppedException(String message) {
        super(message);
    }

    public ConnectionDroppedException(String message, Throwable cause) {
        super(message, cause);
    }
}
