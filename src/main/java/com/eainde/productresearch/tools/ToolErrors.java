package com.eainde.productresearch.tools;

import java.io.EOFException;
import java.net.SocketException;
import java.util.List;
import java.util.Locale;

public final class ToolErrors {

    private static final List<String> DROPPED_MARKERS = List.of(
            "connection reset", "connection closed", "broken pipe",
            "closedresource", "unexpected end of stream", "stream was reset");

    private ToolErrors() {
    }

    /**
     * True when {@code error} or any of its causes signals a dropped connection.
     */
    public static boolean isConnectionDropped(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof ConnectionDroppedException
                    || current instanceof SocketException
                    || current instanceof EOFException) {
                return true;
            }
            String message = current.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                for (String marker : DROPPED_MARKERS) {
                    if (lower.contains(marker)) {
                        return true;
                    }
                }
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }

    /** Message of the innermost cause, or the class name when it carries none. */
    public static String describe(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        return message == null || message.isBlank() ? root.getClass().getSimpleName() : message;
    }
}
