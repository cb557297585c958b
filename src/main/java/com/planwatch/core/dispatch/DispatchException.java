package com.planwatch.core.dispatch;

/**
 * Thrown when the start-workflow command could not be delivered or was rejected.
 * A dispatch failure ends any hope of a successful run but never stops listening.
 */
public class DispatchException extends RuntimeException {

    public enum Kind {
        /** Connection refused, timed out, or otherwise never got a response. */
        TRANSPORT,
        /** The engine answered with a non-2xx status. */
        PROTOCOL
    }

    private final Kind kind;
    private final int statusCode;
    private final String responseBody;

    private DispatchException(Kind kind, String message, int statusCode, String responseBody, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public static DispatchException transport(String message, Throwable cause) {
        return new DispatchException(Kind.TRANSPORT, message, -1, null, cause);
    }

    public static DispatchException protocol(int statusCode, String responseBody) {
        String message = "Engine returned HTTP " + statusCode;
        if (responseBody != null && !responseBody.isBlank()) {
            message += ": " + responseBody;
        }
        return new DispatchException(Kind.PROTOCOL, message, statusCode, responseBody, null);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * HTTP status for {@link Kind#PROTOCOL} failures, -1 otherwise.
     */
    public int statusCode() {
        return statusCode;
    }

    public String responseBody() {
        return responseBody;
    }
}
