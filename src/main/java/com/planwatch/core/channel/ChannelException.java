package com.planwatch.core.channel;

/**
 * Thrown when the event stream fails for any reason other than a clean close by the
 * remote end. Ends listening; the session is still finalized with partial state.
 */
public class ChannelException extends RuntimeException {

    public ChannelException(String message) {
        super(message);
    }

    public ChannelException(String message, Throwable cause) {
        super(message, cause);
    }
}
