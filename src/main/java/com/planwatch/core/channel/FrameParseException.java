package com.planwatch.core.channel;

/**
 * Thrown when a single event frame is not a JSON object. Never fatal to the stream.
 */
public class FrameParseException extends RuntimeException {

    public FrameParseException(String message) {
        super(message);
    }

    public FrameParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
