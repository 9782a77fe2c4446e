package com.taskforge.coordination.streaming;

/**
 * Thrown when a streaming event cannot be turned into a {@link StreamingEvent}.
 */
public class StreamingEventFormatException extends RuntimeException {

    public StreamingEventFormatException(String message) {
        super(message);
    }
}
