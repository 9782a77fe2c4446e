package com.taskforge.coordination.streaming;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Event types a worker may send while it produces output, with the wire names each accepts.
 */
public enum StreamingEventType {
    START("start", "stream_start"),
    CHUNK("chunk", "stream_chunk"),
    THINKING("thinking"),
    REASONING("reasoning"),
    WORKBENCH_DELTA("workbench_delta"),
    STATUS("status"),
    DONE("done", "stream_done"),
    ERROR("error", "stream_error"),
    TOOL_START("tool_start"),
    TOOL_DONE("tool_done");

    private final Set<String> wireNames;

    StreamingEventType(String... wireNames) {
        this.wireNames = Set.of(wireNames);
    }

    public static Optional<StreamingEventType> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.wireNames.contains(normalized))
                .findFirst();
    }
}
