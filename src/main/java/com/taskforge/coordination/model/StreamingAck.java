package com.taskforge.coordination.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamingAck(boolean success, String message, Long offset) {

    public static StreamingAck accepted(Long offset) {
        return new StreamingAck(true, "ok", offset);
    }

    public static StreamingAck rejected(String message) {
        return new StreamingAck(false, message, null);
    }
}
