package com.anthem.pubsub.gateway.exception;

import com.anthem.pubsub.gateway.model.EventErrorCode;

/**
 * Failure of a client event that is reported to the client as an error
 * frame. The message is client-facing.
 */
public class EventError extends RuntimeException {

    private final EventErrorCode code;

    public EventError(EventErrorCode code) {
        this(code, code.getDefaultMessage());
    }

    public EventError(EventErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public EventErrorCode getCode() {
        return code;
    }
}
