package com.triggerd.events;

/**
 * An event batch does not follow the stdin contract: unparseable JSON, wrong
 * schema tag, unsupported version or a missing required field.
 */
public class InvalidEventBatchException extends RuntimeException {

    public InvalidEventBatchException(String message) {
        super(message);
    }

    public InvalidEventBatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
