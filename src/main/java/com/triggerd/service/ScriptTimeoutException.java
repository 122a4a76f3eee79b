package com.triggerd.service;

import java.time.Duration;

/**
 * The script outlived the execution timeout and was killed. Carries whatever
 * it had printed up to that point.
 */
public class ScriptTimeoutException extends Exception {

    private final Duration timeout;
    private final String partialOutput;

    public ScriptTimeoutException(Duration timeout, String partialOutput) {
        super("Execution timed out after " + timeout.toSeconds() + " seconds");
        this.timeout = timeout;
        this.partialOutput = partialOutput;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public String getPartialOutput() {
        return partialOutput;
    }
}
