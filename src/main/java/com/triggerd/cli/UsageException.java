package com.triggerd.cli;

/**
 * The command line itself is wrong: unknown command, missing option or
 * argument. Reported with the usage text and exit code 2.
 */
public class UsageException extends RuntimeException {

    public UsageException(String message) {
        super(message);
    }
}
