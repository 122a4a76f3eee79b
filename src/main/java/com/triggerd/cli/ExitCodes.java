package com.triggerd.cli;

public final class ExitCodes {

    public static final int OK = 0;
    public static final int ERROR = 1;
    public static final int USAGE = 2;
    // EX_CONFIG from sysexits.h
    public static final int ALREADY_RUNNING = 78;

    private ExitCodes() {
    }
}
