package com.triggerd.daemon;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.nio.file.Path;

@Getter
@AllArgsConstructor
public class DaemonStatus {
    private final boolean running;
    // null when not running
    private final Long pid;
    private final Path pidFile;
}
