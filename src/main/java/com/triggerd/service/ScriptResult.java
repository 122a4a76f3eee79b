package com.triggerd.service;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ScriptResult {
    private final int exitCode;
    // stdout and stderr interleaved in the order the script wrote them
    private final String output;
}
