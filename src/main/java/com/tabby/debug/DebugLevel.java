package com.tabby.debug;

/** Severity of a debug record, lowest first. */
public enum DebugLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR;

    public boolean atLeast(DebugLevel min) {
        return ordinal() >= min.ordinal();
    }
}
