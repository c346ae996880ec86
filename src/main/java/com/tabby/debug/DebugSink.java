package com.tabby.debug;

/** Pluggable debug output target (stdout, file, test capture, etc.). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
