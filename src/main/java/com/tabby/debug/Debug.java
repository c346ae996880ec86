package com.tabby.debug;

import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Global debug hub for all Tabby components.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...)
 * - Records below the minimum level are dropped before reaching the sink
 * - Safe default (no-op) if no sink installed
 */
public final class Debug {

    private static final Debug INSTANCE = new Debug();

    private static final DebugSink NOOP = (level, tag, message, error) -> {
        // intentionally empty
    };

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);
    private volatile DebugLevel minLevel = DebugLevel.INFO;

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    /** Route everything to System.out / System.err (ERROR and WARN go to err). */
    public static void useSysOut() {
        INSTANCE.setSink((level, tag, message, error) -> {
            PrintStream out = level.atLeast(DebugLevel.WARN) ? System.err : System.out;
            out.println("[" + level + "][" + tag + "] " + message);
            if (error != null) error.printStackTrace(out);
        });
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    public void setMinLevel(DebugLevel level) {
        this.minLevel = (level == null) ? DebugLevel.INFO : level;
    }

    public DebugLevel getMinLevel() { return minLevel; }

    public boolean isEnabled(DebugLevel level) {
        return level.atLeast(minLevel);
    }

    // Convenience methods
    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (!isEnabled(level)) return;
        sinkRef.get().log(level, tag, message, error);
    }
}
