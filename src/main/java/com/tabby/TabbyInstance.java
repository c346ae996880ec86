package com.tabby;

import com.tabby.config.RuntimeConfig;
import com.tabby.debug.Debug;
import com.tabby.debug.DebugLevel;
import com.tabby.interpreter.InterpreterStack;
import com.tabby.interpreter.VdomElement;
import com.tabby.variant.ErrorSlot;
import com.tabby.variant.ValueStore;
import com.tabby.variant.VariantStat;

import java.util.ArrayList;
import java.util.List;

/**
 * TabbyInstance
 *
 * One runtime instance: its value store (pool, statistics, constants,
 * atoms, error slot) and the interpreter stacks created on it. Instances
 * share nothing; closing one tears down its stacks, then its store.
 *
 * Usage:
 *   try (TabbyInstance inst = TabbyInstance.create(RuntimeConfig.load())) {
 *       ValueStore store = inst.store();
 *       ...
 *   }
 */
public final class TabbyInstance implements AutoCloseable {

    private static final String TAG = "tabby.instance";

    private final RuntimeConfig config;
    private final ValueStore store;
    private final List<InterpreterStack> stacks = new ArrayList<>();
    private boolean closed;

    private TabbyInstance(RuntimeConfig config) {
        this.config = config;
        this.store = new ValueStore(config);
    }

    public static TabbyInstance create() {
        return create(RuntimeConfig.load());
    }

    public static TabbyInstance create(RuntimeConfig config) {
        RuntimeConfig cfg = (config == null) ? RuntimeConfig.defaults() : config;
        applyDebugLevel(cfg.getDebugLevel());
        TabbyInstance inst = new TabbyInstance(cfg);
        Debug.get().i(TAG, "created with " + cfg);
        return inst;
    }

    /** The Debug hub is process-wide; its level only moves when a config asks for a different one. */
    private static void applyDebugLevel(DebugLevel level) {
        Debug debug = Debug.get();
        DebugLevel previous = debug.getMinLevel();
        if (level == null || level == previous) return;
        debug.setMinLevel(level);
        debug.i(TAG, "debug level " + previous + " -> " + level);
    }

    public RuntimeConfig config() { return config; }

    public ValueStore store() { return store; }

    public ErrorSlot errors() { return store.errors(); }

    public VariantStat usageStat() { return store.usageStat(); }

    /** New stack over document; closed together with the instance. */
    public InterpreterStack newStack(VdomElement document) {
        if (closed) throw new IllegalStateException("instance is closed");
        InterpreterStack stack = new InterpreterStack(store, document);
        stacks.add(stack);
        return stack;
    }

    public boolean isClosed() { return closed; }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        for (InterpreterStack s : stacks) s.close();
        stacks.clear();
        store.close();
        Debug.get().i(TAG, "closed, " + store.usageStat());
    }
}
