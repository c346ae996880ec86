package com.tabby.interpreter;

import com.tabby.variant.AtomTable;
import com.tabby.variant.ErrorCode;
import com.tabby.variant.ValueStore;
import com.tabby.variant.Variant;
import com.tabby.variant.VariantObject;

/**
 * Timers of one stack, kept as a set of objects keyed by "id":
 * { "id": ..., "interval": ..., "active": ... }.
 *
 * Observers bound to the timers value get "expired:&lt;id&gt;" when a timer
 * fires, and "activated:&lt;id&gt;" / "deactivated:&lt;id&gt;" when it is
 * switched on or off. Scheduling is left to the host, which calls
 * {@link #fire(String)}.
 */
public final class Timers {

    public static final String KEY_ID = "id";
    public static final String KEY_INTERVAL = "interval";
    public static final String KEY_ACTIVE = "active";

    private final ValueStore store;
    private final InterpreterStack stack;
    private final Variant timers;

    Timers(ValueStore store, InterpreterStack stack) {
        this.store = store;
        this.stack = stack;
        this.timers = store.makeSet(KEY_ID);
    }

    /** The set value observe elements bind to. */
    public Variant variant() { return timers; }

    public boolean isTimers(Variant v) { return v == timers; }

    public int size() { return timers.asSet().size(); }

    public boolean add(String id, long intervalMs, boolean active) {
        if (id == null || id.isEmpty()) {
            store.errors().set(ErrorCode.INVALID_VALUE, "timer id is empty");
            return false;
        }
        Variant timer = store.makeObject();
        Variant idv = store.makeString(id);
        Variant interval = store.makeLongInt(intervalMs);
        try {
            VariantObject obj = timer.asObject();
            obj.set(KEY_ID, idv);
            obj.set(KEY_INTERVAL, interval);
            obj.set(KEY_ACTIVE, store.makeBoolean(active));
            return timers.asSet().add(timer, false);
        } finally {
            store.unref(interval);
            store.unref(idv);
            store.unref(timer);
        }
    }

    public boolean remove(String id) {
        Variant removed = take(id);
        if (!removed.isValid()) return false;
        store.unref(removed);
        return true;
    }

    /** Borrowed timer object, or INVALID with NOT_FOUND. */
    public Variant get(String id) {
        if (id == null) {
            store.errors().set(ErrorCode.INVALID_VALUE, "timer id is null");
            return Variant.INVALID;
        }
        Variant key = store.makeString(id);
        try {
            return timers.asSet().getByKeyValues(key);
        } finally {
            store.unref(key);
        }
    }

    public boolean isActive(String id) {
        Variant t = get(id);
        return t.isValid() && t.asObject().get(KEY_ACTIVE).asBoolean();
    }

    public boolean setActive(String id, boolean active) {
        Variant t = get(id);
        if (!t.isValid()) return false;
        if (isActive(id) == active) return true;

        t.asObject().set(KEY_ACTIVE, store.makeBoolean(active));
        stack.dispatchMessage(timers, active ? AtomTable.MSG_ACTIVATED : AtomTable.MSG_DEACTIVATED, id, null);
        return true;
    }

    /** Host callback for an elapsed interval. Inactive timers fail with NOT_ACCEPTED. */
    public boolean fire(String id) {
        Variant t = get(id);
        if (!t.isValid()) return false;
        if (!t.asObject().get(KEY_ACTIVE).asBoolean()) {
            store.errors().set(ErrorCode.NOT_ACCEPTED, "timer '%s' is not active", id);
            return false;
        }
        stack.dispatchMessage(timers, AtomTable.MSG_EXPIRED, id, null);
        return true;
    }

    private Variant take(String id) {
        if (id == null) {
            store.errors().set(ErrorCode.INVALID_VALUE, "timer id is null");
            return Variant.INVALID;
        }
        Variant key = store.makeString(id);
        try {
            return timers.asSet().removeByKeyValues(key);
        } finally {
            store.unref(key);
        }
    }

    void close() {
        store.unref(timers);
    }
}
