package com.tabby.interpreter;

import com.tabby.debug.Debug;
import com.tabby.variant.AtomTable;
import com.tabby.variant.ErrorCode;
import com.tabby.variant.ValueStore;
import com.tabby.variant.Variant;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * DocumentScope
 *
 * Named variables of one document. The scope holds a reference on every
 * bound value.
 *
 * Named-variable observers watch a name rather than a value. Each watched
 * name gets a handle value that is the source of its events:
 *  - attached  a value was bound to a free name
 *  - change    a bound name got a different value
 *  - detached  the name was unbound
 */
public final class DocumentScope {

    private static final String TAG = "tabby.scope";

    private final ValueStore store;
    private final InterpreterStack stack;
    private final Map<String, Variant> vars = new LinkedHashMap<>();
    private final Map<String, Variant> watchHandles = new HashMap<>();

    DocumentScope(ValueStore store, InterpreterStack stack) {
        this.store = store;
        this.stack = stack;
    }

    // -------------------------
    // Vars API
    // -------------------------

    /** Binds or rebinds name. Does not consume the caller's reference. */
    public boolean bind(String name, Variant value) {
        if (name == null || name.isEmpty()) {
            store.errors().set(ErrorCode.INVALID_VALUE, "document variable name is empty");
            return false;
        }
        if (value == null || !value.isValid()) {
            store.errors().set(ErrorCode.INVALID_VALUE, "document variable '%s' bound to an invalid value", name);
            return false;
        }

        store.ref(value);
        Variant old = vars.put(name, value);
        if (old == null) {
            notifyWatchers(name, AtomTable.MSG_ATTACHED, value);
        } else {
            if (old != value) notifyWatchers(name, AtomTable.MSG_CHANGE, value);
            store.unref(old);
        }
        Debug.get().t(TAG, "bound " + name + " = " + value);
        return true;
    }

    public boolean unbind(String name) {
        Variant old = (name == null) ? null : vars.remove(name);
        if (old == null) {
            store.errors().set(ErrorCode.NOT_FOUND, "no document variable '%s'", name);
            return false;
        }
        notifyWatchers(name, AtomTable.MSG_DETACHED, null);
        store.unref(old);
        return true;
    }

    /** Borrowed value, or INVALID with NOT_FOUND. */
    public Variant get(String name) {
        Variant v = (name == null) ? null : vars.get(name);
        if (v == null) {
            store.errors().set(ErrorCode.NOT_FOUND, "no document variable '%s'", name);
            return Variant.INVALID;
        }
        return v;
    }

    public boolean exists(String name) {
        return name != null && vars.containsKey(name);
    }

    public List<String> names() {
        return new ArrayList<>(vars.keySet());
    }

    // -------------------------
    // Named-variable observers
    // -------------------------

    /** Event source for name; the returned reference belongs to the caller. */
    Variant watch(String name) {
        Variant handle = watchHandles.get(name);
        if (handle == null) {
            handle = store.makeAtomString(name, false);
            watchHandles.put(name, handle);
        }
        store.ref(handle);
        return handle;
    }

    private void notifyWatchers(String name, String type, Variant extra) {
        Variant handle = watchHandles.get(name);
        if (handle != null) stack.dispatchMessage(handle, type, null, extra);
    }

    /** Drops every binding quietly (no detached events). */
    void close() {
        List<Variant> held = new ArrayList<>(vars.values());
        vars.clear();
        for (Variant v : held) store.unref(v);

        for (Variant h : watchHandles.values()) store.unref(h);
        watchHandles.clear();
    }
}
