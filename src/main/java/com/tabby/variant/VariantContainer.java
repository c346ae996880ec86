package com.tabby.variant;

import com.tabby.debug.Debug;

import java.util.List;

/**
 * Shared plumbing of OBJECT, ARRAY and SET payloads: owning store, the
 * variant that wraps the payload, member traversal for transitive
 * reference counting, and the listener list.
 */
public abstract class VariantContainer {

    private static final String TAG = "tabby.container";

    protected final ValueStore store;
    protected final Variant self;
    private ListenerRegistry listeners;

    protected VariantContainer(ValueStore store, Variant self) {
        this.store = store;
        this.self = self;
    }

    public abstract int size();

    /** Direct members, one entry per stored reference, as a detached list. */
    public abstract List<Variant> members();

    /** Drops the container's hold on each member; runs at final release. */
    abstract void clearMembers();

    public Variant variant() { return self; }

    ListenerRegistry listeners() {
        if (listeners == null) listeners = new ListenerRegistry(store, self);
        return listeners;
    }

    public int listenerCount() {
        return (listeners == null) ? 0 : listeners.size();
    }

    /** Final release: listeners first, then members. */
    void destroy() {
        if (listeners != null) {
            listeners.revokeAll();
            listeners = null;
        }
        clearMembers();
    }

    // -------------------------
    // Mutation helpers
    // -------------------------

    protected void beginMutation(String what) {
        if (listeners != null && listeners.isFiring()) {
            Debug.get().w(TAG, what + " on " + self + " from inside its own listener");
        }
    }

    /** Value checks shared by every insertion path. Records the error on failure. */
    protected boolean acceptMember(Variant value) {
        if (value == null || !value.isValid()) {
            store.errors().set(ErrorCode.INVALID_VALUE, "member is not a valid value");
            return false;
        }
        if (value.isContainer() && store.contains(value, self)) {
            store.errors().set(ErrorCode.INVALID_VALUE, "inserting %s would create a reference cycle", value);
            return false;
        }
        return true;
    }

    protected boolean firePre(VariantOperation op, Variant... args) {
        if (listeners == null) return true;
        if (!listeners.firePre(op, args)) {
            store.errors().set(ErrorCode.NOT_ACCEPTED, "%s rejected by listener", op);
            return false;
        }
        return true;
    }

    protected void firePost(VariantOperation op, Variant... args) {
        if (listeners != null) listeners.firePost(op, args);
    }
}
