package com.tabby.variant;

import com.tabby.debug.Debug;
import com.tabby.debug.DebugLevel;

import java.util.ArrayList;
import java.util.List;

/**
 * Synchronous listener list of one container variant.
 *
 * Listeners fire in registration order on the mutating thread. Post
 * listeners run after the mutation is committed; pre listeners run before
 * and may veto it. Exceptions thrown by a listener stay inside the registry.
 */
public final class ListenerRegistry {

    private static final String TAG = "tabby.listener";

    private final ValueStore store;
    private final Variant owner;
    private final List<VariantListener> pre = new ArrayList<>();
    private final List<VariantListener> post = new ArrayList<>();
    private int firing;

    ListenerRegistry(ValueStore store, Variant owner) {
        this.store = store;
        this.owner = owner;
    }

    Variant owner() { return owner; }

    ValueStore store() { return store; }

    VariantListener add(boolean isPre, VariantOperation op, ListenerCallback cb, Object ctxt,
            VariantListener.Release onRelease) {
        VariantListener l = new VariantListener(this, op, cb, ctxt, onRelease, isPre);
        (isPre ? pre : post).add(l);
        Debug.get().t(TAG, "registered " + l + " on " + owner);
        return l;
    }

    boolean remove(VariantListener l) {
        if (l.registry() != this || !l.isActive()) return false;
        boolean removed = (l.isPre() ? pre : post).remove(l);
        if (removed) l.deactivate();
        return removed;
    }

    /** @return false when a pre listener vetoed the mutation */
    boolean firePre(VariantOperation op, Variant... args) {
        if (pre.isEmpty()) return true;
        for (VariantListener l : snapshot(pre)) {
            if (!l.isActive() || l.operation() != op) continue;
            if (!invoke(l, op, args)) {
                Debug.get().d(TAG, op + " on " + owner + " vetoed by " + l);
                return false;
            }
        }
        return true;
    }

    void firePost(VariantOperation op, Variant... args) {
        if (post.isEmpty()) return;
        for (VariantListener l : snapshot(post)) {
            if (!l.isActive() || l.operation() != op) continue;
            invoke(l, op, args);
        }
    }

    /**
     * A listener that throws is logged at WARN and does not abort the
     * mutation in progress. A throwing pre listener counts as a veto.
     */
    private boolean invoke(VariantListener l, VariantOperation op, Variant[] args) {
        firing++;
        try {
            return l.callback().handle(owner, op, l.context(), args);
        } catch (RuntimeException ex) {
            Debug.get().log(DebugLevel.WARN, TAG, op + " listener " + l + " on " + owner + " failed", ex);
            return false;
        } finally {
            firing--;
        }
    }

    boolean isFiring() { return firing > 0; }

    /** Container is going away: revoke everything, release callbacks included. */
    void revokeAll() {
        List<VariantListener> all = new ArrayList<>(pre);
        all.addAll(post);
        pre.clear();
        post.clear();
        for (VariantListener l : all) l.deactivate();
    }

    public int size() {
        return pre.size() + post.size();
    }

    private static List<VariantListener> snapshot(List<VariantListener> src) {
        return new ArrayList<>(src);
    }
}
