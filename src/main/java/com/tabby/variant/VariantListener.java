package com.tabby.variant;

/**
 * Handle of one registered listener. Revocation is one-shot: the first
 * revoke (or close) removes the listener and runs its release callback.
 */
public final class VariantListener implements AutoCloseable {

    /** Runs once when the listener is revoked or its container is destroyed. */
    @FunctionalInterface
    public interface Release {
        void release(VariantListener listener, Object ctxt);
    }

    private final ListenerRegistry registry;
    private final VariantOperation operation;
    private final ListenerCallback callback;
    private final Object ctxt;
    private final Release onRelease;
    private final boolean pre;
    private boolean active = true;

    VariantListener(ListenerRegistry registry, VariantOperation operation, ListenerCallback callback,
            Object ctxt, Release onRelease, boolean pre) {
        this.registry = registry;
        this.operation = operation;
        this.callback = callback;
        this.ctxt = ctxt;
        this.onRelease = onRelease;
        this.pre = pre;
    }

    public Variant source() { return registry.owner(); }

    public VariantOperation operation() { return operation; }

    public Object context() { return ctxt; }

    public boolean isPre() { return pre; }

    public boolean isActive() { return active; }

    ListenerCallback callback() { return callback; }

    ListenerRegistry registry() { return registry; }

    void deactivate() {
        if (!active) return;
        active = false;
        if (onRelease != null) onRelease.release(this, ctxt);
    }

    @Override
    public void close() {
        registry.store().revokeListener(this);
    }

    @Override
    public String toString() {
        return "VariantListener{" + (pre ? "pre " : "post ") + operation + (active ? "" : ", revoked") + "}";
    }
}
