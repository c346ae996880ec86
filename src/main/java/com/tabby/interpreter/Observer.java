package com.tabby.interpreter;

import com.tabby.variant.Variant;

/**
 * Binding of an observe element to an observed value and an event filter.
 * Holds a reference on the observed value until revoked. Revocation is
 * one-shot and goes through the owning stack.
 */
public final class Observer {

    public enum Kind { NAMED_VARIABLE, NATIVE, TIMER, CONTAINER }

    private final InterpreterStack stack;
    private final Kind kind;
    private final Variant observed;
    private final String msgType;
    private final String subType;
    private final VdomElement element;
    private final Runnable onRevoke;
    private boolean active = true;

    Observer(InterpreterStack stack, Kind kind, Variant observed, String msgType, String subType,
            VdomElement element, Runnable onRevoke) {
        this.stack = stack;
        this.kind = kind;
        this.observed = observed;
        this.msgType = msgType;
        this.subType = subType;
        this.element = element;
        this.onRevoke = onRevoke;
    }

    public Kind kind() { return kind; }

    public Variant observed() { return observed; }

    public String msgType() { return msgType; }

    /** Sub-type filter, or null to accept any. */
    public String subType() { return subType; }

    public VdomElement element() { return element; }

    public boolean isActive() { return active; }

    public boolean revoke() {
        return stack.revokeObserver(this);
    }

    boolean matches(Message m) {
        if (!active || m.source() != observed || !msgType.equals(m.type())) return false;
        return subType == null || subType.equals(m.subType());
    }

    // returns false when already revoked
    boolean deactivate() {
        if (!active) return false;
        active = false;
        if (onRevoke != null) onRevoke.run();
        return true;
    }

    @Override
    public String toString() {
        return "Observer{" + kind + " " + msgType + (subType == null ? "" : ":" + subType)
                + " on " + observed + (active ? "" : ", revoked") + "}";
    }
}
