package com.tabby.variant;

/** Payload of a NATIVE variant: the host entity and its ops. */
public final class NativeValue {

    private final Object entity;
    private final NativeOps ops;

    NativeValue(Object entity, NativeOps ops) {
        this.entity = entity;
        this.ops = (ops == null) ? new NativeOps() : ops;
    }

    public Object entity() { return entity; }

    public NativeOps ops() { return ops; }
}
