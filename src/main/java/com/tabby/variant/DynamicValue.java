package com.tabby.variant;

/** Getter/setter pair carried by a DYNAMIC variant. Either method may be null. */
public final class DynamicValue {

    /** Native method signature shared by getters and setters. */
    @FunctionalInterface
    public interface Method {
        Variant call(Variant root, Variant[] args);
    }

    private final Method getter;
    private final Method setter;

    public DynamicValue(Method getter, Method setter) {
        this.getter = getter;
        this.setter = setter;
    }

    public Method getter() { return getter; }

    public Method setter() { return setter; }
}
