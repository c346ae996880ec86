package com.tabby.variant;

/**
 * Behaviour table of a NATIVE variant. Every slot is optional.
 *
 * onObserve/onForget let an external entity produce its own events for an
 * observe binding; onRelease runs when the native variant is released.
 */
public final class NativeOps {

    @FunctionalInterface
    public interface ObserveHook {
        boolean apply(Object entity, String eventName, String subType);
    }

    @FunctionalInterface
    public interface ReleaseHook {
        void release(Object entity);
    }

    private ObserveHook onObserve;
    private ObserveHook onForget;
    private ReleaseHook onRelease;

    public NativeOps onObserve(ObserveHook hook) { this.onObserve = hook; return this; }

    public NativeOps onForget(ObserveHook hook) { this.onForget = hook; return this; }

    public NativeOps onRelease(ReleaseHook hook) { this.onRelease = hook; return this; }

    public ObserveHook onObserve() { return onObserve; }

    public ObserveHook onForget() { return onForget; }

    public ReleaseHook onRelease() { return onRelease; }

    public boolean canObserve() { return onObserve != null; }
}
