package com.tabby.variant;

/**
 * Listener invoked on a container mutation.
 *
 * For pre listeners a false return vetoes the mutation; the return value of
 * post listeners is ignored.
 */
@FunctionalInterface
public interface ListenerCallback {
    boolean handle(Variant source, VariantOperation op, Object ctxt, Variant[] args);
}
