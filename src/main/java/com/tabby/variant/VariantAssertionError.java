package com.tabby.variant;

/**
 * Raised for ownership bugs and corrupted internal structures: null values,
 * refcount underflow, use of a released cell, broken set indices.
 * These are never data-dependent and are not meant to be caught.
 */
public class VariantAssertionError extends AssertionError {

    private static final long serialVersionUID = 1L;

    public VariantAssertionError(String message) {
        super(message);
    }

    static void check(boolean condition, String message) {
        if (!condition) throw new VariantAssertionError(message);
    }
}
