package com.tabby.variant;

/**
 * Non-owning link to a value, for parent pointers and other back-links that
 * would otherwise form a reference cycle. Holds no count; resolves to
 * INVALID once the target cell has been released (even if the cell was
 * later handed out again by the pool).
 */
public final class BackReference {

    private final Variant target;
    private final int generation;

    private BackReference(Variant target) {
        this.target = target;
        this.generation = target.generation;
    }

    public static BackReference to(Variant target) {
        VariantAssertionError.check(target != null && target.isValid(), "back reference to an invalid value");
        return new BackReference(target);
    }

    /** Borrowed target, or INVALID when it is gone. */
    public Variant get() {
        if (target.released || target.generation != generation) return Variant.INVALID;
        return target;
    }

    public boolean isAlive() {
        return get() != Variant.INVALID;
    }

    @Override
    public String toString() {
        return "BackReference{" + (isAlive() ? target.toString() : "gone") + "}";
    }
}
