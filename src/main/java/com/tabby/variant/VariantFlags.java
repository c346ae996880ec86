package com.tabby.variant;

/** Flag bits stored in {@link Variant#getFlags()}. */
public final class VariantFlags {
    /** Never released; ref/unref leave it alone. */
    public static final int NO_FREE = 0x01;
    /** Payload is larger than the inline threshold. */
    public static final int LONG_PAYLOAD = 0x02;
    /** Interned atom string that lives as long as the atom table. */
    public static final int ATOM_STATIC = 0x04;
    /** Value reports extra memory (container internals, long payloads). */
    public static final int EXTRA_SIZE = 0x08;

    private VariantFlags() {}
}
