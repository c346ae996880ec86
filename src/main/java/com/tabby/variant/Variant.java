package com.tabby.variant;

/**
 * Tagged, reference-counted runtime value.
 *
 * Cells are handed out by a {@link ValueStore} and go back to its reuse pool
 * when the count drops to zero, so a Variant must not be touched after the
 * holder gave up its last reference. All lifecycle calls (ref, unref,
 * container mutation) go through the owning store.
 *
 * {@link #INVALID} is the failure sentinel returned by every operation that
 * produces a value.
 */
public final class Variant {

    /** Failure sentinel. Has no type and is never pooled. */
    public static final Variant INVALID = new Variant();

    static {
        INVALID.flags = VariantFlags.NO_FREE;
        INVALID.refc = 1;
    }

    VariantType type;
    int refc;
    int flags;
    Object payload;
    long extraSize;
    long serial;
    int atomId;

    // Bumped every time the cell is released; lets BackReference detect recycling.
    int generation;
    boolean released;

    Variant() {}

    public VariantType getType() { return type; }

    public boolean isType(VariantType t) { return type == t; }

    public boolean isValid() { return this != INVALID && type != null && !released; }

    public int getRefCount() { return refc; }

    public int getFlags() { return flags; }

    public boolean hasFlag(int flag) { return (flags & flag) != 0; }

    public long getExtraSize() { return extraSize; }

    public boolean isContainer() { return type != null && type.isContainer(); }

    public boolean isUndefined() { return type == VariantType.UNDEFINED; }

    public boolean isNull() { return type == VariantType.NULL; }

    public boolean isString() { return type != null && type.isString(); }

    public boolean isNative() { return type == VariantType.NATIVE; }

    // -------------------------
    // Typed payload access
    // -------------------------

    public boolean asBoolean() {
        expect(VariantType.BOOLEAN);
        return (Boolean) payload;
    }

    public double asNumber() {
        if (type != VariantType.NUMBER && type != VariantType.LONGDOUBLE) {
            throw new IllegalStateException("Expected number, got " + type);
        }
        return (Double) payload;
    }

    public long asLongInt() {
        expect(VariantType.LONGINT);
        return (Long) payload;
    }

    /** Text of a string or atom string. */
    public String asString() {
        if (type != VariantType.STRING && type != VariantType.ATOM_STRING) {
            throw new IllegalStateException("Expected string, got " + type);
        }
        return (String) payload;
    }

    /** Atom of an atom string; 0 for anything else. */
    public int atom() {
        return (type == VariantType.ATOM_STRING) ? atomId : 0;
    }

    public byte[] asBytes() {
        expect(VariantType.BYTE_SEQUENCE);
        return (byte[]) payload; // NO defensive copy
    }

    public DynamicValue asDynamic() {
        expect(VariantType.DYNAMIC);
        return (DynamicValue) payload;
    }

    public NativeValue asNative() {
        expect(VariantType.NATIVE);
        return (NativeValue) payload;
    }

    public VariantObject asObject() {
        expect(VariantType.OBJECT);
        return (VariantObject) payload;
    }

    public VariantArray asArray() {
        expect(VariantType.ARRAY);
        return (VariantArray) payload;
    }

    public VariantSet asSet() {
        expect(VariantType.SET);
        return (VariantSet) payload;
    }

    VariantContainer container() {
        return (VariantContainer) payload;
    }

    private void expect(VariantType t) {
        if (type != t) throw new IllegalStateException("Expected " + t + ", got " + type);
    }

    @Override
    public String toString() {
        if (this == INVALID) return "<invalid>";
        if (released) return "<released>";
        switch (type) {
            case STRING:
            case ATOM_STRING:
                return '"' + asString() + '"';
            case OBJECT:
            case ARRAY:
            case SET:
                return type.name().toLowerCase() + "(" + container().size() + ")";
            default:
                return VariantOps.stringify(this);
        }
    }
}
