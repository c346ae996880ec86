package com.tabby.variant;

/** Kind tag carried by every {@link Variant}. */
public enum VariantType {
    UNDEFINED,
    NULL,
    BOOLEAN,
    NUMBER,
    LONGINT,
    LONGDOUBLE,
    STRING,
    ATOM_STRING,
    BYTE_SEQUENCE,
    DYNAMIC,
    NATIVE,
    OBJECT,
    ARRAY,
    SET;

    public boolean isContainer() {
        return this == OBJECT || this == ARRAY || this == SET;
    }

    public boolean isNumeric() {
        return this == BOOLEAN || this == NUMBER || this == LONGINT || this == LONGDOUBLE;
    }

    public boolean isString() {
        return this == STRING || this == ATOM_STRING;
    }

    /** Constants live for the whole instance and are never pooled or counted. */
    public boolean isConstantKind() {
        return this == UNDEFINED || this == NULL || this == BOOLEAN;
    }
}
