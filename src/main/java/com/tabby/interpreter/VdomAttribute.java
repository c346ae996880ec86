package com.tabby.interpreter;

import com.tabby.variant.Variant;

/**
 * Attribute of a {@link VdomElement}: either literal text or a value bound
 * ahead of evaluation. A literal starting with '$' names a document
 * variable.
 */
public final class VdomAttribute {

    private final String name;
    private final String literal;
    private final Variant value;

    private VdomAttribute(String name, String literal, Variant value) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("attribute name is empty");
        this.name = name;
        this.literal = literal;
        this.value = value;
    }

    public static VdomAttribute literal(String name, String text) {
        return new VdomAttribute(name, text, null);
    }

    /** The attribute borrows value; the caller keeps it alive while the tree is in use. */
    public static VdomAttribute bound(String name, Variant value) {
        return new VdomAttribute(name, null, value);
    }

    public String name() { return name; }

    public String literal() { return literal; }

    public Variant value() { return value; }

    public boolean isLiteral() { return value == null; }

    @Override
    public String toString() {
        return name + "=" + (isLiteral() ? "\"" + literal + "\"" : String.valueOf(value));
    }
}
