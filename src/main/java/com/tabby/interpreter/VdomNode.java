package com.tabby.interpreter;

/**
 * Node of the document tree the interpreter walks. Elements carry
 * attributes and children; content and comment nodes carry text only.
 */
public class VdomNode {

    public enum Kind { ELEMENT, CONTENT, COMMENT }

    private final Kind kind;
    private final String text;
    VdomElement parent;

    protected VdomNode(Kind kind, String text) {
        this.kind = kind;
        this.text = text;
    }

    public static VdomNode content(String text) {
        return new VdomNode(Kind.CONTENT, text);
    }

    public static VdomNode comment(String text) {
        return new VdomNode(Kind.COMMENT, text);
    }

    public Kind kind() { return kind; }

    public String text() { return text; }

    public VdomElement parent() { return parent; }

    public boolean isElement() { return kind == Kind.ELEMENT; }

    @Override
    public String toString() {
        return kind == Kind.COMMENT ? "<!--" + text + "-->" : String.valueOf(text);
    }
}
