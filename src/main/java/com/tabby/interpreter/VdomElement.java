package com.tabby.interpreter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class VdomElement extends VdomNode {

    private final String tagName;
    private final List<VdomAttribute> attributes = new ArrayList<>();
    private final List<VdomNode> children = new ArrayList<>();

    public VdomElement(String tagName) {
        super(Kind.ELEMENT, null);
        if (tagName == null || tagName.isEmpty()) throw new IllegalArgumentException("tag name is empty");
        this.tagName = tagName;
    }

    public String tagName() { return tagName; }

    public VdomElement attr(String name, String literal) {
        attributes.add(VdomAttribute.literal(name, literal));
        return this;
    }

    public VdomElement attr(VdomAttribute attribute) {
        attributes.add(attribute);
        return this;
    }

    public VdomElement append(VdomNode child) {
        if (child.parent != null) throw new IllegalStateException("node already has a parent");
        child.parent = this;
        children.add(child);
        return this;
    }

    public List<VdomAttribute> attributes() {
        return Collections.unmodifiableList(attributes);
    }

    /** Literal text of the first attribute with this name, or null. */
    public String literalAttr(String name) {
        for (VdomAttribute a : attributes) {
            if (a.name().equals(name) && a.isLiteral()) return a.literal();
        }
        return null;
    }

    public List<VdomNode> children() {
        return Collections.unmodifiableList(children);
    }

    public VdomElement firstChildElement() {
        for (VdomNode n : children) {
            if (n.isElement()) return (VdomElement) n;
        }
        return null;
    }

    /** Next sibling of child in this element, or null. */
    VdomNode nextSibling(VdomNode child) {
        int i = children.indexOf(child);
        return (i < 0 || i + 1 >= children.size()) ? null : children.get(i + 1);
    }

    VdomNode firstChild() {
        return children.isEmpty() ? null : children.get(0);
    }

    @Override
    public String toString() {
        return "<" + tagName + ">";
    }
}
