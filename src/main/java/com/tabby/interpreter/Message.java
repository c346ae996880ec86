package com.tabby.interpreter;

import com.tabby.variant.Variant;

/**
 * Event queued in a stack's inbox. The inbox holds a reference on source
 * and extra until the message has been drained.
 */
public final class Message {

    private final Variant source;
    private final String type;
    private final String subType;
    private final Variant extra;

    Message(Variant source, String type, String subType, Variant extra) {
        this.source = source;
        this.type = type;
        this.subType = subType;
        this.extra = extra;
    }

    public Variant source() { return source; }

    public String type() { return type; }

    public String subType() { return subType; }

    /** Event payload, or null. */
    public Variant extra() { return extra; }

    @Override
    public String toString() {
        return "Message{" + type + (subType == null ? "" : ":" + subType) + " from " + source + "}";
    }
}
