package com.tabby.variant;

/** Container mutation events delivered to listeners. */
public enum VariantOperation {
    /** A member was added. Args: the new member (objects: key, value). */
    GROW(AtomTable.MSG_GROW),
    /** A member was removed. Args: the removed member (objects: key, value). */
    SHRINK(AtomTable.MSG_SHRINK),
    /** A member was replaced. Args: old, new (objects: key, old, new). */
    CHANGE(AtomTable.MSG_CHANGE);

    private final String messageType;

    VariantOperation(String messageType) {
        this.messageType = messageType;
    }

    /** Event name used by observe bindings ("grow", "shrink", "change"). */
    public String messageType() { return messageType; }

    public static VariantOperation forMessageType(String name) {
        for (VariantOperation op : values()) {
            if (op.messageType.equals(name)) return op;
        }
        return null;
    }
}
