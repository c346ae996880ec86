package com.tabby.interpreter;

import com.tabby.variant.ValueStore;
import com.tabby.variant.Variant;

/**
 * Frame context of a running observe element: the evaluated attributes,
 * the parsed event filter, the bound observer and the child cursor.
 */
public final class ObserveContext {

    Variant on;
    Variant forVar;
    Variant at;
    Variant as;
    Variant with;

    VdomElement define;
    String msgType;
    String subType;
    int msgTypeAtom;

    VdomNode curr;
    Observer observer;

    public String msgType() { return msgType; }

    public String subType() { return subType; }

    /** Definition element whose children replace the observe body, or null. */
    public VdomElement define() { return define; }

    /** Observer bound in the first round, or null. */
    public Observer observer() { return observer; }

    void destroy(ValueStore store) {
        on = clear(store, on);
        forVar = clear(store, forVar);
        at = clear(store, at);
        as = clear(store, as);
        with = clear(store, with);
        curr = null;
    }

    private static Variant clear(ValueStore store, Variant v) {
        if (v != null) store.unref(v);
        return null;
    }
}
