package com.tabby.variant;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Insertion-ordered, string-keyed container.
 *
 * Events carry the key as a transient string value:
 *  - GROW   (key, value)
 *  - SHRINK (key, value)
 *  - CHANGE (key, old, new)
 */
public final class VariantObject extends VariantContainer {

    private final LinkedHashMap<String, Variant> members = new LinkedHashMap<>();

    VariantObject(ValueStore store, Variant self) {
        super(store, self);
    }

    @Override
    public int size() { return members.size(); }

    @Override
    public List<Variant> members() {
        return new ArrayList<>(members.values());
    }

    public List<String> keys() {
        return new ArrayList<>(members.keySet());
    }

    public boolean containsKey(String key) {
        return members.containsKey(key);
    }

    /** Borrowed member, or INVALID with NOT_FOUND. */
    public Variant get(String key) {
        Variant v = (key == null) ? null : members.get(key);
        if (v == null) {
            store.errors().set(ErrorCode.NOT_FOUND, "no member '%s'", key);
            return Variant.INVALID;
        }
        return v;
    }

    /** Does not consume the caller's reference. Setting the stored value again is a no-op. */
    public boolean set(String key, Variant value) {
        if (key == null) {
            store.errors().set(ErrorCode.INVALID_VALUE, "object key is null");
            return false;
        }
        if (!acceptMember(value)) return false;

        Variant old = members.get(key);
        if (old == value) return true;

        beginMutation("set");
        Variant k = store.makeString(key);
        try {
            if (old == null) {
                if (!firePre(VariantOperation.GROW, k, value)) return false;
                store.adopt(self, value);
                members.put(key, value);
                firePost(VariantOperation.GROW, k, value);
            } else {
                if (!firePre(VariantOperation.CHANGE, k, old, value)) return false;
                store.adopt(self, value);
                members.put(key, value);
                int holds = self.getRefCount();
                firePost(VariantOperation.CHANGE, k, old, value);
                store.abandon(old, holds);
            }
        } finally {
            store.unref(k);
        }
        return true;
    }

    public boolean remove(String key) {
        Variant old = (key == null) ? null : members.get(key);
        if (old == null) {
            store.errors().set(ErrorCode.NOT_FOUND, "no member '%s'", key);
            return false;
        }

        beginMutation("remove");
        Variant k = store.makeString(key);
        try {
            if (!firePre(VariantOperation.SHRINK, k, old)) return false;
            members.remove(key);
            int holds = self.getRefCount();
            firePost(VariantOperation.SHRINK, k, old);
            store.abandon(old, holds);
        } finally {
            store.unref(k);
        }
        return true;
    }

    @Override
    void clearMembers() {
        List<Variant> held = members();
        members.clear();
        for (Variant m : held) store.unref(m);
    }

    // live map, for key projection without touching the error slot
    Map<String, Variant> view() { return members; }
}
