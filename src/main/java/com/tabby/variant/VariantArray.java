package com.tabby.variant;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered container addressed by position.
 *
 * Events: GROW(value) on insertion, SHRINK(value) on removal,
 * CHANGE(old, new) on replacement.
 */
public final class VariantArray extends VariantContainer {

    private final ArrayList<Variant> members;

    VariantArray(ValueStore store, Variant self, int sizeHint) {
        super(store, self);
        this.members = new ArrayList<>(Math.max(sizeHint, 4));
    }

    @Override
    public int size() { return members.size(); }

    @Override
    public List<Variant> members() {
        return new ArrayList<>(members);
    }

    /** Borrowed member, or INVALID with OUT_OF_BOUNDS. */
    public Variant get(int idx) {
        if (!inRange(idx, members.size())) return Variant.INVALID;
        return members.get(idx);
    }

    public boolean append(Variant value) {
        return insertBefore(members.size(), value);
    }

    public boolean prepend(Variant value) {
        return insertBefore(0, value);
    }

    /** idx == size() appends. Does not consume the caller's reference. */
    public boolean insertBefore(int idx, Variant value) {
        if (!inRange(idx, members.size() + 1)) return false;
        if (!acceptMember(value)) return false;

        beginMutation("insert");
        if (!firePre(VariantOperation.GROW, value)) return false;
        store.adopt(self, value);
        members.add(idx, value);
        firePost(VariantOperation.GROW, value);
        return true;
    }

    public boolean set(int idx, Variant value) {
        if (!inRange(idx, members.size())) return false;
        if (!acceptMember(value)) return false;

        Variant old = members.get(idx);
        if (old == value) return true;

        beginMutation("set");
        if (!firePre(VariantOperation.CHANGE, old, value)) return false;
        store.adopt(self, value);
        members.set(idx, value);
        int holds = self.getRefCount();
        firePost(VariantOperation.CHANGE, old, value);
        store.abandon(old, holds);
        return true;
    }

    public boolean remove(int idx) {
        if (!inRange(idx, members.size())) return false;

        Variant old = members.get(idx);
        beginMutation("remove");
        if (!firePre(VariantOperation.SHRINK, old)) return false;
        members.remove(idx);
        int holds = self.getRefCount();
        firePost(VariantOperation.SHRINK, old);
        store.abandon(old, holds);
        return true;
    }

    private boolean inRange(int idx, int limit) {
        if (idx < 0 || idx >= limit) {
            store.errors().set(ErrorCode.OUT_OF_BOUNDS, "index %d out of [0, %d)", idx, limit);
            return false;
        }
        return true;
    }

    @Override
    void clearMembers() {
        List<Variant> held = members();
        members.clear();
        for (Variant m : held) store.unref(m);
    }
}
