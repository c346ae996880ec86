package com.tabby.variant;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Interned strings, grouped in buckets.
 *
 * An atom is a positive int; 0 means "no atom". The MESSAGE bucket holds the
 * event names the interpreter accepts in observe bindings and is seeded with
 * the runtime's own events.
 */
public final class AtomTable {

    public enum Bucket { DEFAULT, MESSAGE }

    public static final String MSG_GROW = "grow";
    public static final String MSG_SHRINK = "shrink";
    public static final String MSG_CHANGE = "change";
    public static final String MSG_ATTACHED = "attached";
    public static final String MSG_DETACHED = "detached";
    public static final String MSG_EXPIRED = "expired";
    public static final String MSG_ACTIVATED = "activated";
    public static final String MSG_DEACTIVATED = "deactivated";

    private final EnumMap<Bucket, Map<String, Integer>> buckets = new EnumMap<>(Bucket.class);
    private final List<String> strings = new ArrayList<>();

    AtomTable() {
        for (Bucket b : Bucket.values()) buckets.put(b, new HashMap<>());
        strings.add(null); // atom 0 is reserved

        for (String s : new String[] { MSG_GROW, MSG_SHRINK, MSG_CHANGE, MSG_ATTACHED,
                MSG_DETACHED, MSG_EXPIRED, MSG_ACTIVATED, MSG_DEACTIVATED }) {
            intern(Bucket.MESSAGE, s);
        }
    }

    /** Returns the atom for s in the bucket, creating it when missing. */
    public int intern(Bucket bucket, String s) {
        if (s == null) throw new IllegalArgumentException("atom string is null");
        Map<String, Integer> b = buckets.get(bucket);
        Integer atom = b.get(s);
        if (atom != null) return atom;

        int id = strings.size();
        strings.add(s);
        b.put(s, id);
        return id;
    }

    public int intern(String s) {
        return intern(Bucket.DEFAULT, s);
    }

    /** Returns the existing atom for s, or 0. Never creates. */
    public int tryAtom(Bucket bucket, String s) {
        if (s == null) return 0;
        Integer atom = buckets.get(bucket).get(s);
        return (atom == null) ? 0 : atom;
    }

    public String toText(int atom) {
        if (atom <= 0 || atom >= strings.size()) return null;
        return strings.get(atom);
    }

    public int size() {
        return strings.size() - 1;
    }
}
