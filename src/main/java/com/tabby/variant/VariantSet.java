package com.tabby.variant;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * VariantSet
 *
 * Unique-keyed container with two indexes over the same entries:
 *  - a red-black tree ordered by key tuple (lookup, sorted iteration)
 *  - a dense positional array (insertion order, index access)
 *
 * The key tuple is projected from the member's named fields; a missing
 * field projects to undefined. Without declared key names (keyless mode)
 * the whole member is the single key.
 *
 * Key values are borrowed from the member itself, so a member's key fields
 * must not be replaced while it sits in the set. {@link #verifyIntegrity}
 * reports a replaced or released key value.
 *
 * Events: GROW(value), SHRINK(value), CHANGE(old, new). SHRINK fires after
 * positional indexes have been renumbered.
 */
public final class VariantSet extends VariantContainer {

    /** Orders positional slots by their key tuples. Used by {@link #sort}. */
    @FunctionalInterface
    public interface SortComparator {
        int compare(int nrKeyNames, Variant[] left, Variant[] right, Object userData);
    }

    /** Ascending key order, the same order the tree uses. */
    public static final SortComparator KEY_ORDER = (n, l, r, ud) -> compareKeyTuples(n, l, r);

    // nominal sizes for statistics
    private static final long SIZE_OF_ENTRY = 48;
    private static final long SIZE_OF_SLOT = 8;

    static final class Entry {
        Variant elem;
        Variant[] kvs;
        int idx = -1;

        Entry left, right, parent;
        boolean red;

        Entry(Variant elem, Variant[] kvs) {
            this.elem = elem;
            this.kvs = kvs;
        }
    }

    private final String keySpec;
    private final String[] keyNames;
    private final int nrKeyNames;
    private final ArrayList<Entry> arr;
    private Entry root;

    VariantSet(ValueStore store, Variant self, int sizeHint, String keySpec) {
        super(store, self);
        String spec = (keySpec == null) ? "" : keySpec.trim();
        if (spec.isEmpty()) {
            this.keySpec = null;
            this.keyNames = new String[0];
            this.nrKeyNames = 1;
        } else {
            this.keySpec = spec;
            this.keyNames = spec.split("\\s+");
            this.nrKeyNames = keyNames.length;
        }
        this.arr = new ArrayList<>(Math.max(sizeHint, 8));
    }

    @Override
    public int size() { return arr.size(); }

    @Override
    public List<Variant> members() {
        List<Variant> out = new ArrayList<>(arr.size());
        for (Entry e : arr) out.add(e.elem);
        return out;
    }

    public boolean isKeyless() { return keySpec == null; }

    public List<String> keyNames() {
        return Collections.unmodifiableList(Arrays.asList(keyNames));
    }

    // ===================== KEY PROJECTION =====================

    private Variant[] keyValuesOf(Variant value) {
        if (isKeyless()) return new Variant[] { value };

        Variant[] kvs = new Variant[nrKeyNames];
        Map<String, Variant> fields = value.isType(VariantType.OBJECT) ? value.asObject().view() : null;
        for (int i = 0; i < nrKeyNames; i++) {
            Variant v = (fields == null) ? null : fields.get(keyNames[i]);
            kvs[i] = (v == null) ? store.makeUndefined() : v;
        }
        return kvs;
    }

    static int compareKeyTuples(int n, Variant[] a, Variant[] b) {
        for (int i = 0; i < n; i++) {
            int c = VariantOps.compare(a[i], b[i]);
            if (c != 0) return c;
        }
        return 0;
    }

    private int compareKeys(Variant[] a, Variant[] b) {
        return compareKeyTuples(nrKeyNames, a, b);
    }

    private Entry find(Variant[] kvs) {
        Entry p = root;
        while (p != null) {
            int c = compareKeys(kvs, p.kvs);
            if (c < 0) p = p.left;
            else if (c > 0) p = p.right;
            else return p;
        }
        return null;
    }

    // ===================== ADD / REMOVE =====================

    /**
     * Adds value under its key tuple. Does not consume the caller's reference.
     *
     * Existing key: fails with DUPLICATED_KEY unless allowOverride; with
     * override the stored member is replaced in place (same positional
     * index) and CHANGE fires, unless it is the very same value.
     */
    public boolean add(Variant value, boolean allowOverride) {
        if (!acceptMember(value)) return false;

        Variant[] kvs = keyValuesOf(value);

        Entry parent = null;
        Entry cur = root;
        int cmp = 0;
        while (cur != null) {
            parent = cur;
            cmp = compareKeys(kvs, cur.kvs);
            if (cmp < 0) cur = cur.left;
            else if (cmp > 0) cur = cur.right;
            else break;
        }

        if (cur == null) {
            beginMutation("add");
            if (!firePre(VariantOperation.GROW, value)) return false;

            Entry e = new Entry(value, kvs);
            store.adopt(self, value);
            e.idx = arr.size();
            arr.add(e);
            e.parent = parent;
            if (parent == null) root = e;
            else if (cmp < 0) parent.left = e;
            else parent.right = e;
            fixAfterInsertion(e);

            afterMutation();
            firePost(VariantOperation.GROW, value);
            return true;
        }

        if (!allowOverride) {
            store.errors().set(ErrorCode.DUPLICATED_KEY, "key %s already present", Arrays.toString(kvs));
            return false;
        }
        if (cur.elem == value) return true;

        beginMutation("override");
        Variant old = cur.elem;
        if (!firePre(VariantOperation.CHANGE, old, value)) return false;

        store.adopt(self, value);
        cur.elem = value;
        cur.kvs = kvs;

        afterMutation();
        int holds = self.getRefCount();
        firePost(VariantOperation.CHANGE, old, value);
        store.abandon(old, holds);
        return true;
    }

    /** Removes the member whose key tuple matches value's. */
    public boolean remove(Variant value) {
        if (value == null || !value.isValid()) {
            store.errors().set(ErrorCode.INVALID_VALUE, "value is not valid");
            return false;
        }
        Entry e = find(keyValuesOf(value));
        if (e == null) {
            store.errors().set(ErrorCode.NOT_FOUND, "no member with key of %s", value);
            return false;
        }
        int holds = detach(e);
        if (holds < 0) return false;
        store.abandon(e.elem, holds);
        return true;
    }

    /** Borrowed member with the given key values, or INVALID. */
    public Variant getByKeyValues(Variant... keyValues) {
        if (!checkKeyValues(keyValues)) return Variant.INVALID;
        Entry e = find(keyValues);
        if (e == null) {
            store.errors().set(ErrorCode.NOT_FOUND, "no member with key %s", Arrays.toString(keyValues));
            return Variant.INVALID;
        }
        return e.elem;
    }

    /** Removed member, now owned by the caller; INVALID on failure. */
    public Variant removeByKeyValues(Variant... keyValues) {
        if (!checkKeyValues(keyValues)) return Variant.INVALID;
        Entry e = find(keyValues);
        if (e == null) {
            store.errors().set(ErrorCode.NOT_FOUND, "no member with key %s", Arrays.toString(keyValues));
            return Variant.INVALID;
        }
        return take(e);
    }

    private boolean checkKeyValues(Variant[] keyValues) {
        if (isKeyless()) {
            store.errors().set(ErrorCode.NOT_SUPPORTED, "set has no declared key");
            return false;
        }
        if (keyValues == null || keyValues.length != nrKeyNames) {
            store.errors().set(ErrorCode.INVALID_VALUE, "expected %d key values", nrKeyNames);
            return false;
        }
        for (Variant kv : keyValues) {
            if (kv == null || !kv.isValid()) {
                store.errors().set(ErrorCode.INVALID_VALUE, "key value is not valid");
                return false;
            }
        }
        return true;
    }

    // ===================== POSITIONAL ACCESS =====================

    /** Borrowed member at position idx, or INVALID with OUT_OF_BOUNDS. */
    public Variant getByIndex(int idx) {
        if (!inRange(idx)) return Variant.INVALID;
        return arr.get(idx).elem;
    }

    /** Removed member, now owned by the caller; INVALID on failure. */
    public Variant removeByIndex(int idx) {
        if (!inRange(idx)) return Variant.INVALID;
        return take(arr.get(idx));
    }

    /**
     * Remove-then-add: SHRINK for the old member, then GROW (or CHANGE when
     * value collides with another member's key). The replacement takes the
     * last position. Storing the member already at idx is a no-op.
     */
    public boolean setByIndex(int idx, Variant value) {
        if (!inRange(idx)) return false;
        if (arr.get(idx).elem == value) return true;
        if (!acceptMember(value)) return false;

        Variant removed = removeByIndex(idx);
        if (!removed.isValid()) return false;
        boolean ok = add(value, true);
        store.unref(removed);
        return ok;
    }

    /** Reorders positions only; key lookup and iteration order are unaffected. */
    public boolean sort(SortComparator comparator, Object userData) {
        if (comparator == null) {
            store.errors().set(ErrorCode.INVALID_VALUE, "comparator is null");
            return false;
        }
        beginMutation("sort");
        arr.sort((l, r) -> comparator.compare(nrKeyNames, l.kvs, r.kvs, userData));
        refreshIndices(0);
        afterMutation();
        return true;
    }

    public boolean swap(int i, int j) {
        if (!inRange(i) || !inRange(j)) return false;
        beginMutation("swap");
        Entry l = arr.get(i);
        Entry r = arr.get(j);
        arr.set(i, r);
        arr.set(j, l);
        l.idx = j;
        r.idx = i;
        afterMutation();
        return true;
    }

    private boolean inRange(int idx) {
        if (idx < 0 || idx >= arr.size()) {
            store.errors().set(ErrorCode.OUT_OF_BOUNDS, "index %d out of [0, %d)", idx, arr.size());
            return false;
        }
        return true;
    }

    private Variant take(Entry e) {
        Variant v = e.elem;
        int holds = detach(e);
        if (holds < 0) return Variant.INVALID;
        store.ref(v);
        store.abandon(v, holds);
        return v;
    }

    /**
     * Unlinks e from both indexes. The set's hold on e.elem is left to the
     * caller, who gives it back with the returned count; -1 when vetoed.
     */
    private int detach(Entry e) {
        beginMutation("remove");
        if (!firePre(VariantOperation.SHRINK, e.elem)) return -1;

        int slot = e.idx;
        deleteEntry(e);
        arr.remove(slot);
        refreshIndices(slot);
        e.idx = -1;

        afterMutation();
        int holds = self.getRefCount();
        firePost(VariantOperation.SHRINK, e.elem);
        return holds;
    }

    private void refreshIndices(int from) {
        for (int i = from; i < arr.size(); i++) arr.get(i).idx = i;
    }

    private void afterMutation() {
        updateExtraSize();
        if (store.config().isCheckIntegrity()) verifyIntegrity();
    }

    void updateExtraSize() {
        long extra = 0;
        if (keySpec != null) extra += keySpec.length() + 1 + SIZE_OF_SLOT * nrKeyNames;
        extra += (SIZE_OF_ENTRY + SIZE_OF_SLOT * nrKeyNames + SIZE_OF_SLOT) * arr.size();
        store.setExtraSize(self, extra);
    }

    @Override
    void clearMembers() {
        List<Variant> held = members();
        for (Entry e : arr) {
            e.idx = -1;
            e.left = e.right = e.parent = null;
        }
        arr.clear();
        root = null;
        for (Variant m : held) store.unref(m);
    }

    // ===================== ITERATION =====================

    /** Cursor at the smallest key; null with NOT_FOUND when empty. */
    public SetIterator iteratorBegin() {
        if (root == null) {
            store.errors().set(ErrorCode.NOT_FOUND, "set is empty");
            return null;
        }
        return new SetIterator(first());
    }

    /** Cursor at the largest key; null with NOT_FOUND when empty. */
    public SetIterator iteratorEnd() {
        if (root == null) {
            store.errors().set(ErrorCode.NOT_FOUND, "set is empty");
            return null;
        }
        return new SetIterator(last());
    }

    /**
     * Bidirectional cursor in key order. Stepping off either end leaves it
     * invalid; stepping an invalid cursor fails with INVALID_VALUE.
     */
    public final class SetIterator {

        private Entry curr;
        private Entry prev;
        private Entry next;

        private SetIterator(Entry start) {
            this.curr = start;
            refresh();
        }

        public boolean isValid() {
            return curr != null && curr.idx >= 0;
        }

        public boolean next() {
            if (!isValid()) {
                store.errors().set(ErrorCode.INVALID_VALUE, "iterator is exhausted");
                return false;
            }
            curr = next;
            refresh();
            return curr != null;
        }

        public boolean prev() {
            if (!isValid()) {
                store.errors().set(ErrorCode.INVALID_VALUE, "iterator is exhausted");
                return false;
            }
            curr = prev;
            refresh();
            return curr != null;
        }

        /** Borrowed member under the cursor. */
        public Variant value() {
            if (!isValid()) {
                store.errors().set(ErrorCode.INVALID_VALUE, "iterator is exhausted");
                return Variant.INVALID;
            }
            return curr.elem;
        }

        private void refresh() {
            if (curr == null || curr.idx < 0) {
                curr = prev = next = null;
                return;
            }
            prev = predecessor(curr);
            next = successor(curr);
        }
    }

    // ===================== RED-BLACK TREE =====================

    private Entry first() {
        Entry p = root;
        if (p != null) while (p.left != null) p = p.left;
        return p;
    }

    private Entry last() {
        Entry p = root;
        if (p != null) while (p.right != null) p = p.right;
        return p;
    }

    private static Entry minimum(Entry p) {
        while (p.left != null) p = p.left;
        return p;
    }

    private static Entry successor(Entry t) {
        if (t.right != null) return minimum(t.right);
        Entry p = t.parent;
        Entry ch = t;
        while (p != null && ch == p.right) {
            ch = p;
            p = p.parent;
        }
        return p;
    }

    private static Entry predecessor(Entry t) {
        if (t.left != null) {
            Entry p = t.left;
            while (p.right != null) p = p.right;
            return p;
        }
        Entry p = t.parent;
        Entry ch = t;
        while (p != null && ch == p.left) {
            ch = p;
            p = p.parent;
        }
        return p;
    }

    private static boolean isRed(Entry e) {
        return e != null && e.red;
    }

    private void rotateLeft(Entry x) {
        Entry y = x.right;
        x.right = y.left;
        if (y.left != null) y.left.parent = x;
        y.parent = x.parent;
        if (x.parent == null) root = y;
        else if (x == x.parent.left) x.parent.left = y;
        else x.parent.right = y;
        y.left = x;
        x.parent = y;
    }

    private void rotateRight(Entry x) {
        Entry y = x.left;
        x.left = y.right;
        if (y.right != null) y.right.parent = x;
        y.parent = x.parent;
        if (x.parent == null) root = y;
        else if (x == x.parent.right) x.parent.right = y;
        else x.parent.left = y;
        y.right = x;
        x.parent = y;
    }

    private void fixAfterInsertion(Entry z) {
        z.red = true;
        while (z != root && isRed(z.parent)) {
            Entry p = z.parent;
            Entry g = p.parent;
            if (p == g.left) {
                Entry u = g.right;
                if (isRed(u)) {
                    p.red = false;
                    u.red = false;
                    g.red = true;
                    z = g;
                } else {
                    if (z == p.right) {
                        z = p;
                        rotateLeft(z);
                        p = z.parent;
                    }
                    p.red = false;
                    g.red = true;
                    rotateRight(g);
                }
            } else {
                Entry u = g.left;
                if (isRed(u)) {
                    p.red = false;
                    u.red = false;
                    g.red = true;
                    z = g;
                } else {
                    if (z == p.left) {
                        z = p;
                        rotateRight(z);
                        p = z.parent;
                    }
                    p.red = false;
                    g.red = true;
                    rotateLeft(g);
                }
            }
        }
        root.red = false;
    }

    private void transplant(Entry u, Entry v) {
        if (u.parent == null) root = v;
        else if (u == u.parent.left) u.parent.left = v;
        else u.parent.right = v;
        if (v != null) v.parent = u.parent;
    }

    // Entries are relinked, never content-swapped: positional slots keep pointing at live nodes.
    private void deleteEntry(Entry z) {
        Entry x;
        Entry xParent;
        boolean removedRed = z.red;

        if (z.left == null) {
            x = z.right;
            xParent = z.parent;
            transplant(z, z.right);
        } else if (z.right == null) {
            x = z.left;
            xParent = z.parent;
            transplant(z, z.left);
        } else {
            Entry y = minimum(z.right);
            removedRed = y.red;
            x = y.right;
            if (y.parent == z) {
                xParent = y;
            } else {
                xParent = y.parent;
                transplant(y, y.right);
                y.right = z.right;
                y.right.parent = y;
            }
            transplant(z, y);
            y.left = z.left;
            y.left.parent = y;
            y.red = z.red;
        }

        z.left = z.right = z.parent = null;
        if (!removedRed) fixAfterDeletion(x, xParent);
    }

    private void fixAfterDeletion(Entry x, Entry xParent) {
        while (x != root && !isRed(x)) {
            if (x == xParent.left) {
                Entry w = xParent.right;
                if (isRed(w)) {
                    w.red = false;
                    xParent.red = true;
                    rotateLeft(xParent);
                    w = xParent.right;
                }
                if (!isRed(w.left) && !isRed(w.right)) {
                    w.red = true;
                    x = xParent;
                    xParent = x.parent;
                } else {
                    if (!isRed(w.right)) {
                        w.left.red = false;
                        w.red = true;
                        rotateRight(w);
                        w = xParent.right;
                    }
                    w.red = xParent.red;
                    xParent.red = false;
                    w.right.red = false;
                    rotateLeft(xParent);
                    x = root;
                    xParent = null;
                }
            } else {
                Entry w = xParent.left;
                if (isRed(w)) {
                    w.red = false;
                    xParent.red = true;
                    rotateRight(xParent);
                    w = xParent.left;
                }
                if (!isRed(w.right) && !isRed(w.left)) {
                    w.red = true;
                    x = xParent;
                    xParent = x.parent;
                } else {
                    if (!isRed(w.left)) {
                        w.right.red = false;
                        w.red = true;
                        rotateLeft(w);
                        w = xParent.left;
                    }
                    w.red = xParent.red;
                    xParent.red = false;
                    w.left.red = false;
                    rotateRight(xParent);
                    x = root;
                    xParent = null;
                }
            }
        }
        if (x != null) x.red = false;
    }

    // ===================== INTEGRITY =====================

    /**
     * Re-checks both indexes: red-black shape, strict key order along the
     * tree, one-to-one tree/array correspondence and dense positions.
     *
     * @throws VariantAssertionError on the first violation found
     */
    public void verifyIntegrity() {
        VariantAssertionError.check(root == null || !root.red, "red root");
        VariantAssertionError.check(root == null || root.parent == null, "root has a parent");
        blackHeight(root);

        Map<Entry, Boolean> inTree = new IdentityHashMap<>();
        Entry prevEntry = null;
        for (Entry e = first(); e != null; e = successor(e)) {
            if (prevEntry != null) {
                VariantAssertionError.check(compareKeys(prevEntry.kvs, e.kvs) < 0, "tree out of key order");
            }
            inTree.put(e, Boolean.TRUE);
            prevEntry = e;
        }
        VariantAssertionError.check(inTree.size() == arr.size(),
                "tree has " + inTree.size() + " nodes, array has " + arr.size());

        for (int i = 0; i < arr.size(); i++) {
            Entry e = arr.get(i);
            VariantAssertionError.check(e.idx == i, "slot " + i + " records index " + e.idx);
            VariantAssertionError.check(inTree.containsKey(e), "slot " + i + " is not linked into the tree");
            VariantAssertionError.check(e.elem != null && e.elem.isValid(), "slot " + i + " holds a dead value");
            verifyKeyValues(i, e);
        }
    }

    /** Stored key values must still be the member's live fields. */
    private void verifyKeyValues(int slot, Entry e) {
        if (isKeyless()) {
            VariantAssertionError.check(e.kvs[0] == e.elem, "slot " + slot + " key is not its member");
            return;
        }
        Map<String, Variant> fields = e.elem.isType(VariantType.OBJECT) ? e.elem.asObject().view() : null;
        for (int k = 0; k < nrKeyNames; k++) {
            Variant kv = e.kvs[k];
            VariantAssertionError.check(kv != null && kv.isValid(),
                    "slot " + slot + " key '" + keyNames[k] + "' was released");
            Variant field = (fields == null) ? null : fields.get(keyNames[k]);
            boolean current = (field == null) ? kv.isType(VariantType.UNDEFINED) : field == kv;
            VariantAssertionError.check(current,
                    "slot " + slot + " key '" + keyNames[k] + "' was replaced in its member");
        }
    }

    private int blackHeight(Entry e) {
        if (e == null) return 1;
        if (e.left != null) VariantAssertionError.check(e.left.parent == e, "broken parent link");
        if (e.right != null) VariantAssertionError.check(e.right.parent == e, "broken parent link");
        if (e.red) VariantAssertionError.check(!isRed(e.left) && !isRed(e.right), "red node with red child");
        int l = blackHeight(e.left);
        int r = blackHeight(e.right);
        VariantAssertionError.check(l == r, "unequal black height");
        return l + (e.red ? 0 : 1);
    }
}
