package com.tabby.variant;

import com.tabby.config.RuntimeConfig;
import com.tabby.debug.Debug;
import com.tabby.debug.DebugLevel;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * ValueStore
 *
 * Per-instance value context: the bounded reuse pool, usage statistics,
 * constant values, atom table, release-function table and last-error slot.
 * Every lifecycle call goes through the store that made the value; there is
 * no process-wide state.
 *
 * Reference counting:
 *  - scalars: plain increment/decrement
 *  - containers: ref/unref is applied to every member as well, so a member
 *    holds (1 + containerRefc - 1) references on behalf of each container it
 *    sits in; the final unref (1 -> 0) drops the container's own hold
 *  - constants (undefined, null, true, false): ref/unref are no-ops
 *
 * Not thread-safe: one store belongs to one execution context.
 */
public final class ValueStore implements AutoCloseable {

    /** Nominal cell size used for memory statistics. */
    public static final long SIZE_OF_VARIANT = 32;

    private static final String TAG = "tabby.store";

    private final RuntimeConfig config;
    private final int capacity;
    private final ArrayDeque<Variant> pool;
    private final VariantStat stat;
    private final ErrorSlot errors = new ErrorSlot();
    private final AtomTable atoms = new AtomTable();
    private final Map<VariantType, Consumer<Variant>> releasers = new EnumMap<>(VariantType.class);

    private final Variant undefined;
    private final Variant nullValue;
    private final Variant trueValue;
    private final Variant falseValue;

    private long nextSerial = 1;
    private boolean closed;

    public ValueStore() {
        this(RuntimeConfig.defaults());
    }

    public ValueStore(RuntimeConfig config) {
        if (config == null) throw new IllegalArgumentException("config is null");
        this.config = config;
        this.capacity = config.getPoolCapacity();
        this.pool = new ArrayDeque<>(Math.max(1, capacity));
        this.stat = new VariantStat(capacity);

        this.undefined = constant(VariantType.UNDEFINED, null);
        this.nullValue = constant(VariantType.NULL, null);
        this.trueValue = constant(VariantType.BOOLEAN, Boolean.TRUE);
        this.falseValue = constant(VariantType.BOOLEAN, Boolean.FALSE);

        registerReleasers();
    }

    private Variant constant(VariantType type, Object payload) {
        Variant v = new Variant();
        v.type = type;
        v.payload = payload;
        v.refc = 1;
        v.flags = VariantFlags.NO_FREE;
        v.serial = nextSerial++;
        return v;
    }

    // kind -> release function, run when the count reaches zero
    private void registerReleasers() {
        releasers.put(VariantType.NATIVE, v -> {
            NativeValue nv = (NativeValue) v.payload;
            if (nv != null && nv.ops().onRelease() != null) nv.ops().onRelease().release(nv.entity());
        });
        releasers.put(VariantType.OBJECT, v -> v.container().destroy());
        releasers.put(VariantType.ARRAY, v -> v.container().destroy());
        releasers.put(VariantType.SET, v -> v.container().destroy());
    }

    public RuntimeConfig config() { return config; }

    public ErrorSlot errors() { return errors; }

    public AtomTable atoms() { return atoms; }

    // ===================== POOL =====================

    /** Zeroed cell of the given kind, from the pool when one is available. */
    public Variant acquire(VariantType kind) {
        VariantAssertionError.check(!closed, "value store is closed");
        VariantAssertionError.check(kind != null, "acquire with null kind");

        Variant v = pool.pollFirst();
        boolean reserved = (v != null);
        if (v == null) v = new Variant();

        v.type = kind;
        v.refc = 0;
        v.flags = 0;
        v.payload = null;
        v.extraSize = 0;
        v.atomId = 0;
        v.released = false;
        v.serial = nextSerial++;

        stat.countValue(kind, reserved, true);
        stat.setReserved(pool.size());
        if (Debug.get().isEnabled(DebugLevel.TRACE)) {
            Debug.get().t(TAG, "acquire " + kind + (reserved ? " (pooled)" : " (new)"));
        }
        return v;
    }

    /** Returns the cell to the pool, or drops it when the pool is full. */
    public void release(Variant v) {
        checkLive(v);
        VariantAssertionError.check(!v.hasFlag(VariantFlags.NO_FREE), "release of a no-free value");

        if (v.extraSize != 0) setExtraSize(v, 0);

        VariantType kind = v.type;
        v.payload = null;
        v.refc = 0;
        v.flags = 0;
        v.released = true;
        v.generation++;

        boolean reserved = !closed && pool.size() < capacity;
        if (reserved) pool.addLast(v);

        stat.countValue(kind, reserved, false);
        stat.setReserved(pool.size());
        if (Debug.get().isEnabled(DebugLevel.TRACE)) {
            Debug.get().t(TAG, "release " + kind + (reserved ? " (pooled)" : " (freed)"));
        }
    }

    public VariantStat usageStat() {
        return stat.snapshot();
    }

    void setExtraSize(Variant v, long extra) {
        long delta = extra - v.extraSize;
        v.extraSize = extra;
        if (extra > 0) v.flags |= VariantFlags.EXTRA_SIZE;
        else v.flags &= ~VariantFlags.EXTRA_SIZE;
        stat.addMemory(v.type, delta);
    }

    // ===================== REFERENCE COUNTING =====================

    public int ref(Variant v) {
        checkLive(v);
        if (v.hasFlag(VariantFlags.NO_FREE)) return v.refc;

        v.refc++;
        if (v.isContainer()) {
            for (Variant m : v.container().members()) ref(m);
        }
        return v.refc;
    }

    public int unref(Variant v) {
        checkLive(v);
        if (v.hasFlag(VariantFlags.NO_FREE)) return v.refc;
        VariantAssertionError.check(v.refc > 0, "refcount underflow on " + v.type);

        if (v.refc > 1 && v.isContainer()) {
            for (Variant m : v.container().members()) unref(m);
        }

        v.refc--;
        if (v.refc > 0) return v.refc;

        Consumer<Variant> releaser = releasers.get(v.type);
        if (releaser != null) releaser.accept(v);
        release(v);
        return 0;
    }

    /** Takes the references a member needs when it is stored into container. */
    void adopt(Variant container, Variant member) {
        for (int i = 0; i < container.refc; i++) ref(member);
    }

    /**
     * Gives back what {@link #adopt} took. holds is the container's count
     * when the member was unlinked; listeners may have changed it since.
     */
    void abandon(Variant member, int holds) {
        for (int i = holds; i > 0; i--) unref(member);
    }

    /** True when needle is haystack itself or reachable through its members. */
    boolean contains(Variant haystack, Variant needle) {
        if (haystack == needle) return true;
        if (!haystack.isContainer()) return false;
        for (Variant m : haystack.container().members()) {
            if (m.isContainer() && contains(m, needle)) return true;
        }
        return false;
    }

    private static void checkLive(Variant v) {
        VariantAssertionError.check(v != null && v != Variant.INVALID, "null or invalid variant");
        VariantAssertionError.check(!v.released, "use of released " + v.type + " value");
    }

    // ===================== CONSTANTS & SCALARS =====================

    public Variant makeUndefined() { return undefined; }

    public Variant makeNull() { return nullValue; }

    public Variant makeBoolean(boolean b) { return b ? trueValue : falseValue; }

    public Variant makeNumber(double d) {
        return scalar(VariantType.NUMBER, d);
    }

    public Variant makeLongInt(long l) {
        return scalar(VariantType.LONGINT, l);
    }

    public Variant makeLongDouble(double d) {
        return scalar(VariantType.LONGDOUBLE, d);
    }

    private Variant scalar(VariantType type, Object payload) {
        Variant v = acquire(type);
        v.payload = payload;
        v.refc = 1;
        return v;
    }

    public Variant makeString(String s) {
        if (s == null) {
            errors.set(ErrorCode.INVALID_VALUE, "string is null");
            return Variant.INVALID;
        }
        Variant v = scalar(VariantType.STRING, s);
        long len = s.getBytes(StandardCharsets.UTF_8).length + 1L;
        if (len - 1 > config.getLongStringThreshold()) {
            v.flags |= VariantFlags.LONG_PAYLOAD;
            setExtraSize(v, len);
        }
        return v;
    }

    /** Interned string. Static atoms are not counted as extra memory. */
    public Variant makeAtomString(String s, boolean isStatic) {
        if (s == null) {
            errors.set(ErrorCode.INVALID_VALUE, "atom string is null");
            return Variant.INVALID;
        }
        Variant v = scalar(VariantType.ATOM_STRING, s);
        v.atomId = atoms.intern(s);
        if (isStatic) v.flags |= VariantFlags.ATOM_STATIC;
        else setExtraSize(v, s.getBytes(StandardCharsets.UTF_8).length + 1L);
        return v;
    }

    public Variant makeByteSequence(byte[] bytes) {
        if (bytes == null) {
            errors.set(ErrorCode.INVALID_VALUE, "byte sequence is null");
            return Variant.INVALID;
        }
        Variant v = scalar(VariantType.BYTE_SEQUENCE, bytes.clone());
        if (bytes.length > config.getLongStringThreshold()) {
            v.flags |= VariantFlags.LONG_PAYLOAD;
            setExtraSize(v, bytes.length);
        }
        return v;
    }

    public Variant makeDynamic(DynamicValue.Method getter, DynamicValue.Method setter) {
        if (getter == null && setter == null) {
            errors.set(ErrorCode.INVALID_VALUE, "dynamic value needs a getter or a setter");
            return Variant.INVALID;
        }
        return scalar(VariantType.DYNAMIC, new DynamicValue(getter, setter));
    }

    public Variant makeNative(Object entity, NativeOps ops) {
        if (entity == null) {
            errors.set(ErrorCode.INVALID_VALUE, "native entity is null");
            return Variant.INVALID;
        }
        return scalar(VariantType.NATIVE, new NativeValue(entity, ops));
    }

    // ===================== CONTAINERS =====================

    public Variant makeObject() {
        Variant v = acquire(VariantType.OBJECT);
        v.payload = new VariantObject(this, v);
        v.refc = 1;
        return v;
    }

    /** Object holding the given members in map iteration order. */
    public Variant makeObject(Map<String, Variant> members) {
        Variant v = makeObject();
        if (members == null) return v;
        for (Map.Entry<String, Variant> e : members.entrySet()) {
            if (!v.asObject().set(e.getKey(), e.getValue())) {
                unref(v);
                return Variant.INVALID;
            }
        }
        return v;
    }

    public Variant makeArray(Variant... members) {
        Variant v = acquire(VariantType.ARRAY);
        v.payload = new VariantArray(this, v, members == null ? 0 : members.length);
        v.refc = 1;
        if (members == null) return v;
        for (Variant m : members) {
            if (!v.asArray().append(m)) {
                unref(v);
                return Variant.INVALID;
            }
        }
        return v;
    }

    public Variant makeSet(String keySpec, Variant... members) {
        return makeSet(0, keySpec, members);
    }

    /**
     * Keyed set. keySpec is a space separated list of field names; null or
     * blank means members are compared as whole values. Initial members are
     * added with override, so a later duplicate replaces an earlier one.
     */
    public Variant makeSet(int sizeHint, String keySpec, Variant... members) {
        Variant v = acquire(VariantType.SET);
        v.payload = new VariantSet(this, v, sizeHint, keySpec);
        v.refc = 1;
        VariantSet set = v.asSet();
        set.updateExtraSize();
        if (members == null) return v;
        for (Variant m : members) {
            if (!set.add(m, true)) {
                unref(v);
                return Variant.INVALID;
            }
        }
        return v;
    }

    /** Same as {@link #makeSet(String, Variant...)} with the key spec given as a string variant. */
    public Variant makeSetByKey(Variant keySpec, Variant... members) {
        String spec = null;
        if (keySpec != null && keySpec != Variant.INVALID) {
            if (!keySpec.isString()) {
                errors.set(ErrorCode.WRONG_DATA_TYPE, "set key must be a string, got %s", keySpec.getType());
                return Variant.INVALID;
            }
            spec = keySpec.asString();
        }
        return makeSet(0, spec, members);
    }

    // ===================== LISTENERS =====================

    public VariantListener registerPostListener(Variant v, VariantOperation op, ListenerCallback cb, Object ctxt) {
        return register(false, v, op, cb, ctxt, null);
    }

    public VariantListener registerPostListener(Variant v, VariantOperation op, ListenerCallback cb, Object ctxt,
            VariantListener.Release onRelease) {
        return register(false, v, op, cb, ctxt, onRelease);
    }

    public VariantListener registerPreListener(Variant v, VariantOperation op, ListenerCallback cb, Object ctxt) {
        return register(true, v, op, cb, ctxt, null);
    }

    public VariantListener registerPreListener(Variant v, VariantOperation op, ListenerCallback cb, Object ctxt,
            VariantListener.Release onRelease) {
        return register(true, v, op, cb, ctxt, onRelease);
    }

    private VariantListener register(boolean pre, Variant v, VariantOperation op, ListenerCallback cb, Object ctxt,
            VariantListener.Release onRelease) {
        if (v == null || !v.isValid() || op == null || cb == null) {
            errors.set(ErrorCode.INVALID_VALUE, "listener needs a value, an operation and a callback");
            return null;
        }
        if (!v.isContainer()) {
            errors.set(ErrorCode.WRONG_DATA_TYPE, "cannot listen on %s", v.getType());
            return null;
        }
        return v.container().listeners().add(pre, op, cb, ctxt, onRelease);
    }

    /** One-shot: a second revocation of the same handle fails with INVALID_VALUE. */
    public boolean revokeListener(VariantListener listener) {
        if (listener == null) {
            errors.set(ErrorCode.INVALID_VALUE, "listener is null");
            return false;
        }
        if (!listener.registry().remove(listener)) {
            errors.set(ErrorCode.INVALID_VALUE, "listener already revoked");
            return false;
        }
        return true;
    }

    // ===================== TEARDOWN =====================

    public boolean isClosed() { return closed; }

    /** Instance teardown: empties the pool. Live values are left to their holders. */
    @Override
    public void close() {
        if (closed) return;
        closed = true;
        pool.clear();
        stat.setReserved(0);
        Debug.get().d(TAG, "closed, " + stat);
    }
}
