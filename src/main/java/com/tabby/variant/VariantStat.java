package com.tabby.variant;

import java.util.EnumMap;
import java.util.Map;

/**
 * Usage statistics of one {@link ValueStore}.
 *
 * Counts live values and their nominal memory per kind. Pool hits count the
 * value but not its cell memory (the cell was already accounted for while
 * it sat in the pool).
 */
public final class VariantStat {

    private final EnumMap<VariantType, Long> nrValues = new EnumMap<>(VariantType.class);
    private final EnumMap<VariantType, Long> szMem = new EnumMap<>(VariantType.class);
    private long nrTotalValues;
    private long szTotalMem;
    private int nrReserved;
    private int nrMaxReserved;

    VariantStat(int maxReserved) {
        for (VariantType t : VariantType.values()) {
            nrValues.put(t, 0L);
            szMem.put(t, 0L);
        }
        this.nrMaxReserved = maxReserved;
    }

    private VariantStat(VariantStat other) {
        this.nrValues.putAll(other.nrValues);
        this.szMem.putAll(other.szMem);
        this.nrTotalValues = other.nrTotalValues;
        this.szTotalMem = other.szTotalMem;
        this.nrReserved = other.nrReserved;
        this.nrMaxReserved = other.nrMaxReserved;
    }

    VariantStat snapshot() {
        return new VariantStat(this);
    }

    void countValue(VariantType type, boolean reserved, boolean add) {
        if (type == null || type.isConstantKind()) return;
        long d = add ? 1 : -1;
        nrValues.merge(type, d, Long::sum);
        nrTotalValues += d;
        if (!reserved) addMemory(type, d * ValueStore.SIZE_OF_VARIANT);
    }

    void addMemory(VariantType type, long delta) {
        if (type == null || delta == 0) return;
        szMem.merge(type, delta, Long::sum);
        szTotalMem += delta;
    }

    void setReserved(int reserved) {
        this.nrReserved = reserved;
    }

    public long getValueCount(VariantType type) { return nrValues.get(type); }

    public long getMemory(VariantType type) { return szMem.get(type); }

    public long getTotalValues() { return nrTotalValues; }

    public long getTotalMemory() { return szTotalMem; }

    public int getReserved() { return nrReserved; }

    public int getMaxReserved() { return nrMaxReserved; }

    public Map<VariantType, Long> valueCounts() {
        return new EnumMap<>(nrValues);
    }

    @Override
    public String toString() {
        return "VariantStat{values=" + nrTotalValues + ", mem=" + szTotalMem
                + ", reserved=" + nrReserved + "/" + nrMaxReserved + "}";
    }
}
