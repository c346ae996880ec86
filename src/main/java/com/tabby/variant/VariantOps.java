package com.tabby.variant;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Value conversions and the runtime's total order.
 *
 * Order across kinds (low to high):
 *  undefined, null, numeric (boolean, number, longint, longdouble),
 *  string (string, atom string), byte sequence, dynamic, native,
 *  object, array, set
 *
 * Within a group: numbers by value, strings by code point, byte sequences
 * unsigned lexicographic, dynamic/native by creation serial, containers
 * member by member then by size.
 */
public final class VariantOps {

    private VariantOps() {}

    // ===================== NUMBERIFY / BOOLEANIZE =====================

    public static double numberify(Variant v) {
        if (v == null || !v.isValid()) return 0;
        switch (v.type) {
            case UNDEFINED:
            case NULL:
                return 0;
            case BOOLEAN:
                return v.asBoolean() ? 1 : 0;
            case NUMBER:
            case LONGDOUBLE:
                return v.asNumber();
            case LONGINT:
                return v.asLongInt();
            case STRING:
            case ATOM_STRING:
                return parseNumber(v.asString());
            case OBJECT:
            case ARRAY:
            case SET: {
                double sum = 0;
                for (Variant m : v.container().members()) sum += numberify(m);
                return sum;
            }
            default:
                return 0;
        }
    }

    private static double parseNumber(String s) {
        String t = s.trim();
        if (t.isEmpty()) return 0;
        try {
            return Double.parseDouble(t);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    public static boolean booleanize(Variant v) {
        if (v != null && v.isType(VariantType.BYTE_SEQUENCE)) {
            for (byte b : v.asBytes()) {
                if (b != 0) return true;
            }
            return false;
        }
        return numberify(v) != 0;
    }

    // ===================== STRINGIFY =====================

    public static String stringify(Variant v) {
        StringBuilder sb = new StringBuilder();
        stringify(v, sb);
        return sb.toString();
    }

    private static void stringify(Variant v, StringBuilder sb) {
        if (v == null || !v.isValid()) {
            sb.append("<invalid>");
            return;
        }
        switch (v.type) {
            case UNDEFINED: sb.append("undefined"); break;
            case NULL: sb.append("null"); break;
            case BOOLEAN: sb.append(v.asBoolean() ? "true" : "false"); break;
            case NUMBER:
            case LONGDOUBLE: sb.append(formatNumber(v.asNumber())); break;
            case LONGINT: sb.append(v.asLongInt()); break;
            case STRING:
            case ATOM_STRING: sb.append(v.asString()); break;
            case BYTE_SEQUENCE: appendHex(v.asBytes(), sb); break;
            case DYNAMIC: sb.append("<dynamic>"); break;
            case NATIVE: sb.append("<native>"); break;
            case OBJECT: {
                VariantObject obj = v.asObject();
                for (String k : obj.keys()) {
                    sb.append(k).append(':');
                    stringify(obj.get(k), sb);
                    sb.append('\n');
                }
                break;
            }
            case ARRAY:
            case SET:
                for (Variant m : v.container().members()) {
                    stringify(m, sb);
                    sb.append('\n');
                }
                break;
            default:
                throw new IllegalStateException("Unknown variant type: " + v.type);
        }
    }

    static String formatNumber(double d) {
        if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return Double.toString(d);
    }

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private static void appendHex(byte[] bytes, StringBuilder sb) {
        for (byte b : bytes) {
            sb.append(HEX[(b >> 4) & 0x0F]).append(HEX[b & 0x0F]);
        }
    }

    // ===================== ORDER =====================

    public static boolean isEqual(Variant a, Variant b) {
        return compare(a, b) == 0;
    }

    public static int compare(Variant a, Variant b) {
        if (a == b) return 0;
        int ra = rank(a), rb = rank(b);
        if (ra != rb) return Integer.compare(ra, rb);

        switch (ra) {
            case 0: // invalid
            case 1: // undefined
            case 2: // null
                return 0;
            case 3:
                return compareNumeric(a, b);
            case 4:
                return compareCodePoints(a.asString(), b.asString());
            case 5:
                return Arrays.compareUnsigned(a.asBytes(), b.asBytes());
            case 6:
            case 7:
                return Long.compare(a.serial, b.serial);
            case 8:
                return compareObjects(a.asObject(), b.asObject());
            default:
                return compareMembers(a.container().members(), b.container().members());
        }
    }

    /**
     * Numeric kinds share one scale. A LONGINT meeting a floating kind is
     * compared exactly, so the order stays transitive above 2^53. NaN sorts
     * above every number and -0.0 equals 0.0.
     */
    private static int compareNumeric(Variant a, Variant b) {
        boolean la = a.isType(VariantType.LONGINT), lb = b.isType(VariantType.LONGINT);
        if (la && lb) return Long.compare(a.asLongInt(), b.asLongInt());
        if (la) return compareLongToDouble(a.asLongInt(), numberify(b));
        if (lb) return -compareLongToDouble(b.asLongInt(), numberify(a));
        double da = numberify(a), db = numberify(b);
        if (da == db) return 0;
        return Double.compare(da, db);
    }

    static int compareLongToDouble(long l, double d) {
        if (Double.isNaN(d)) return -1;
        if (Double.isInfinite(d)) return d > 0 ? -1 : 1;
        return new BigDecimal(l).compareTo(new BigDecimal(d));
    }

    private static int rank(Variant v) {
        if (v == null || !v.isValid()) return 0;
        switch (v.type) {
            case UNDEFINED: return 1;
            case NULL: return 2;
            case BOOLEAN:
            case NUMBER:
            case LONGINT:
            case LONGDOUBLE: return 3;
            case STRING:
            case ATOM_STRING: return 4;
            case BYTE_SEQUENCE: return 5;
            case DYNAMIC: return 6;
            case NATIVE: return 7;
            case OBJECT: return 8;
            case ARRAY: return 9;
            case SET: return 10;
            default: throw new IllegalStateException("Unknown variant type: " + v.type);
        }
    }

    static int compareCodePoints(String a, String b) {
        int i = 0, j = 0;
        while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i), cb = b.codePointAt(j);
            if (ca != cb) return Integer.compare(ca, cb);
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Boolean.compare(i < a.length(), j < b.length());
    }

    private static int compareObjects(VariantObject a, VariantObject b) {
        List<String> ka = sortedKeys(a), kb = sortedKeys(b);
        int n = Math.min(ka.size(), kb.size());
        for (int i = 0; i < n; i++) {
            int c = compareCodePoints(ka.get(i), kb.get(i));
            if (c != 0) return c;
            c = compare(a.get(ka.get(i)), b.get(kb.get(i)));
            if (c != 0) return c;
        }
        return Integer.compare(ka.size(), kb.size());
    }

    private static List<String> sortedKeys(VariantObject obj) {
        List<String> keys = new ArrayList<>(obj.keys());
        Collections.sort(keys, VariantOps::compareCodePoints);
        return keys;
    }

    private static int compareMembers(List<Variant> a, List<Variant> b) {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int c = compare(a.get(i), b.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(a.size(), b.size());
    }
}
