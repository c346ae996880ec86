import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tabby.config.RuntimeConfig;
import com.tabby.variant.NativeOps;
import com.tabby.variant.ValueStore;
import com.tabby.variant.Variant;
import com.tabby.variant.VariantOps;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class VariantOpsTest {

    private ValueStore store;
    private final List<Variant> made = new ArrayList<>();

    @BeforeEach
    void setUp() {
        store = new ValueStore(RuntimeConfig.load());
    }

    @AfterEach
    void tearDown() {
        for (Variant v : made) store.unref(v);
        made.clear();
        assertEquals(0, store.usageStat().getTotalValues());
    }

    private Variant json(String s) {
        Variant v = JsonValues.parse(store, s);
        assertTrue(v.isValid(), "failed to load [" + s + "]");
        made.add(v);
        return v;
    }

    private Variant keep(Variant v) {
        made.add(v);
        return v;
    }

    // -------------------------
    // numberify / booleanize
    // -------------------------

    private static final Object[][] NUMBERIFY = {
        { 0.0, "undefined" },
        { 0.0, "null" },
        { 1.0, "true" },
        { 0.0, "false" },
        { 0.0, "0" },
        { 0.0, "0.0" },
        { 0.0, "''" },
        { 0.0, "' '" },
        { 0.0, "'0'" },
        { 0.0, "'0.0'" },
        { 123.34, "'123.34'" },
        { 0.0, "'abcd'" },
        { 10.0, "[1,2,3,4]" },
        { 100.0, "{'a':10,'b':20,'c':30,'d':40}" },
    };

    @Test
    public void numberify_table() {
        for (Object[] row : NUMBERIFY) {
            String src = (String) row[1];
            assertEquals((double) row[0], VariantOps.numberify(json(src)), "[" + src + "]");
        }
    }

    @Test
    public void booleanize_table() {
        for (Object[] row : NUMBERIFY) {
            String src = (String) row[1];
            boolean expected = (double) row[0] != 0.0;
            assertEquals(expected, VariantOps.booleanize(json(src)), "[" + src + "]");
        }
    }

    @Test
    public void numberify_setSumsMembers() {
        Variant set = keep(store.makeSet("", json("1.5"), json("2.5"), json("'3'")));
        assertEquals(7.0, VariantOps.numberify(set));
        assertTrue(VariantOps.booleanize(set));
        assertFalse(VariantOps.booleanize(keep(store.makeSet(""))));
    }

    @Test
    public void booleanize_bytesLookAtContent() {
        assertFalse(VariantOps.booleanize(keep(store.makeByteSequence(new byte[] { 0, 0 }))));
        assertTrue(VariantOps.booleanize(keep(store.makeByteSequence(new byte[] { 0, 1 }))));
        assertFalse(VariantOps.booleanize(keep(store.makeByteSequence(new byte[0]))));
    }

    @Test
    public void numberify_invalidIsZero() {
        assertEquals(0.0, VariantOps.numberify(Variant.INVALID));
        assertFalse(VariantOps.booleanize(null));
    }

    // -------------------------
    // stringify
    // -------------------------

    @Test
    public void stringify_table() {
        String[][] rows = {
            { "undefined", "undefined" },
            { "null", "null" },
            { "true", "true" },
            { "false", "false" },
            { "10 ", "10" },
            { "0.0 ", "0" },
            { "' '", " " },
            { "'0'", "0" },
            { "'0.0'", "0.0" },
            { "'123.34'", "123.34" },
            { "'abcd'", "abcd" },
            { "[1,2,3,4]", "1\n2\n3\n4\n" },
            { "{'a':10,'b':20,'c':30,'d':40}", "a:10\nb:20\nc:30\nd:40\n" },
            { "[{'id':'1','name': 'Tom', 'age': 2, 'male': true },"
                + "{'id':'2','name':'Jerry','age':3,'male':true}]",
              "id:1\nname:Tom\nage:2\nmale:true\n"
                + "\n"
                + "id:2\nname:Jerry\nage:3\nmale:true\n"
                + "\n" },
        };
        for (String[] row : rows) {
            assertEquals(row[1], VariantOps.stringify(json(row[0])), "[" + row[0] + "]");
        }
    }

    @Test
    public void stringify_bytesAsUpperHex() {
        String[][] rows = {
            { "1234", "31323334" },
            { "abcd", "61626364" },
        };
        for (String[] row : rows) {
            Variant bs = keep(store.makeByteSequence(row[0].getBytes(StandardCharsets.US_ASCII)));
            assertEquals(row[1], VariantOps.stringify(bs));
        }
        byte[] raw = { 'a', 'b', 'c', 'd', (byte) 0xE7, 'e', 'f' };
        assertEquals("61626364E76566", VariantOps.stringify(keep(store.makeByteSequence(raw))));
    }

    @Test
    public void stringify_numbers() {
        assertEquals("-3", VariantOps.stringify(keep(store.makeNumber(-3))));
        assertEquals("0.5", VariantOps.stringify(keep(store.makeNumber(0.5))));
        assertEquals("9007199254740993", VariantOps.stringify(keep(store.makeLongInt(9007199254740993L))));
        assertEquals("1.0E15", VariantOps.stringify(keep(store.makeNumber(1e15))));
    }

    // -------------------------
    // order
    // -------------------------

    @Test
    public void compare_ranksKindsInFixedOrder() {
        Variant[] ascending = {
            store.makeUndefined(),
            store.makeNull(),
            store.makeBoolean(false),
            keep(store.makeNumber(2)),
            keep(store.makeString("a")),
            keep(store.makeByteSequence(new byte[] { 1 })),
            keep(store.makeDynamic((root, args) -> root, null)),
            keep(store.makeNative("n", new NativeOps())),
            json("{}"),
            json("[]"),
            keep(store.makeSet("")),
        };
        for (int i = 0; i < ascending.length; i++) {
            for (int j = 0; j < ascending.length; j++) {
                int c = VariantOps.compare(ascending[i], ascending[j]);
                assertEquals(Integer.signum(Integer.compare(i, j)), Integer.signum(c),
                        ascending[i].getType() + " vs " + ascending[j].getType());
            }
        }
    }

    @Test
    public void compare_numericKindsShareOneScale() {
        assertTrue(VariantOps.compare(store.makeBoolean(true), keep(store.makeNumber(0.5))) > 0);
        assertTrue(VariantOps.compare(keep(store.makeLongInt(2)), keep(store.makeNumber(1.5))) > 0);
        assertTrue(VariantOps.isEqual(keep(store.makeLongInt(3)), keep(store.makeLongDouble(3.0))));
        assertTrue(VariantOps.compare(keep(store.makeLongInt(9007199254740993L)),
                keep(store.makeLongInt(9007199254740992L))) > 0);
    }

    @Test
    public void compare_longIntAgainstDoubleIsExactAboveTwoPow53() {
        Variant a = keep(store.makeLongInt(9007199254740992L));
        Variant b = keep(store.makeNumber(9007199254740992.0));
        Variant c = keep(store.makeLongInt(9007199254740993L));

        assertEquals(0, VariantOps.compare(a, b));
        assertTrue(VariantOps.compare(a, c) < 0);
        assertTrue(VariantOps.compare(b, c) < 0, "a == b and a < c, so b < c");
        assertTrue(VariantOps.compare(c, b) > 0);

        Variant ld = keep(store.makeLongDouble(9007199254740992.0));
        assertTrue(VariantOps.compare(ld, c) < 0);
    }

    @Test
    public void compare_nanAndZeroSignsStayConsistent() {
        Variant nan = keep(store.makeNumber(Double.NaN));
        Variant inf = keep(store.makeNumber(Double.POSITIVE_INFINITY));
        Variant max = keep(store.makeLongInt(Long.MAX_VALUE));
        Variant min = keep(store.makeLongInt(Long.MIN_VALUE));
        Variant negInf = keep(store.makeNumber(Double.NEGATIVE_INFINITY));

        assertTrue(VariantOps.compare(max, inf) < 0);
        assertTrue(VariantOps.compare(inf, nan) < 0);
        assertTrue(VariantOps.compare(max, nan) < 0);
        assertTrue(VariantOps.compare(nan, max) > 0);
        assertTrue(VariantOps.compare(min, negInf) > 0);
        assertTrue(VariantOps.isEqual(nan, keep(store.makeNumber(Double.NaN))));

        Variant zero = keep(store.makeLongInt(0));
        Variant negZero = keep(store.makeNumber(-0.0));
        Variant posZero = keep(store.makeNumber(0.0));
        assertTrue(VariantOps.isEqual(zero, negZero));
        assertTrue(VariantOps.isEqual(zero, posZero));
        assertTrue(VariantOps.isEqual(negZero, posZero));
    }

    @Test
    public void compare_stringsByCodePoint() {
        Variant emoji = keep(store.makeString("\uD83D\uDE00"));
        Variant bmpMax = keep(store.makeString("\uFFFF"));
        assertTrue(VariantOps.compare(emoji, bmpMax) > 0);

        Variant ab = keep(store.makeString("ab"));
        Variant atomAb = keep(store.makeAtomString("ab", false));
        assertTrue(VariantOps.isEqual(ab, atomAb));
        assertTrue(VariantOps.compare(keep(store.makeString("a")), ab) < 0);
    }

    @Test
    public void compare_bytesUnsigned() {
        Variant low = keep(store.makeByteSequence(new byte[] { 0x7F }));
        Variant high = keep(store.makeByteSequence(new byte[] { (byte) 0x80 }));
        assertTrue(VariantOps.compare(low, high) < 0);
    }

    @Test
    public void compare_containersMemberWise() {
        assertTrue(VariantOps.compare(json("{a:1}"), json("{a:2}")) < 0);
        assertTrue(VariantOps.compare(json("{a:1}"), json("{b:0}")) < 0);
        assertTrue(VariantOps.compare(json("{a:1}"), json("{a:1,b:1}")) < 0);
        assertTrue(VariantOps.isEqual(json("{a:1,b:2}"), json("{b:2,a:1}")));

        assertTrue(VariantOps.compare(json("[1,2]"), json("[1,3]")) < 0);
        assertTrue(VariantOps.compare(json("[1]"), json("[1,0]")) < 0);
        assertTrue(VariantOps.isEqual(json("[1,'x']"), json("[1,'x']")));
    }

    @Test
    public void compare_nativesByCreation() {
        Variant first = keep(store.makeNative("x", null));
        Variant second = keep(store.makeNative("x", null));
        assertTrue(VariantOps.compare(first, second) < 0);
        assertTrue(VariantOps.isEqual(first, first));
    }
}
