import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tabby.config.RuntimeConfig;
import com.tabby.interpreter.InterpreterStack;
import com.tabby.interpreter.Observation;
import com.tabby.interpreter.ObserveContext;
import com.tabby.interpreter.Observer;
import com.tabby.interpreter.ObserverBridge;
import com.tabby.interpreter.StackFrame;
import com.tabby.interpreter.StackStage;
import com.tabby.interpreter.Timers;
import com.tabby.interpreter.VdomAttribute;
import com.tabby.interpreter.VdomElement;
import com.tabby.interpreter.VdomNode;
import com.tabby.variant.AtomTable;
import com.tabby.variant.ErrorCode;
import com.tabby.variant.NativeOps;
import com.tabby.variant.ValueStore;
import com.tabby.variant.Variant;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ObserverBridgeTest {

    private ValueStore store;
    private VdomElement document;
    private VdomElement button;
    private InterpreterStack stack;
    private final ObserverBridge bridge = new ObserverBridge();

    @BeforeEach
    void setUp() {
        store = new ValueStore(RuntimeConfig.load());
        store.atoms().intern(AtomTable.Bucket.MESSAGE, "click");
        store.atoms().intern(AtomTable.Bucket.MESSAGE, "ping");

        document = new VdomElement("hvml");
        VdomElement body = new VdomElement("body");
        button = new VdomElement("button").attr("id", "ok").attr("class", "btn primary");
        body.append(button);
        body.append(new VdomElement("button").attr("id", "cancel").attr("class", "btn"));
        document.append(body);

        stack = new InterpreterStack(store, document);
    }

    @AfterEach
    void tearDown() {
        stack.close();
        assertTrue(stack.observers().isEmpty());
    }

    private StackFrame observe(VdomAttribute... attrs) {
        VdomElement e = new VdomElement("observe");
        for (VdomAttribute a : attrs) e.attr(a);
        document.append(e);
        return stack.pushFrame(e, bridge);
    }

    private static VdomAttribute lit(String name, String text) {
        return VdomAttribute.literal(name, text);
    }

    private static VdomAttribute val(String name, Variant v) {
        return VdomAttribute.bound(name, v);
    }

    // -------------------------
    // container targets
    // -------------------------

    @Test
    public void container_growIsRoutedToObserver() {
        Variant arr = store.makeArray();
        StackFrame f = observe(val("on", arr), lit("for", "grow"));
        assertFalse(f.isFailed());
        assertEquals(1, stack.observers().size());
        assertEquals(Observer.Kind.CONTAINER, stack.observers().get(0).kind());

        Variant item = store.makeString("item");
        arr.asArray().append(item);
        assertEquals(1, stack.inboxSize());

        List<Observation> got = stack.drainInbox();
        assertEquals(1, got.size());
        assertEquals("grow", got.get(0).message().type());
        assertSame(arr, got.get(0).message().source());
        assertSame(item, got.get(0).message().extra());
        assertSame(f.pos(), got.get(0).element());

        // events of other kinds do not reach the observer
        arr.asArray().remove(0);
        assertTrue(stack.drainInbox().isEmpty());

        store.unref(item);
        store.unref(arr);
    }

    @Test
    public void container_popRevokesObserverAndListener() {
        Variant set = store.makeSet("id");
        observe(val("on", set), lit("for", "change"));
        assertEquals(1, set.asSet().listenerCount());
        assertEquals(3, set.getRefCount(), "caller, frame attribute, observer");

        assertTrue(stack.popFrame());
        assertTrue(stack.observers().isEmpty());
        assertEquals(0, set.asSet().listenerCount());
        assertEquals(1, set.getRefCount());
        store.unref(set);
    }

    @Test
    public void container_nonMutationEventIsRejected() {
        Variant obj = store.makeObject();
        StackFrame f = observe(val("on", obj), lit("for", "attached"));

        assertTrue(f.isFailed());
        assertEquals(ErrorCode.INVALID_VALUE, f.failure());
        assertTrue(f.failureDetail().contains("unknown msg"));
        assertEquals(0, obj.asObject().listenerCount());
        assertTrue(stack.observers().isEmpty());

        stack.popFrame();
        assertEquals(1, obj.getRefCount());
        store.unref(obj);
    }

    // -------------------------
    // attribute processing
    // -------------------------

    @Test
    public void attributes_missingForFails() {
        Variant arr = store.makeArray();
        StackFrame f = observe(val("on", arr));
        assertTrue(f.isFailed());
        assertEquals(ErrorCode.INVALID_VALUE, f.failure());
        stack.popFrame();
        store.unref(arr);
    }

    @Test
    public void attributes_unknownEventNameFails() {
        Variant arr = store.makeArray();
        StackFrame f = observe(val("on", arr), lit("for", "explode"));
        assertTrue(f.isFailed());
        assertEquals(ErrorCode.INVALID_VALUE, f.failure());
        stack.popFrame();
        store.unref(arr);
    }

    @Test
    public void attributes_duplicateFails() {
        StackFrame f = observe(lit("for", "grow"), lit("for", "shrink"));
        assertTrue(f.isFailed());
        assertEquals(ErrorCode.DUPLICATED, f.failure());
    }

    @Test
    public void attributes_unknownNameFails() {
        StackFrame f = observe(lit("for", "grow"), lit("in", "#ok"));
        assertTrue(f.isFailed());
        assertEquals(ErrorCode.NOT_IMPLEMENTED, f.failure());
    }

    @Test
    public void attributes_unresolvedVariableFails() {
        StackFrame f = observe(lit("on", "$missing"), lit("for", "grow"));
        assertTrue(f.isFailed());
        assertEquals(ErrorCode.INVALID_VALUE, f.failure());
    }

    @Test
    public void attributes_resolveDocumentVariables() {
        Variant arr = store.makeArray();
        stack.scope().bind("list", arr);
        StackFrame f = observe(lit("on", "$list"), lit("for", "grow"));
        assertFalse(f.isFailed());
        assertSame(arr, stack.observers().get(0).observed());
        store.unref(arr);
    }

    @Test
    public void attributes_noTargetIsNotSupported() {
        StackFrame f = observe(lit("for", "grow"));
        assertTrue(f.isFailed());
        assertEquals(ErrorCode.NOT_SUPPORTED, f.failure());
    }

    @Test
    public void attributes_scalarTargetIsNotSupported() {
        Variant n = store.makeNumber(3);
        StackFrame f = observe(val("on", n), lit("for", "change"));
        assertTrue(f.isFailed());
        assertEquals(ErrorCode.NOT_SUPPORTED, f.failure());
        stack.popFrame();
        assertEquals(1, n.getRefCount());
        store.unref(n);
    }

    // -------------------------
    // named variables
    // -------------------------

    @Test
    public void namedVariable_changeEvents() {
        observe(lit("at", "user"), lit("for", "change"));
        assertEquals(Observer.Kind.NAMED_VARIABLE, stack.observers().get(0).kind());

        Variant tom = store.makeString("Tom");
        Variant jerry = store.makeString("Jerry");

        stack.scope().bind("user", tom);
        assertTrue(stack.drainInbox().isEmpty(), "attached is not observed");

        stack.scope().bind("user", jerry);
        List<Observation> got = stack.drainInbox();
        assertEquals(1, got.size());
        assertEquals("change", got.get(0).message().type());
        assertSame(jerry, got.get(0).message().extra());

        stack.scope().bind("user", jerry);
        assertTrue(stack.drainInbox().isEmpty());

        stack.scope().bind("other", tom);
        assertTrue(stack.drainInbox().isEmpty());

        store.unref(tom);
        store.unref(jerry);
    }

    @Test
    public void namedVariable_attachDetach() {
        observe(lit("at", "user"), lit("for", "attached"));
        observe(lit("at", "user"), lit("for", "detached"));

        Variant v = store.makeNumber(1);
        stack.scope().bind("user", v);
        stack.scope().unbind("user");

        List<Observation> got = stack.drainInbox();
        assertEquals(2, got.size());
        assertEquals("attached", got.get(0).observer().msgType());
        assertEquals("detached", got.get(1).observer().msgType());
        assertSame(got.get(0).message().source(), got.get(1).message().source());
        store.unref(v);
    }

    @Test
    public void namedVariable_winsOverOn() {
        Variant arr = store.makeArray();
        observe(lit("at", "user"), val("on", arr), lit("for", "change"));
        assertEquals(Observer.Kind.NAMED_VARIABLE, stack.observers().get(0).kind());
        assertEquals(0, arr.asArray().listenerCount());
        store.unref(arr);
    }

    // -------------------------
    // element queries
    // -------------------------

    @Test
    public void elementQuery_routesElementEvents() {
        StackFrame f = observe(lit("on", ".btn"), lit("for", "click"));
        assertFalse(f.isFailed());
        assertEquals(Observer.Kind.NATIVE, stack.observers().get(0).kind());

        assertEquals(1, stack.fireElementEvent(button, "click", null));
        List<Observation> got = stack.drainInbox();
        assertEquals(1, got.size());
        assertEquals("click", got.get(0).message().type());

        assertEquals(0, stack.fireElementEvent(button, "ping", null), "not observed for ping");
        assertEquals(0, stack.fireElementEvent(document, "click", null), "not in the result");

        stack.popFrame();
        assertEquals(0, stack.fireElementEvent(button, "click", null));
    }

    @Test
    public void elementQuery_noMatchFailsWithNotFound() {
        StackFrame f = observe(lit("on", "#nowhere"), lit("for", "click"));
        assertTrue(f.isFailed());
        assertEquals(ErrorCode.NOT_FOUND, f.failure());
        assertTrue(stack.observers().isEmpty());
    }

    @Test
    public void elementQuery_subTypeFilter() {
        observe(lit("on", "#ok"), lit("for", "click:left"));

        stack.fireElementEvent(button, "click", "right");
        assertTrue(stack.drainInbox().isEmpty());

        stack.fireElementEvent(button, "click", "left");
        assertEquals(1, stack.drainInbox().size());
    }

    // -------------------------
    // natives
    // -------------------------

    @Test
    public void native_observeAndForgetHooks() {
        List<String> calls = new ArrayList<>();
        NativeOps ops = new NativeOps()
                .onObserve((entity, event, sub) -> calls.add("observe:" + event + ":" + sub))
                .onForget((entity, event, sub) -> calls.add("forget:" + event + ":" + sub));
        Variant nat = store.makeNative("socket", ops);

        observe(val("on", nat), lit("for", "ping:pong"));
        assertEquals(List.of("observe:ping:pong"), calls);

        stack.dispatchMessage(nat, "ping", "pong", null);
        assertEquals(1, stack.drainInbox().size());

        stack.popFrame();
        assertEquals(List.of("observe:ping:pong", "forget:ping:pong"), calls);
        store.unref(nat);
    }

    @Test
    public void native_refusalIsNotSupported() {
        Variant refusing = store.makeNative("x", new NativeOps().onObserve((e, ev, sub) -> false));
        StackFrame f = observe(val("on", refusing), lit("for", "ping"));
        assertTrue(f.isFailed());
        assertEquals(ErrorCode.NOT_SUPPORTED, f.failure());
        stack.popFrame();

        Variant plain = store.makeNative("y", null);
        f = observe(val("on", plain), lit("for", "ping"));
        assertTrue(f.isFailed());
        assertEquals(ErrorCode.NOT_SUPPORTED, f.failure());

        store.unref(refusing);
        store.unref(plain);
    }

    // -------------------------
    // timers
    // -------------------------

    @Test
    public void timers_expiredWithSubType() {
        assertTrue(stack.timers().add("t1", 100, true));
        assertTrue(stack.timers().add("t2", 250, true));
        observe(val("on", stack.timers().variant()), lit("for", "expired:t1"));
        assertEquals(Observer.Kind.TIMER, stack.observers().get(0).kind());

        assertTrue(stack.timers().fire("t1"));
        assertTrue(stack.timers().fire("t2"));
        List<Observation> got = stack.drainInbox();
        assertEquals(1, got.size());
        assertEquals("t1", got.get(0).message().subType());
    }

    @Test
    public void timers_activationEvents() {
        stack.timers().add("t1", 100, true);
        observe(val("on", stack.timers().variant()), lit("for", "deactivated"));
        observe(val("on", stack.timers().variant()), lit("for", "activated"));

        assertTrue(stack.timers().setActive("t1", false));
        assertTrue(stack.timers().setActive("t1", false));
        assertTrue(stack.timers().setActive("t1", true));

        List<Observation> got = stack.drainInbox();
        assertEquals(2, got.size());
        assertEquals("deactivated", got.get(0).message().type());
        assertEquals("activated", got.get(1).message().type());
    }

    @Test
    public void timers_inactiveTimerDoesNotFire() {
        stack.timers().add("t1", 100, false);
        assertFalse(stack.timers().isActive("t1"));

        store.errors().clear();
        assertFalse(stack.timers().fire("t1"));
        assertEquals(ErrorCode.NOT_ACCEPTED, store.errors().getCode());

        store.errors().clear();
        assertFalse(stack.timers().fire("nope"));
        assertEquals(ErrorCode.NOT_FOUND, store.errors().getCode());
    }

    @Test
    public void timers_duplicateIdAndRemoval() {
        assertTrue(stack.timers().add("t1", 100, true));
        store.errors().clear();
        assertFalse(stack.timers().add("t1", 200, true));
        assertEquals(ErrorCode.DUPLICATED_KEY, store.errors().getCode());

        assertEquals(100L, stack.timers().get("t1").asObject().get(Timers.KEY_INTERVAL).asLongInt());
        assertTrue(stack.timers().remove("t1"));
        assertEquals(0, stack.timers().size());
    }

    // -------------------------
    // with / alias
    // -------------------------

    @Test
    public void with_definitionWithoutChildElementsFails() {
        VdomElement define = new VdomElement("define");
        define.append(VdomNode.content("just text"));
        Variant def = store.makeNative(define, null);
        Variant arr = store.makeArray();

        StackFrame f = observe(val("on", arr), lit("for", "grow"), val("with", def));
        assertTrue(f.isFailed());
        assertEquals(ErrorCode.NO_DATA, f.failure());
        assertTrue(stack.observers().isEmpty());

        stack.popFrame();
        store.unref(def);
        store.unref(arr);
    }

    @Test
    public void with_nonDefinitionFails() {
        Variant arr = store.makeArray();
        Variant notDef = store.makeString("define");
        StackFrame f = observe(val("on", arr), lit("for", "grow"), val("with", notDef));
        assertTrue(f.isFailed());
        assertEquals(ErrorCode.INVALID_VALUE, f.failure());
        stack.popFrame();
        store.unref(notDef);
        store.unref(arr);
    }

    @Test
    public void alias_releaseRevokesObserver() {
        Variant arr = store.makeArray();
        StackFrame f = observe(val("on", arr), lit("for", "grow"), lit("as", "watcher"));
        assertFalse(f.isFailed());
        assertTrue(stack.scope().exists("watcher"));
        Observer o = stack.observers().get(0);
        assertSame(o, stack.scope().get("watcher").asNative().entity());

        assertTrue(stack.scope().unbind("watcher"));
        assertFalse(o.isActive());
        assertTrue(stack.observers().isEmpty());
        assertEquals(0, arr.asArray().listenerCount());

        // popping after the alias already revoked it is quiet
        assertTrue(stack.popFrame());
        store.unref(arr);
    }

    @Test
    public void revoke_isOneShot() {
        Variant arr = store.makeArray();
        observe(val("on", arr), lit("for", "grow"));
        Observer o = stack.observers().get(0);

        assertTrue(o.revoke());
        store.errors().clear();
        assertFalse(o.revoke());
        assertEquals(ErrorCode.INVALID_VALUE, store.errors().getCode());
        store.unref(arr);
    }

    // -------------------------
    // event loop
    // -------------------------

    @Test
    public void selectChild_firstRoundSkipsBody() {
        VdomElement e = new VdomElement("observe").attr("at", "x").attr("for", "change");
        e.append(new VdomElement("update"));
        stack.pushFrame(e, bridge);
        assertNull(stack.selectChild());
    }

    @Test
    public void selectChild_eventLoopWalksElementsOnly() {
        VdomElement update = new VdomElement("update");
        VdomElement p = new VdomElement("p");
        VdomElement e = new VdomElement("observe").attr("at", "x").attr("for", "change");
        e.append(VdomNode.content("\n  "));
        e.append(update);
        e.append(VdomNode.comment("note"));
        e.append(p);

        stack.setStage(StackStage.EVENT_LOOP);
        StackFrame f = stack.pushFrame(e, bridge);
        assertFalse(f.isFailed());
        assertNull(((ObserveContext) f.context()).observer(), "nothing is bound in the event loop");

        assertSame(update, stack.selectChild());
        assertSame(p, stack.selectChild());
        assertNull(stack.selectChild());
    }

    @Test
    public void selectChild_usesDefinitionBody() {
        VdomElement define = new VdomElement("define");
        VdomElement inner = new VdomElement("init");
        define.append(VdomNode.comment("c"));
        define.append(inner);
        Variant def = store.makeNative(define, null);

        VdomElement e = new VdomElement("observe").attr("at", "x").attr("for", "change")
                .attr(VdomAttribute.bound("with", def));
        e.append(new VdomElement("ignored"));

        stack.setStage(StackStage.EVENT_LOOP);
        StackFrame f = stack.pushFrame(e, bridge);
        assertSame(define, ((ObserveContext) f.context()).define());
        assertSame(inner, stack.selectChild());
        assertNull(stack.selectChild());

        stack.popFrame();
        store.unref(def);
    }

    // -------------------------
    // teardown
    // -------------------------

    @Test
    public void close_releasesEverything() {
        Variant arr = store.makeArray();
        observe(val("on", arr), lit("for", "grow"));
        observe(lit("at", "user"), lit("for", "attached"));
        stack.scope().bind("user", arr);
        arr.asArray().append(store.makeNull());
        assertEquals(2, stack.inboxSize());

        stack.close();
        assertTrue(stack.observers().isEmpty());
        assertEquals(0, stack.depth());
        assertEquals(0, arr.asArray().listenerCount());
        assertEquals(1, arr.getRefCount());

        store.unref(arr);
        assertEquals(0, store.usageStat().getTotalValues());
    }
}
