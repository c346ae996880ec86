package com.tabby.interpreter;

import com.tabby.debug.Debug;
import com.tabby.variant.ErrorCode;
import com.tabby.variant.ValueStore;
import com.tabby.variant.Variant;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * InterpreterStack
 *
 * Execution state of one document task:
 *  - frames:    running elements, innermost first
 *  - stage:     first round (binding) or event loop (handling)
 *  - observers: active observe bindings, in registration order
 *  - inbox:     events waiting to be matched against observers
 *  - scope:     document variables
 *  - timers:    the task's timer set
 *
 * Single-threaded: events are queued synchronously on the mutating thread
 * and consumed by {@link #drainInbox()}.
 */
public final class InterpreterStack implements AutoCloseable {

    private static final String TAG = "tabby.stack";

    private final ValueStore store;
    private final VdomElement document;
    private final DocumentScope scope;
    private final Timers timers;

    private ElementQuery elementQuery = ElementQuery.SIMPLE;
    private AttributeEvaluator evaluator = AttributeEvaluator.DEFAULT;
    private StackStage stage = StackStage.FIRST_ROUND;

    private final Deque<StackFrame> frames = new ArrayDeque<>();
    private final List<Observer> observers = new ArrayList<>();
    private final ArrayDeque<Message> inbox = new ArrayDeque<>();
    // messages handed out by the last drain; released on the next one
    private final List<Message> drained = new ArrayList<>();
    private boolean closed;

    public InterpreterStack(ValueStore store, VdomElement document) {
        if (store == null) throw new IllegalArgumentException("store is null");
        this.store = store;
        this.document = document;
        this.scope = new DocumentScope(store, this);
        this.timers = new Timers(store, this);
    }

    public ValueStore store() { return store; }

    public VdomElement document() { return document; }

    public DocumentScope scope() { return scope; }

    public Timers timers() { return timers; }

    public ElementQuery elementQuery() { return elementQuery; }

    public void setElementQuery(ElementQuery q) {
        this.elementQuery = (q == null) ? ElementQuery.SIMPLE : q;
    }

    public AttributeEvaluator evaluator() { return evaluator; }

    public void setAttributeEvaluator(AttributeEvaluator e) {
        this.evaluator = (e == null) ? AttributeEvaluator.DEFAULT : e;
    }

    public StackStage stage() { return stage; }

    public void setStage(StackStage stage) {
        this.stage = stage;
    }

    // ===================== FRAMES =====================

    /**
     * Pushes a frame for pos and runs its afterPushed hook. A frame whose
     * element failed to start stays pushed, marked failed, until popped.
     */
    public StackFrame pushFrame(VdomElement pos, ElementOps ops) {
        checkOpen();
        StackFrame frame = new StackFrame(pos, ops);
        frames.push(frame);

        store.errors().clear();
        Object ctxt = ops.afterPushed(this, frame);
        if (ctxt == null) {
            frame.fail(store.errors().getCode(), store.errors().getDetail());
            Debug.get().w(TAG, pos + " failed to start: " + store.errors().describe());
        } else {
            frame.setContext(ctxt);
        }
        return frame;
    }

    /** Innermost frame, or null. */
    public StackFrame bottomFrame() {
        return frames.peek();
    }

    public int depth() { return frames.size(); }

    public boolean popFrame() {
        StackFrame frame = frames.peek();
        if (frame == null) return false;
        frame.ops().onPopping(this, frame);
        frames.pop();
        return true;
    }

    /** Next child element of the innermost frame, or null. */
    public VdomElement selectChild() {
        StackFrame frame = frames.peek();
        if (frame == null || frame.isFailed()) return null;
        return frame.ops().selectChild(this, frame);
    }

    // ===================== OBSERVERS =====================

    /** Takes a reference on observed for the observer's lifetime. */
    Observer registerObserver(Observer.Kind kind, Variant observed, String msgType, String subType,
            VdomElement element, Runnable onRevoke) {
        store.ref(observed);
        Observer o = new Observer(this, kind, observed, msgType, subType, element, onRevoke);
        observers.add(o);
        Debug.get().d(TAG, "registered " + o);
        return o;
    }

    /** One-shot: a second revocation fails with INVALID_VALUE. */
    public boolean revokeObserver(Observer observer) {
        if (observer == null || !observer.isActive()) {
            store.errors().set(ErrorCode.INVALID_VALUE, "observer already revoked");
            return false;
        }
        observers.remove(observer);
        observer.deactivate();
        store.unref(observer.observed());
        Debug.get().d(TAG, "revoked " + observer);
        return true;
    }

    public List<Observer> observers() {
        return Collections.unmodifiableList(new ArrayList<>(observers));
    }

    // ===================== MESSAGES =====================

    /** Queues an event. The inbox holds references on source and extra until drained. */
    public void dispatchMessage(Variant source, String type, String subType, Variant extra) {
        if (closed) {
            Debug.get().w(TAG, "message " + type + " dropped: stack is closed");
            return;
        }
        if (source == null || !source.isValid() || type == null) {
            Debug.get().w(TAG, "message " + type + " dropped: no valid source");
            return;
        }
        Variant x = (extra != null && extra.isValid()) ? extra : null;
        store.ref(source);
        if (x != null) store.ref(x);
        inbox.add(new Message(source, type, subType, x));
    }

    /**
     * Routes an element event to every element-query observer whose
     * result contains target and listens for type.
     *
     * @return number of messages queued
     */
    public int fireElementEvent(VdomElement target, String type, String subType) {
        List<Variant> sources = new ArrayList<>();
        for (Observer o : observers) {
            if (o.kind() != Observer.Kind.NATIVE || !o.observed().isNative()) continue;
            Object entity = o.observed().asNative().entity();
            if (!(entity instanceof ElementCollection)) continue;
            ElementCollection c = (ElementCollection) entity;
            if (c.contains(target) && c.isObserved(type) && !sources.contains(o.observed())) {
                sources.add(o.observed());
            }
        }
        for (Variant s : sources) dispatchMessage(s, type, subType, null);
        return sources.size();
    }

    public int inboxSize() { return inbox.size(); }

    /**
     * Matches every queued message against the active observers, in
     * registration order. Messages stay valid until the next drain.
     */
    public List<Observation> drainInbox() {
        releaseDrained();

        List<Observation> out = new ArrayList<>();
        while (!inbox.isEmpty()) {
            Message m = inbox.poll();
            for (Observer o : observers) {
                if (o.matches(m)) out.add(new Observation(o, m));
            }
            drained.add(m);
        }
        return out;
    }

    private void releaseDrained() {
        for (Message m : drained) release(m);
        drained.clear();
    }

    private void release(Message m) {
        store.unref(m.source());
        if (m.extra() != null) store.unref(m.extra());
    }

    // ===================== TEARDOWN =====================

    private void checkOpen() {
        if (closed) throw new IllegalStateException("interpreter stack is closed");
    }

    public boolean isClosed() { return closed; }

    @Override
    public void close() {
        if (closed) return;
        while (popFrame()) {
            // each pop revokes its frame's observer
        }
        for (Observer o : new ArrayList<>(observers)) revokeObserver(o);

        releaseDrained();
        while (!inbox.isEmpty()) release(inbox.poll());

        closed = true;
        scope.close();
        timers.close();
        Debug.get().d(TAG, "closed");
    }
}
