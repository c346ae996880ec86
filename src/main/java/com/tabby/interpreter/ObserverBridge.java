package com.tabby.interpreter;

import com.tabby.debug.Debug;
import com.tabby.variant.AtomTable;
import com.tabby.variant.ErrorCode;
import com.tabby.variant.ErrorSlot;
import com.tabby.variant.ListenerCallback;
import com.tabby.variant.NativeOps;
import com.tabby.variant.NativeValue;
import com.tabby.variant.ValueStore;
import com.tabby.variant.Variant;
import com.tabby.variant.VariantListener;
import com.tabby.variant.VariantOperation;

import java.util.List;

/**
 * ObserverBridge
 *
 * Element ops of the observe element.
 *
 * Attributes (each at most once):
 *  - for   event filter, "type" or "type:subtype"; required
 *  - on    observed target
 *  - at    name of a document variable to watch
 *  - as    alias: binds a handle to the observer into the document scope
 *  - with  definition element whose children replace the observe body
 *
 * Target resolution in the first round, first match wins:
 *  1. at is a string             named-variable observer
 *  2. on is a string             element query, observed through the result
 *     on is native              the entity's onObserve hook
 *  3. on is the stack's timers   timer observer
 *  4. on is object/array/set     container listener (grow, shrink, change)
 */
public final class ObserverBridge implements ElementOps {

    private static final String TAG = "tabby.observe";

    public static final String ATTR_FOR = "for";
    public static final String ATTR_ON = "on";
    public static final String ATTR_AT = "at";
    public static final String ATTR_AS = "as";
    public static final String ATTR_WITH = "with";

    private static final char EVENT_SEPARATOR = ':';

    // ===================== afterPushed =====================

    @Override
    public Object afterPushed(InterpreterStack stack, StackFrame frame) {
        ValueStore store = stack.store();
        ErrorSlot errors = store.errors();
        VdomElement element = frame.pos();

        ObserveContext ctxt = new ObserveContext();
        frame.setContext(ctxt);

        for (VdomAttribute attr : element.attributes()) {
            Variant val = stack.evaluator().eval(stack, attr);
            if (!val.isValid()) {
                errors.set(ErrorCode.INVALID_VALUE, "vdom attribute '%s' for element %s undefined",
                        attr.name(), element);
                return null;
            }
            boolean ok = processAttribute(stack, ctxt, element, attr.name(), val);
            store.unref(val);
            if (!ok) return null;
        }

        if (ctxt.with != null) {
            VdomElement define = definitionOf(ctxt.with);
            if (define == null) {
                errors.set(ErrorCode.INVALID_VALUE, "'with' of %s is not a definition element", element);
                return null;
            }
            if (define.firstChildElement() == null) {
                errors.set(ErrorCode.NO_DATA, "definition %s has no child element", define);
                return null;
            }
            ctxt.define = define;
        }

        if (ctxt.forVar == null || !ctxt.forVar.isString()) {
            errors.set(ErrorCode.INVALID_VALUE, "%s needs a string 'for' attribute", element);
            return null;
        }

        if (stack.stage() != StackStage.FIRST_ROUND) {
            errors.clear();
            return ctxt;
        }

        Observer observer = bind(stack, frame, ctxt);
        if (observer == null) return null;

        if (ctxt.as != null && ctxt.as.isString()) {
            if (!bindAlias(stack, ctxt.as.asString(), observer)) return null;
        }

        ctxt.observer = observer;
        errors.clear();
        return ctxt;
    }

    private boolean processAttribute(InterpreterStack stack, ObserveContext ctxt, VdomElement element,
            String name, Variant val) {
        ErrorSlot errors = stack.store().errors();
        switch (name) {
            case ATTR_FOR:
                if (ctxt.forVar != null) return duplicated(errors, name, element);
                ctxt.forVar = hold(stack, val);
                return parseEventFilter(stack, ctxt, element);
            case ATTR_ON:
                if (ctxt.on != null) return duplicated(errors, name, element);
                ctxt.on = hold(stack, val);
                return true;
            case ATTR_AT:
                if (ctxt.at != null) return duplicated(errors, name, element);
                ctxt.at = hold(stack, val);
                return true;
            case ATTR_AS:
                if (ctxt.as != null) return duplicated(errors, name, element);
                ctxt.as = hold(stack, val);
                return true;
            case ATTR_WITH:
                if (ctxt.with != null) return duplicated(errors, name, element);
                ctxt.with = hold(stack, val);
                return true;
            default:
                errors.set(ErrorCode.NOT_IMPLEMENTED, "vdom attribute '%s' for element %s", name, element);
                return false;
        }
    }

    private static boolean duplicated(ErrorSlot errors, String name, VdomElement element) {
        errors.set(ErrorCode.DUPLICATED, "vdom attribute '%s' for element %s", name, element);
        return false;
    }

    private static Variant hold(InterpreterStack stack, Variant val) {
        stack.store().ref(val);
        return val;
    }

    // Non-string 'for' is reported once all attributes are in.
    private boolean parseEventFilter(InterpreterStack stack, ObserveContext ctxt, VdomElement element) {
        if (!ctxt.forVar.isString()) return true;

        String s = ctxt.forVar.asString();
        int sep = s.indexOf(EVENT_SEPARATOR);
        ctxt.msgType = (sep < 0) ? s : s.substring(0, sep);
        ctxt.subType = (sep < 0) ? null : s.substring(sep + 1);

        ctxt.msgTypeAtom = stack.store().atoms().tryAtom(AtomTable.Bucket.MESSAGE, ctxt.msgType);
        if (ctxt.msgTypeAtom == 0) {
            stack.store().errors().set(ErrorCode.INVALID_VALUE,
                    "unknown vdom attribute 'for = %s' for element %s", s, element);
            return false;
        }
        return true;
    }

    private static VdomElement definitionOf(Variant with) {
        if (!with.isNative()) return null;
        Object entity = with.asNative().entity();
        return (entity instanceof VdomElement) ? (VdomElement) entity : null;
    }

    // ===================== binding =====================

    private Observer bind(InterpreterStack stack, StackFrame frame, ObserveContext ctxt) {
        Variant on = ctxt.on;

        if (ctxt.at != null && ctxt.at.isString()) {
            return bindNamedVariable(stack, frame, ctxt, ctxt.at.asString());
        }
        if (on != null && on.isString()) {
            return bindElementQuery(stack, frame, ctxt, on.asString());
        }
        if (on != null && on.isNative()) {
            return bindNative(stack, frame, ctxt, on);
        }
        if (on != null && stack.timers().isTimers(on)) {
            return stack.registerObserver(Observer.Kind.TIMER, on, ctxt.msgType, ctxt.subType, frame.pos(), null);
        }
        if (on != null && on.isContainer()) {
            return bindContainer(stack, frame, ctxt, on);
        }

        stack.store().errors().set(ErrorCode.NOT_SUPPORTED, "cannot observe %s",
                on == null ? "without a target" : on.getType());
        return null;
    }

    private Observer bindNamedVariable(InterpreterStack stack, StackFrame frame, ObserveContext ctxt, String name) {
        Variant handle = stack.scope().watch(name);
        try {
            return stack.registerObserver(Observer.Kind.NAMED_VARIABLE, handle, ctxt.msgType, ctxt.subType,
                    frame.pos(), null);
        } finally {
            stack.store().unref(handle);
        }
    }

    private Observer bindElementQuery(InterpreterStack stack, StackFrame frame, ObserveContext ctxt,
            String selector) {
        ValueStore store = stack.store();
        List<VdomElement> found = stack.elementQuery().select(stack.document(), selector);
        if (found == null || found.isEmpty()) {
            store.errors().set(ErrorCode.NOT_FOUND, "no element matches '%s'", selector);
            return null;
        }

        NativeOps ops = new NativeOps()
                .onObserve((entity, event, sub) -> ((ElementCollection) entity).observe(event))
                .onForget((entity, event, sub) -> ((ElementCollection) entity).forget(event));
        Variant elems = store.makeNative(new ElementCollection(found), ops);
        try {
            return bindNative(stack, frame, ctxt, elems);
        } finally {
            store.unref(elems);
        }
    }

    private Observer bindNative(InterpreterStack stack, StackFrame frame, ObserveContext ctxt, Variant on) {
        NativeValue nv = on.asNative();
        NativeOps ops = nv.ops();
        if (!ops.canObserve()) {
            stack.store().errors().set(ErrorCode.NOT_SUPPORTED, "native entity cannot be observed");
            return null;
        }
        if (!ops.onObserve().apply(nv.entity(), ctxt.msgType, ctxt.subType)) {
            stack.store().errors().set(ErrorCode.NOT_SUPPORTED, "native entity refused '%s'", ctxt.msgType);
            return null;
        }

        String msgType = ctxt.msgType;
        String subType = ctxt.subType;
        Runnable forget = () -> {
            if (ops.onForget() != null) ops.onForget().apply(nv.entity(), msgType, subType);
        };
        return stack.registerObserver(Observer.Kind.NATIVE, on, msgType, subType, frame.pos(), forget);
    }

    private Observer bindContainer(InterpreterStack stack, StackFrame frame, ObserveContext ctxt, Variant on) {
        ValueStore store = stack.store();
        VariantOperation op = VariantOperation.forMessageType(ctxt.msgType);
        if (op == null) {
            store.errors().set(ErrorCode.INVALID_VALUE, "unknown msg: %s", ctxt.msgType);
            return null;
        }

        ListenerCallback callback = (source, operation, c, args) -> {
            Variant extra = (args == null || args.length == 0) ? null : args[args.length - 1];
            stack.dispatchMessage(source, operation.messageType(), null, extra);
            return true;
        };
        VariantListener listener = store.registerPostListener(on, op, callback, stack);
        if (listener == null) return null;

        return stack.registerObserver(Observer.Kind.CONTAINER, on, ctxt.msgType, ctxt.subType, frame.pos(),
                () -> store.revokeListener(listener));
    }

    private boolean bindAlias(InterpreterStack stack, String name, Observer observer) {
        ValueStore store = stack.store();
        NativeOps ops = new NativeOps().onRelease(entity -> {
            Observer o = (Observer) entity;
            if (o.isActive()) o.revoke();
        });
        Variant handle = store.makeNative(observer, ops);
        boolean bound = stack.scope().bind(name, handle);
        // unbound: this drops the last reference and revokes the observer
        store.unref(handle);
        return bound;
    }

    // ===================== onPopping / selectChild =====================

    @Override
    public boolean onPopping(InterpreterStack stack, StackFrame frame) {
        ObserveContext ctxt = (ObserveContext) frame.context();
        if (ctxt == null) return true;

        if (ctxt.observer != null && ctxt.observer.isActive()) stack.revokeObserver(ctxt.observer);
        ctxt.destroy(stack.store());
        frame.setContext(null);
        return true;
    }

    @Override
    public VdomElement selectChild(InterpreterStack stack, StackFrame frame) {
        if (stack.stage() == StackStage.FIRST_ROUND) return null;

        ObserveContext ctxt = (ObserveContext) frame.context();
        if (ctxt == null) return null;

        VdomElement body = (ctxt.define != null) ? ctxt.define : frame.pos();
        while (true) {
            VdomNode curr = (ctxt.curr == null) ? body.firstChild() : body.nextSibling(ctxt.curr);
            ctxt.curr = curr;
            if (curr == null) {
                stack.store().errors().clear();
                return null;
            }
            if (curr.isElement()) return (VdomElement) curr;
            Debug.get().t(TAG, "skipping " + curr.kind() + " node");
        }
    }
}
