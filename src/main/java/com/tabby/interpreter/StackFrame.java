package com.tabby.interpreter;

import com.tabby.variant.ErrorCode;

/**
 * One running element on an {@link InterpreterStack}.
 */
public final class StackFrame {

    private final VdomElement pos;
    private final ElementOps ops;
    private Object ctxt;
    private ErrorCode failure;
    private String failureDetail;

    StackFrame(VdomElement pos, ElementOps ops) {
        this.pos = pos;
        this.ops = ops;
    }

    public VdomElement pos() { return pos; }

    public ElementOps ops() { return ops; }

    public Object context() { return ctxt; }

    public void setContext(Object ctxt) { this.ctxt = ctxt; }

    public boolean isFailed() { return failure != null; }

    /** Why the element failed to start, or null. */
    public ErrorCode failure() { return failure; }

    public String failureDetail() { return failureDetail; }

    void fail(ErrorCode code, String detail) {
        this.failure = (code == null || code == ErrorCode.OK) ? ErrorCode.INVALID_VALUE : code;
        this.failureDetail = detail;
    }

    @Override
    public String toString() {
        return "StackFrame{" + pos + (failure == null ? "" : ", failed: " + failure) + "}";
    }
}
