package com.tabby.interpreter;

/**
 * Per-element hooks the stack calls while running a frame.
 */
public interface ElementOps {

    /**
     * Called right after the frame is pushed.
     *
     * @return the frame context, or null when the element failed to start
     *         (cause in the store's error slot)
     */
    Object afterPushed(InterpreterStack stack, StackFrame frame);

    /** Called before the frame is popped; releases the frame context. */
    boolean onPopping(InterpreterStack stack, StackFrame frame);

    /** Next child element to run, or null when the frame is done. */
    VdomElement selectChild(InterpreterStack stack, StackFrame frame);
}
