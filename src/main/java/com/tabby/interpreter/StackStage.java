package com.tabby.interpreter;

public enum StackStage {
    /** Initial walk of the document: observers are bound, bodies are skipped. */
    FIRST_ROUND,
    /** Handling observed events: bodies run, nothing is bound. */
    EVENT_LOOP
}
