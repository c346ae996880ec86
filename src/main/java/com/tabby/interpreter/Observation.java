package com.tabby.interpreter;

/** One message matched against one observer, as returned by {@link InterpreterStack#drainInbox()}. */
public final class Observation {

    private final Observer observer;
    private final Message message;

    Observation(Observer observer, Message message) {
        this.observer = observer;
        this.message = message;
    }

    public Observer observer() { return observer; }

    public Message message() { return message; }

    /** Element whose body handles the event. */
    public VdomElement element() { return observer.element(); }

    @Override
    public String toString() {
        return "Observation{" + message + " -> " + observer + "}";
    }
}
