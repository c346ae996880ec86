package com.tabby.interpreter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Native entity wrapping the result of an element query. Tracks which
 * event types it is being observed for, so element events are only
 * dispatched while someone listens.
 */
public final class ElementCollection {

    private final List<VdomElement> elements;
    private final List<String> observed = new ArrayList<>();

    ElementCollection(List<VdomElement> elements) {
        this.elements = new ArrayList<>(elements);
    }

    public List<VdomElement> elements() {
        return Collections.unmodifiableList(elements);
    }

    public boolean contains(VdomElement e) {
        for (VdomElement x : elements) {
            if (x == e) return true;
        }
        return false;
    }

    boolean observe(String eventName) {
        observed.add(eventName);
        return true;
    }

    boolean forget(String eventName) {
        return observed.remove(eventName);
    }

    public boolean isObserved(String eventName) {
        return observed.contains(eventName);
    }
}
