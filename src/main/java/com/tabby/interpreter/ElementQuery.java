package com.tabby.interpreter;

import java.util.ArrayList;
import java.util.List;

/**
 * Selects document elements for an observe target given as a selector
 * string.
 */
@FunctionalInterface
public interface ElementQuery {

    List<VdomElement> select(VdomElement root, String selector);

    /**
     * Single simple selector: "#id", ".class" or a tag name. Matches are
     * returned in document order.
     */
    ElementQuery SIMPLE = (root, selector) -> {
        List<VdomElement> out = new ArrayList<>();
        if (root == null || selector == null || selector.trim().isEmpty()) return out;
        collect(root, selector.trim(), out);
        return out;
    };

    private static void collect(VdomElement e, String selector, List<VdomElement> out) {
        if (matches(e, selector)) out.add(e);
        for (VdomNode n : e.children()) {
            if (n.isElement()) collect((VdomElement) n, selector, out);
        }
    }

    private static boolean matches(VdomElement e, String selector) {
        if (selector.startsWith("#")) {
            return selector.substring(1).equals(e.literalAttr("id"));
        }
        if (selector.startsWith(".")) {
            String cls = e.literalAttr("class");
            if (cls == null) return false;
            for (String c : cls.trim().split("\\s+")) {
                if (c.equals(selector.substring(1))) return true;
            }
            return false;
        }
        return e.tagName().equalsIgnoreCase(selector);
    }
}
