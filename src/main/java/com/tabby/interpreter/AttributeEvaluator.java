package com.tabby.interpreter;

import com.tabby.variant.ErrorCode;
import com.tabby.variant.Variant;

/**
 * Turns an element attribute into a value.
 */
@FunctionalInterface
public interface AttributeEvaluator {

    /** @return the value, owned by the caller, or INVALID with the cause in the error slot */
    Variant eval(InterpreterStack stack, VdomAttribute attr);

    /**
     * Bound values as they are; "$name" resolves a document variable; any
     * other literal becomes a string.
     */
    AttributeEvaluator DEFAULT = (stack, attr) -> {
        if (!attr.isLiteral()) {
            if (!attr.value().isValid()) return Variant.INVALID;
            stack.store().ref(attr.value());
            return attr.value();
        }
        String s = attr.literal();
        if (s == null) {
            stack.store().errors().set(ErrorCode.INVALID_VALUE, "attribute '%s' has no value", attr.name());
            return Variant.INVALID;
        }
        if (s.startsWith("$") && s.length() > 1) {
            Variant v = stack.scope().get(s.substring(1));
            if (!v.isValid()) return Variant.INVALID;
            stack.store().ref(v);
            return v;
        }
        return stack.store().makeString(s);
    };
}
