package com.tabby.variant;

import com.tabby.debug.Debug;

/**
 * Last-error slot of one runtime instance.
 *
 * Public operations report failure by returning a sentinel and recording the
 * cause here. A successful call does not clear the slot; callers clear it
 * explicitly when they want a fresh reading.
 */
public final class ErrorSlot {

    private static final String TAG = "tabby.error";

    private ErrorCode code = ErrorCode.OK;
    private String detail;

    public void set(ErrorCode code) {
        set(code, null);
    }

    public void set(ErrorCode code, String format, Object... args) {
        this.code = (code == null) ? ErrorCode.OK : code;
        this.detail = (format == null) ? null : String.format(format, args);
        Debug.get().d(TAG, describe());
    }

    public void clear() {
        code = ErrorCode.OK;
        detail = null;
    }

    public ErrorCode getCode() { return code; }

    public String getDetail() { return detail; }

    public boolean isOk() { return code == ErrorCode.OK; }

    public String describe() {
        return (detail == null) ? code.message() : code.message() + ": " + detail;
    }

    @Override
    public String toString() {
        return "ErrorSlot{" + code + (detail == null ? "" : ", " + detail) + "}";
    }
}
