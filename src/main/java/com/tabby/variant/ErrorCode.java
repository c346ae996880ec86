package com.tabby.variant;

/** Codes stored in the instance-scoped {@link ErrorSlot}. */
public enum ErrorCode {
    OK("ok"),
    OUT_OF_MEMORY("out of memory"),
    INVALID_VALUE("invalid value"),
    WRONG_DATA_TYPE("wrong data type"),
    DUPLICATED_KEY("duplicated key"),
    NOT_FOUND("not found"),
    OUT_OF_BOUNDS("out of bounds"),
    DUPLICATED("duplicated"),
    NOT_IMPLEMENTED("not implemented"),
    NOT_SUPPORTED("not supported"),
    NO_DATA("no data"),
    NOT_ACCEPTED("not accepted");

    private final String message;

    ErrorCode(String message) {
        this.message = message;
    }

    public String message() { return message; }
}
