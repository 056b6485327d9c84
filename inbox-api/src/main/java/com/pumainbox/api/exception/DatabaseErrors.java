package com.pumainbox.api.exception;

import org.springframework.core.NestedExceptionUtils;

public final class DatabaseErrors {

    private DatabaseErrors() {
    }

    /** The driver-level message behind a (possibly wrapped) data access failure. */
    public static String message(Throwable e) {
        Throwable cause = NestedExceptionUtils.getMostSpecificCause(e);
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }
}
