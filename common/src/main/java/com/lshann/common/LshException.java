package com.lshann.common;

import java.util.Objects;

/**
 * Base exception for index operations.
 *
 * <p>Every failure carries an {@link ErrorKind} so a binding layer can map it onto
 * its own error convention without inspecting messages.</p>
 */
public class LshException extends RuntimeException {

    private final ErrorKind kind;

    public LshException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public LshException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static LshException invalidParameter(String message) {
        return new LshException(ErrorKind.INVALID_PARAMETER, message);
    }

    public static LshException backendFault(String message, Throwable cause) {
        return new LshException(ErrorKind.BACKEND_FAULT, message, cause);
    }

    public static LshException unbound(String message) {
        return new LshException(ErrorKind.UNBOUND, message);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + kind + "]: " + getMessage();
    }
}
