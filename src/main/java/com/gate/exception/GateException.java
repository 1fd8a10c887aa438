package com.gate.exception;

/**
 * Base exception for the condition compiler.
 */
public class GateException extends RuntimeException {

    public GateException(String message) {
        super(message);
    }

    public GateException(String message, Throwable cause) {
        super(message, cause);
    }
}
