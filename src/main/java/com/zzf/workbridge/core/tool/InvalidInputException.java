package com.zzf.workbridge.core.tool;

/**
 * Malformed operation arguments, detected before anything is dispatched.
 */
public class InvalidInputException extends RuntimeException {
    public InvalidInputException(String message) {
        super(message);
    }
}
