package com.zzf.workbridge.config;

/**
 * Raised at the container boundary when a protocol front cannot be brought up.
 */
public class BridgeException extends RuntimeException {
    public BridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
