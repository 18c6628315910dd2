package com.zzf.workbridge.core.util;

import java.lang.reflect.InvocationTargetException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public final class Errors {

    private Errors() {}

    /**
     * Strips the wrappers added by futures and reflection.
     */
    public static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException
                || current instanceof ExecutionException
                || current instanceof InvocationTargetException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Message safe to hand to a remote caller: the root message, or the exception's simple class
     * name when it carries none.
     */
    public static String messageOf(Throwable t) {
        if (t == null) {
            return "Unknown error";
        }
        Throwable root = unwrap(t);
        String msg = root.getMessage();
        if (msg == null || msg.trim().isEmpty()) {
            return root.getClass().getSimpleName();
        }
        return msg;
    }
}
