package com.zzf.workbridge.api;

/**
 * Handle returned by subscriptions; calling it more than once is harmless.
 */
@FunctionalInterface
public interface Unsubscribe {
    void unsubscribe();
}
