package com.zzf.workbridge.lifecycle;

import java.util.concurrent.CompletableFuture;

@FunctionalInterface
public interface PortAllocator {
    /**
     * @return a loopback port that was free at the time of the call
     */
    CompletableFuture<Integer> findFreePort();
}
