package com.zzf.workbridge.lifecycle;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.util.concurrent.CompletableFuture;

/**
 * Asks the OS for an ephemeral loopback port by binding port 0 and releasing it again.
 */
public final class LoopbackPortAllocator implements PortAllocator {

    @Override
    public CompletableFuture<Integer> findFreePort() {
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            socket.setReuseAddress(true);
            return CompletableFuture.completedFuture(socket.getLocalPort());
        } catch (IOException e) {
            return CompletableFuture.failedFuture(new UncheckedIOException("No free loopback port", e));
        }
    }
}
