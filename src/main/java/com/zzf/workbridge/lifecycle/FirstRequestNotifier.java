package com.zzf.workbridge.lifecycle;

import com.zzf.workbridge.api.Unsubscribe;
import com.zzf.workbridge.core.util.Errors;
import com.zzf.workbridge.workspace.WorkspacePaths;
import org.slf4j.Logger;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Signals the first request seen for each normalized workspace path. Subscribers are called
 * synchronously in registration order; one failing subscriber never hides the event from the
 * others.
 */
public final class FirstRequestNotifier {
    private final Set<String> seen = ConcurrentHashMap.newKeySet();
    private final List<Subscription> subscribers = new CopyOnWriteArrayList<>();
    private final Logger logger;

    public FirstRequestNotifier(Logger logger) {
        this.logger = logger;
    }

    public Unsubscribe subscribe(Consumer<String> callback) {
        Subscription subscription = new Subscription(callback);
        subscribers.add(subscription);
        return () -> subscribers.remove(subscription);
    }

    /**
     * Records a request for {@code rawPath}.
     *
     * @return true when this was the first request for the normalized path
     */
    public boolean onRequest(String rawPath) {
        String path = WorkspacePaths.tryNormalize(rawPath);
        if (path == null) {
            logger.debug("first.request.skip reason=unusable_path path={}", rawPath);
            return false;
        }
        if (!seen.add(path)) {
            return false;
        }
        logger.debug("first.request workspace={} subscribers={}", path, subscribers.size());
        for (Subscription subscription : subscribers) {
            try {
                subscription.callback.accept(path);
            } catch (RuntimeException e) {
                logger.error("first.request.callback.fail workspace={} err={}", path, Errors.messageOf(e), e);
            }
        }
        return true;
    }

    public void clear(String rawPath) {
        String path = WorkspacePaths.tryNormalize(rawPath);
        if (path != null) {
            seen.remove(path);
        }
    }

    public boolean hasSeen(String rawPath) {
        String path = WorkspacePaths.tryNormalize(rawPath);
        return path != null && seen.contains(path);
    }

    public void clearSeen() {
        seen.clear();
    }

    public void clearSubscribers() {
        subscribers.clear();
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    // identity-compared so the same callback can be subscribed twice and removed once
    private static final class Subscription {
        private final Consumer<String> callback;

        private Subscription(Consumer<String> callback) {
            this.callback = callback;
        }
    }
}
