package com.zzf.workbridge.lifecycle;

import com.zzf.workbridge.api.Unsubscribe;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FirstRequestNotifierTest {

    private final FirstRequestNotifier notifier = new FirstRequestNotifier(LoggerFactory.getLogger(FirstRequestNotifierTest.class));

    @Test
    void shouldReportFirstRequestOnly() {
        assertTrue(notifier.onRequest("/ws/a"));
        assertFalse(notifier.onRequest("/ws/a/"));
        assertTrue(notifier.hasSeen("/ws//a"));
    }

    @Test
    void shouldIgnoreBlankPaths() {
        assertFalse(notifier.onRequest(""));
        assertFalse(notifier.onRequest(null));
    }

    @Test
    void shouldKeepNotifyingWhenOneSubscriberFails() {
        List<String> calls = new ArrayList<>();
        notifier.subscribe(path -> calls.add("first:" + path));
        notifier.subscribe(path -> {
            throw new IllegalStateException("boom");
        });
        notifier.subscribe(path -> calls.add("third:" + path));

        notifier.onRequest("/ws/a/");

        assertEquals(List.of("first:/ws/a", "third:/ws/a"), calls);
    }

    @Test
    void shouldRemoveOnlyTheUnsubscribedRegistration() {
        List<String> calls = new ArrayList<>();
        Consumer<String> callback = calls::add;
        Unsubscribe first = notifier.subscribe(callback);
        notifier.subscribe(callback);

        first.unsubscribe();
        first.unsubscribe();
        notifier.onRequest("/ws/a");

        assertEquals(1, calls.size());
        assertEquals(1, notifier.subscriberCount());
    }

    @Test
    void shouldTreatClearedPathAsNew() {
        notifier.onRequest("/ws/a");
        notifier.clear("/ws/a/");

        assertTrue(notifier.onRequest("/ws/a"));

        notifier.clearSeen();
        assertFalse(notifier.hasSeen("/ws/a"));
    }
}
