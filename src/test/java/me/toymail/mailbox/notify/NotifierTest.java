package me.toymail.mailbox.notify;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

public class NotifierTest {

    @Test
    public void testNotify_InSubscriptionOrder() {
        Notifier<String> notifier = new Notifier<>();
        List<String> seen = new ArrayList<>();
        notifier.subscribe(e -> seen.add("first:" + e));
        notifier.subscribe(e -> seen.add("second:" + e));

        assertEquals(2, notifier.notify("x"));
        assertEquals(List.of("first:x", "second:x"), seen);
    }

    @Test
    public void testNotify_NoSubscribers() {
        assertEquals(0, new Notifier<String>().notify("x"));
    }

    @Test
    public void testNotify_FailingObserverDoesNotStopOthers() {
        Notifier<String> notifier = new Notifier<>();
        List<String> seen = new ArrayList<>();
        notifier.subscribe(e -> {
            throw new IllegalStateException("boom");
        });
        notifier.subscribe(seen::add);

        assertEquals(1, notifier.notify("x"));
        assertEquals(List.of("x"), seen);
    }

    @Test
    public void testUnsubscribe_FromInsideCallback() {
        Notifier<String> notifier = new Notifier<>();
        List<String> seen = new ArrayList<>();
        Consumer<String> once = new Consumer<>() {
            @Override
            public void accept(String e) {
                seen.add(e);
                notifier.unsubscribe(this);
            }
        };
        notifier.subscribe(once);

        notifier.notify("a");
        notifier.notify("b");

        assertEquals(List.of("a"), seen);
        assertEquals(0, notifier.size());
    }

    @Test
    public void testSubscribe_FromInsideCallbackStartsNextEvent() {
        Notifier<String> notifier = new Notifier<>();
        List<String> late = new ArrayList<>();
        notifier.subscribe(e -> {
            if (notifier.size() == 1) {
                notifier.subscribe(late::add);
            }
        });

        notifier.notify("a");
        assertTrue(late.isEmpty());
        notifier.notify("b");
        assertEquals(List.of("b"), late);
    }

    @Test
    public void testSubscribe_NullRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Notifier<String>().subscribe(null));
    }

    @Test
    public void testClear() {
        Notifier<String> notifier = new Notifier<>();
        notifier.subscribe(e -> { });
        notifier.clear();
        assertEquals(0, notifier.size());
        assertFalse(notifier.unsubscribe(e -> { }));
    }
}
