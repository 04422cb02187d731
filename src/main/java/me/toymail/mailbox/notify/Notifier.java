package me.toymail.mailbox.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Synchronous fan-out of events to subscribers.
 *
 * Delivery runs on the caller's thread, in subscription order, over a snapshot
 * of the subscriber list, so observers may subscribe or unsubscribe from inside
 * a callback; the change takes effect from the next event. An observer that
 * throws is logged and skipped.
 */
public final class Notifier<E> {
    private static final Logger log = LoggerFactory.getLogger(Notifier.class);

    private final List<Consumer<? super E>> observers = new ArrayList<>();

    public void subscribe(Consumer<? super E> observer) {
        if (observer == null) {
            throw new IllegalArgumentException("Observer cannot be null");
        }
        synchronized (observers) {
            observers.add(observer);
        }
    }

    /**
     * Removes the first registration of the observer.
     *
     * @return true if it was subscribed
     */
    public boolean unsubscribe(Consumer<? super E> observer) {
        synchronized (observers) {
            return observers.remove(observer);
        }
    }

    public int size() {
        synchronized (observers) {
            return observers.size();
        }
    }

    public void clear() {
        synchronized (observers) {
            observers.clear();
        }
    }

    /**
     * Delivers the event to every current subscriber.
     *
     * @return the number of observers that received it without failing
     */
    public int notify(E event) {
        List<Consumer<? super E>> snapshot;
        synchronized (observers) {
            snapshot = new ArrayList<>(observers);
        }
        int delivered = 0;
        for (Consumer<? super E> observer : snapshot) {
            try {
                observer.accept(event);
                delivered++;
            } catch (RuntimeException e) {
                log.warn("Observer failed on {}: {} - {}", event, e.getClass().getSimpleName(), e.getMessage());
            }
        }
        return delivered;
    }
}
