package com.scholary.transcriber.event;

import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Observable stream of progress events with explicit subscribe/unsubscribe.
 *
 * <p>Listeners are invoked synchronously on the publishing thread, in subscription order. A
 * listener that throws is logged and does not stop delivery to the others.
 *
 * @param <E> event type
 */
public class ProgressFeed<E> {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProgressFeed.class);

  private final CopyOnWriteArrayList<Consumer<? super E>> listeners = new CopyOnWriteArrayList<>();

  /**
   * Register a listener.
   *
   * @param listener receives every event published after this call
   * @return a handle that removes the listener when closed
   */
  public Subscription subscribe(Consumer<? super E> listener) {
    Objects.requireNonNull(listener, "listener");
    listeners.add(listener);
    return () -> listeners.remove(listener);
  }

  /** Deliver an event to every current listener. */
  public void publish(E event) {
    Objects.requireNonNull(event, "event");
    for (Consumer<? super E> listener : listeners) {
      try {
        listener.accept(event);
      } catch (RuntimeException e) {
        LOGGER.warn("Progress listener failed for event {}: {}", event, e.getMessage(), e);
      }
    }
  }

  public int subscriberCount() {
    return listeners.size();
  }

  /** Handle returned by {@link #subscribe}. Closing it twice is harmless. */
  @FunctionalInterface
  public interface Subscription extends AutoCloseable {
    @Override
    void close();
  }
}
