package ca.gc.cra.eventstream.infrastructure.sink;

import ca.gc.cra.eventstream.application.port.EventSink;
import ca.gc.cra.eventstream.domain.stream.Event;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory sink used for tests and dry runs.
 *
 * @since 0.1.0
 */
public final class InMemoryEventSink implements EventSink {
  private final CopyOnWriteArrayList<Event> events = new CopyOnWriteArrayList<>();

  @Override
  public void export(Event event) {
    events.add(Objects.requireNonNull(event, "event"));
  }

  /**
   * Returns a snapshot of exported events in arrival order.
   *
   * @return immutable list of events
   */
  public List<Event> snapshot() {
    return List.copyOf(events);
  }

  /**
   * Returns the number of exported events.
   *
   * @return event count
   */
  public int size() {
    return events.size();
  }

  /**
   * Clears the captured events.
   */
  public void clear() {
    events.clear();
  }
}
