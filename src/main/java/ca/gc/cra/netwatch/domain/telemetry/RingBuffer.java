package ca.gc.cra.netwatch.domain.telemetry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Fixed-capacity FIFO that evicts the oldest element on overflow.
 *
 * <p>Not thread-safe: owners guard access with their own lock. Iteration order is insertion order.</p>
 *
 * @param <T> element type
 * @since 0.1.0
 */
public final class RingBuffer<T> {
  private final int capacity;
  private final ArrayDeque<T> items;

  /**
   * Creates an empty buffer.
   *
   * @param capacity maximum number of retained elements; must be positive
   */
  public RingBuffer(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive (was " + capacity + ')');
    }
    this.capacity = capacity;
    this.items = new ArrayDeque<>(Math.min(capacity, 1_024));
  }

  /**
   * Appends an element, evicting the oldest one when full.
   *
   * @param item element to append; must not be {@code null}
   * @return {@code true} when an element was evicted
   */
  public boolean add(T item) {
    Objects.requireNonNull(item, "item");
    boolean evicted = false;
    if (items.size() == capacity) {
      items.pollFirst();
      evicted = true;
    }
    items.addLast(item);
    return evicted;
  }

  /**
   * Copies the contents, oldest first.
   *
   * @return new list in insertion order
   */
  public List<T> toList() {
    return new ArrayList<>(items);
  }

  /**
   * Copies up to {@code limit} of the newest elements, newest first.
   *
   * @param limit maximum elements to return
   * @return newest elements in reverse insertion order
   */
  public List<T> newest(int limit) {
    List<T> out = new ArrayList<>(Math.max(0, Math.min(limit, items.size())));
    var it = items.descendingIterator();
    while (it.hasNext() && out.size() < limit) {
      out.add(it.next());
    }
    return out;
  }

  public int size() {
    return items.size();
  }

  public int capacity() {
    return capacity;
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }

  public void clear() {
    items.clear();
  }
}
