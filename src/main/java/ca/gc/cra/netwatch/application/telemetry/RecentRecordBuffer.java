package ca.gc.cra.netwatch.application.telemetry;

import ca.gc.cra.netwatch.domain.net.PacketRecord;
import ca.gc.cra.netwatch.domain.telemetry.RingBuffer;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO of the most recent full records.
 *
 * <p>Feeds the dashboard activity, threat-count and geographic panels and is the export source at capture end.
 * Guarded by a single {@link ReentrantLock}; copies are taken under the lock and returned unshared.</p>
 *
 * @since 0.1.0
 */
public final class RecentRecordBuffer {
  /** Default number of retained records. */
  public static final int DEFAULT_CAPACITY = 1_000;

  private final RingBuffer<PacketRecord> records;
  private final ReentrantLock lock = new ReentrantLock();

  public RecentRecordBuffer() {
    this(DEFAULT_CAPACITY);
  }

  /**
   * Creates a buffer.
   *
   * @param capacity maximum retained records; must be positive
   */
  public RecentRecordBuffer(int capacity) {
    this.records = new RingBuffer<>(capacity);
  }

  /**
   * Appends a record, evicting the oldest when full.
   *
   * @param record accepted record
   */
  public void add(PacketRecord record) {
    Objects.requireNonNull(record, "record");
    lock.lock();
    try {
      records.add(record);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Copies the buffer, oldest first.
   *
   * @return records in arrival order
   */
  public List<PacketRecord> snapshot() {
    lock.lock();
    try {
      return List.copyOf(records.toList());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Copies the newest records, newest first.
   *
   * @param limit maximum records returned
   * @return newest records
   */
  public List<PacketRecord> newest(int limit) {
    lock.lock();
    try {
      return List.copyOf(records.newest(limit));
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return records.size();
    } finally {
      lock.unlock();
    }
  }

  public int capacity() {
    return records.capacity();
  }
}
