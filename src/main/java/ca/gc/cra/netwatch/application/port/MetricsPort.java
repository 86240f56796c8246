package ca.gc.cra.netwatch.application.port;

/**
 * <strong>What:</strong> Port abstracting NETWATCH metrics emission.
 * <ul>
 *   <li>Counter increments for events such as filtered frames or render ticks.</li>
 *   <li>Numeric observations for render latency or export sizes.</li>
 * </ul>
 *
 * @implNote Metric keys use dotted names (e.g. {@code capture.records.accepted}); adapters may normalize them.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key metric identifier; must not be {@code null}
   * @param value observed value, unit defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
