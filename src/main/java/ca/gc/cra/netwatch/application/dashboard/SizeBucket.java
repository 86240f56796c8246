package ca.gc.cra.netwatch.application.dashboard;

/** Packet size classes shown in the size distribution panel. */
public enum SizeBucket {
  SMALL("<100B", 0, 100),
  MEDIUM("100-499B", 100, 500),
  LARGE("500-1499B", 500, 1_500),
  JUMBO(">=1500B", 1_500, Integer.MAX_VALUE);

  private final String label;
  private final int minInclusive;
  private final int maxExclusive;

  SizeBucket(String label, int minInclusive, int maxExclusive) {
    this.label = label;
    this.minInclusive = minInclusive;
    this.maxExclusive = maxExclusive;
  }

  public String label() {
    return label;
  }

  /**
   * Resolves the bucket of a packet size.
   *
   * @param size size in bytes
   * @return matching bucket
   */
  public static SizeBucket of(int size) {
    for (SizeBucket bucket : values()) {
      if (size >= bucket.minInclusive && size < bucket.maxExclusive) {
        return bucket;
      }
    }
    return size < 0 ? SMALL : JUMBO;
  }
}
