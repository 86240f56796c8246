package ca.gc.cra.netwatch.domain.threat;

import java.util.Locale;

/**
 * <strong>What:</strong> Ordered risk classification attached to every packet record and connection flow.
 * <p><strong>Role:</strong> Domain enum; declaration order is the severity order so {@link #compareTo(Enum)}
 * and {@link #max(ThreatLevel, ThreatLevel)} can escalate flow levels.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ThreatLevel {
  /** Score 0-1. */
  SAFE("Safe"),
  /** Score 2-3. */
  LOW("Low"),
  /** Score 4-5. */
  MEDIUM("Medium"),
  /** Score 6-7. */
  HIGH("High"),
  /** Score 8 and above. */
  CRITICAL("Critical");

  private final String label;

  ThreatLevel(String label) {
    this.label = label;
  }

  /**
   * Returns the display and export label, e.g. {@code "Medium"}.
   *
   * @return human-readable label
   */
  public String label() {
    return label;
  }

  /**
   * Maps an additive risk score to a level.
   *
   * @param score non-negative risk score
   * @return level for the score; negative scores map to {@link #SAFE}
   */
  public static ThreatLevel fromScore(int score) {
    if (score <= 1) {
      return SAFE;
    }
    if (score <= 3) {
      return LOW;
    }
    if (score <= 5) {
      return MEDIUM;
    }
    if (score <= 7) {
      return HIGH;
    }
    return CRITICAL;
  }

  /**
   * Returns the more severe of two levels; {@code null} arguments are ignored.
   *
   * @param a first level
   * @param b second level
   * @return the higher level, or {@link #SAFE} when both are {@code null}
   */
  public static ThreatLevel max(ThreatLevel a, ThreatLevel b) {
    if (a == null) {
      return b == null ? SAFE : b;
    }
    if (b == null) {
      return a;
    }
    return a.compareTo(b) >= 0 ? a : b;
  }

  /**
   * Parses a label or constant name, case-insensitively.
   *
   * @param raw value such as {@code "High"} or {@code "HIGH"}
   * @return matching level
   * @throws IllegalArgumentException when the value is blank or unknown
   */
  public static ThreatLevel fromLabel(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("threat level must not be blank");
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    for (ThreatLevel level : values()) {
      if (level.name().equals(normalized)) {
        return level;
      }
    }
    throw new IllegalArgumentException("Unknown threat level: " + raw);
  }

  /**
   * Indicates whether records at this level raise an alert.
   *
   * @return {@code true} for every level above {@link #SAFE}
   */
  public boolean isAlerting() {
    return this != SAFE;
  }
}
