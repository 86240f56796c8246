package ca.gc.cra.netwatch.domain.telemetry;

import ca.gc.cra.netwatch.domain.net.PacketRecord;
import ca.gc.cra.netwatch.domain.threat.ThreatLevel;
import java.time.Instant;
import java.util.Objects;

/**
 * Alert raised for a record classified above {@link ThreatLevel#SAFE}.
 *
 * @param timestamp capture time of the record
 * @param message human-readable summary
 * @param level record threat level
 * @since 0.1.0
 */
public record ThreatAlert(Instant timestamp, String message, ThreatLevel level) {
  private static final String UNKNOWN = "unknown";

  public ThreatAlert {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(level, "level");
  }

  /**
   * Builds the alert for a record.
   *
   * @param record classified record
   * @return alert with message {@code Suspicious <protocol> traffic from <src> to <dst>}
   */
  public static ThreatAlert forRecord(PacketRecord record) {
    String message = "Suspicious " + record.protocol() + " traffic from "
        + Objects.requireNonNullElse(record.srcIp(), UNKNOWN) + " to "
        + Objects.requireNonNullElse(record.dstIp(), UNKNOWN);
    return new ThreatAlert(record.timestamp(), message, record.threatLevel());
  }
}
