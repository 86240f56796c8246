package ca.gc.cra.netwatch.domain.threat;

import ca.gc.cra.netwatch.domain.net.PacketRecord;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> Heuristic threat scoring for decoded packet records.
 * <p><strong>Why:</strong> Gives the dashboard and connection table a coarse, explainable risk signal without
 * payload inspection.</p>
 * <p><strong>Role:</strong> Pure domain service between the decoder and the telemetry aggregator.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Sum independent {@link RiskSignal} scores (port, destination, size, protocol).</li>
 *   <li>Map the total to a {@link ThreatLevel} via {@link ThreatLevel#fromScore(int)}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless after construction; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> A handful of map lookups and string prefix checks per record.</p>
 *
 * @since 0.1.0
 */
public final class ThreatClassifier {
  /** Weight per port; ports absent from the table score {@code 0} unless above {@link #EPHEMERAL_FLOOR}. */
  static final Map<Integer, Integer> PORT_WEIGHTS = Map.ofEntries(
      Map.entry(1433, 3),
      Map.entry(3389, 3),
      Map.entry(5900, 3),
      Map.entry(23, 3),
      Map.entry(135, 3),
      Map.entry(139, 3),
      Map.entry(445, 3),
      Map.entry(21, 2),
      Map.entry(25, 2),
      Map.entry(110, 2),
      Map.entry(143, 2),
      Map.entry(993, 2),
      Map.entry(995, 2));
  static final int EPHEMERAL_FLOOR = 49_152;
  static final int MIN_NORMAL_SIZE = 64;
  static final int MAX_NORMAL_SIZE = 1_500;
  private static final int DNS_PORT = 53;

  /** One additive contribution to the risk score. */
  @FunctionalInterface
  public interface RiskSignal {
    /**
     * Scores a record.
     *
     * @param record record under evaluation
     * @return non-negative contribution
     */
    int score(PacketRecord record);
  }

  static final RiskSignal PORT = record -> {
    OptionalInt port = record.preferredPort();
    if (port.isEmpty()) {
      return 0;
    }
    Integer weight = PORT_WEIGHTS.get(port.getAsInt());
    if (weight != null) {
      return weight;
    }
    return port.getAsInt() > EPHEMERAL_FLOOR ? 1 : 0;
  };

  static final RiskSignal DESTINATION = record -> {
    String dst = record.dstIp();
    if (dst == null) {
      return 0;
    }
    int score = AddressScope.isPrivate(dst) ? 0 : 1;
    if (AddressScope.hasFlaggedPrefix(dst)) {
      score += 2;
    }
    return score;
  };

  static final RiskSignal SIZE = record ->
      record.size() > MAX_NORMAL_SIZE || record.size() < MIN_NORMAL_SIZE ? 1 : 0;

  static final RiskSignal PROTOCOL = record -> switch (record.protocol()) {
    case "ICMP" -> 1;
    case "UDP" -> Objects.equals(record.dstPort(), DNS_PORT) ? 0 : 1;
    default -> 0;
  };

  private static final List<RiskSignal> DEFAULT_SIGNALS = List.of(PORT, DESTINATION, SIZE, PROTOCOL);

  private final List<RiskSignal> signals;

  /** Creates a classifier with the standard port, destination, size and protocol signals. */
  public ThreatClassifier() {
    this(DEFAULT_SIGNALS);
  }

  /**
   * Creates a classifier with a custom signal table.
   *
   * @param signals ordered signals; must not be {@code null}
   */
  public ThreatClassifier(List<RiskSignal> signals) {
    this.signals = List.copyOf(Objects.requireNonNull(signals, "signals"));
  }

  /**
   * Computes the additive risk score for a record.
   *
   * @param record decoded record; must not be {@code null}
   * @return total score
   */
  public int score(PacketRecord record) {
    Objects.requireNonNull(record, "record");
    int total = 0;
    for (RiskSignal signal : signals) {
      total += signal.score(record);
    }
    return total;
  }

  /**
   * Classifies a record. Absent fields contribute nothing.
   *
   * @param record decoded record; must not be {@code null}
   * @return threat level for the record
   */
  public ThreatLevel classify(PacketRecord record) {
    return ThreatLevel.fromScore(score(record));
  }
}
