package ca.gc.cra.netwatch.domain.net;

import java.util.Objects;

/**
 * Coarse location attached to a packet's destination address.
 *
 * @param country country label, e.g. {@code "Local Network"}
 * @param city city label
 * @param latitude latitude in degrees, or {@code null} when unknown
 * @param longitude longitude in degrees, or {@code null} when unknown
 * @since 0.1.0
 */
public record GeoHint(String country, String city, Double latitude, Double longitude) {
  /** Label used for private and loopback destinations. */
  public static final String LOCAL_NETWORK = "Local Network";

  public GeoHint {
    country = Objects.requireNonNullElse(country, "Unknown");
    city = Objects.requireNonNullElse(city, "Unknown");
  }

  /**
   * Indicates whether the hint describes a local destination.
   *
   * @return {@code true} when the country is {@link #LOCAL_NETWORK}
   */
  public boolean isLocal() {
    return LOCAL_NETWORK.equals(country);
  }
}
