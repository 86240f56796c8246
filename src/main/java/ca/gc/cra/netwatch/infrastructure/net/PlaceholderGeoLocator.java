package ca.gc.cra.netwatch.infrastructure.net;

import ca.gc.cra.netwatch.domain.net.GeoHint;
import ca.gc.cra.netwatch.domain.threat.AddressScope;

/**
 * Fixed lookup table standing in for a geolocation database.
 *
 * <p>Private destinations map to {@link GeoHint#LOCAL_NETWORK}; {@code 8.8.} and {@code 1.1.} prefixes map to the
 * public resolvers' locations; everything else is {@code Unknown}.</p>
 */
public final class PlaceholderGeoLocator {
  static final GeoHint LOCAL = new GeoHint(GeoHint.LOCAL_NETWORK, "Local", null, null);
  static final GeoHint MOUNTAIN_VIEW = new GeoHint("United States", "Mountain View", 37.4056, -122.0775);
  static final GeoHint SYDNEY = new GeoHint("Australia", "Sydney", -33.8688, 151.2093);
  static final GeoHint UNKNOWN = new GeoHint("Unknown", "Unknown", null, null);

  /**
   * Resolves a destination address.
   *
   * @param ip textual address; {@code null} yields {@code null}
   * @return location hint or {@code null} when there is no address
   */
  public GeoHint locate(String ip) {
    if (ip == null) {
      return null;
    }
    if (AddressScope.isPrivate(ip)) {
      return LOCAL;
    }
    if (ip.startsWith("8.8.")) {
      return MOUNTAIN_VIEW;
    }
    if (ip.startsWith("1.1.")) {
      return SYDNEY;
    }
    return UNKNOWN;
  }
}
