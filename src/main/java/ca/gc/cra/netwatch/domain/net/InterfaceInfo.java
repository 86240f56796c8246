package ca.gc.cra.netwatch.domain.net;

import java.util.List;
import java.util.Objects;

/**
 * Capture device as reported by the capture library.
 *
 * @param name device name passed to {@code iface=}
 * @param description vendor description, empty when unavailable
 * @param addresses assigned addresses in textual form
 * @param up whether the device is administratively up
 * @param loopback whether the device is a loopback device
 * @since 0.1.0
 */
public record InterfaceInfo(
    String name, String description, List<String> addresses, boolean up, boolean loopback) {
  public InterfaceInfo {
    Objects.requireNonNull(name, "name");
    description = Objects.requireNonNullElse(description, "");
    addresses = addresses == null ? List.of() : List.copyOf(addresses);
  }
}
