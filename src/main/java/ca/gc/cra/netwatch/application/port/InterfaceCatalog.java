package ca.gc.cra.netwatch.application.port;

import ca.gc.cra.netwatch.domain.net.InterfaceInfo;
import java.util.List;

/**
 * <strong>What:</strong> Port enumerating capture devices available on the host.
 * <p><strong>Role:</strong> Backs the {@code interfaces} command so operators can pick an {@code iface=} value.</p>
 *
 * @since 0.1.0
 */
public interface InterfaceCatalog {
  /**
   * Lists capture devices in the order reported by the platform.
   *
   * @return devices; empty when none are visible to the current user
   * @throws Exception if the capture library cannot enumerate devices
   */
  List<InterfaceInfo> list() throws Exception;
}
