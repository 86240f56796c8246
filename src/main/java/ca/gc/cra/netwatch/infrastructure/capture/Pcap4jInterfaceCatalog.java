package ca.gc.cra.netwatch.infrastructure.capture;

import ca.gc.cra.netwatch.application.port.InterfaceCatalog;
import ca.gc.cra.netwatch.domain.net.InterfaceInfo;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.pcap4j.core.PcapAddress;
import org.pcap4j.core.PcapNativeException;
import org.pcap4j.core.PcapNetworkInterface;
import org.pcap4j.core.Pcaps;

/** Lists capture devices through pcap4j. */
public final class Pcap4jInterfaceCatalog implements InterfaceCatalog {

  @Override
  public List<InterfaceInfo> list() throws IOException {
    List<PcapNetworkInterface> devices;
    try {
      devices = Pcaps.findAllDevs();
    } catch (PcapNativeException ex) {
      throw new IOException("Unable to enumerate capture devices: " + ex.getMessage(), ex);
    }
    List<InterfaceInfo> out = new ArrayList<>(devices.size());
    for (PcapNetworkInterface nif : devices) {
      List<String> addresses = new ArrayList<>();
      for (PcapAddress address : nif.getAddresses()) {
        if (address.getAddress() != null) {
          addresses.add(address.getAddress().getHostAddress());
        }
      }
      out.add(new InterfaceInfo(nif.getName(), nif.getDescription(), addresses, nif.isUp(), nif.isLoopBack()));
    }
    return out;
  }
}
