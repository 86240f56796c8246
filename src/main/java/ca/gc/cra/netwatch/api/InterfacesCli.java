package ca.gc.cra.netwatch.api;

import ca.gc.cra.netwatch.application.port.InterfaceCatalog;
import ca.gc.cra.netwatch.application.report.TextTable;
import ca.gc.cra.netwatch.config.CompositionRoot;
import ca.gc.cra.netwatch.domain.net.InterfaceInfo;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists capture devices for the {@code interfaces} command.
 */
public final class InterfacesCli {
  private static final Logger log = LoggerFactory.getLogger(InterfacesCli.class);
  private static final String HELP_TEXT = """
      NETWATCH interfaces

      Usage:
        netwatch interfaces

      Lists capture devices with their addresses and state. Use a NAME as iface= for capture or dashboard.
      """;

  private InterfacesCli() {}

  static ExitCode run(String[] args) {
    return run(args, CompositionRoot.interfaceCatalog());
  }

  static ExitCode run(String[] args, InterfaceCatalog catalog) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    List<InterfaceInfo> interfaces;
    try {
      interfaces = catalog.list();
    } catch (IOException ex) {
      log.error("Unable to list capture devices: {}", ex.getMessage(), ex);
      CliPrinter.println("Listing devices usually requires root privileges or CAP_NET_RAW.");
      return ExitCode.IO_ERROR;
    } catch (Exception ex) {
      log.error("Unexpected failure listing capture devices", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
    if (interfaces.isEmpty()) {
      CliPrinter.println("No capture devices found.");
      return ExitCode.SUCCESS;
    }
    CliPrinter.printLines(table(interfaces));
    return ExitCode.SUCCESS;
  }

  static List<String> table(List<InterfaceInfo> interfaces) {
    TextTable table = new TextTable(List.of("Name", "Description", "Addresses", "Status"));
    for (InterfaceInfo info : interfaces) {
      String status = (info.up() ? "UP" : "DOWN") + (info.loopback() ? " (loopback)" : "");
      String addresses = info.addresses().isEmpty() ? "-" : String.join(", ", info.addresses());
      table.addRow(List.of(info.name(), info.description().isEmpty() ? "-" : info.description(), addresses, status));
    }
    return table.render();
  }
}
