package ca.gc.cra.netwatch.application.pipeline;

import ca.gc.cra.netwatch.domain.net.PacketRecord;

/**
 * Receives every accepted, classified record on the ingestion thread.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface PacketRecordListener {
  /**
   * Called once per accepted record after telemetry has been updated.
   *
   * @param record classified record
   */
  void onRecord(PacketRecord record);

  /** Listener that ignores records; used in dashboard mode. */
  PacketRecordListener NONE = record -> {};
}
