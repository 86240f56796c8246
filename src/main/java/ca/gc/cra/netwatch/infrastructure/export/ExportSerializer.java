package ca.gc.cra.netwatch.infrastructure.export;

import ca.gc.cra.netwatch.domain.net.GeoHint;
import ca.gc.cra.netwatch.domain.net.PacketRecord;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * <strong>What:</strong> Serializes packet records as a pretty-printed JSON array or as CSV.
 * <p><strong>JSON:</strong> one object per record with snake_case fields; absent optional values are {@code null}.</p>
 * <p><strong>CSV:</strong> header plus one row per record over {@link #CSV_COLUMNS}; absent optional values are empty.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from thread-safe Jackson factories.</p>
 *
 * @since 0.1.0
 */
public final class ExportSerializer {
  /** CSV column order. */
  public static final List<String> CSV_COLUMNS = List.of(
      "timestamp",
      "packet_number",
      "src_ip",
      "dst_ip",
      "protocol",
      "src_port",
      "dst_port",
      "packet_size",
      "flags",
      "application_protocol",
      "description");

  private static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ISO_OFFSET_DATE_TIME.withZone(ZoneOffset.UTC);

  private final JsonFactory jsonFactory = new JsonFactory();
  private final CsvMapper csvMapper = new CsvMapper();
  private final CsvSchema csvSchema;

  public ExportSerializer() {
    CsvSchema.Builder builder = CsvSchema.builder();
    for (String column : CSV_COLUMNS) {
      builder.addColumn(column);
    }
    this.csvSchema = builder.setUseHeader(false).setNullValue("").build();
  }

  /**
   * Serializes records as a UTF-8 JSON array.
   *
   * @param records records in capture order
   * @return JSON bytes
   * @throws IOException if generation fails
   */
  public byte[] toJson(List<PacketRecord> records) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(256, records.size() * 512));
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.useDefaultPrettyPrinter();
      gen.writeStartArray();
      for (PacketRecord record : records) {
        writeRecord(gen, record);
      }
      gen.writeEndArray();
    }
    return out.toByteArray();
  }

  private static void writeRecord(JsonGenerator gen, PacketRecord record) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("timestamp", timestamp(record.timestamp()));
    gen.writeNumberField("packet_number", record.sequence());
    gen.writeStringField("src_mac", record.srcMac());
    gen.writeStringField("dst_mac", record.dstMac());
    gen.writeStringField("src_ip", record.srcIp());
    gen.writeStringField("dst_ip", record.dstIp());
    gen.writeStringField("protocol", record.protocol());
    writeNullableInt(gen, "src_port", record.srcPort());
    writeNullableInt(gen, "dst_port", record.dstPort());
    gen.writeNumberField("packet_size", record.size());
    gen.writeStringField("flags", record.flags());
    gen.writeNumberField("payload_size", record.payloadSize());
    gen.writeStringField("application_protocol", record.applicationProtocol());
    gen.writeStringField("description", record.description());
    gen.writeStringField("threat_level", record.threatLevel().label());
    writeGeo(gen, record.geo());
    gen.writeEndObject();
  }

  private static void writeGeo(JsonGenerator gen, GeoHint geo) throws IOException {
    if (geo == null) {
      gen.writeNullField("geo_info");
      return;
    }
    gen.writeObjectFieldStart("geo_info");
    gen.writeStringField("country", geo.country());
    gen.writeStringField("city", geo.city());
    writeNullableDouble(gen, "latitude", geo.latitude());
    writeNullableDouble(gen, "longitude", geo.longitude());
    gen.writeEndObject();
  }

  private static void writeNullableInt(JsonGenerator gen, String field, Integer value) throws IOException {
    if (value == null) {
      gen.writeNullField(field);
    } else {
      gen.writeNumberField(field, value);
    }
  }

  private static void writeNullableDouble(JsonGenerator gen, String field, Double value) throws IOException {
    if (value == null) {
      gen.writeNullField(field);
    } else {
      gen.writeNumberField(field, value);
    }
  }

  /**
   * Serializes records as UTF-8 CSV with a header row.
   *
   * @param records records in capture order
   * @return CSV bytes
   * @throws IOException if generation fails
   */
  public byte[] toCsv(List<PacketRecord> records) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(256, records.size() * 160));
    // Header row is present even when there are no records.
    out.write((String.join(",", CSV_COLUMNS) + "\n").getBytes(StandardCharsets.UTF_8));
    try (SequenceWriter writer = csvMapper.writer(csvSchema).writeValues(out)) {
      for (PacketRecord record : records) {
        writer.write(csvRow(record));
      }
    }
    return out.toByteArray();
  }

  static Map<String, Object> csvRow(PacketRecord record) {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("timestamp", timestamp(record.timestamp()));
    row.put("packet_number", record.sequence());
    row.put("src_ip", record.srcIp());
    row.put("dst_ip", record.dstIp());
    row.put("protocol", record.protocol());
    row.put("src_port", record.srcPort());
    row.put("dst_port", record.dstPort());
    row.put("packet_size", record.size());
    row.put("flags", record.flags());
    row.put("application_protocol", record.applicationProtocol());
    row.put("description", record.description());
    return row;
  }

  static String timestamp(Instant instant) {
    return TIMESTAMP.format(instant);
  }
}
