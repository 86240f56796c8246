package ca.gc.cra.netwatch.domain.net;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Arrays;

/**
 * <strong>What:</strong> Immutable link-layer frame handed from a capture source to the decoder.
 * <p><strong>Role:</strong> Domain value object bridging {@code PacketSource} and {@code PacketDecoder}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the payload is copied on construction.</p>
 *
 * @param data raw frame bytes, copied; {@code null} becomes an empty array
 * @param timestampMicros capture timestamp in microseconds since epoch, {@code 0} when unknown
 * @since 0.1.0
 */
public record RawFrame(byte[] data, long timestampMicros) {
  public RawFrame {
    data = data != null ? data.clone() : new byte[0];
  }

  /**
   * Returns the frame bytes.
   *
   * @return internal array; decoders read it in place and must not mutate it
   */
  @Override
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Copied on construction; decoders read every frame in place.")
  public byte[] data() {
    return data;
  }

  /**
   * Returns the captured length in bytes.
   *
   * @return number of captured bytes
   */
  public int length() {
    return data.length;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RawFrame that)) {
      return false;
    }
    return timestampMicros == that.timestampMicros() && Arrays.equals(data, that.data());
  }

  @Override
  public int hashCode() {
    int result = Arrays.hashCode(data);
    result = 31 * result + Long.hashCode(timestampMicros);
    return result;
  }

  @Override
  public String toString() {
    return "RawFrame{length=" + data.length + ", timestampMicros=" + timestampMicros + '}';
  }
}
