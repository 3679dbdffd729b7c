package ca.gc.cra.protomine.application.extract;

import ca.gc.cra.protomine.domain.packet.Packet;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Packets extracted from one page, grouped by state and then direction in page order.
 *
 * <p>Instances are immutable; build them with {@link Builder}.</p>
 *
 * @since 0.1.0
 */
public final class ExtractionResult {
  private final Map<String, Map<String, List<Packet>>> packets;
  private final List<SkippedPacket> skipped;

  private ExtractionResult(Map<String, Map<String, List<Packet>>> packets, List<SkippedPacket> skipped) {
    this.packets = packets;
    this.skipped = skipped;
  }

  /**
   * Returns packets keyed by state, then direction.
   *
   * @return unmodifiable, insertion-ordered view
   */
  public Map<String, Map<String, List<Packet>>> packets() {
    return packets;
  }

  /**
   * Returns the packets of one state and direction.
   *
   * @param state protocol state, e.g. {@code Play}
   * @param direction direction, e.g. {@code Clientbound}
   * @return packets in page order; empty when the section was absent
   */
  public List<Packet> packets(String state, String direction) {
    return packets.getOrDefault(state, Map.of()).getOrDefault(direction, List.of());
  }

  /**
   * Returns packets that produced no schema.
   *
   * @return skipped packets in page order
   */
  public List<SkippedPacket> skipped() {
    return skipped;
  }

  /**
   * Counts extracted packets across all states.
   *
   * @return number of packets
   */
  public int packetCount() {
    int count = 0;
    for (Map<String, List<Packet>> directions : packets.values()) {
      for (List<Packet> list : directions.values()) {
        count += list.size();
      }
    }
    return count;
  }

  @Override
  public String toString() {
    return "ExtractionResult{packets=" + packetCount() + ", skipped=" + skipped.size() + '}';
  }

  /**
   * Creates an empty builder.
   *
   * @return builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Mutable accumulator used by {@link SectionWalker}; not thread-safe. */
  public static final class Builder {
    private final Map<String, Map<String, List<Packet>>> packets = new LinkedHashMap<>();
    private final List<SkippedPacket> skipped = new ArrayList<>();

    private Builder() {}

    /**
     * Registers a direction so it appears in the result even without packets.
     *
     * @param state protocol state
     * @param direction direction subsection
     * @return this builder
     */
    public Builder direction(String state, String direction) {
      packets.computeIfAbsent(state, k -> new LinkedHashMap<>())
          .computeIfAbsent(direction, k -> new ArrayList<>());
      return this;
    }

    /**
     * Appends a packet.
     *
     * @param state protocol state
     * @param direction direction subsection
     * @param packet extracted packet
     * @return this builder
     */
    public Builder add(String state, String direction, Packet packet) {
      Objects.requireNonNull(packet, "packet");
      direction(state, direction);
      packets.get(state).get(direction).add(packet);
      return this;
    }

    /**
     * Records a skipped packet.
     *
     * @param packet skip record
     * @return this builder
     */
    public Builder skip(SkippedPacket packet) {
      skipped.add(Objects.requireNonNull(packet, "packet"));
      return this;
    }

    /**
     * Freezes the accumulated packets.
     *
     * @return immutable result
     */
    public ExtractionResult build() {
      Map<String, Map<String, List<Packet>>> frozen = new LinkedHashMap<>();
      packets.forEach((state, directions) -> {
        Map<String, List<Packet>> frozenDirections = new LinkedHashMap<>();
        directions.forEach((direction, list) -> frozenDirections.put(direction, List.copyOf(list)));
        frozen.put(state, Collections.unmodifiableMap(frozenDirections));
      });
      return new ExtractionResult(Collections.unmodifiableMap(frozen), List.copyOf(skipped));
    }
  }
}
