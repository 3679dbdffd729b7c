package ca.gc.cra.protomine.domain.packet;

import ca.gc.cra.protomine.domain.schema.CompositeList;
import java.util.Objects;
import java.util.Optional;

/**
 * Schema of one protocol message as documented by a wiki packet section.
 *
 * @param name packet section name, e.g. {@code Merchant Offers}
 * @param preamble description text preceding the packet table; often empty
 * @param protocolId identifier used on the wire, e.g. {@code 0x2D}
 * @param resourceId resource name the game knows the packet by; absent for older revisions
 * @param fields root fields in table order
 *
 * @since 0.1.0
 */
public record Packet(
    String name,
    String preamble,
    String protocolId,
    Optional<String> resourceId,
    CompositeList fields) {

  /**
   * Creates a packet record.
   *
   * @throws NullPointerException if any component is {@code null}
   */
  public Packet {
    name = Objects.requireNonNull(name, "name");
    preamble = Objects.requireNonNull(preamble, "preamble");
    protocolId = Objects.requireNonNull(protocolId, "protocolId");
    resourceId = Objects.requireNonNull(resourceId, "resourceId");
    fields = Objects.requireNonNull(fields, "fields");
  }
}
