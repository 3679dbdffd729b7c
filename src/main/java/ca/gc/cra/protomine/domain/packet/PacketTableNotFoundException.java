package ca.gc.cra.protomine.domain.packet;

import ca.gc.cra.protomine.domain.DialectException;

/**
 * Raised when a packet section holds no table; the packet needs manual intervention.
 *
 * @since 0.1.0
 */
public class PacketTableNotFoundException extends DialectException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception for the named packet.
   *
   * @param packetName packet section name
   */
  public PacketTableNotFoundException(String packetName) {
    super(packetName, "Cannot find packet table; intervention required");
  }
}
