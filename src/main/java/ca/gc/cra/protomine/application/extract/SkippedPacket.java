package ca.gc.cra.protomine.application.extract;

import java.util.Objects;

/**
 * Packet section that produced no schema during a run.
 *
 * @param state protocol state section
 * @param direction direction subsection
 * @param name packet section name
 * @param reason why the packet was skipped
 * @since 0.1.0
 */
public record SkippedPacket(String state, String direction, String name, Reason reason) {

  /** Cause of a skip. */
  public enum Reason {
    /** Field-name and field-type columns disagree. */
    SYMMETRY,
    /** Section holds no table; recorded only when missing tables are tolerated. */
    MISSING_TABLE
  }

  public SkippedPacket {
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(direction, "direction");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(reason, "reason");
  }
}
