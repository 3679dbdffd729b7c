package ca.gc.cra.protomine.application.extract;

import ca.gc.cra.protomine.application.port.MetricsPort;
import ca.gc.cra.protomine.config.DialectConfig;
import ca.gc.cra.protomine.domain.DialectException;
import ca.gc.cra.protomine.domain.packet.Packet;
import ca.gc.cra.protomine.domain.packet.PacketTableNotFoundException;
import ca.gc.cra.protomine.domain.wiki.WikiSection;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks the page's section tree: states at the top level, directions below them, one packet per
 * direction subsection.
 *
 * <p>Only section names listed in the {@link DialectConfig} are accepted. An unknown name stops the
 * walk with a {@link DialectException} so page reorganisations are noticed instead of silently
 * dropping packets.</p>
 *
 * @since 0.1.0
 */
public final class SectionWalker {
  private static final Logger log = LoggerFactory.getLogger(SectionWalker.class);

  private final DialectConfig dialect;
  private final PacketAssembler assembler;
  private final boolean skipMissingTables;
  private final MetricsPort metrics;

  /**
   * Creates a walker that aborts on packet sections without a table.
   *
   * @param dialect accepted section names
   * @param assembler assembler applied to each packet section
   */
  public SectionWalker(DialectConfig dialect, PacketAssembler assembler) {
    this(dialect, assembler, false, MetricsPort.NO_OP);
  }

  /**
   * Creates a walker.
   *
   * @param dialect accepted section names
   * @param assembler assembler applied to each packet section
   * @param skipMissingTables record sections without a table as skipped instead of aborting
   * @param metrics metrics sink for skipped sections
   */
  public SectionWalker(
      DialectConfig dialect, PacketAssembler assembler, boolean skipMissingTables, MetricsPort metrics) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.assembler = Objects.requireNonNull(assembler, "assembler");
    this.skipMissingTables = skipMissingTables;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Extracts every packet under {@code root}.
   *
   * @param root page root section
   * @return packets grouped by state and direction, plus skipped packets
   * @throws DialectException if a state or direction name is not configured, or a packet layout is
   *     not recognized
   */
  public ExtractionResult walk(WikiSection root) {
    Objects.requireNonNull(root, "root");
    ExtractionResult.Builder result = ExtractionResult.builder();
    for (WikiSection state : root.children()) {
      String stateName = state.name();
      if (dialect.isIgnored(stateName)) {
        log.debug("Ignoring section {}", stateName);
        continue;
      }
      if (!dialect.isState(stateName)) {
        throw new DialectException(stateName, "Unknown wiki header '" + stateName + "'");
      }
      for (WikiSection direction : state.children()) {
        String directionName = direction.name();
        if (!dialect.isDirection(directionName)) {
          throw new DialectException(directionName,
              "Unknown direction '" + directionName + "' in state " + stateName);
        }
        result.direction(stateName, directionName);
        for (WikiSection packet : direction.children()) {
          walkPacket(stateName, directionName, packet, result);
        }
      }
    }
    return result.build();
  }

  private void walkPacket(
      String state, String direction, WikiSection packet, ExtractionResult.Builder result) {
    Optional<Packet> assembled;
    try {
      assembled = assembler.assemble(packet);
    } catch (PacketTableNotFoundException ex) {
      if (!skipMissingTables) {
        log.error("Packet {} in {}/{} has no table; intervention required", packet.name(), state, direction);
        throw ex;
      }
      log.warn("Skipping packet {} in {}/{}: no table", packet.name(), state, direction);
      metrics.increment("extract.packets.skipped.missingTable");
      result.skip(new SkippedPacket(state, direction, packet.name(), SkippedPacket.Reason.MISSING_TABLE));
      return;
    }
    if (assembled.isPresent()) {
      result.add(state, direction, assembled.get());
    } else {
      result.skip(new SkippedPacket(state, direction, packet.name(), SkippedPacket.Reason.SYMMETRY));
    }
  }
}
