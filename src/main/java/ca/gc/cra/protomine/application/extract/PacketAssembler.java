package ca.gc.cra.protomine.application.extract;

import ca.gc.cra.protomine.application.port.MetricsPort;
import ca.gc.cra.protomine.config.DialectConfig;
import ca.gc.cra.protomine.domain.DialectException;
import ca.gc.cra.protomine.domain.packet.Packet;
import ca.gc.cra.protomine.domain.packet.PacketIdentifiers;
import ca.gc.cra.protomine.domain.packet.PacketTableNotFoundException;
import ca.gc.cra.protomine.domain.schema.CompositeList;
import ca.gc.cra.protomine.domain.schema.SchemaInferenceEngine;
import ca.gc.cra.protomine.domain.schema.SymmetryException;
import ca.gc.cra.protomine.domain.table.Cell;
import ca.gc.cra.protomine.domain.table.Grid;
import ca.gc.cra.protomine.domain.table.ParsedTable;
import ca.gc.cra.protomine.domain.table.TableFormatException;
import ca.gc.cra.protomine.domain.table.WikiTableParser;
import ca.gc.cra.protomine.domain.wiki.WikiSection;
import ca.gc.cra.protomine.logging.Logs;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns one packet section of the protocol page into a {@link Packet}.
 * <p><strong>Why:</strong> Locates the packet table, checks it has the expected layout, decodes the
 * identifier cell and runs schema inference on the field-name and field-type columns.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from its collaborators; safe to share when the
 * metrics port is thread-safe.</p>
 * <p><strong>Observability:</strong> Emits {@code extract.packets.parsed},
 * {@code extract.packets.skipped.symmetry} and the {@code extract.packet.fields} histogram.</p>
 *
 * @since 0.1.0
 */
public final class PacketAssembler {
  private static final Logger log = LoggerFactory.getLogger(PacketAssembler.class);
  private static final String TABLE_OPEN = "{|";

  private final DialectConfig dialect;
  private final SchemaInferenceEngine engine;
  private final MetricsPort metrics;

  /**
   * Creates an assembler.
   *
   * @param dialect header labels to look for
   * @param engine inference engine applied to the field columns
   * @param metrics metrics sink
   */
  public PacketAssembler(DialectConfig dialect, SchemaInferenceEngine engine, MetricsPort metrics) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Extracts the packet described by {@code section}.
   *
   * @param section packet subsection; its name identifies the packet
   * @return the packet, or empty when the field columns are not symmetric
   * @throws PacketTableNotFoundException if the section holds no table
   * @throws DialectException if the table layout or identifier cell is not recognized
   * @throws TableFormatException if the table markup cannot be parsed
   */
  public Optional<Packet> assemble(WikiSection section) {
    Objects.requireNonNull(section, "section");
    String name = section.name();

    StringBuilder preamble = new StringBuilder();
    String tableText = splitPreamble(section.text(), preamble);
    if (tableText == null) {
      throw new PacketTableNotFoundException(name);
    }

    Grid table;
    try {
      ParsedTable parsed = WikiTableParser.parse(tableText);
      table = parsed.grid();
    } catch (TableFormatException ex) {
      log.error("Packet {} has a malformed table near line '{}'", name, ex.line());
      throw ex;
    }

    Cell idHeader = table.cellAt(0, 0)
        .orElseThrow(() -> new DialectException(name, "Packet table has no cells"));
    if (!idHeader.content().strip().equals(dialect.packetIdHeader())) {
      throw new DialectException(name, "Packet table does not start with '" + dialect.packetIdHeader()
          + "'; intervention required");
    }
    Cell idCell = table.cellAt(0, 1)
        .orElseThrow(() -> new DialectException(name, "Packet table has no identifier cell"));
    Map<String, String> identifiers = PacketIdentifiers.decode(idCell.content(), name);

    Cell nameHeader = singleHeader(table, dialect.fieldNameHeader(), name);
    Cell typeHeader = singleHeader(table, dialect.fieldTypeHeader(), name);
    int bodyHeight = Math.max(0, table.height() - 1);
    Grid names = table.crop(nameHeader.x(), 1, nameHeader.colspan(), bodyHeight);
    Grid types = table.crop(typeHeader.x(), 1, typeHeader.colspan(), bodyHeight);

    CompositeList fields;
    try {
      fields = engine.infer(names, types);
    } catch (SymmetryException ex) {
      log.warn("Symmetry error in packet {}; intervention required: {}",
          name, Logs.singleLine(ex.getMessage()));
      metrics.increment("extract.packets.skipped.symmetry");
      return Optional.empty();
    }

    metrics.increment("extract.packets.parsed");
    metrics.observe("extract.packet.fields", fields.size());
    String protocolId = identifiers.get(PacketIdentifiers.PROTOCOL);
    Optional<String> resourceId = Optional.ofNullable(identifiers.get(PacketIdentifiers.RESOURCE));
    log.debug("Packet {} parsed: id={} resource={} fields={}",
        name, protocolId, resourceId.orElse("-"), fields.size());
    return Optional.of(new Packet(name, preamble.toString(), protocolId, resourceId, fields));
  }

  /**
   * Copies the lines before the first table into {@code preamble}.
   *
   * @return text from the table-open line onwards, or {@code null} when there is no table
   */
  private static String splitPreamble(String text, StringBuilder preamble) {
    int position = 0;
    while (position < text.length()) {
      int end = text.indexOf('\n', position);
      int lineEnd = end < 0 ? text.length() : end;
      String line = text.substring(position, lineEnd);
      if (line.strip().startsWith(TABLE_OPEN)) {
        return text.substring(position);
      }
      preamble.append(line).append('\n');
      position = lineEnd + 1;
    }
    return null;
  }

  private static Cell singleHeader(Grid table, String label, String packetName) {
    List<Cell> matches = table.searchHeaders(content -> content.strip().equals(label));
    if (matches.size() != 1) {
      throw new DialectException(packetName, "Expected exactly one '" + label + "' header but found "
          + matches.size());
    }
    return matches.get(0);
  }
}
