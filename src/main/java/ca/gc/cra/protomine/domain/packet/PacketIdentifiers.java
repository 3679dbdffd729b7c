package ca.gc.cra.protomine.domain.packet;

import ca.gc.cra.protomine.domain.DialectException;
import ca.gc.cra.protomine.logging.Logs;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Decodes the packet identifier cell of a packet table.
 *
 * <p>Two forms exist. Older revisions hold a bare hex literal such as {@code 0x00}. Current revisions
 * hold {@code key: value} groups:</p>
 *
 * <pre>
 * ''protocol:''&lt;br/&gt;&lt;code&gt;0x2D&lt;/code&gt;&lt;br/&gt;&lt;br/&gt;''resource:''&lt;br/&gt;&lt;code&gt;merchant_offers&lt;/code&gt;
 * </pre>
 *
 * @since 0.1.0
 */
public final class PacketIdentifiers {
  /** Key holding the on-wire packet id. Always present in a decoded identifier. */
  public static final String PROTOCOL = "protocol";
  /** Key holding the resource name of the packet. Optional. */
  public static final String RESOURCE = "resource";

  private static final String HEX_PREFIX = "0x";
  private static final String KEY_OPEN = "''";
  private static final String KEY_CLOSE = ":''";
  private static final String CODE_OPEN = "<code>";
  private static final String CODE_CLOSE = "</code>";
  private static final String LINE_BREAK = "<br";
  private static final int MAX_ECHOED_BYTES = 160;

  private PacketIdentifiers() {}

  /**
   * Decodes an identifier cell into a key/value map.
   *
   * @param cellContent content of the identifier cell
   * @param packetName packet section name used in diagnostics
   * @return insertion-ordered, unmodifiable map containing at least {@link #PROTOCOL}
   * @throws DialectException if the cell is malformed or lacks a protocol value
   */
  public static Map<String, String> decode(String cellContent, String packetName) {
    Objects.requireNonNull(cellContent, "cellContent");
    Objects.requireNonNull(packetName, "packetName");
    String text = cellContent.strip();
    if (text.startsWith(HEX_PREFIX)) {
      return Map.of(PROTOCOL, text);
    }

    Map<String, String> values = new LinkedHashMap<>();
    String rest = text;
    while (!rest.isEmpty()) {
      if (!rest.startsWith(KEY_OPEN)) {
        throw formatError(packetName, cellContent);
      }
      int keyEnd = rest.indexOf(KEY_CLOSE, KEY_OPEN.length());
      if (keyEnd < 0) {
        throw formatError(packetName, cellContent);
      }
      String key = rest.substring(KEY_OPEN.length(), keyEnd).strip();
      rest = skipLineBreaks(rest.substring(keyEnd + KEY_CLOSE.length()), packetName, cellContent);

      if (!rest.startsWith(CODE_OPEN)) {
        throw formatError(packetName, cellContent);
      }
      int valueEnd = rest.indexOf(CODE_CLOSE);
      if (valueEnd < 0) {
        throw formatError(packetName, cellContent);
      }
      String value = rest.substring(CODE_OPEN.length(), valueEnd).strip();
      rest = skipLineBreaks(rest.substring(valueEnd + CODE_CLOSE.length()), packetName, cellContent);
      values.put(key, value);
    }

    if (!values.containsKey(PROTOCOL)) {
      throw new DialectException(packetName, "Packet identifier has no '" + PROTOCOL + "' value: "
          + Logs.truncate(cellContent, MAX_ECHOED_BYTES));
    }
    return Collections.unmodifiableMap(values);
  }

  private static String skipLineBreaks(String text, String packetName, String cellContent) {
    String rest = text.stripLeading();
    while (rest.startsWith(LINE_BREAK)) {
      int end = rest.indexOf('>');
      if (end < 0) {
        throw formatError(packetName, cellContent);
      }
      rest = rest.substring(end + 1).stripLeading();
    }
    return rest;
  }

  private static DialectException formatError(String packetName, String cellContent) {
    return new DialectException(packetName,
        "Packet identifier format error: " + Logs.truncate(cellContent, MAX_ECHOED_BYTES));
  }
}
