package ca.gc.cra.protomine;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/** Loads markup fixtures from {@code src/test/resources/pages}. */
public final class Fixtures {
  private Fixtures() {}

  public static String page(String name) {
    try (InputStream in = Fixtures.class.getResourceAsStream("/pages/" + name)) {
      if (in == null) {
        throw new IllegalStateException("missing fixture " + name);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }
}
