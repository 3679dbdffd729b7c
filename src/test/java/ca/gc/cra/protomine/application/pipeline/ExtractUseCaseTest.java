package ca.gc.cra.protomine.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.protomine.Fixtures;
import ca.gc.cra.protomine.application.extract.ExtractionResult;
import ca.gc.cra.protomine.application.port.MetricsPort;
import ca.gc.cra.protomine.application.port.PageSource;
import ca.gc.cra.protomine.config.CompositionRoot;
import ca.gc.cra.protomine.config.ExtractConfig;
import ca.gc.cra.protomine.domain.DialectException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class ExtractUseCaseTest {

  @Test
  void extractsFixturePage() throws IOException {
    List<String> observed = new ArrayList<>();
    List<String> counted = new ArrayList<>();
    MetricsPort metrics = new MetricsPort() {
      @Override
      public void increment(String key) {
        counted.add(key);
      }

      @Override
      public void observe(String key, long value) {
        observed.add(key);
      }
    };
    AtomicLong requested = new AtomicLong();
    PageSource source = revision -> {
      requested.set(revision);
      return Fixtures.page("protocol.wiki");
    };
    ExtractUseCase useCase = new CompositionRoot(ExtractConfig.defaults(), metrics).extractUseCase(source);

    ExtractionResult result = useCase.run(1234L);

    assertEquals(1234L, requested.get());
    assertEquals(4, result.packetCount());
    assertEquals(1, result.skipped().size());
    assertTrue(observed.contains("extract.page.latencyNanos"));
    assertEquals(4, counted.stream().filter("extract.packets.parsed"::equals).count());
    assertEquals(1, counted.stream().filter("extract.packets.skipped.symmetry"::equals).count());
  }

  @Test
  void readFailuresPropagate() {
    IOException failure = new IOException("offline");
    PageSource source = revision -> {
      throw failure;
    };
    ExtractUseCase useCase =
        new CompositionRoot(ExtractConfig.defaults(), MetricsPort.NO_OP).extractUseCase(source);

    IOException thrown = assertThrows(IOException.class, () -> useCase.run(1L));
    assertSame(failure, thrown);
  }

  @Test
  void dialectErrorsAbortTheRun() {
    PageSource source = revision -> "== Combat ==\n";
    ExtractUseCase useCase =
        new CompositionRoot(ExtractConfig.defaults(), MetricsPort.NO_OP).extractUseCase(source);

    assertThrows(DialectException.class, () -> useCase.run(1L));
  }
}
