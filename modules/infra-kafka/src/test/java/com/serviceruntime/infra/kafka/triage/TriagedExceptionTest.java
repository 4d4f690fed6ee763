package com.serviceruntime.infra.kafka.triage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.net.ConnectException;
import org.junit.jupiter.api.Test;

class TriagedExceptionTest {
  @Test
  void shouldReportFixedSeverity() {
    assertEquals(Severity.FATAL, new LedgerCorrupted().severity());
  }

  @Test
  void shouldDeferToCauseSeverity() {
    assertEquals(
        Severity.TRANSIENT, new PriceLookupFailed(new ConnectException("refused")).severity());
    assertEquals(
        Severity.FATAL, new PriceLookupFailed(new LedgerCorrupted()).severity());
    assertEquals(
        Severity.PERMANENT,
        new PriceLookupFailed(new IllegalArgumentException("bad symbol")).severity());
  }

  @Test
  void shouldRequireCauseWhenDeferring() {
    assertThrows(NullPointerException.class, () -> new PriceLookupFailed(null));
  }

  private static final class LedgerCorrupted extends TriagedException {
    private LedgerCorrupted() {
      super("ledger corrupted", Severity.FATAL);
    }
  }

  private static final class PriceLookupFailed extends TriagedException {
    private PriceLookupFailed(Throwable cause) {
      super("price lookup failed", cause);
    }
  }
}
