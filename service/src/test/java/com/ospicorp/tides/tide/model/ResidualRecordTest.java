package com.ospicorp.tides.tide.model;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.tides.tide.model.enums.TideKind;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ResidualRecordTest {
  private static final Instant T0 = Instant.parse("2021-06-01T00:00:00Z");

  @Test
  void residualIsObservedMinusPredicted() {
    ResidualRecord r = ResidualRecord.of(T0, 1.3, 1.1, TideKind.HIGH);

    assertEquals(1.3 - 1.1, r.residual());
    assertEquals(r, new ResidualRecord(T0, 1.3, 1.1, 1.3 - 1.1, TideKind.HIGH));
  }

  @Test
  void inconsistentResidualIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new ResidualRecord(T0, 1.3, 1.1, 0.5, null));
    assertThrows(IllegalArgumentException.class,
        () -> new ResidualRecord(T0, 1.3, 1.1, -(1.3 - 1.1), null));
  }
}
