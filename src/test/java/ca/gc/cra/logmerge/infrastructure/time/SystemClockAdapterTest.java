package ca.gc.cra.logmerge.infrastructure.time;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class SystemClockAdapterTest {

  @Test
  void readsInjectedClock() {
    Instant fixed = Instant.parse("2024-01-01T00:00:00Z");
    SystemClockAdapter clock = new SystemClockAdapter(Clock.fixed(fixed, ZoneOffset.UTC));

    assertEquals(fixed.toEpochMilli(), clock.nowMillis());
    assertEquals(fixed, clock.now());
  }

  @Test
  void defaultClockIsCurrent() {
    long before = System.currentTimeMillis();
    long now = new SystemClockAdapter().nowMillis();

    assertTrue(now >= before);
  }
}
