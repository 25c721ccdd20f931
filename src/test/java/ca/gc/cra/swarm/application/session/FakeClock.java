package ca.gc.cra.swarm.application.session;

import ca.gc.cra.swarm.application.port.ClockPort;
import java.util.concurrent.atomic.AtomicLong;

/** Manually advanced clock. */
final class FakeClock implements ClockPort {
  private final AtomicLong now = new AtomicLong(1_000_000L);

  @Override
  public long nowMillis() {
    return now.get();
  }

  void advance(long millis) {
    now.addAndGet(millis);
  }
}
