package ca.gc.cra.swarm.application.harness;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.swarm.application.port.RequestProbe;
import ca.gc.cra.swarm.domain.outcome.Counter;
import ca.gc.cra.swarm.infrastructure.counters.AtomicOutcomeCounters;
import ca.gc.cra.swarm.infrastructure.time.SystemClockAdapter;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class TimedWorkerHarnessTest {
  private final AtomicOutcomeCounters counters = new AtomicOutcomeCounters();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void workersRunForTheDurationAndAccountForEveryRequest() {
    AtomicLong calls = new AtomicLong();
    RequestProbe probe = () -> {
      long call = calls.incrementAndGet();
      Thread.sleep(1);
      if (call % 3 == 0) {
        throw new IOException("connection reset");
      }
      return call % 3 == 1;
    };

    RunSummary summary = harness(4, Duration.ofMillis(300)).run(probe);

    long sent = summary.counters().get(Counter.REQUEST_SENT);
    long ok = summary.counters().get(Counter.REQUEST_OK);
    long failed = summary.counters().get(Counter.REQUEST_FAILED);
    assertTrue(sent > 0);
    assertEquals(sent, ok + failed);
    assertEquals(calls.get(), sent);
    assertTrue(ok > 0 && failed > 0);
    assertTrue(summary.elapsed().toMillis() >= 250, "elapsed " + summary.elapsed());
    assertEquals(4, summary.launched());
    assertFalse(summary.interrupted());
  }

  @Test
  void noRequestsAreSentAfterAllWorkersDrained() throws InterruptedException {
    AtomicLong calls = new AtomicLong();
    RequestProbe probe = () -> {
      calls.incrementAndGet();
      Thread.sleep(2);
      return true;
    };

    harness(2, Duration.ofMillis(100)).run(probe);
    long afterRun = calls.get();
    Thread.sleep(50);

    assertEquals(afterRun, calls.get());
  }

  @Test
  void crashedWorkersEndTheRunEarly() {
    RequestProbe probe = () -> {
      throw new IllegalStateException("boom");
    };

    RunSummary summary = harness(3, Duration.ofSeconds(30)).run(probe);

    assertEquals(3, metrics.count("soak.worker.crashed"));
    assertEquals(3, summary.counters().get(Counter.REQUEST_SENT));
    assertTrue(summary.elapsed().toSeconds() < 30);
  }

  @Test
  void rejectsNonPositiveSettings() {
    assertThrows(IllegalArgumentException.class, () -> harness(0, Duration.ofSeconds(1)));
    assertThrows(IllegalArgumentException.class, () -> harness(1, Duration.ZERO));
  }

  private TimedWorkerHarness harness(int workers, Duration duration) {
    return new TimedWorkerHarness(
        workers, duration, Duration.ofMillis(1), counters, metrics, SystemClockAdapter.INSTANCE);
  }
}
