package ca.gc.cra.swarm.infrastructure.counters;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.swarm.application.port.MetricsPort;
import ca.gc.cra.swarm.domain.outcome.Counter;
import ca.gc.cra.swarm.domain.outcome.CounterSnapshot;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class AtomicOutcomeCountersTest {

  @Test
  void concurrentIncrementsAreNotLost() throws InterruptedException {
    AtomicOutcomeCounters counters = new AtomicOutcomeCounters();
    ExecutorService pool = Executors.newFixedThreadPool(8);
    for (int i = 0; i < 8; i++) {
      pool.execute(() -> {
        for (int n = 0; n < 10_000; n++) {
          counters.increment(Counter.FOLD);
        }
      });
    }
    pool.shutdown();
    pool.awaitTermination(30, TimeUnit.SECONDS);

    assertEquals(80_000, counters.get(Counter.FOLD));
    assertEquals(0, counters.get(Counter.ALL_IN));
  }

  @Test
  void incrementsAreMirroredUnderTheMetricKey() {
    Map<String, AtomicInteger> mirrored = new ConcurrentHashMap<>();
    MetricsPort metrics = new MetricsPort() {
      @Override
      public void increment(String key) {
        mirrored.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
      }

      @Override
      public void observe(String key, long value) {}
    };
    AtomicOutcomeCounters counters = new AtomicOutcomeCounters(metrics);

    counters.increment(Counter.REGISTRATION_OK);
    counters.increment(Counter.REGISTRATION_OK);
    counters.increment(Counter.REQUEST_FAILED);

    assertEquals(2, mirrored.get("session.registration.ok").get());
    assertEquals(1, mirrored.get("soak.request.failed").get());
  }

  @Test
  void snapshotIsDetachedFromLaterIncrements() {
    AtomicOutcomeCounters counters = new AtomicOutcomeCounters();
    counters.increment(Counter.GAME_JOINED);

    CounterSnapshot snapshot = counters.snapshot();
    counters.increment(Counter.GAME_JOINED);

    assertEquals(1, snapshot.get(Counter.GAME_JOINED));
    assertEquals(2, counters.get(Counter.GAME_JOINED));
    assertEquals(Counter.values().length, snapshot.values().size());
  }
}
