package ca.gc.cra.swarm.application.harness;

import ca.gc.cra.swarm.application.port.ClockPort;
import ca.gc.cra.swarm.application.port.MetricsPort;
import ca.gc.cra.swarm.application.port.OutcomeCounters;
import ca.gc.cra.swarm.application.port.RequestProbe;
import ca.gc.cra.swarm.domain.outcome.Counter;
import ca.gc.cra.swarm.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs a fixed population of stateless request workers against one target for a
 * wall-clock duration.
 * <p><strong>Concurrency:</strong> Workers share a single stop flag checked at the top of each iteration. When
 * the duration elapses the flag is raised and the harness waits for every worker to leave its loop, so one
 * in-flight request per worker may complete after the deadline.</p>
 * <p><strong>Failures:</strong> A non-success answer counts as failed. A transport error counts as failed and
 * the worker backs off before its next request.</p>
 *
 * @since 0.1.0
 */
public final class TimedWorkerHarness {
  private static final Logger log = LoggerFactory.getLogger(TimedWorkerHarness.class);

  private final int workers;
  private final Duration duration;
  private final Duration failureBackoff;
  private final OutcomeCounters counters;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a harness.
   *
   * @param workers number of concurrent workers; must be positive
   * @param duration how long workers keep sending; must be positive
   * @param failureBackoff pause after a transport error; zero disables it
   * @param counters run-wide counters
   * @param metrics metrics sink
   * @param clock time source
   */
  public TimedWorkerHarness(
      int workers,
      Duration duration,
      Duration failureBackoff,
      OutcomeCounters counters,
      MetricsPort metrics,
      ClockPort clock) {
    if (workers <= 0) {
      throw new IllegalArgumentException("workers must be positive");
    }
    this.duration = Objects.requireNonNull(duration, "duration");
    if (duration.isZero() || duration.isNegative()) {
      throw new IllegalArgumentException("duration must be positive");
    }
    this.failureBackoff = Objects.requireNonNull(failureBackoff, "failureBackoff");
    if (failureBackoff.isNegative()) {
      throw new IllegalArgumentException("failureBackoff must be >= 0");
    }
    this.workers = workers;
    this.counters = Objects.requireNonNull(counters, "counters");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Starts the workers, lets them run for the configured duration, stops and drains them.
   *
   * @param probe request sent by every worker iteration
   * @return summary built after every worker returned
   */
  public RunSummary run(RequestProbe probe) {
    Objects.requireNonNull(probe, "probe");
    long startedAt = clock.nowMillis();
    AtomicBoolean stop = new AtomicBoolean();
    AtomicInteger running = new AtomicInteger();
    CountDownLatch finished = new CountDownLatch(workers);
    ExecutorService pool = ExecutorFactories.newWorkerPool(
        workers, "swarm-soak", (thread, ex) -> log.error("Soak worker {} died", thread.getName(), ex));

    log.info("Starting {} workers for {} s", workers, duration.toSeconds());
    for (int i = 0; i < workers; i++) {
      int index = i;
      pool.execute(() -> {
        running.incrementAndGet();
        try {
          work(index, probe, stop);
        } finally {
          running.decrementAndGet();
          finished.countDown();
        }
      });
    }

    boolean interrupted = false;
    try {
      if (finished.await(duration.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("All workers stopped before the duration elapsed");
      }
    } catch (InterruptedException ex) {
      interrupted = true;
      log.warn("Interrupted before the duration elapsed; stopping workers");
    }
    stop.set(true);
    log.info("Duration ended; waiting for {} workers to finish", running.get());
    pool.shutdown();
    while (true) {
      try {
        finished.await();
        break;
      } catch (InterruptedException ex) {
        interrupted = true;
        pool.shutdownNow();
      }
    }

    Duration elapsed = Duration.ofMillis(Math.max(0L, clock.nowMillis() - startedAt));
    log.info("All {} workers finished in {} ms", workers, elapsed.toMillis());
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
    return new RunSummary(counters.snapshot(), Map.of(), workers, workers, workers, elapsed, interrupted);
  }

  private void work(int index, RequestProbe probe, AtomicBoolean stop) {
    try {
      while (!stop.get()) {
        counters.increment(Counter.REQUEST_SENT);
        boolean ok;
        try {
          ok = probe.send();
        } catch (IOException ex) {
          counters.increment(Counter.REQUEST_FAILED);
          log.debug("Worker {} request failed: {}", index, ex.getMessage());
          pause();
          continue;
        }
        counters.increment(ok ? Counter.REQUEST_OK : Counter.REQUEST_FAILED);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.debug("Worker {} interrupted", index);
    } catch (RuntimeException ex) {
      metrics.increment("soak.worker.crashed");
      log.error("Worker {} crashed", index, ex);
    }
  }

  private void pause() throws InterruptedException {
    if (!failureBackoff.isZero()) {
      Thread.sleep(failureBackoff.toMillis());
    }
  }
}
