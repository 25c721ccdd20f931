package ca.gc.cra.swarm.application.harness;

import ca.gc.cra.swarm.application.port.ClockPort;
import ca.gc.cra.swarm.application.port.MetricsPort;
import ca.gc.cra.swarm.application.port.OutcomeCounters;
import ca.gc.cra.swarm.application.session.SessionFactory;
import ca.gc.cra.swarm.application.session.SessionResult;
import ca.gc.cra.swarm.application.session.TerminationReason;
import ca.gc.cra.swarm.domain.outcome.Counter;
import ca.gc.cra.swarm.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Launches one {@link ca.gc.cra.swarm.application.session.PlayerSession} per player id
 * with at most {@code maxConcurrency} of them active at any instant, then joins them all.
 * <p><strong>Concurrency:</strong> The launcher acquires an admission permit before each submit and blocks while
 * all permits are held. Each session releases its permit when it terminates. The join reacquires every permit,
 * so {@link #run(SessionFactory, long, long)} returns only after the last launched session finished.</p>
 * <p><strong>Failures:</strong> A runtime exception escaping a session is logged at error and counted as
 * {@link Counter#SESSION_CRASHED}; the remaining sessions keep running.</p>
 * <p><strong>Interrupts:</strong> Interrupting the launcher stops further admissions. Running sessions are
 * drained, the summary is flagged as interrupted and the thread's interrupt status is restored.</p>
 * <p><strong>Observability:</strong> Emits {@code session.duration.millis} per session and
 * {@code session.active.peak} once per run.</p>
 *
 * @since 0.1.0
 */
public final class SessionHarness {
  private static final Logger log = LoggerFactory.getLogger(SessionHarness.class);
  private static final long POOL_SHUTDOWN_TIMEOUT_MILLIS = 5_000L;

  private final int maxConcurrency;
  private final long progressEvery;
  private final OutcomeCounters counters;
  private final MetricsPort metrics;
  private final ClockPort clock;

  private final AtomicInteger active = new AtomicInteger();
  private final AtomicInteger peakActive = new AtomicInteger();
  private final AtomicLong completed = new AtomicLong();
  private final Map<TerminationReason, AtomicLong> terminations = new EnumMap<>(TerminationReason.class);

  /**
   * Creates a harness.
   *
   * @param maxConcurrency upper bound on simultaneously active sessions; must be positive
   * @param progressEvery log a progress line every this many launches; {@code 0} disables progress lines
   * @param counters run-wide counters shared with every session
   * @param metrics metrics sink for per-session timings
   * @param clock time source
   */
  public SessionHarness(
      int maxConcurrency,
      long progressEvery,
      OutcomeCounters counters,
      MetricsPort metrics,
      ClockPort clock) {
    if (maxConcurrency <= 0) {
      throw new IllegalArgumentException("maxConcurrency must be positive");
    }
    if (progressEvery < 0) {
      throw new IllegalArgumentException("progressEvery must be >= 0");
    }
    this.maxConcurrency = maxConcurrency;
    this.progressEvery = progressEvery;
    this.counters = Objects.requireNonNull(counters, "counters");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.clock = Objects.requireNonNull(clock, "clock");
    for (TerminationReason reason : TerminationReason.values()) {
      terminations.put(reason, new AtomicLong());
    }
  }

  /**
   * Runs {@code population} sessions with ids {@code firstId .. firstId + population - 1}.
   *
   * @param factory creates the session for each id
   * @param firstId id of the first session
   * @param population number of sessions to launch; must be positive
   * @return summary built after every launched session terminated
   */
  public RunSummary run(SessionFactory factory, long firstId, long population) {
    Objects.requireNonNull(factory, "factory");
    if (population <= 0) {
      throw new IllegalArgumentException("population must be positive");
    }
    long startedAt = clock.nowMillis();
    log.info("Launching {} sessions with at most {} concurrent", population, maxConcurrency);

    ExecutorService pool = ExecutorFactories.newSessionPool(
        maxConcurrency, "swarm-session", (thread, ex) -> log.error("Session thread {} died", thread.getName(), ex));
    Semaphore admission = new Semaphore(maxConcurrency);
    long launched = 0;
    boolean interrupted = false;
    try {
      for (long offset = 0; offset < population; offset++) {
        try {
          admission.acquire();
        } catch (InterruptedException ex) {
          interrupted = true;
          log.warn("Interrupted after launching {} of {} sessions; draining running sessions", launched, population);
          break;
        }
        long id = firstId + offset;
        try {
          pool.execute(() -> runSession(factory, id, admission));
        } catch (RejectedExecutionException ex) {
          admission.release();
          throw ex;
        }
        launched++;
        if (progressEvery > 0 && launched % progressEvery == 0) {
          log.info("Launched {} of {} sessions ({} active)", launched, population, active.get());
        }
      }
    } finally {
      admission.acquireUninterruptibly(maxConcurrency);
      interrupted |= shutdown(pool);
    }

    metrics.observe("session.active.peak", peakActive.get());
    Duration elapsed = Duration.ofMillis(Math.max(0L, clock.nowMillis() - startedAt));
    log.info("All {} launched sessions finished in {} ms", launched, elapsed.toMillis());
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
    return new RunSummary(
        counters.snapshot(),
        terminationCounts(),
        launched,
        completed.get(),
        peakActive.get(),
        elapsed,
        interrupted);
  }

  private void runSession(SessionFactory factory, long id, Semaphore admission) {
    int now = active.incrementAndGet();
    peakActive.accumulateAndGet(now, Math::max);
    long startedAt = clock.nowMillis();
    try {
      SessionResult result = factory.create(id).run();
      terminations.get(result.reason()).incrementAndGet();
    } catch (RuntimeException ex) {
      counters.increment(Counter.SESSION_CRASHED);
      log.error("Session {} crashed", id, ex);
    } finally {
      metrics.observe("session.duration.millis", Math.max(0L, clock.nowMillis() - startedAt));
      active.decrementAndGet();
      completed.incrementAndGet();
      admission.release();
    }
  }

  private boolean shutdown(ExecutorService pool) {
    pool.shutdown();
    try {
      if (!pool.awaitTermination(POOL_SHUTDOWN_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
        log.warn("Session threads still alive after {} ms; forcing shutdown", POOL_SHUTDOWN_TIMEOUT_MILLIS);
        pool.shutdownNow();
      }
      return false;
    } catch (InterruptedException ex) {
      pool.shutdownNow();
      return true;
    }
  }

  private Map<TerminationReason, Long> terminationCounts() {
    Map<TerminationReason, Long> counts = new EnumMap<>(TerminationReason.class);
    terminations.forEach((reason, count) -> {
      if (count.get() > 0) {
        counts.put(reason, count.get());
      }
    });
    return counts;
  }
}
