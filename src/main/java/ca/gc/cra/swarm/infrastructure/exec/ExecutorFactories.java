package ca.gc.cra.swarm.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the thread pools that run player sessions and soak workers.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size pool for player sessions.
   *
   * <p>The hand-off queue is unbounded; callers bound the number of queued sessions with their own admission
   * gate. A finishing session releases its admission permit before its thread returns to the pool, so a
   * zero-capacity queue would reject the next launch.</p>
   *
   * @param size number of session threads
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler installed on each thread
   * @return configured executor service
   */
  public static ExecutorService newSessionPool(int size, String prefix, UncaughtExceptionHandler handler) {
    requirePositive(size);
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        threadFactory(prefix, "swarm-session", handler),
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds a fixed-size pool that runs exactly {@code size} long-lived workers.
   *
   * @param size number of worker threads
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler installed on each thread
   * @return configured executor service rejecting any task beyond {@code size} concurrent ones
   */
  public static ExecutorService newWorkerPool(int size, String prefix, UncaughtExceptionHandler handler) {
    requirePositive(size);
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new SynchronousQueue<>(),
        threadFactory(prefix, "swarm-worker", handler),
        new ThreadPoolExecutor.AbortPolicy());
  }

  private static ThreadFactory threadFactory(
      String prefix, String defaultPrefix, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? defaultPrefix : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(false);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }

  private static void requirePositive(int size) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
  }
}
