/**
 * <strong>Purpose:</strong> Concurrency harnesses that run many sessions or workers and join them.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.swarm.application.harness.SessionHarness} bounds in-flight
 * sessions with an admission semaphore over a fixed pool; {@link ca.gc.cra.swarm.application.harness.TimedWorkerHarness}
 * stops a fixed worker population through one shared stop flag. Both report only after every task finished.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.swarm.application.harness;
