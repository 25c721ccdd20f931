package ca.gc.cra.swarm.application.harness;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.swarm.application.port.SessionTransport;
import ca.gc.cra.swarm.application.port.TransportConnector;
import ca.gc.cra.swarm.application.session.PlayerSession;
import ca.gc.cra.swarm.application.session.SessionFactory;
import ca.gc.cra.swarm.application.session.SessionPlan;
import ca.gc.cra.swarm.application.session.SessionSettings;
import ca.gc.cra.swarm.application.session.TerminationReason;
import ca.gc.cra.swarm.domain.outcome.Counter;
import ca.gc.cra.swarm.domain.protocol.Credentials;
import ca.gc.cra.swarm.infrastructure.counters.AtomicOutcomeCounters;
import ca.gc.cra.swarm.infrastructure.protocol.JsonProtocolCodec;
import ca.gc.cra.swarm.infrastructure.time.SystemClockAdapter;
import java.io.IOException;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class SessionHarnessTest {
  private static final String REGISTERED = "{\"type\":\"event_player_leaderboard_entry_start\"}";

  private final AtomicOutcomeCounters counters = new AtomicOutcomeCounters();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void launchesEverySessionWithinTheConcurrencyBound() {
    AtomicInteger inFlight = new AtomicInteger();
    AtomicInteger maxInFlight = new AtomicInteger();
    TransportConnector slowRefusal = (address, timeout) -> {
      int now = inFlight.incrementAndGet();
      maxInFlight.accumulateAndGet(now, Math::max);
      try {
        Thread.sleep(5);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      } finally {
        inFlight.decrementAndGet();
      }
      throw new ConnectException("Connection refused");
    };

    RunSummary summary = harness(4).run(factory(SessionPlan.PLAY, slowRefusal), 0, 40);

    assertEquals(40, summary.launched());
    assertEquals(40, summary.completed());
    assertTrue(summary.peakActive() <= 4, "peak was " + summary.peakActive());
    assertTrue(maxInFlight.get() <= 4, "connects in flight peaked at " + maxInFlight.get());
    assertEquals(40, summary.counters().get(Counter.REGISTRATION_FAILED));
    assertEquals(40, summary.terminations(TerminationReason.CONNECT_FAILED));
    assertFalse(summary.interrupted());
  }

  @Test
  void everyRegistrationIsCountedExactlyOnce() {
    AtomicInteger calls = new AtomicInteger();
    TransportConnector alternating = (address, timeout) -> {
      if (calls.getAndIncrement() % 2 == 1) {
        throw new ConnectException("Connection refused");
      }
      return new RegisteringTransport();
    };

    RunSummary summary = harness(3).run(factory(SessionPlan.REGISTER_ONLY, alternating), 100, 25);

    long ok = summary.counters().get(Counter.REGISTRATION_OK);
    long failed = summary.counters().get(Counter.REGISTRATION_FAILED);
    assertEquals(25, ok + failed);
    assertEquals(13, ok);
    assertEquals(ok, summary.terminations(TerminationReason.REGISTERED));
    assertEquals(0, summary.counters().get(Counter.GAME_JOINED));
  }

  @Test
  void crashingSessionIsCountedAndOthersContinue() {
    TransportConnector refusing = (address, timeout) -> {
      throw new ConnectException("Connection refused");
    };
    SessionFactory delegate = factory(SessionPlan.PLAY, refusing);
    SessionFactory flaky = id -> {
      if (id == 3) {
        throw new IllegalStateException("boom");
      }
      return delegate.create(id);
    };

    RunSummary summary = harness(2).run(flaky, 0, 10);

    assertEquals(10, summary.completed());
    assertEquals(1, summary.counters().get(Counter.SESSION_CRASHED));
    assertEquals(9, summary.counters().get(Counter.REGISTRATION_FAILED));
  }

  @Test
  void emitsSessionTimingsAndPeak() {
    TransportConnector refusing = (address, timeout) -> {
      throw new ConnectException("Connection refused");
    };

    harness(2).run(factory(SessionPlan.PLAY, refusing), 0, 6);

    assertEquals(6, metrics.observed("session.duration.millis").size());
    assertEquals(1, metrics.observed("session.active.peak").size());
  }

  @Test
  void interruptedLauncherStopsAdmittingAndRestoresTheFlag() {
    TransportConnector refusing = (address, timeout) -> {
      throw new ConnectException("Connection refused");
    };

    Thread.currentThread().interrupt();
    RunSummary summary = harness(2).run(factory(SessionPlan.PLAY, refusing), 0, 1_000);

    assertTrue(Thread.interrupted(), "interrupt flag should be restored");
    assertTrue(summary.interrupted());
    assertEquals(0, summary.launched());
    assertEquals(summary.launched(), summary.completed());
  }

  @Test
  void rejectsEmptyPopulation() {
    SessionFactory unused = id -> {
      throw new AssertionError("no session expected");
    };

    assertThrows(IllegalArgumentException.class, () -> harness(1).run(unused, 0, 0));
  }

  private SessionHarness harness(int concurrency) {
    return new SessionHarness(concurrency, 10, counters, metrics, SystemClockAdapter.INSTANCE);
  }

  private SessionFactory factory(SessionPlan plan, TransportConnector connector) {
    SessionSettings settings = new SessionSettings(
        InetSocketAddress.createUnresolved("localhost", 8083),
        plan,
        Duration.ofSeconds(1),
        Duration.ofSeconds(1),
        Duration.ofSeconds(1));
    JsonProtocolCodec codec = new JsonProtocolCodec();
    return id -> new PlayerSession(
        Credentials.derive("bot-", "pw", id), settings, connector, codec, counters, SystemClockAdapter.INSTANCE);
  }

  /** Accepts every registration. */
  private static final class RegisteringTransport implements SessionTransport {
    @Override
    public void sendLine(String line, Duration timeout) {}

    @Override
    public String readLine(Duration timeout) throws IOException {
      return REGISTERED;
    }

    @Override
    public void close() {}
  }
}
