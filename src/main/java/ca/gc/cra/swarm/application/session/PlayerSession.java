package ca.gc.cra.swarm.application.session;

import ca.gc.cra.swarm.application.port.ClockPort;
import ca.gc.cra.swarm.application.port.OutcomeCounters;
import ca.gc.cra.swarm.application.port.ProtocolCodec;
import ca.gc.cra.swarm.application.port.SessionTransport;
import ca.gc.cra.swarm.application.port.TransportConnector;
import ca.gc.cra.swarm.domain.outcome.Counter;
import ca.gc.cra.swarm.domain.protocol.Action;
import ca.gc.cra.swarm.domain.protocol.Credentials;
import ca.gc.cra.swarm.domain.protocol.Registration;
import ca.gc.cra.swarm.domain.protocol.Request;
import ca.gc.cra.swarm.domain.protocol.ResponseKind;
import ca.gc.cra.swarm.domain.protocol.ServerResponse;
import ca.gc.cra.swarm.logging.Logs;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Finite automaton driving one simulated player through
 * {@code CONNECTING -> REGISTERING -> JOINING -> INTERACTING -> TERMINATED}.
 * <p><strong>Betting policy:</strong> the first own turn with a positive stack goes all-in; every own turn after
 * that folds. A turn with a non-positive stack before the all-in folds and leaves the all-in flag unset, so
 * the next funded turn still goes all-in.</p>
 * <p><strong>Failures:</strong> connect, timeout, decode, and protocol failures end this session only. Each is
 * converted into at most one counter increment and a log line; nothing propagates to the harness.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe. A session is owned by the task running it and
 * {@link #run()} may be invoked once.</p>
 * <p><strong>Observability:</strong> Log lines carry the username in the {@code player} MDC key.</p>
 *
 * @since 0.1.0
 */
public final class PlayerSession {
  /** MDC key holding the username of the session logging on the current thread. */
  public static final String MDC_PLAYER = "player";

  private static final Logger log = LoggerFactory.getLogger(PlayerSession.class);
  private static final int LOGGED_LINE_BYTES = 512;

  private final Credentials credentials;
  private final SessionSettings settings;
  private final TransportConnector connector;
  private final ProtocolCodec codec;
  private final OutcomeCounters counters;
  private final ClockPort clock;
  private final List<SessionState> history = new ArrayList<>(SessionState.values().length);

  private SessionState state = SessionState.CONNECTING;
  private boolean allInCommitted;
  private boolean started;

  /**
   * Creates a session that has not yet connected.
   *
   * @param credentials credentials derived from the session id
   * @param settings shared connection and timing parameters
   * @param connector opens the session's single connection
   * @param codec wire codec
   * @param counters run-wide outcome counters
   * @param clock time source for the activity deadline
   */
  public PlayerSession(
      Credentials credentials,
      SessionSettings settings,
      TransportConnector connector,
      ProtocolCodec codec,
      OutcomeCounters counters,
      ClockPort clock) {
    this.credentials = Objects.requireNonNull(credentials, "credentials");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.connector = Objects.requireNonNull(connector, "connector");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.counters = Objects.requireNonNull(counters, "counters");
    this.clock = Objects.requireNonNull(clock, "clock");
    history.add(state);
  }

  /**
   * Drives the session to {@link SessionState#TERMINATED}. The connection, if one was opened, is closed on
   * every exit path.
   *
   * @return terminal outcome
   * @throws IllegalStateException when the session already ran
   */
  public SessionResult run() {
    if (started) {
      throw new IllegalStateException("session " + credentials.username() + " already ran");
    }
    started = true;
    String previousPlayer = MDC.get(MDC_PLAYER);
    MDC.put(MDC_PLAYER, credentials.username());
    try {
      TerminationReason reason;
      try {
        reason = connectAndDrive();
      } finally {
        advance(SessionState.TERMINATED);
      }
      log.debug("Session ended: {}", reason);
      return new SessionResult(credentials.username(), reason, allInCommitted);
    } finally {
      if (previousPlayer == null) {
        MDC.remove(MDC_PLAYER);
      } else {
        MDC.put(MDC_PLAYER, previousPlayer);
      }
    }
  }

  /**
   * Returns the current state.
   *
   * @return current state
   */
  public SessionState state() {
    return state;
  }

  /**
   * Returns every state this session has entered, in order.
   *
   * @return immutable copy of the state history
   */
  public List<SessionState> history() {
    return List.copyOf(history);
  }

  /**
   * Indicates whether the one-time all-in bet has been placed.
   *
   * @return {@code true} once an all-in bet was sent
   */
  public boolean allInCommitted() {
    return allInCommitted;
  }

  /**
   * Returns the session username.
   *
   * @return username
   */
  public String username() {
    return credentials.username();
  }

  private TerminationReason connectAndDrive() {
    SessionTransport transport;
    try {
      transport = connector.open(settings.server(), settings.connectTimeout());
    } catch (IOException ex) {
      log.debug("Error dialing game server {}: {}", settings.server(), ex.getMessage());
      counters.increment(Counter.REGISTRATION_FAILED);
      return TerminationReason.CONNECT_FAILED;
    }

    try (transport) {
      advance(SessionState.REGISTERING);
      TerminationReason registration = register(transport);
      if (registration != TerminationReason.REGISTERED) {
        return registration;
      }
      if (settings.plan() == SessionPlan.REGISTER_ONLY) {
        return TerminationReason.REGISTERED;
      }

      advance(SessionState.JOINING);
      if (!join(transport)) {
        return TerminationReason.JOIN_FAILED;
      }

      advance(SessionState.INTERACTING);
      return interact(transport);
    }
  }

  private TerminationReason register(SessionTransport transport) {
    ServerResponse response;
    try {
      send(transport, Registration.of(credentials), settings.ioTimeout());
      response = receive(transport, settings.ioTimeout());
    } catch (IOException ex) {
      log.debug("Registration did not complete: {}", ex.getMessage());
      counters.increment(Counter.REGISTRATION_FAILED);
      return TerminationReason.REGISTRATION_INCOMPLETE;
    }

    if (response.kind() == ResponseKind.REGISTERED) {
      counters.increment(Counter.REGISTRATION_OK);
      log.debug("Successfully registered");
      return TerminationReason.REGISTERED;
    }
    counters.increment(Counter.REGISTRATION_FAILED);
    if (response.code() != 0) {
      log.debug("Registration failed: code {}, message '{}'", response.code(), response.message());
      return TerminationReason.REGISTRATION_REJECTED;
    }
    log.debug("Registration resulted in unexpected response: type='{}', message='{}'",
        response.type(), response.message());
    return TerminationReason.REGISTRATION_UNEXPECTED;
  }

  private boolean join(SessionTransport transport) {
    try {
      send(transport, Action.join(), settings.ioTimeout());
    } catch (IOException ex) {
      log.debug("Error sending join action: {}", ex.getMessage());
      return false;
    }
    counters.increment(Counter.GAME_JOINED);
    log.debug("Sent join action; waiting for game events");
    return true;
  }

  private TerminationReason interact(SessionTransport transport) {
    long deadline = clock.nowMillis() + settings.activityTimeout().toMillis();
    long ioMillis = settings.ioTimeout().toMillis();
    while (true) {
      long remaining = deadline - clock.nowMillis();
      if (remaining <= 0) {
        log.debug("Game activity timeout after {}; ending session", settings.activityTimeout());
        return TerminationReason.ACTIVITY_TIMEOUT;
      }

      ServerResponse response;
      try {
        response = receive(transport, Duration.ofMillis(Math.min(ioMillis, remaining)));
      } catch (IOException ex) {
        if (clock.nowMillis() >= deadline) {
          log.debug("Game activity timeout while waiting for the server; ending session");
          return TerminationReason.ACTIVITY_TIMEOUT;
        }
        log.debug("Exiting game loop: {}", ex.getMessage());
        return TerminationReason.CONNECTION_LOST;
      }

      switch (response.kind()) {
        case BET_TURN -> {
          if (response.isTurnFor(credentials.username()) && !takeTurn(transport, response)) {
            return TerminationReason.SEND_FAILED;
          }
        }
        case TERMINAL -> {
          log.debug("Received terminal event {}; ending session", response.type());
          if (!response.eventJson().isEmpty()) {
            log.debug("Terminal event data: {}", Logs.truncate(response.eventJson(), LOGGED_LINE_BYTES));
          }
          return TerminationReason.GAME_ENDED;
        }
        case BARE_ERROR -> log.warn("Received error from server: code {}, message '{}'",
            response.code(), response.message());
        case AMBIGUOUS -> log.debug("Received message with empty type and no error code: {}", response);
        default -> {
          // not relevant to the betting policy
        }
      }
    }
  }

  private boolean takeTurn(SessionTransport transport, ServerResponse turn) {
    long chips = turn.player().chips();
    log.debug("My turn to bet; stage '{}', chips {}, minimum bet {}", turn.stage(), chips, turn.minimumBet());
    try {
      if (allInCommitted) {
        send(transport, Action.fold(), settings.ioTimeout());
        counters.increment(Counter.FOLD);
      } else if (chips > 0) {
        send(transport, Action.bet(chips), settings.ioTimeout());
        counters.increment(Counter.ALL_IN);
        allInCommitted = true;
      } else {
        log.debug("Chips are {}; folding instead of going all-in", chips);
        send(transport, Action.fold(), settings.ioTimeout());
        counters.increment(Counter.FOLD);
      }
      return true;
    } catch (IOException ex) {
      log.debug("Error sending betting action: {}", ex.getMessage());
      return false;
    }
  }

  private void send(SessionTransport transport, Request request, Duration timeout) throws IOException {
    String line = codec.encode(request);
    log.debug("Sending: {}", request);
    transport.sendLine(line, timeout);
  }

  private ServerResponse receive(SessionTransport transport, Duration timeout) throws IOException {
    String line = transport.readLine(timeout);
    log.debug("Received: {}", Logs.truncate(line.strip(), LOGGED_LINE_BYTES));
    return codec.decode(line);
  }

  private void advance(SessionState next) {
    if (!state.canAdvanceTo(next)) {
      throw new IllegalStateException("illegal session transition " + state + " -> " + next);
    }
    state = next;
    history.add(next);
  }
}
