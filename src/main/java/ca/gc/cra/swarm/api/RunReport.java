package ca.gc.cra.swarm.api;

import ca.gc.cra.swarm.application.harness.RunSummary;
import ca.gc.cra.swarm.application.session.TerminationReason;
import ca.gc.cra.swarm.domain.outcome.Counter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Renders the single summary block printed once a run has joined. */
final class RunReport {
  static final List<Counter> PLAY_COUNTERS = List.of(
      Counter.REGISTRATION_OK,
      Counter.REGISTRATION_FAILED,
      Counter.GAME_JOINED,
      Counter.ALL_IN,
      Counter.FOLD,
      Counter.SESSION_CRASHED);
  static final List<Counter> REGISTER_COUNTERS = List.of(
      Counter.REGISTRATION_OK,
      Counter.REGISTRATION_FAILED,
      Counter.SESSION_CRASHED);
  static final List<Counter> SOAK_COUNTERS = List.of(
      Counter.REQUEST_SENT,
      Counter.REQUEST_OK,
      Counter.REQUEST_FAILED);

  private RunReport() {}

  static Map<String, String> sessionRows(RunSummary summary, List<Counter> counters) {
    Map<String, String> rows = new LinkedHashMap<>();
    rows.put("Sessions launched", Long.toString(summary.launched()));
    rows.put("Sessions completed", Long.toString(summary.completed()));
    rows.put("Peak active sessions", Integer.toString(summary.peakActive()));
    for (Counter counter : counters) {
      rows.put(counter.label(), Long.toString(summary.counters().get(counter)));
    }
    for (TerminationReason reason : TerminationReason.values()) {
      long count = summary.terminations(reason);
      if (count > 0) {
        rows.put("Ended " + reason.name().toLowerCase(Locale.ROOT).replace('_', ' '), Long.toString(count));
      }
    }
    rows.put("Elapsed", formatSeconds(summary.elapsed().toMillis()));
    if (summary.interrupted()) {
      rows.put("Interrupted", "true");
    }
    return rows;
  }

  static Map<String, String> soakRows(RunSummary summary) {
    Map<String, String> rows = new LinkedHashMap<>();
    rows.put("Workers", Long.toString(summary.launched()));
    for (Counter counter : SOAK_COUNTERS) {
      rows.put(counter.label(), Long.toString(summary.counters().get(counter)));
    }
    long millis = summary.elapsed().toMillis();
    rows.put("Elapsed", formatSeconds(millis));
    if (millis > 0) {
      double perSecond = summary.counters().get(Counter.REQUEST_SENT) * 1000.0 / millis;
      rows.put("Requests per second", String.format(Locale.ROOT, "%.1f", perSecond));
    }
    if (summary.interrupted()) {
      rows.put("Interrupted", "true");
    }
    return rows;
  }

  private static String formatSeconds(long millis) {
    return String.format(Locale.ROOT, "%.3f s", millis / 1000.0);
  }
}
