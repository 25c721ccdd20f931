package ca.gc.cra.swarm.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validation of network endpoints supplied through configuration.
 *
 * @since 0.1.0
 */
public final class Net {
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Parses a {@code HOST:PORT} endpoint into an unresolved socket address. No DNS lookup is made.
   *
   * @param value raw endpoint
   * @return unresolved address
   * @throws IllegalArgumentException when malformed
   */
  public static InetSocketAddress parseHostPort(String value) {
    String sanitized = Strings.requireNonBlank("host:port", value);
    String host;
    String portPart;
    if (sanitized.startsWith("[")) {
      int idx = sanitized.indexOf(']');
      if (idx < 0) {
        throw new IllegalArgumentException("host:port must close IPv6 literal with ']'");
      }
      if (idx + 2 > sanitized.length() || sanitized.charAt(idx + 1) != ':') {
        throw new IllegalArgumentException("host:port must include :<port> after IPv6 literal");
      }
      host = sanitized.substring(1, idx);
      portPart = sanitized.substring(idx + 2);
      validateIpv6(host);
    } else {
      int lastColon = sanitized.lastIndexOf(':');
      if (lastColon <= 0 || lastColon == sanitized.length() - 1) {
        throw new IllegalArgumentException("host:port must use HOST:PORT format");
      }
      host = sanitized.substring(0, lastColon);
      portPart = sanitized.substring(lastColon + 1);
      if (host.indexOf(':') >= 0) {
        throw new IllegalArgumentException("IPv6 host must be wrapped in [ ]");
      }
      validateHost(host);
    }
    int port = (int) Numbers.parseInRange("port", portPart, 1, 65535);
    return InetSocketAddress.createUnresolved(host, port);
  }

  /**
   * Validates an absolute {@code http} or {@code https} URL with a host.
   *
   * @param name field name used in error messages
   * @param value raw URL
   * @return parsed URI
   * @throws IllegalArgumentException when malformed or not HTTP
   */
  public static URI validateHttpUrl(String name, String value) {
    String sanitized = Strings.requireNonBlank(name, value);
    URI uri;
    try {
      uri = new URI(sanitized);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(name + " is not a valid URL: " + sanitized, ex);
    }
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      throw new IllegalArgumentException(name + " must use http or https (was " + sanitized + ")");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException(name + " must include a host (was " + sanitized + ")");
    }
    return uri;
  }

  private static void validateHost(String host) {
    if (IPV4_PATTERN.matcher(host).matches()) {
      for (String octet : host.split("\\.")) {
        Numbers.requireRange("IPv4 octet", Integer.parseInt(octet), 0, 255);
      }
      return;
    }
    if (host.isEmpty() || host.length() > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException(
          "invalid hostname length: " + host.length() + " (must be 1.." + MAX_HOSTNAME_LENGTH + ')');
    }
    for (String label : host.split("\\.", -1)) {
      validateLabel(label);
    }
  }

  private static void validateLabel(String label) {
    if (label.isEmpty() || label.length() > MAX_LABEL_LENGTH) {
      throw new IllegalArgumentException(
          "invalid hostname: label length " + label.length() + " (must be 1.." + MAX_LABEL_LENGTH + ")");
    }
    if (!isAsciiAlnum(label.charAt(0)) || !isAsciiAlnum(label.charAt(label.length() - 1))) {
      throw new IllegalArgumentException("invalid hostname: labels must start/end with alphanumeric");
    }
    for (int i = 1; i < label.length() - 1; i++) {
      char c = label.charAt(i);
      if (!(isAsciiAlnum(c) || c == '-')) {
        throw new IllegalArgumentException("invalid hostname: illegal character '" + c + '\'');
      }
    }
  }

  private static void validateIpv6(String host) {
    try {
      if (!(InetAddress.getByName(host) instanceof Inet6Address)) {
        throw new IllegalArgumentException("invalid IPv6 literal: " + host);
      }
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException("invalid IPv6 literal: " + host, ex);
    }
  }

  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || (c >= '0' && c <= '9');
  }
}
