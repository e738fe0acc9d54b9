package io.github.wphillipmoore.rabbitmq.admin.auth;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;

/**
 * Basic authentication credentials for the RabbitMQ management API.
 *
 * <p>Used to construct the {@code Authorization: Basic} header sent with every request.
 *
 * @param username the username, never null
 * @param password the password, never null
 */
public record BasicAuth(String username, String password) {

  /** Validates that username and password are non-null. */
  public BasicAuth {
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(password, "password");
  }

  /** Returns the {@code Authorization} header value for these credentials. */
  public String toHeaderValue() {
    String credentials = username + ":" + password;
    String encoded =
        Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    return "Basic " + encoded;
  }

  /** Keeps the password out of logs and exception messages. */
  @Override
  public String toString() {
    return "BasicAuth[username=" + username + ", password=********]";
  }
}
