package io.github.wphillipmoore.rabbitmq.admin.exception;

import java.util.Objects;

/**
 * Thrown when the HTTP exchange with the management API could not be completed (connection
 * refused, DNS failure, interrupted send).
 */
public final class RabbitAdminTransportException extends RabbitAdminException {

  private static final long serialVersionUID = 1L;

  private final String url;

  /**
   * Creates a transport exception.
   *
   * @param message description of the failure
   * @param url the URL that was being accessed
   */
  public RabbitAdminTransportException(String message, String url) {
    super(message);
    this.url = Objects.requireNonNull(url, "url");
  }

  /**
   * Creates a transport exception with a cause.
   *
   * @param message description of the failure
   * @param url the URL that was being accessed
   * @param cause the underlying cause
   */
  public RabbitAdminTransportException(String message, String url, Throwable cause) {
    super(message, cause);
    this.url = Objects.requireNonNull(url, "url");
  }

  /** Returns the URL that was being accessed when the failure occurred. */
  public String getUrl() {
    return url;
  }
}
