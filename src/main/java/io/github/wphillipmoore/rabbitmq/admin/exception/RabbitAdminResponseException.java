package io.github.wphillipmoore.rabbitmq.admin.exception;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when the management API returned a success status but the body could not be decoded
 * into the expected JSON shape.
 *
 * <p>The {@code responseText} may be {@code null} if the response body was not available.
 */
public final class RabbitAdminResponseException extends RabbitAdminException {

  private static final long serialVersionUID = 1L;

  private final int statusCode;
  private final @Nullable String responseText;

  /**
   * Creates a response exception.
   *
   * @param message description of the failure
   * @param statusCode the HTTP status code of the response
   * @param responseText the raw response text, or {@code null} if unavailable
   */
  public RabbitAdminResponseException(
      String message, int statusCode, @Nullable String responseText) {
    super(message);
    this.statusCode = statusCode;
    this.responseText = responseText;
  }

  /**
   * Creates a response exception with a cause.
   *
   * @param message description of the failure
   * @param statusCode the HTTP status code of the response
   * @param responseText the raw response text, or {@code null} if unavailable
   * @param cause the underlying cause
   */
  public RabbitAdminResponseException(
      String message, int statusCode, @Nullable String responseText, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
    this.responseText = responseText;
  }

  /** Returns the HTTP status code, which was a success code. */
  public int getStatusCode() {
    return statusCode;
  }

  /**
   * Returns the raw response text, or {@code null} if the response body was not available.
   *
   * @return the response text, or {@code null}
   */
  public @Nullable String getResponseText() {
    return responseText;
  }
}
