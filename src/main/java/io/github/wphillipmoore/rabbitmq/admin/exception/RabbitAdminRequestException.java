package io.github.wphillipmoore.rabbitmq.admin.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Thrown when the management API answers with a client or server error status (4xx or 5xx).
 *
 * <p>The {@code parameters} map is an unmodifiable, insertion-ordered copy of the query and body
 * parameters that were sent, with password values already masked.
 */
public final class RabbitAdminRequestException extends RabbitAdminException {

  private static final long serialVersionUID = 1L;

  private final String method;
  private final String url;
  private final Map<String, Object> parameters;
  private final int statusCode;
  private final String statusMessage;
  private final String responseText;

  /**
   * Creates a request exception.
   *
   * @param message description of the failure
   * @param method the HTTP method of the failed request
   * @param url the full request URL
   * @param parameters the request parameters (defensively copied as unmodifiable)
   * @param statusCode the HTTP status code
   * @param statusMessage the broker's message for the status
   * @param responseText the raw response body, empty if none
   */
  public RabbitAdminRequestException(
      String message,
      String method,
      String url,
      Map<String, Object> parameters,
      int statusCode,
      String statusMessage,
      String responseText) {
    super(message);
    this.method = Objects.requireNonNull(method, "method");
    this.url = Objects.requireNonNull(url, "url");
    this.parameters =
        Collections.unmodifiableMap(
            new LinkedHashMap<>(Objects.requireNonNull(parameters, "parameters")));
    this.statusCode = statusCode;
    this.statusMessage = Objects.requireNonNull(statusMessage, "statusMessage");
    this.responseText = Objects.requireNonNull(responseText, "responseText");
  }

  /** Returns the HTTP method of the failed request. */
  public String getMethod() {
    return method;
  }

  /** Returns the full URL of the failed request. */
  public String getUrl() {
    return url;
  }

  /**
   * Returns the parameters that were sent. The returned map is unmodifiable.
   *
   * @return an unmodifiable map of request parameters
   */
  public Map<String, Object> getParameters() {
    return parameters;
  }

  /** Returns the HTTP status code. */
  public int getStatusCode() {
    return statusCode;
  }

  /** Returns the broker's message for the status. */
  public String getStatusMessage() {
    return statusMessage;
  }

  /** Returns the raw response body. */
  public String getResponseText() {
    return responseText;
  }
}
