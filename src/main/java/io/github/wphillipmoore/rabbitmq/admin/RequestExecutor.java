package io.github.wphillipmoore.rabbitmq.admin;

import io.github.wphillipmoore.rabbitmq.admin.exception.RabbitAdminException;
import io.github.wphillipmoore.rabbitmq.admin.exception.RabbitAdminRequestException;
import io.github.wphillipmoore.rabbitmq.admin.exception.RabbitAdminTransportException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.spi.LoggingEventBuilder;

/**
 * Executes one {@link AdminRequest}: dispatches it through the transport, classifies the status
 * code, logs the outcome and raises a typed failure.
 *
 * <p>Exactly one log record is emitted per call, at INFO on success and at ERROR on failure, with
 * the key/value pairs {@code method}, {@code url}, {@code params}, {@code status}, {@code message}
 * and {@code content}. Transport failures carry no {@code status}. Holds no per-call state.
 */
public final class RequestExecutor {

  static final String SUCCESS_MESSAGE = "Request execution success";
  static final String FAILURE_MESSAGE = "Error executing request";

  private final RabbitAdminTransport transport;
  private final Logger logger;
  private final @Nullable Duration timeout;
  private final boolean verifyTls;

  /**
   * Creates an executor.
   *
   * @param transport the HTTP transport
   * @param logger the logger receiving one record per request
   * @param timeout request timeout, or {@code null} for none
   * @param verifyTls whether to verify TLS certificates
   */
  public RequestExecutor(
      RabbitAdminTransport transport,
      Logger logger,
      @Nullable Duration timeout,
      boolean verifyTls) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.logger = Objects.requireNonNull(logger, "logger");
    this.timeout = timeout;
    this.verifyTls = verifyTls;
  }

  /**
   * Executes a request.
   *
   * @param request the assembled request
   * @return the response, for a status code outside 400 to 599
   * @throws RabbitAdminTransportException if the exchange could not be completed; other runtime
   *     failures of the transport are wrapped in one
   * @throws RabbitAdminRequestException if the broker answered with a 4xx or 5xx status
   */
  public AdminResponse execute(AdminRequest request) {
    String target = request.target();
    Map<String, Object> parameters = request.loggableParameters();

    TransportResponse transportResponse;
    try {
      transportResponse =
          transport.execute(
              request.method(),
              target,
              request.bodyParameters(),
              buildHeaders(request),
              timeout,
              verifyTls);
    } catch (RuntimeException e) {
      RuntimeException failure =
          e instanceof RabbitAdminException
              ? e
              : new RabbitAdminTransportException("HTTP request failed", target, e);
      logger
          .atError()
          .setMessage(FAILURE_MESSAGE)
          .addKeyValue("method", request.method().name())
          .addKeyValue("url", target)
          .addKeyValue("params", parameters)
          .addKeyValue("message", failure.getMessage())
          .setCause(failure)
          .log();
      throw failure;
    }

    AdminResponse response = AdminResponse.from(transportResponse);
    boolean failed = HttpStatuses.isError(response.statusCode());

    LoggingEventBuilder event = failed ? logger.atError() : logger.atInfo();
    event
        .setMessage(failed ? FAILURE_MESSAGE : SUCCESS_MESSAGE)
        .addKeyValue("method", request.method().name())
        .addKeyValue("url", target)
        .addKeyValue("params", parameters)
        .addKeyValue("status", response.statusCode())
        .addKeyValue("message", response.statusMessage())
        .addKeyValue("content", response.body())
        .log();

    if (failed) {
      throw new RabbitAdminRequestException(
          formatFailure(request.method(), target, parameters, response.statusMessage()),
          request.method().name(),
          target,
          parameters,
          response.statusCode(),
          response.statusMessage(),
          response.body());
    }
    return response;
  }

  private static Map<String, String> buildHeaders(AdminRequest request) {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("Accept", "application/json");
    headers.put("Authorization", request.auth().toHeaderValue());
    return headers;
  }

  /** Formats {@code Error executing request [METHOD] URL (k=v, ...): message}. */
  static String formatFailure(
      HttpMethod method, String url, Map<String, Object> parameters, String statusMessage) {
    StringJoiner params = new StringJoiner(", ", "(", ")");
    parameters.forEach((key, value) -> params.add(key + "=" + value));
    return FAILURE_MESSAGE
        + " ["
        + method.name()
        + "] "
        + url
        + " "
        + params
        + ": "
        + statusMessage;
  }
}
