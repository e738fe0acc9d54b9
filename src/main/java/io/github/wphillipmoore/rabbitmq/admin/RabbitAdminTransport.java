package io.github.wphillipmoore.rabbitmq.admin;

import java.time.Duration;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Transport interface for RabbitMQ management API HTTP communication.
 *
 * <p>Implementations perform exactly one HTTP exchange per call, with no retries, and should
 * throw {@link io.github.wphillipmoore.rabbitmq.admin.exception.RabbitAdminTransportException}
 * for network or connection failures. Error status codes are returned, not thrown.
 */
public interface RabbitAdminTransport {

  /**
   * Sends a request to the management API.
   *
   * @param method the HTTP method
   * @param url fully-qualified URL, including any query string
   * @param payload JSON-serializable request body, or {@code null} to send no body
   * @param headers HTTP headers to include in the request
   * @param timeout request timeout, or {@code null} for no timeout
   * @param verifyTls whether to verify TLS certificates
   * @return the transport response
   */
  TransportResponse execute(
      HttpMethod method,
      String url,
      @Nullable Map<String, Object> payload,
      Map<String, String> headers,
      @Nullable Duration timeout,
      boolean verifyTls);
}
