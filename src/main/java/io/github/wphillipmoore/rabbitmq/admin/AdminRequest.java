package io.github.wphillipmoore.rabbitmq.admin;

import io.github.wphillipmoore.rabbitmq.admin.auth.BasicAuth;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * One assembled management API request. Created fresh for every operation and never reused.
 *
 * <p>Parameter maps are copied into unmodifiable, insertion-ordered maps.
 *
 * @param method the HTTP method
 * @param url the absolute URL with encoded path segments and no query string
 * @param queryParameters unencoded query parameters, never null
 * @param bodyParameters the JSON body, or {@code null} when no body is sent
 * @param auth the credentials to authenticate with
 */
public record AdminRequest(
    HttpMethod method,
    String url,
    Map<String, String> queryParameters,
    @Nullable Map<String, Object> bodyParameters,
    BasicAuth auth) {

  static final String MASKED_VALUE = "********";

  /** Validates non-null fields and copies the parameter maps. */
  public AdminRequest {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(url, "url");
    Objects.requireNonNull(auth, "auth");
    queryParameters =
        Collections.unmodifiableMap(
            new LinkedHashMap<>(Objects.requireNonNull(queryParameters, "queryParameters")));
    if (bodyParameters != null) {
      bodyParameters = Collections.unmodifiableMap(new LinkedHashMap<>(bodyParameters));
    }
  }

  /**
   * Creates a request without a body from a composed URL.
   *
   * @param method the HTTP method
   * @param url the composed URL
   * @param auth the credentials
   * @return the request
   */
  public static AdminRequest of(HttpMethod method, UrlBuilder url, BasicAuth auth) {
    return new AdminRequest(method, url.path(), url.queryParameters(), null, auth);
  }

  /**
   * Creates a request with a JSON body from a composed URL.
   *
   * @param method the HTTP method
   * @param url the composed URL
   * @param body the JSON body
   * @param auth the credentials
   * @return the request
   */
  public static AdminRequest withBody(
      HttpMethod method, UrlBuilder url, Map<String, Object> body, BasicAuth auth) {
    Objects.requireNonNull(body, "body");
    return new AdminRequest(method, url.path(), url.queryParameters(), body, auth);
  }

  /** Returns the URL with the encoded query string appended. */
  public String target() {
    return UrlBuilder.withQuery(url, queryParameters);
  }

  /**
   * Returns query and body parameters merged in that order, with any {@code password} value
   * masked. Suitable for logs and exception messages.
   */
  public Map<String, Object> loggableParameters() {
    Map<String, Object> result = new LinkedHashMap<>(queryParameters);
    if (bodyParameters != null) {
      result.putAll(bodyParameters);
    }
    result.replaceAll((key, value) -> "password".equals(key) ? MASKED_VALUE : value);
    return result;
  }
}
