package io.github.wphillipmoore.rabbitmq.admin;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Immutable composer for management API URLs.
 *
 * <p>Each call to {@link #segment(String)} percent-encodes its argument once, so a name such as
 * {@code "/"} becomes a single {@code %2F} segment instead of a path separator. Every method
 * returns a new instance.
 *
 * <pre>{@code
 * String url = UrlBuilder.of("http://host:15672/api")
 *     .segment("queues").segment("/").segment("orders")
 *     .path();  // http://host:15672/api/queues/%2F/orders
 * }</pre>
 */
public final class UrlBuilder {

  private final String baseUrl;
  private final List<String> encodedSegments;
  private final Map<String, String> queryParameters;

  private UrlBuilder(
      String baseUrl, List<String> encodedSegments, Map<String, String> queryParameters) {
    this.baseUrl = baseUrl;
    this.encodedSegments = encodedSegments;
    this.queryParameters = queryParameters;
  }

  /**
   * Starts a URL from the API base URL. Trailing slashes are stripped.
   *
   * @param baseUrl the management API base URL, e.g. {@code http://host:15672/api}
   * @return a builder with no path segments and no query parameters
   */
  public static UrlBuilder of(String baseUrl) {
    return new UrlBuilder(
        stripTrailingSlashes(Objects.requireNonNull(baseUrl, "baseUrl")), List.of(), Map.of());
  }

  /**
   * Appends one path segment, percent-encoding it.
   *
   * @param rawSegment the unencoded segment
   * @return a new builder with the segment appended
   */
  public UrlBuilder segment(String rawSegment) {
    Objects.requireNonNull(rawSegment, "rawSegment");
    List<String> segments = new ArrayList<>(encodedSegments);
    segments.add(encodeSegment(rawSegment));
    return new UrlBuilder(baseUrl, Collections.unmodifiableList(segments), queryParameters);
  }

  /**
   * Adds a query parameter. A repeated key replaces the earlier value but keeps its position.
   *
   * @param key the unencoded parameter name
   * @param value the unencoded parameter value
   * @return a new builder with the parameter added
   */
  public UrlBuilder query(String key, String value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    Map<String, String> query = new LinkedHashMap<>(queryParameters);
    query.put(key, value);
    return new UrlBuilder(baseUrl, encodedSegments, Collections.unmodifiableMap(query));
  }

  /** Returns the base URL followed by the encoded path, without the query string. */
  public String path() {
    if (encodedSegments.isEmpty()) {
      return baseUrl;
    }
    return baseUrl + "/" + String.join("/", encodedSegments);
  }

  /** Returns the unencoded query parameters in insertion order. The map is unmodifiable. */
  public Map<String, String> queryParameters() {
    return queryParameters;
  }

  /** Returns the full URL including the encoded query string, if any. */
  public String build() {
    return withQuery(path(), queryParameters);
  }

  /**
   * Percent-encodes a single path segment. Spaces become {@code %20}, and {@code /} becomes
   * {@code %2F}.
   */
  static String encodeSegment(String rawSegment) {
    return URLEncoder.encode(rawSegment, StandardCharsets.UTF_8).replace("+", "%20");
  }

  /** Appends {@code ?k=v&...} to the URL, encoding keys and values. */
  static String withQuery(String url, Map<String, String> queryParameters) {
    if (queryParameters.isEmpty()) {
      return url;
    }
    StringJoiner query = new StringJoiner("&", url + "?", "");
    queryParameters.forEach(
        (key, value) ->
            query.add(
                URLEncoder.encode(key, StandardCharsets.UTF_8)
                    + "="
                    + URLEncoder.encode(value, StandardCharsets.UTF_8)));
    return query.toString();
  }

  static String stripTrailingSlashes(String url) {
    int end = url.length();
    while (end > 0 && url.charAt(end - 1) == '/') {
      end--;
    }
    return url.substring(0, end);
  }
}
