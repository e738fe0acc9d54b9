package io.github.wphillipmoore.rabbitmq.admin;

import java.util.Map;

/** Status code classification and reason phrases for management API responses. */
final class HttpStatuses {

  private static final Map<Integer, String> REASON_PHRASES =
      Map.ofEntries(
          Map.entry(200, "OK"),
          Map.entry(201, "Created"),
          Map.entry(202, "Accepted"),
          Map.entry(204, "No Content"),
          Map.entry(301, "Moved Permanently"),
          Map.entry(302, "Found"),
          Map.entry(304, "Not Modified"),
          Map.entry(400, "Bad Request"),
          Map.entry(401, "Unauthorized"),
          Map.entry(403, "Forbidden"),
          Map.entry(404, "Not Found"),
          Map.entry(405, "Method Not Allowed"),
          Map.entry(406, "Not Acceptable"),
          Map.entry(409, "Conflict"),
          Map.entry(415, "Unsupported Media Type"),
          Map.entry(500, "Internal Server Error"),
          Map.entry(502, "Bad Gateway"),
          Map.entry(503, "Service Unavailable"),
          Map.entry(504, "Gateway Timeout"));

  private HttpStatuses() {}

  /**
   * Returns whether the status code denotes a failed request.
   *
   * @param statusCode the HTTP status code
   * @return {@code true} for client and server errors (400 to 599 inclusive)
   */
  static boolean isError(int statusCode) {
    return statusCode >= 400 && statusCode <= 599;
  }

  /** Returns the standard reason phrase, or {@code "HTTP <code>"} for unlisted codes. */
  static String reasonPhrase(int statusCode) {
    String phrase = REASON_PHRASES.get(statusCode);
    return phrase != null ? phrase : "HTTP " + statusCode;
  }
}
