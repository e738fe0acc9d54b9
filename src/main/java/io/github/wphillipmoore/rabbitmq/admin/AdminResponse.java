package io.github.wphillipmoore.rabbitmq.admin;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import io.github.wphillipmoore.rabbitmq.admin.exception.RabbitAdminResponseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Result of executing an {@link AdminRequest}.
 *
 * <p>{@code decodedBody} is non-null only when the body is a JSON object or array and the
 * response content type, when present, names JSON. Objects decode to {@code Map}, arrays to
 * {@code List}, numbers to {@code Double}.
 *
 * @param statusCode the HTTP status code
 * @param statusMessage the broker's message for the status, never null
 * @param body the raw response body, never null
 * @param headers the response headers, never null, unmodifiable
 * @param decodedBody the decoded JSON body, or {@code null}
 */
public record AdminResponse(
    int statusCode,
    String statusMessage,
    String body,
    Map<String, String> headers,
    @Nullable Object decodedBody) {

  private static final Gson GSON = new Gson();

  /** Validates non-null fields and defensively copies headers. */
  public AdminResponse {
    Objects.requireNonNull(statusMessage, "statusMessage");
    Objects.requireNonNull(body, "body");
    headers = Map.copyOf(Objects.requireNonNull(headers, "headers"));
  }

  /**
   * Builds a response from the transport's answer, decoding the body and resolving the status
   * message.
   *
   * @param response the transport response
   * @return the admin response
   */
  static AdminResponse from(TransportResponse response) {
    Object decoded = decodeBody(response.body(), contentType(response.headers()));
    return new AdminResponse(
        response.statusCode(),
        resolveStatusMessage(response.statusCode(), decoded),
        response.body(),
        response.headers(),
        decoded);
  }

  /**
   * Returns the decoded body as a JSON object.
   *
   * @return a mutable copy of the decoded object
   * @throws RabbitAdminResponseException if the body is not a JSON object or is malformed JSON
   */
  @SuppressWarnings("unchecked")
  public Map<String, Object> requireObject() {
    if (!(decodedBody instanceof Map)) {
      rejectInvalidJson();
      throw new RabbitAdminResponseException("Response is not a JSON object", statusCode, body);
    }
    return new LinkedHashMap<>((Map<String, Object>) decodedBody);
  }

  /**
   * Returns the decoded body as a JSON array of objects.
   *
   * @return a mutable list of the decoded objects
   * @throws RabbitAdminResponseException if the body is not a JSON array of objects or is
   *     malformed JSON
   */
  @SuppressWarnings("unchecked")
  public List<Map<String, Object>> requireList() {
    if (!(decodedBody instanceof List)) {
      rejectInvalidJson();
      throw new RabbitAdminResponseException("Response is not a JSON array", statusCode, body);
    }
    List<Map<String, Object>> result = new ArrayList<>();
    for (Object item : (List<Object>) decodedBody) {
      if (!(item instanceof Map)) {
        throw new RabbitAdminResponseException(
            "Response array item is not a JSON object", statusCode, body);
      }
      result.add(new LinkedHashMap<>((Map<String, Object>) item));
    }
    return result;
  }

  static @Nullable Object decodeBody(String text, @Nullable String contentType) {
    if (!isJsonCandidate(text, contentType)) {
      return null;
    }
    try {
      return GSON.fromJson(text.strip(), Object.class);
    } catch (JsonParseException e) {
      // raised by rejectInvalidJson once a caller needs the body
      return null;
    }
  }

  /** Re-parses a JSON-looking body that failed to decode and raises the parse failure. */
  private void rejectInvalidJson() {
    if (decodedBody != null || !isJsonCandidate(body, contentType(headers))) {
      return;
    }
    try {
      GSON.fromJson(body.strip(), Object.class);
    } catch (JsonParseException e) {
      throw new RabbitAdminResponseException("Invalid JSON in response", statusCode, body, e);
    }
  }

  private static boolean isJsonCandidate(String text, @Nullable String contentType) {
    if (contentType != null && !contentType.toLowerCase(Locale.ROOT).contains("json")) {
      return false;
    }
    String trimmed = text.strip();
    return trimmed.startsWith("{") || trimmed.startsWith("[");
  }

  /**
   * Picks the broker's {@code reason} or {@code error} field from a JSON error body, falling back
   * to the standard reason phrase.
   */
  static String resolveStatusMessage(int statusCode, @Nullable Object decoded) {
    if (decoded instanceof Map<?, ?> map) {
      for (String key : new String[] {"reason", "error"}) {
        Object value = map.get(key);
        if (value instanceof String text && !text.isBlank()) {
          return text;
        }
      }
    }
    return HttpStatuses.reasonPhrase(statusCode);
  }

  private static @Nullable String contentType(Map<String, String> headers) {
    for (Map.Entry<String, String> entry : headers.entrySet()) {
      if ("content-type".equalsIgnoreCase(entry.getKey())) {
        return entry.getValue();
      }
    }
    return null;
  }
}
