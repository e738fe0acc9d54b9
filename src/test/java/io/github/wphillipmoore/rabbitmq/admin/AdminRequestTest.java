package io.github.wphillipmoore.rabbitmq.admin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.wphillipmoore.rabbitmq.admin.auth.BasicAuth;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AdminRequestTest {

  private static final String BASE_URL = "http://host:15672/api";
  private static final BasicAuth AUTH = new BasicAuth("guest", "guest");

  @Test
  void ofCarriesPathAndQueryWithoutBody() {
    UrlBuilder url = UrlBuilder.of(BASE_URL).segment("nodes").segment("n1").query("memory", "true");

    AdminRequest request = AdminRequest.of(HttpMethod.GET, url, AUTH);

    assertThat(request.url()).isEqualTo(BASE_URL + "/nodes/n1");
    assertThat(request.queryParameters()).containsEntry("memory", "true");
    assertThat(request.bodyParameters()).isNull();
    assertThat(request.target()).isEqualTo(BASE_URL + "/nodes/n1?memory=true");
  }

  @Test
  void bodyIsDefensivelyCopied() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("durable", true);

    AdminRequest request =
        AdminRequest.withBody(HttpMethod.PUT, UrlBuilder.of(BASE_URL), body, AUTH);
    body.put("durable", false);

    assertThat(request.bodyParameters()).containsEntry("durable", true);
    assertThatThrownBy(() -> request.bodyParameters().put("x", 1))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void loggableParametersMergeQueryAndBodyAndMaskPassword() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("password", "secret");
    body.put("tags", "monitoring");
    UrlBuilder url = UrlBuilder.of(BASE_URL).query("dry_run", "true");

    AdminRequest request = AdminRequest.withBody(HttpMethod.PUT, url, body, AUTH);

    assertThat(request.loggableParameters())
        .containsExactly(
            Map.entry("dry_run", "true"),
            Map.entry("password", AdminRequest.MASKED_VALUE),
            Map.entry("tags", "monitoring"));
    assertThat(request.bodyParameters()).containsEntry("password", "secret");
  }

  @Test
  void nullMethodThrowsNullPointerException() {
    assertThatThrownBy(() -> new AdminRequest(null, BASE_URL, Map.of(), null, AUTH))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("method");
  }

  @Test
  void nullAuthThrowsNullPointerException() {
    assertThatThrownBy(() -> new AdminRequest(HttpMethod.GET, BASE_URL, Map.of(), null, null))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("auth");
  }
}
