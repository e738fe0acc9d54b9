package io.github.wphillipmoore.rabbitmq.admin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TransportResponseTest {

  @Test
  void nullBodyThrowsNullPointerException() {
    assertThatThrownBy(() -> new TransportResponse(200, null, Map.of()))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("body");
  }

  @Test
  void nullHeadersThrowsNullPointerException() {
    assertThatThrownBy(() -> new TransportResponse(200, "", null))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("headers");
  }

  @Test
  void headersAreDefensivelyCopied() {
    HashMap<String, String> mutableHeaders = new HashMap<>();
    mutableHeaders.put("X-Key", "original");

    TransportResponse response = new TransportResponse(200, "", mutableHeaders);
    mutableHeaders.put("X-Key", "modified");

    assertThat(response.headers()).containsEntry("X-Key", "original");
    assertThatThrownBy(() -> response.headers().put("X-New", "value"))
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
