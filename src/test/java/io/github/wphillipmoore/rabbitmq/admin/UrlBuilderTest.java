package io.github.wphillipmoore.rabbitmq.admin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class UrlBuilderTest {

  private static final String BASE_URL = "http://host:15672/api";

  @Nested
  class Segments {

    @Test
    void baseUrlAloneHasNoTrailingSlash() {
      assertThat(UrlBuilder.of(BASE_URL + "//").path()).isEqualTo(BASE_URL);
    }

    @Test
    void joinsSegmentsWithSlash() {
      String url = UrlBuilder.of(BASE_URL).segment("queues").segment("shop").segment("q1").path();

      assertThat(url).isEqualTo(BASE_URL + "/queues/shop/q1");
    }

    @Test
    void defaultVhostBecomesEncodedToken() {
      String url = UrlBuilder.of(BASE_URL).segment("queues").segment("/").path();

      assertThat(url).endsWith("/queues/" + RabbitAdminClient.DEFAULT_VHOST_ENCODED);
    }

    @ParameterizedTest
    @CsvSource({
      "'/', %2F",
      "'a/b', a%2Fb",
      "'rabbit@host', rabbit%40host",
      "'my queue', my%20queue",
      "'a+b', a%2Bb",
      "'%2F', %252F",
      "'amq.topic', amq.topic"
    })
    void encodesEachSegmentOnce(String raw, String encoded) {
      assertThat(UrlBuilder.encodeSegment(raw)).isEqualTo(encoded);
    }

    @ParameterizedTest
    @ValueSource(strings = {"/", "prod/eu", "ünïcødé", "a b+c", "x%y"})
    void encodedSegmentRoundTripsThroughDecoding(String raw) {
      String url = UrlBuilder.of(BASE_URL).segment("queues").segment(raw).segment("q").path();

      String rawPath = URI.create(url).getRawPath();
      String[] parts = rawPath.split("/");
      assertThat(parts).hasSize(5);
      assertThat(URLDecoder.decode(parts[3], StandardCharsets.UTF_8)).isEqualTo(raw);
    }

    @Test
    void buildersAreImmutable() {
      UrlBuilder base = UrlBuilder.of(BASE_URL).segment("nodes");
      UrlBuilder node = base.segment("rabbit@host");

      assertThat(base.path()).isEqualTo(BASE_URL + "/nodes");
      assertThat(node.path()).isEqualTo(BASE_URL + "/nodes/rabbit%40host");
    }

    @Test
    void nullSegmentThrowsNullPointerException() {
      assertThatThrownBy(() -> UrlBuilder.of(BASE_URL).segment(null))
          .isInstanceOf(NullPointerException.class)
          .hasMessage("rawSegment");
    }
  }

  @Nested
  class Query {

    @Test
    void noQueryLeavesUrlUntouched() {
      assertThat(UrlBuilder.of(BASE_URL).segment("nodes").build()).isEqualTo(BASE_URL + "/nodes");
    }

    @Test
    void appendsQueryInInsertionOrder() {
      UrlBuilder url =
          UrlBuilder.of(BASE_URL).segment("nodes").query("memory", "true").query("binary", "true");

      assertThat(url.build()).isEqualTo(BASE_URL + "/nodes?memory=true&binary=true");
      assertThat(url.path()).isEqualTo(BASE_URL + "/nodes");
      assertThat(url.queryParameters()).containsKeys("memory", "binary");
    }

    @Test
    void encodesQueryKeysAndValues() {
      String url = UrlBuilder.of(BASE_URL).query("name", "a b&c").build();

      assertThat(url).isEqualTo(BASE_URL + "?name=a+b%26c");
    }

    @Test
    void repeatedKeyReplacesValue() {
      UrlBuilder url = UrlBuilder.of(BASE_URL).query("memory", "false").query("memory", "true");

      assertThat(url.build()).isEqualTo(BASE_URL + "?memory=true");
    }
  }
}
