package io.github.wphillipmoore.rabbitmq.admin;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class HttpStatusesTest {

  @Test
  void errorIffWithinFourHundredToFiveNinetyNine() {
    IntStream.rangeClosed(100, 699)
        .forEach(
            code ->
                assertThat(HttpStatuses.isError(code))
                    .as("status %d", code)
                    .isEqualTo(code >= 400 && code <= 599));
  }

  @ParameterizedTest
  @ValueSource(ints = {200, 201, 204, 301, 302, 304, 399})
  void successAndRedirectCodesAreNotErrors(int code) {
    assertThat(HttpStatuses.isError(code)).isFalse();
  }

  @ParameterizedTest
  @ValueSource(ints = {400, 401, 404, 409, 500, 503, 599})
  void clientAndServerErrorsAreErrors(int code) {
    assertThat(HttpStatuses.isError(code)).isTrue();
  }

  @Test
  void reasonPhraseForKnownCode() {
    assertThat(HttpStatuses.reasonPhrase(404)).isEqualTo("Not Found");
  }

  @Test
  void reasonPhraseForUnknownCode() {
    assertThat(HttpStatuses.reasonPhrase(599)).isEqualTo("HTTP 599");
  }
}
