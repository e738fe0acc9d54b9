package io.github.wphillipmoore.rabbitmq.admin.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class BasicAuthTest {

  @Test
  void constructionWithValidValues() {
    BasicAuth auth = new BasicAuth("admin", "secret");

    assertThat(auth.username()).isEqualTo("admin");
    assertThat(auth.password()).isEqualTo("secret");
  }

  @Test
  void nullUsernameThrowsNullPointerException() {
    assertThatThrownBy(() -> new BasicAuth(null, "secret"))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("username");
  }

  @Test
  void nullPasswordThrowsNullPointerException() {
    assertThatThrownBy(() -> new BasicAuth("admin", null))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("password");
  }

  @Test
  void headerValueIsBase64OfUsernameColonPassword() {
    assertThat(new BasicAuth("guest", "guest").toHeaderValue())
        .isEqualTo("Basic Z3Vlc3Q6Z3Vlc3Q=");
  }

  @Test
  void headerValueEncodesUtf8() {
    assertThat(new BasicAuth("ü", "p").toHeaderValue()).isEqualTo("Basic w7w6cA==");
  }

  @Test
  void toStringHidesPassword() {
    BasicAuth auth = new BasicAuth("admin", "secret");

    assertThat(auth.toString()).contains("admin").doesNotContain("secret");
  }
}
