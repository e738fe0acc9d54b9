package io.github.wphillipmoore.rabbitmq.admin.examples;

import io.github.wphillipmoore.rabbitmq.admin.RabbitAdminClient;
import org.slf4j.LoggerFactory;

/** Builds a client for the examples from environment variables. */
final class Clients {

  static RabbitAdminClient fromEnvironment() {
    return new RabbitAdminClient.Builder(
            env("RABBITMQ_API_URL", "http://localhost:15672/api"),
            env("RABBITMQ_ADMIN_USER", "guest"),
            env("RABBITMQ_ADMIN_PASSWORD", "guest"))
        .logger(LoggerFactory.getLogger("io.github.wphillipmoore.rabbitmq.admin.examples"))
        .build();
  }

  static String env(String key, String defaultValue) {
    String value = System.getenv(key);
    return value != null ? value : defaultValue;
  }

  private Clients() {}
}
