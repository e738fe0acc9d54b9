package io.github.wphillipmoore.rabbitmq.admin.examples;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.wphillipmoore.rabbitmq.admin.RabbitAdminClient;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;

/**
 * Integration tests for the runnable examples against a live broker.
 *
 * <p>Gated by the {@code RABBITMQ_ADMIN_RUN_INTEGRATION} environment variable.
 */
@EnabledIfEnvironmentVariable(named = "RABBITMQ_ADMIN_RUN_INTEGRATION", matches = ".+")
class ExamplesIT {

  RabbitAdminClient client() {
    return Clients.fromEnvironment();
  }

  @Test
  void topologyReport() {
    var report = TopologyReport.collect(client());

    assertThat(report.reachable()).isTrue();
    assertThat(report.nodes()).isNotEmpty();
  }

  @Test
  void provisionAndTeardown() {
    RabbitAdminClient client = client();
    try {
      var result = ProvisionEnvironment.provision(client);

      assertThat(result.objectsFailed()).isEmpty();
      assertThat(result.verified()).isTrue();
    } finally {
      assertThat(ProvisionEnvironment.teardown(client)).isEmpty();
    }
    assertThat(client.userExist(ProvisionEnvironment.APP_USER)).isFalse();
  }
}
