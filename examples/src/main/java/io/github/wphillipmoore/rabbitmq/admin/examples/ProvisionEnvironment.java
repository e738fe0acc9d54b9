package io.github.wphillipmoore.rabbitmq.admin.examples;

import io.github.wphillipmoore.rabbitmq.admin.RabbitAdminClient;
import io.github.wphillipmoore.rabbitmq.admin.exception.RabbitAdminException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Environment provisioner.
 *
 * <p>Creates an application user with permissions on the default vhost, a set of durable queues,
 * and bindings from {@code amq.direct} and {@code amq.topic}, then verifies the result. Includes
 * a teardown function to remove everything it provisioned.
 */
public final class ProvisionEnvironment {

  static final String PREFIX = "prov";
  static final String APP_USER = PREFIX + ".app";
  static final List<String> QUEUES = List.of(PREFIX + ".orders", PREFIX + ".invoices");

  /** Result of the provisioning operation. */
  public record ProvisionResult(
      List<String> objectsCreated, List<String> objectsFailed, boolean verified) {

    /** Defensive copy of list fields. */
    public ProvisionResult {
      objectsCreated = List.copyOf(objectsCreated);
      objectsFailed = List.copyOf(objectsFailed);
    }
  }

  /** Provision the user, queues and bindings. */
  public static ProvisionResult provision(RabbitAdminClient client) {
    List<String> created = new ArrayList<>();
    List<String> failed = new ArrayList<>();

    attempt(
        created,
        failed,
        "user " + APP_USER,
        () -> client.createUser(APP_USER, "changeit", List.of("monitoring")));
    attempt(
        created,
        failed,
        "permissions " + APP_USER,
        () ->
            client.setUserPermissions(
                APP_USER, RabbitAdminClient.DEFAULT_VHOST, "^" + PREFIX + "\\..*", ".*", ".*"));

    for (String queue : QUEUES) {
      attempt(created, failed, "queue " + queue, () -> client.createQueue(queue));
      attempt(
          created,
          failed,
          "binding amq.direct -> " + queue,
          () -> client.createBinding("amq.direct", queue, queue));
      attempt(
          created,
          failed,
          "binding amq.topic -> " + queue,
          () ->
              client.createBinding(
                  "amq.topic",
                  queue,
                  queue + ".#",
                  RabbitAdminClient.DEFAULT_VHOST,
                  Map.of("x-provisioned-by", PREFIX)));
    }

    return new ProvisionResult(created, failed, verify(client));
  }

  /** Remove the provisioned user and queues. Bindings go with their queues. */
  public static List<String> teardown(RabbitAdminClient client) {
    List<String> failures = new ArrayList<>();
    for (String queue : QUEUES) {
      try {
        client.deleteQueue(queue);
      } catch (RabbitAdminException e) {
        failures.add("queue " + queue + ": " + e.getMessage());
      }
    }
    try {
      client.deleteUser(APP_USER);
    } catch (RabbitAdminException e) {
      failures.add("user " + APP_USER + ": " + e.getMessage());
    }
    return failures;
  }

  /** Provision, report, and tear down the environment. */
  public static ProvisionResult run(RabbitAdminClient client) {
    System.out.println("\n=== Provisioning environment ===");
    ProvisionResult result = provision(client);

    System.out.printf("%nCreated: %d%n", result.objectsCreated().size());
    result.objectsCreated().forEach(obj -> System.out.printf("  + %s%n", obj));

    if (!result.objectsFailed().isEmpty()) {
      System.out.printf("%nFailed: %d%n", result.objectsFailed().size());
      result.objectsFailed().forEach(obj -> System.out.printf("  ! %s%n", obj));
    }

    System.out.printf("%nVerified: %s%n", result.verified());

    System.out.println("\n=== Tearing down ===");
    List<String> failures = teardown(client);
    if (failures.isEmpty()) {
      System.out.println("Teardown complete.");
    } else {
      System.out.printf("Teardown failures: %s%n", failures);
    }

    return result;
  }

  static boolean verify(RabbitAdminClient client) {
    if (!client.userExist(APP_USER)) {
      return false;
    }
    try {
      List<String> names =
          client.getQueues().stream().map(q -> String.valueOf(q.get("name"))).toList();
      return names.containsAll(QUEUES);
    } catch (RabbitAdminException e) {
      return false;
    }
  }

  private static void attempt(
      List<String> created, List<String> failed, String label, Runnable action) {
    try {
      action.run();
      created.add(label);
    } catch (RabbitAdminException e) {
      failed.add(label + ": " + e.getMessage());
    }
  }

  /** Entry point. */
  public static void main(String[] args) {
    run(Clients.fromEnvironment());
  }

  private ProvisionEnvironment() {}
}
