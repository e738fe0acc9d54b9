package io.github.wphillipmoore.rabbitmq.admin.examples;

import io.github.wphillipmoore.rabbitmq.admin.RabbitAdminClient;
import io.github.wphillipmoore.rabbitmq.admin.exception.RabbitAdminException;
import java.util.List;
import java.util.Map;

/**
 * Broker topology report.
 *
 * <p>Prints the cluster name and version from {@code /overview}, each node with its running state
 * and memory use, and every queue with its message count. Unreachable brokers produce an empty
 * report instead of an exception.
 */
public final class TopologyReport {

  /** Summary of a single node. */
  public record NodeInfo(String name, boolean running, long memUsed) {}

  /** Summary of a single queue. */
  public record QueueInfo(String vhost, String name, long messages) {}

  /** The full report. */
  public record Report(
      boolean reachable,
      String clusterName,
      String version,
      List<NodeInfo> nodes,
      List<QueueInfo> queues) {

    /** Defensive copy of list fields. */
    public Report {
      nodes = List.copyOf(nodes);
      queues = List.copyOf(queues);
    }
  }

  /** Collect the report. */
  public static Report collect(RabbitAdminClient client) {
    Map<String, Object> overview;
    try {
      overview = client.getOverview();
    } catch (RabbitAdminException e) {
      return new Report(false, "UNKNOWN", "UNKNOWN", List.of(), List.of());
    }

    List<NodeInfo> nodes =
        client.getNodes().stream()
            .map(
                node ->
                    new NodeInfo(
                        str(node, "name"),
                        Boolean.TRUE.equals(node.get("running")),
                        number(node, "mem_used")))
            .toList();

    List<QueueInfo> queues =
        client.getQueues().stream()
            .map(
                queue ->
                    new QueueInfo(
                        str(queue, "vhost"), str(queue, "name"), number(queue, "messages")))
            .toList();

    return new Report(
        true, str(overview, "cluster_name"), str(overview, "rabbitmq_version"), nodes, queues);
  }

  /** Collect and print the report. */
  public static Report run(RabbitAdminClient client) {
    Report report = collect(client);
    if (!report.reachable()) {
      System.out.println("Broker unreachable.");
      return report;
    }

    System.out.printf("%n=== %s (RabbitMQ %s) ===%n", report.clusterName(), report.version());
    System.out.printf("%n%-40s %-8s %s%n", "Node", "Running", "Memory");
    System.out.println("-".repeat(70));
    for (NodeInfo node : report.nodes()) {
      System.out.printf("%-40s %-8s %d%n", node.name(), node.running(), node.memUsed());
    }

    System.out.printf("%n%-15s %-40s %s%n", "Vhost", "Queue", "Messages");
    System.out.println("-".repeat(70));
    for (QueueInfo queue : report.queues()) {
      System.out.printf("%-15s %-40s %d%n", queue.vhost(), queue.name(), queue.messages());
    }
    if (report.queues().isEmpty()) {
      System.out.println("  (no queues)");
    }
    return report;
  }

  private static String str(Map<String, Object> entry, String key) {
    return String.valueOf(entry.getOrDefault(key, "")).strip();
  }

  private static long number(Map<String, Object> entry, String key) {
    Object value = entry.get(key);
    return value instanceof Number n ? n.longValue() : 0L;
  }

  /** Entry point. */
  public static void main(String[] args) {
    run(Clients.fromEnvironment());
  }

  private TopologyReport() {}
}
