package io.github.wphillipmoore.rabbitmq.admin;

/** HTTP methods used by the RabbitMQ management API operations. */
public enum HttpMethod {
  GET,
  PUT,
  POST,
  DELETE
}
