package io.github.wphillipmoore.rabbitmq.admin.exception;

/**
 * Base exception for all RabbitMQ management API errors.
 *
 * <p>This is an unchecked exception hierarchy. All admin client errors extend this sealed class.
 */
public sealed class RabbitAdminException extends RuntimeException
    permits RabbitAdminTransportException,
        RabbitAdminRequestException,
        RabbitAdminResponseException {

  private static final long serialVersionUID = 1L;

  /** Creates an exception with the given message. */
  public RabbitAdminException(String message) {
    super(message);
  }

  /** Creates an exception with the given message and cause. */
  public RabbitAdminException(String message, Throwable cause) {
    super(message, cause);
  }
}
