package io.github.wphillipmoore.rabbitmq.admin;

import io.github.wphillipmoore.rabbitmq.admin.auth.BasicAuth;
import io.github.wphillipmoore.rabbitmq.admin.exception.RabbitAdminException;
import io.github.wphillipmoore.rabbitmq.admin.exception.RabbitAdminRequestException;
import io.github.wphillipmoore.rabbitmq.admin.exception.RabbitAdminResponseException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

/**
 * Client for the RabbitMQ HTTP management API.
 *
 * <p>Each operation composes a URL and parameter set and hands it to a {@link RequestExecutor},
 * which performs exactly one HTTP exchange. Operations return a value or throw a {@link
 * RabbitAdminException}; only {@link #userExist(String)} never throws. Vhost and resource names
 * are passed unencoded and percent-encoded once per path segment.
 *
 * <p>Instances are created via the {@link Builder}:
 *
 * <pre>{@code
 * RabbitAdminClient client = new RabbitAdminClient.Builder(
 *         "http://localhost:15672/api", new BasicAuth("guest", "guest"))
 *     .logger(LoggerFactory.getLogger("rabbitmq.admin"))
 *     .build();
 * client.createQueue("orders");
 * }</pre>
 *
 * <p>The client holds no mutable state and is safe for concurrent use when its transport is.
 */
public final class RabbitAdminClient {

  /** The default virtual host. */
  public static final String DEFAULT_VHOST = "/";

  /** The default virtual host as it appears in a request path. */
  public static final String DEFAULT_VHOST_ENCODED = "%2F";

  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  private final String apiBaseUrl;
  private final BasicAuth credentials;
  private final RequestExecutor executor;

  private RabbitAdminClient(Builder builder) {
    this.apiBaseUrl = UrlBuilder.stripTrailingSlashes(builder.apiBaseUrl);
    this.credentials = builder.credentials;
    RabbitAdminTransport transport =
        builder.transport != null ? builder.transport : new HttpClientTransport();
    this.executor =
        new RequestExecutor(transport, builder.logger, builder.timeout, builder.verifyTls);
  }

  /** Returns the management API base URL, without trailing slashes. */
  public String getApiBaseUrl() {
    return apiBaseUrl;
  }

  /** Returns the username requests are authenticated as. */
  public String getUsername() {
    return credentials.username();
  }

  // ---------------------------------------------------------------------------
  // Users
  // ---------------------------------------------------------------------------

  /**
   * Creates or replaces a user.
   *
   * @param name the user name
   * @param password the password
   * @param tags user tags such as {@code administrator} or {@code monitoring}
   * @return {@code true}
   * @throws RabbitAdminException if the request fails
   */
  public boolean createUser(String name, String password, List<String> tags) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(password, "password");
    Objects.requireNonNull(tags, "tags");
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("password", password);
    body.put("tags", String.join(",", tags));
    execute(HttpMethod.PUT, api().segment("users").segment(name), body);
    return true;
  }

  /** Creates or replaces a user without tags. */
  public boolean createUser(String name, String password) {
    return createUser(name, password, List.of());
  }

  /**
   * Deletes a user.
   *
   * @param name the user name
   * @return {@code true}
   * @throws RabbitAdminException if the request fails
   */
  public boolean deleteUser(String name) {
    Objects.requireNonNull(name, "name");
    execute(HttpMethod.DELETE, api().segment("users").segment(name), null);
    return true;
  }

  /**
   * Returns a single user.
   *
   * @param name the user name
   * @return the decoded user object
   * @throws RabbitAdminRequestException if the user does not exist (404) or the request fails
   * @throws RabbitAdminResponseException if the body is not a JSON object
   */
  public Map<String, Object> getUser(String name) {
    Objects.requireNonNull(name, "name");
    return execute(HttpMethod.GET, api().segment("users").segment(name), null).requireObject();
  }

  /**
   * Returns whether a user exists. Any failure, including transport errors, counts as absent.
   *
   * @param name the user name
   * @return {@code true} if {@link #getUser(String)} succeeds
   */
  public boolean userExist(String name) {
    try {
      getUser(name);
      return true;
    } catch (RabbitAdminException e) {
      return false;
    }
  }

  /**
   * Returns all users.
   *
   * @return the decoded list of users
   * @throws RabbitAdminException if the request fails
   */
  public List<Map<String, Object>> getUsers() {
    return execute(HttpMethod.GET, api().segment("users"), null).requireList();
  }

  // ---------------------------------------------------------------------------
  // Permissions
  // ---------------------------------------------------------------------------

  /**
   * Sets a user's permissions on a vhost.
   *
   * @param name the user name
   * @param vhost the unencoded vhost name
   * @param configure regular expression for configure permission
   * @param write regular expression for write permission
   * @param read regular expression for read permission
   * @return {@code true}
   * @throws RabbitAdminException if the request fails
   */
  public boolean setUserPermissions(
      String name, String vhost, String configure, String write, String read) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(vhost, "vhost");
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("configure", Objects.requireNonNull(configure, "configure"));
    body.put("write", Objects.requireNonNull(write, "write"));
    body.put("read", Objects.requireNonNull(read, "read"));
    execute(HttpMethod.PUT, api().segment("permissions").segment(vhost).segment(name), body);
    return true;
  }

  /** Sets empty permissions for a user on the given vhost. */
  public boolean setUserPermissions(String name, String vhost) {
    return setUserPermissions(name, vhost, "", "", "");
  }

  /** Sets empty permissions for a user on the default vhost. */
  public boolean setUserPermissions(String name) {
    return setUserPermissions(name, DEFAULT_VHOST);
  }

  // ---------------------------------------------------------------------------
  // Queues
  // ---------------------------------------------------------------------------

  /**
   * Declares a durable, non auto-delete queue with no arguments.
   *
   * @param name the queue name
   * @param vhost the unencoded vhost name
   * @return {@code true}
   * @throws RabbitAdminException if the request fails
   */
  public boolean createQueue(String name, String vhost) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(vhost, "vhost");
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("auto_delete", false);
    body.put("durable", true);
    body.put("arguments", Map.of());
    execute(HttpMethod.PUT, api().segment("queues").segment(vhost).segment(name), body);
    return true;
  }

  /** Declares a queue on the default vhost. */
  public boolean createQueue(String name) {
    return createQueue(name, DEFAULT_VHOST);
  }

  /**
   * Deletes a queue.
   *
   * @param name the queue name
   * @param vhost the unencoded vhost name
   * @return {@code true}
   * @throws RabbitAdminException if the request fails
   */
  public boolean deleteQueue(String name, String vhost) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(vhost, "vhost");
    execute(HttpMethod.DELETE, api().segment("queues").segment(vhost).segment(name), null);
    return true;
  }

  /** Deletes a queue on the default vhost. */
  public boolean deleteQueue(String name) {
    return deleteQueue(name, DEFAULT_VHOST);
  }

  /**
   * Returns all queues across all vhosts.
   *
   * @return the decoded list of queues
   * @throws RabbitAdminException if the request fails
   */
  public List<Map<String, Object>> getQueues() {
    return execute(HttpMethod.GET, api().segment("queues"), null).requireList();
  }

  // ---------------------------------------------------------------------------
  // Bindings
  // ---------------------------------------------------------------------------

  /**
   * Binds a queue to an exchange.
   *
   * @param exchangeName the source exchange
   * @param queueName the destination queue
   * @param routingKey the routing key, or {@code null} to send none
   * @param vhost the unencoded vhost name
   * @param arguments binding arguments
   * @return {@code true}
   * @throws RabbitAdminException if the request fails
   */
  public boolean createBinding(
      String exchangeName,
      String queueName,
      @Nullable String routingKey,
      String vhost,
      Map<String, Object> arguments) {
    Objects.requireNonNull(exchangeName, "exchangeName");
    Objects.requireNonNull(queueName, "queueName");
    Objects.requireNonNull(vhost, "vhost");
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("arguments", new LinkedHashMap<>(Objects.requireNonNull(arguments, "arguments")));
    if (routingKey != null) {
      body.put("routing_key", routingKey);
    }
    UrlBuilder url =
        api()
            .segment("bindings")
            .segment(vhost)
            .segment("e")
            .segment(exchangeName)
            .segment("q")
            .segment(queueName);
    execute(HttpMethod.POST, url, body);
    return true;
  }

  /** Binds a queue to an exchange on the given vhost with no arguments. */
  public boolean createBinding(
      String exchangeName, String queueName, @Nullable String routingKey, String vhost) {
    return createBinding(exchangeName, queueName, routingKey, vhost, Map.of());
  }

  /** Binds a queue to an exchange on the default vhost with no arguments. */
  public boolean createBinding(
      String exchangeName, String queueName, @Nullable String routingKey) {
    return createBinding(exchangeName, queueName, routingKey, DEFAULT_VHOST);
  }

  /** Binds a queue to an exchange on the default vhost without a routing key. */
  public boolean createBinding(String exchangeName, String queueName) {
    return createBinding(exchangeName, queueName, null);
  }

  // ---------------------------------------------------------------------------
  // Topology
  // ---------------------------------------------------------------------------

  /**
   * Returns the cluster-wide overview.
   *
   * @return the decoded overview object
   * @throws RabbitAdminException if the request fails
   */
  public Map<String, Object> getOverview() {
    return execute(HttpMethod.GET, api().segment("overview"), null).requireObject();
  }

  /**
   * Returns all cluster nodes.
   *
   * @return the decoded list of nodes
   * @throws RabbitAdminException if the request fails
   */
  public List<Map<String, Object>> getNodes() {
    return execute(HttpMethod.GET, api().segment("nodes"), null).requireList();
  }

  /**
   * Returns a single node.
   *
   * @param name the node name, e.g. {@code rabbit@host}
   * @param includeMemory whether to request the memory breakdown ({@code ?memory=true})
   * @return the decoded node object
   * @throws RabbitAdminException if the request fails
   */
  public Map<String, Object> getNode(String name, boolean includeMemory) {
    Objects.requireNonNull(name, "name");
    UrlBuilder url = api().segment("nodes").segment(name);
    if (includeMemory) {
      url = url.query("memory", "true");
    }
    return execute(HttpMethod.GET, url, null).requireObject();
  }

  /** Returns a single node without the memory breakdown. */
  public Map<String, Object> getNode(String name) {
    return getNode(name, false);
  }

  private UrlBuilder api() {
    return UrlBuilder.of(apiBaseUrl);
  }

  private AdminResponse execute(
      HttpMethod method, UrlBuilder url, @Nullable Map<String, Object> body) {
    AdminRequest request =
        body != null
            ? AdminRequest.withBody(method, url, body, credentials)
            : AdminRequest.of(method, url, credentials);
    return executor.execute(request);
  }

  /** Builder for {@link RabbitAdminClient}. */
  public static final class Builder {

    private final String apiBaseUrl;
    private final BasicAuth credentials;
    private @Nullable RabbitAdminTransport transport;
    private Logger logger = NOPLogger.NOP_LOGGER;
    private boolean verifyTls = true;
    private @Nullable Duration timeout = DEFAULT_TIMEOUT;

    /**
     * Creates a builder with the required client parameters.
     *
     * @param apiBaseUrl the management API base URL, e.g. {@code http://host:15672/api}
     * @param credentials the basic auth credentials
     */
    public Builder(String apiBaseUrl, BasicAuth credentials) {
      this.apiBaseUrl = Objects.requireNonNull(apiBaseUrl, "apiBaseUrl");
      this.credentials = Objects.requireNonNull(credentials, "credentials");
    }

    /**
     * Creates a builder from a base URL, username and password.
     *
     * @param apiBaseUrl the management API base URL
     * @param username the username
     * @param password the password
     */
    public Builder(String apiBaseUrl, String username, String password) {
      this(apiBaseUrl, new BasicAuth(username, password));
    }

    /** Sets the transport implementation. Defaults to a new {@link HttpClientTransport}. */
    public Builder transport(RabbitAdminTransport transport) {
      this.transport = Objects.requireNonNull(transport, "transport");
      return this;
    }

    /** Sets the logger receiving one record per request. Defaults to a no-op logger. */
    public Builder logger(Logger logger) {
      this.logger = Objects.requireNonNull(logger, "logger");
      return this;
    }

    /** Sets whether to verify TLS certificates. Defaults to {@code true}. */
    public Builder verifyTls(boolean verifyTls) {
      this.verifyTls = verifyTls;
      return this;
    }

    /** Sets the request timeout. Defaults to 30 seconds. Pass {@code null} for no timeout. */
    public Builder timeout(@Nullable Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    /**
     * Builds the client.
     *
     * @return the configured client
     */
    public RabbitAdminClient build() {
      return new RabbitAdminClient(this);
    }
  }
}
