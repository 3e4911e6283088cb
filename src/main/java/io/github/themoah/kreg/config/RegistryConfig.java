package io.github.themoah.kreg.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration of every named broker the client registry connects to.
 */
public class RegistryConfig {

  private static final Logger log = LoggerFactory.getLogger(RegistryConfig.class);

  private static final String DEFAULT_CONFIG_FILE = "application.properties";
  private static final String PROP_STARTUP_MODE = "kafka.startup.mode";
  private static final String PROP_CONNECT_TIMEOUT_MS = "kafka.connect.timeout.ms";
  private static final String PROP_BROKER_PREFIX = "kafka.broker.";
  private static final String KEY_ADDRESS = "address";
  private static final String KEY_REQUIRED_ACKS = "required-acks";
  private static final String KEY_PARTITIONER = "partitioner";
  private static final String KEY_READ_TIMEOUT = "read-timeout-seconds";
  private static final String KEY_WRITE_TIMEOUT = "write-timeout-seconds";
  private static final String KEY_MAX_OPEN_REQUESTS = "max-open-requests";
  private static final String KEY_PROPERTY_PREFIX = "property.";

  private static final String DEFAULT_BROKER_NAME = "default";
  private static final StartupMode DEFAULT_STARTUP_MODE = StartupMode.PARTIAL;
  private static final long DEFAULT_CONNECT_TIMEOUT_MS = 10_000L;

  private final Map<String, BrokerConfig> brokers;
  private final StartupMode startupMode;
  private final long connectTimeoutMs;

  private RegistryConfig(Builder builder) {
    this.brokers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.brokers));
    this.startupMode = builder.startupMode;
    this.connectTimeoutMs = builder.connectTimeoutMs;
  }

  /**
   * Returns the configured brokers keyed by name, in declaration order.
   */
  public Map<String, BrokerConfig> getBrokers() {
    return brokers;
  }

  public StartupMode getStartupMode() {
    return startupMode;
  }

  public long getConnectTimeoutMs() {
    return connectTimeoutMs;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builds a single-broker configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>KAFKA_BOOTSTRAP_SERVERS - comma separated addresses (default: localhost:9092)</li>
   *   <li>KAFKA_BROKER_NAME - registry name of the broker (default: default)</li>
   *   <li>KAFKA_REQUIRED_ACKS - acknowledgment requirement (default: 1)</li>
   *   <li>KAFKA_PARTITIONER - 0 default, 1 random, 2 round-robin (default: 0)</li>
   *   <li>KAFKA_STARTUP_MODE - partial or all-or-nothing (default: partial)</li>
   * </ul>
   */
  public static RegistryConfig fromEnvironment() {
    Map<String, String> env = System.getenv();
    String name = env.getOrDefault("KAFKA_BROKER_NAME", DEFAULT_BROKER_NAME);

    BrokerConfig broker = BrokerConfig.builder(name)
      .address(env.getOrDefault("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
      .requiredAcks(parseInt("KAFKA_REQUIRED_ACKS", env.get("KAFKA_REQUIRED_ACKS"),
        BrokerConfig.DEFAULT_REQUIRED_ACKS))
      .partitioner(PartitionerType.fromCode(
        parseInt("KAFKA_PARTITIONER", env.get("KAFKA_PARTITIONER"), 0)))
      .build();

    return builder()
      .broker(broker)
      .startupMode(parseStartupMode(env.get("KAFKA_STARTUP_MODE")))
      .build();
  }

  /**
   * Loads configuration from the default application.properties file on the classpath.
   *
   * @return RegistryConfig loaded from classpath
   * @throws IOException if the config file cannot be read
   */
  public static RegistryConfig fromClasspath() throws IOException {
    return fromClasspath(DEFAULT_CONFIG_FILE);
  }

  /**
   * Loads configuration from a properties file on the classpath.
   *
   * @param resourceName the name of the properties file on the classpath
   * @return RegistryConfig loaded from the resource
   * @throws IOException if the config file cannot be read
   */
  public static RegistryConfig fromClasspath(String resourceName) throws IOException {
    log.info("Loading configuration from classpath: {}", resourceName);
    try (InputStream is = RegistryConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
      if (is == null) {
        throw new IOException("Resource not found on classpath: " + resourceName);
      }
      Properties props = new Properties();
      props.load(is);
      return fromProperties(props);
    }
  }

  /**
   * Loads configuration from a properties file at the given path.
   *
   * @param path the path to the properties file
   * @return RegistryConfig loaded from the file
   * @throws IOException if the file cannot be read
   */
  public static RegistryConfig fromFile(Path path) throws IOException {
    log.info("Loading configuration from file: {}", path);
    try (InputStream is = Files.newInputStream(path)) {
      Properties props = new Properties();
      props.load(is);
      return fromProperties(props);
    }
  }

  /**
   * Creates configuration from a Properties object.
   *
   * <p>Brokers are declared with {@code kafka.broker.<name>.<key>} entries; a broker
   * exists once its {@code address} is set. Keys under {@code property.} are copied
   * into the Kafka clients unchanged.
   *
   * @param props the properties containing kafka.* configuration
   * @return RegistryConfig built from the properties
   */
  public static RegistryConfig fromProperties(Properties props) {
    Builder builder = builder();

    String mode = props.getProperty(PROP_STARTUP_MODE);
    builder.startupMode(parseStartupMode(mode));

    builder.connectTimeoutMs(parseLong(PROP_CONNECT_TIMEOUT_MS,
      props.getProperty(PROP_CONNECT_TIMEOUT_MS), DEFAULT_CONNECT_TIMEOUT_MS));

    // Broker names in sorted order so the registry is built deterministically
    TreeSet<String> names = new TreeSet<>();
    for (String key : props.stringPropertyNames()) {
      if (key.startsWith(PROP_BROKER_PREFIX) && key.endsWith("." + KEY_ADDRESS)) {
        String name = key.substring(PROP_BROKER_PREFIX.length(), key.length() - KEY_ADDRESS.length() - 1);
        if (!name.isEmpty() && !name.contains(".")) {
          names.add(name);
        }
      }
    }

    for (String name : names) {
      builder.broker(brokerFromProperties(name, props));
    }

    log.info("Configuration loaded: brokers={}, startupMode={}", names, builder.startupMode);
    return builder.build();
  }

  private static BrokerConfig brokerFromProperties(String name, Properties props) {
    String prefix = PROP_BROKER_PREFIX + name + ".";
    BrokerConfig.Builder broker = BrokerConfig.builder(name)
      .address(props.getProperty(prefix + KEY_ADDRESS))
      .requiredAcks(parseInt(prefix + KEY_REQUIRED_ACKS,
        props.getProperty(prefix + KEY_REQUIRED_ACKS), BrokerConfig.DEFAULT_REQUIRED_ACKS))
      .partitioner(PartitionerType.fromCode(
        parseInt(prefix + KEY_PARTITIONER, props.getProperty(prefix + KEY_PARTITIONER), 0)))
      .readTimeoutSeconds(parseInt(prefix + KEY_READ_TIMEOUT,
        props.getProperty(prefix + KEY_READ_TIMEOUT), 0))
      .writeTimeoutSeconds(parseInt(prefix + KEY_WRITE_TIMEOUT,
        props.getProperty(prefix + KEY_WRITE_TIMEOUT), 0))
      .maxOpenRequests(parseInt(prefix + KEY_MAX_OPEN_REQUESTS,
        props.getProperty(prefix + KEY_MAX_OPEN_REQUESTS), 0));

    // kafka.broker.b1.property.security.protocol -> security.protocol
    String propertyPrefix = prefix + KEY_PROPERTY_PREFIX;
    for (String key : props.stringPropertyNames()) {
      if (key.startsWith(propertyPrefix)) {
        broker.property(key.substring(propertyPrefix.length()), props.getProperty(key));
      }
    }
    return broker.build();
  }

  private static StartupMode parseStartupMode(String value) {
    if (value == null || value.isBlank()) {
      return DEFAULT_STARTUP_MODE;
    }
    try {
      return StartupMode.parse(value);
    } catch (IllegalArgumentException e) {
      log.warn("Invalid startup mode: '{}', using default: {}", value, DEFAULT_STARTUP_MODE);
      return DEFAULT_STARTUP_MODE;
    }
  }

  private static int parseInt(String name, String value, int defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", name, value, defaultValue);
      return defaultValue;
    }
  }

  private static long parseLong(String name, String value, long defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", name, value, defaultValue);
      return defaultValue;
    }
  }

  public static class Builder {

    private final Map<String, BrokerConfig> brokers = new LinkedHashMap<>();
    private StartupMode startupMode = DEFAULT_STARTUP_MODE;
    private long connectTimeoutMs = DEFAULT_CONNECT_TIMEOUT_MS;

    public Builder broker(BrokerConfig broker) {
      Objects.requireNonNull(broker, "broker cannot be null");
      this.brokers.put(broker.name(), broker);
      return this;
    }

    public Builder startupMode(StartupMode startupMode) {
      this.startupMode = Objects.requireNonNull(startupMode, "startupMode cannot be null");
      return this;
    }

    public Builder connectTimeoutMs(long connectTimeoutMs) {
      this.connectTimeoutMs = connectTimeoutMs;
      return this;
    }

    public RegistryConfig build() {
      return new RegistryConfig(this);
    }
  }
}
