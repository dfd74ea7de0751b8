package io.fullerstack.config;

import java.time.Duration;
import java.util.*;

/**
 * Hierarchical configuration backed by {@link ResourceBundle} property files.
 *
 * <p>Supports fallback chain:
 * <ol>
 *   <li>{bundle}_{context}-{scope}.properties (scope-specific)</li>
 *   <li>{bundle}_{context}.properties (context-specific)</li>
 *   <li>{bundle}.properties (module defaults)</li>
 * </ol>
 *
 * <p>Each level is loaded as its own {@link ResourceBundle} and lookups walk
 * the chain from the most specific level to the module defaults. Only the
 * defaults bundle is mandatory; missing override files are skipped.
 *
 * <p><strong>Example Property Files:</strong>
 * <pre>
 * # hub.properties (module defaults)
 * hub.channel-capacity=10000
 *
 * # hub_health.properties (context override)
 * hub.channel-capacity=16   # Health subscribers only need the latest few results
 * </pre>
 *
 * <p><strong>Usage:</strong>
 * <pre>
 * HierarchicalConfig defaults = HierarchicalConfig.forBundle("hub");
 * int capacity = defaults.getInt("hub.channel-capacity");
 *
 * HierarchicalConfig health = HierarchicalConfig.forContext("hub", "health");
 * int healthCapacity = health.getInt("hub.channel-capacity");
 * </pre>
 *
 * <p><strong>System Property Overrides:</strong>
 * <p>System properties take precedence over all property files:
 * <pre>
 * java -Dhub.channel-capacity=20000 -jar app.jar
 * </pre>
 */
public class HierarchicalConfig {

  private static final ResourceBundle.Control NO_FALLBACK =
    ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES);

  private final List<ResourceBundle> chain;  // Most specific first
  private final String context;  // For debugging/logging

  private HierarchicalConfig(List<ResourceBundle> chain, String context) {
    this.chain = List.copyOf(chain);
    this.context = context;
  }

  /**
   * Get module-level configuration ({bundle}.properties).
   *
   * @param baseName bundle base name (e.g., "hub", "series")
   * @return Module configuration
   * @throws ConfigurationException if the bundle cannot be found
   */
  public static HierarchicalConfig forBundle(String baseName) {
    requireName(baseName, "baseName");
    return new HierarchicalConfig(List.of(loadRequired(baseName)), baseName);
  }

  /**
   * Get context-specific configuration.
   *
   * <p>Fallback chain:
   * <ol>
   *   <li>{bundle}_{context}.properties</li>
   *   <li>{bundle}.properties</li>
   * </ol>
   *
   * @param baseName bundle base name
   * @param contextName context name (e.g., "health", "csv-replay")
   * @return Context-specific configuration
   */
  public static HierarchicalConfig forContext(String baseName, String contextName) {
    requireName(baseName, "baseName");
    requireName(contextName, "contextName");

    List<ResourceBundle> chain = new ArrayList<>();
    loadOptional(baseName + "_" + contextName).ifPresent(chain::add);
    chain.add(loadRequired(baseName));
    return new HierarchicalConfig(chain, baseName + ":" + contextName);
  }

  /**
   * Get scope-specific configuration inside a context.
   *
   * <p>Fallback chain:
   * <ol>
   *   <li>{bundle}_{context}-{scope}.properties</li>
   *   <li>{bundle}_{context}.properties</li>
   *   <li>{bundle}.properties</li>
   * </ol>
   *
   * @param baseName bundle base name
   * @param contextName context name
   * @param scopeName scope name inside the context
   * @return Scope-specific configuration
   */
  public static HierarchicalConfig forScope(String baseName, String contextName, String scopeName) {
    requireName(baseName, "baseName");
    requireName(contextName, "contextName");
    requireName(scopeName, "scopeName");

    List<ResourceBundle> chain = new ArrayList<>();
    loadOptional(baseName + "_" + contextName + "-" + scopeName).ifPresent(chain::add);
    loadOptional(baseName + "_" + contextName).ifPresent(chain::add);
    chain.add(loadRequired(baseName));
    return new HierarchicalConfig(chain, baseName + ":" + contextName + "/" + scopeName);
  }

  private static ResourceBundle loadRequired(String bundleName) {
    return loadOptional(bundleName).orElseThrow(() ->
      new ConfigurationException("No configuration bundle '" + bundleName + "' on the classpath")
    );
  }

  private static Optional<ResourceBundle> loadOptional(String bundleName) {
    try {
      return Optional.of(ResourceBundle.getBundle(bundleName, Locale.ROOT, NO_FALLBACK));
    } catch (MissingResourceException e) {
      return Optional.empty();
    }
  }

  private static void requireName(String value, String label) {
    Objects.requireNonNull(value, label + " cannot be null");
    if (value.isBlank()) {
      throw new IllegalArgumentException(label + " cannot be blank");
    }
  }

  // =========================================================================
  // Type-safe getters with system property override support
  // =========================================================================

  /**
   * Get string value.
   *
   * <p>Checks system properties first, then ResourceBundle.
   *
   * @param key Property key
   * @return Property value
   * @throws ConfigurationException if key not found
   */
  public String getString(String key) {
    String sysProp = System.getProperty(key);
    if (sysProp != null) {
      return sysProp;
    }

    String value = lookup(key);
    if (value == null) {
      throw new ConfigurationException(
        "Missing config key '" + key + "' in context: " + context
      );
    }
    return value;
  }

  /**
   * Get string value with default.
   *
   * @param key Property key
   * @param defaultValue Default if not found
   * @return Property value or default
   */
  public String getString(String key, String defaultValue) {
    String sysProp = System.getProperty(key);
    if (sysProp != null) {
      return sysProp;
    }

    String value = lookup(key);
    return value != null ? value : defaultValue;
  }

  private String lookup(String key) {
    for (ResourceBundle bundle : chain) {
      if (bundle.containsKey(key)) {
        return bundle.getString(key);
      }
    }
    return null;
  }

  /**
   * Get int value.
   *
   * @param key Property key
   * @return Property value as int
   * @throws ConfigurationException if key not found or invalid format
   */
  public int getInt(String key) {
    String value = getString(key).trim();
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new ConfigurationException(
        "Invalid int value for key '" + key + "': " + value, e
      );
    }
  }

  /**
   * Get int value with default.
   *
   * @param key Property key
   * @param defaultValue Default if not found
   * @return Property value as int or default
   * @throws ConfigurationException if the value is present but not an int
   */
  public int getInt(String key, int defaultValue) {
    return contains(key) ? getInt(key) : defaultValue;
  }

  /**
   * Get long value.
   *
   * @param key Property key
   * @return Property value as long
   * @throws ConfigurationException if key not found or invalid format
   */
  public long getLong(String key) {
    String value = getString(key).trim();
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new ConfigurationException(
        "Invalid long value for key '" + key + "': " + value, e
      );
    }
  }

  /**
   * Get long value with default.
   *
   * @param key Property key
   * @param defaultValue Default if not found
   * @return Property value as long or default
   * @throws ConfigurationException if the value is present but not a long
   */
  public long getLong(String key, long defaultValue) {
    return contains(key) ? getLong(key) : defaultValue;
  }

  /**
   * Get boolean value.
   *
   * @param key Property key
   * @return Property value as boolean
   */
  public boolean getBoolean(String key) {
    return Boolean.parseBoolean(getString(key).trim());
  }

  /**
   * Get boolean value with default.
   *
   * @param key Property key
   * @param defaultValue Default if not found
   * @return Property value as boolean or default
   */
  public boolean getBoolean(String key, boolean defaultValue) {
    String value = getString(key, null);
    if (value == null) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  /**
   * Get a duration expressed in milliseconds.
   *
   * @param key Property key (by convention ending in "-ms")
   * @param defaultValue Default if not found
   * @return Property value as a duration or default
   * @throws ConfigurationException if the value is present but not a long
   */
  public Duration getMillis(String key, Duration defaultValue) {
    return contains(key) ? Duration.ofMillis(getLong(key)) : defaultValue;
  }

  /**
   * Check if key exists in configuration.
   *
   * @param key Property key
   * @return true if key exists
   */
  public boolean contains(String key) {
    if (System.getProperty(key) != null) {
      return true;
    }
    return lookup(key) != null;
  }

  /**
   * Get all keys in this configuration level.
   *
   * @return Set of all keys
   */
  public Set<String> keys() {
    Set<String> keys = new TreeSet<>();
    chain.forEach(bundle -> keys.addAll(bundle.keySet()));
    return keys;
  }

  /**
   * Get configuration context (for debugging).
   *
   * @return Context description (e.g., "hub", "hub:health")
   */
  public String context() {
    return context;
  }

  @Override
  public String toString() {
    return "HierarchicalConfig[context=" + context + "]";
  }
}
