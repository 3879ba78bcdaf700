package restore.prim.storage;

import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Ints;
import org.checkerframework.checker.nullness.qual.Nullable;
import restore.prim.ConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A read-only view of the options handed to {@link StorageBackend#initialize(Map)},
 * with helpers that collect every problem before reporting any.
 *
 * <pre>
 *   BackendOptions opts = BackendOptions.of("s3", options);
 *   opts.require("accessKeyId", "secretAccessKey");
 *   opts.check();   // throws, naming every missing key
 * </pre>
 */
public final class BackendOptions {

  private final String backend;
  private final ImmutableMap<String, String> options;
  private final List<String> missing = new ArrayList<>();
  private final List<String> invalid = new ArrayList<>();

  private BackendOptions(String backend, Map<String, String> options) {
    this.backend = backend;
    this.options = ImmutableMap.copyOf(options);
  }

  public static BackendOptions of(String backend, Map<String, String> options) {
    return new BackendOptions(backend, options);
  }

  public boolean has(String key) {
    String value = options.get(key);
    return value != null && !value.isBlank();
  }

  /**
   * Note every key that is absent or blank.
   */
  public BackendOptions require(String... keys) {
    for (String key : keys) {
      if (!has(key)) {
        missing.add(key);
      }
    }
    return this;
  }

  /**
   * Note a requirement that is satisfied by any one of several keys.
   */
  public BackendOptions requireOneOf(String... keys) {
    for (String key : keys) {
      if (has(key)) {
        return this;
      }
    }
    missing.add(String.join("|", keys));
    return this;
  }

  /**
   * Parse an optional integer option, noting it as invalid when it is not an integer in
   * <code>[min, max]</code>.
   */
  public int intValue(String key, int defaultValue, int min, int max) {
    if (!has(key)) {
      return defaultValue;
    }
    Integer value = Ints.tryParse(options.get(key).trim());
    if (value != null && value >= min && value <= max) {
      return value;
    }
    invalid.add(key);
    return defaultValue;
  }

  /**
   * Throw if any earlier check failed.
   */
  public void check() throws ConfigurationException {
    if (!missing.isEmpty() || !invalid.isEmpty()) {
      throw ConfigurationException.forOptions(backend, missing, invalid);
    }
  }

  /**
   * @return the trimmed value of a key that {@link #check()} has vouched for
   */
  public String get(String key) {
    String value = options.get(key);
    if (value == null || value.isBlank()) {
      throw new IllegalStateException(backend + ": option " + key + " was not validated");
    }
    return value.trim();
  }

  public @Nullable String optional(String key) {
    return has(key) ? options.get(key).trim() : null;
  }

  public String optional(String key, String defaultValue) {
    return has(key) ? options.get(key).trim() : defaultValue;
  }

}
