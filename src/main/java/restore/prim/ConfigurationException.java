package restore.prim;

import com.google.common.collect.ImmutableList;

import java.util.Collection;
import java.util.List;

/**
 * Thrown when configuration is missing or malformed: a backend was given incomplete
 * options, an unknown storage type was requested, or encryption was enabled without a
 * password.
 */
public class ConfigurationException extends BackupException {

  private final ImmutableList<String> keys;

  public ConfigurationException(String message) {
    super(message);
    this.keys = ImmutableList.of();
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
    this.keys = ImmutableList.of();
  }

  private ConfigurationException(String message, Collection<String> keys) {
    super(message);
    this.keys = ImmutableList.copyOf(keys);
  }

  /**
   * @param backend the backend whose options were rejected
   * @param missing required keys that were absent or blank
   * @param invalid keys that were present but unusable
   */
  public static ConfigurationException forOptions(String backend, List<String> missing, List<String> invalid) {
    StringBuilder message = new StringBuilder(backend).append(':');
    if (!missing.isEmpty()) {
      message.append(" missing required option(s) ").append(String.join(", ", missing));
    }
    if (!invalid.isEmpty()) {
      if (!missing.isEmpty()) {
        message.append(';');
      }
      message.append(" invalid option(s) ").append(String.join(", ", invalid));
    }
    return new ConfigurationException(message.toString(), ImmutableList.<String>builder().addAll(missing).addAll(invalid).build());
  }

  /**
   * The option keys this failure is about, if it is about options at all.
   */
  public List<String> keys() {
    return keys;
  }

}
