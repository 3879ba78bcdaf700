package restore.bkup.impls;

import org.checkerframework.checker.nullness.qual.Nullable;
import restore.bkup.types.PasswordProvider;

/**
 * Reads the password from an environment variable.
 */
public class EnvironmentPasswordProvider implements PasswordProvider {

  public static final String DEFAULT_VARIABLE = "RESTORE_PASSWORD";

  private final String variable;

  public EnvironmentPasswordProvider() {
    this(DEFAULT_VARIABLE);
  }

  public EnvironmentPasswordProvider(String variable) {
    this.variable = variable;
  }

  @Override
  public @Nullable String password() {
    String value = System.getenv(variable);
    return value == null || value.isEmpty() ? null : value;
  }

}
