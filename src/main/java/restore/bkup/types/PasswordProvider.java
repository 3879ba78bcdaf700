package restore.bkup.types;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Supplies the secret used to encrypt and decrypt archives.  Implementations must never
 * log or persist it.
 */
public interface PasswordProvider {

  /**
   * @return the password, or null if none is available
   */
  @Nullable String password();

  /**
   * Drop any cached password, for instance after it failed to decrypt something.
   */
  default void forget() {
  }

  PasswordProvider NONE = () -> null;

}
