package restore.bkup.impls;

import org.checkerframework.checker.nullness.qual.Nullable;
import restore.bkup.types.PasswordProvider;

public class StaticPasswordProvider implements PasswordProvider {

  private final @Nullable String password;

  public StaticPasswordProvider(@Nullable String password) {
    this.password = password;
  }

  @Override
  public @Nullable String password() {
    return password;
  }

  @Override
  public String toString() {
    return "StaticPasswordProvider(***)";
  }

}
