package restore.bkup.impls;

import org.checkerframework.checker.nullness.qual.Nullable;
import restore.bkup.Util;
import restore.bkup.types.PasswordProvider;

/**
 * Asks on the console the first time a password is needed and remembers the answer
 * until {@link #forget()}.
 */
public class ConsolePasswordProvider implements PasswordProvider {

  private final String prompt;
  private @Nullable String cached;

  public ConsolePasswordProvider(String prompt) {
    this.prompt = prompt;
  }

  @Override
  public synchronized @Nullable String password() {
    if (cached == null && System.console() != null) {
      cached = Util.readPassword(prompt);
    }
    return cached;
  }

  @Override
  public synchronized void forget() {
    cached = null;
  }

}
