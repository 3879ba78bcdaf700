package restore.prim;

import java.nio.file.Path;

/**
 * The persisted state file could not be read back.
 */
public class StateCorruptionException extends BackupException {

  public StateCorruptionException(Path file, Throwable cause) {
    super("state file " + file + " is unreadable: " + cause.getMessage(), cause);
  }

}
