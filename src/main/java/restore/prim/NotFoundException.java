package restore.prim;

/**
 * Thrown when a local source or a remote object does not exist.
 */
public class NotFoundException extends BackupException {

  private final String what;

  public NotFoundException(String what) {
    super("not found: " + what);
    this.what = what;
  }

  public NotFoundException(String what, Throwable cause) {
    super("not found: " + what, cause);
    this.what = what;
  }

  /**
   * The missing path or remote key.
   */
  public String what() {
    return what;
  }

}
