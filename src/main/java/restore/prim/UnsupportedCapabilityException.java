package restore.prim;

/**
 * A storage backend was asked for something it cannot do, such as a share link.
 */
public class UnsupportedCapabilityException extends BackupException {

  public UnsupportedCapabilityException(String message) {
    super(message);
  }

}
