package restore.prim;

/**
 * A network, authorization, or remote-service failure while moving bytes to or from a
 * storage backend.
 */
public class TransferException extends BackupException {

  public TransferException(String message) {
    super(message);
  }

  public TransferException(String message, Throwable cause) {
    super(message, cause);
  }

}
