package restore.prim;

/**
 * Thrown when an encrypted archive cannot be authenticated: the password is wrong or
 * the ciphertext has been tampered with.
 */
public class AuthenticationException extends BackupException {

  public AuthenticationException(String message, Throwable cause) {
    super(message, cause);
  }

}
