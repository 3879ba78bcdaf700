package restore.prim.storage;

import restore.prim.ConfigurationException;
import restore.prim.NotFoundException;
import restore.prim.QuietAutoCloseable;
import restore.prim.TransferException;
import restore.prim.UnsupportedCapabilityException;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * A remote place to keep backup artifacts.
 *
 * <p>Remote paths are relative, <code>/</code>-separated keys such as
 * <code>backups/photos/backup_photos_20240101T000000000Z.tar.xz</code>.  Each
 * implementation maps them onto its own layout.
 *
 * <p>Instances are single-owner: one instance serves one unit of work (a backup, a
 * restore, a share) and is then {@link #close() closed}.  Instances are not shared
 * across concurrent operations.
 *
 * <p>Every implementation follows the same error contract:
 * <ul>
 *   <li>{@link ConfigurationException} from {@link #initialize(Map)} when required options
 *       are missing or malformed.  All offending keys are reported at once, and the
 *       check happens before any connection is attempted.</li>
 *   <li>{@link NotFoundException} when a local source or remote object does not
 *       exist.</li>
 *   <li>{@link TransferException} for network, authorization, or service failures.</li>
 *   <li>{@link UnsupportedCapabilityException} from {@link #generateShareLink(String, Duration)}
 *       on backends that cannot share, before any network call.</li>
 * </ul>
 */
public interface StorageBackend extends QuietAutoCloseable {

  /**
   * Validate options and open a session.  Must be called exactly once, before anything
   * else.  The map is not retained or modified.
   *
   * @param options backend-specific settings
   * @throws ConfigurationException if required keys are missing or malformed
   * @throws TransferException if the session cannot be established
   */
  void initialize(Map<String, String> options) throws IOException;

  /**
   * Store a local file under a remote path, replacing any existing object there.
   *
   * @throws NotFoundException if <code>localFile</code> does not exist
   * @throws TransferException if the upload fails
   */
  void upload(Path localFile, String remotePath) throws IOException;

  /**
   * Fetch a remote object into a local file, creating missing parent directories and
   * replacing the file if it exists.
   *
   * @throws NotFoundException if the remote object does not exist
   * @throws TransferException if the download fails
   */
  void download(String remotePath, Path localFile) throws IOException;

  /**
   * @return true if an object exists at <code>remotePath</code>
   * @throws TransferException if the backend could not be asked
   */
  boolean exists(String remotePath) throws IOException;

  /**
   * Remove a remote object.  Deleting an object that does not exist succeeds.
   *
   * @throws TransferException if the delete fails
   */
  void delete(String remotePath) throws IOException;

  /**
   * @return true if {@link #generateShareLink(String, Duration)} can succeed on this
   *         instance
   */
  default boolean supportsSharing() {
    return false;
  }

  /**
   * Create a time-limited URL through which anyone can download the object.
   *
   * @param remotePath an existing remote object
   * @param expiration how long the link stays valid
   * @return the URL
   * @throws UnsupportedCapabilityException if {@link #supportsSharing()} is false
   * @throws TransferException if the backend refuses
   */
  default String generateShareLink(String remotePath, Duration expiration) throws IOException {
    throw new UnsupportedCapabilityException(getClass().getSimpleName() + " cannot generate share links");
  }

  /**
   * Release the session.  Safe to call more than once, and safe to call on an
   * instance whose {@link #initialize(Map)} failed.
   */
  @Override
  void close();

}
