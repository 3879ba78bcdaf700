package restore.bkup.impls;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import restore.bkup.types.Config;
import restore.bkup.types.ShareLink;
import restore.prim.BackupException;
import restore.prim.BackupException.Stage;
import restore.prim.NotFoundException;
import restore.prim.UnsupportedCapabilityException;
import restore.prim.storage.StorageBackend;
import restore.prim.storage.StorageRegistry;
import restore.prim.time.UnreliableWallClock;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Uploads a single file to a fresh remote location and hands out a time-limited link to it.
 */
public class ShareLinkIssuer {

  private static final Logger LOG = LoggerFactory.getLogger(ShareLinkIssuer.class);

  public static final String REMOTE_ROOT = "shared";

  private final Config config;
  private final StorageRegistry registry;
  private final UnreliableWallClock clock;

  public ShareLinkIssuer(Config config, StorageRegistry registry, UnreliableWallClock clock) {
    this.config = config;
    this.registry = registry;
    this.clock = clock;
  }

  /**
   * Share a local file.  Nothing is uploaded if the backend cannot make links.  If the
   * link cannot be made after the upload, the uploaded copy is deleted again.
   *
   * @param localPath the file to share
   * @param storageType where to put it
   * @param expiration how long the link works; must be positive
   * @return the link
   * @throws NotFoundException if <code>localPath</code> is not a regular file
   * @throws UnsupportedCapabilityException if the backend cannot make links
   */
  public ShareLink shareFile(Path localPath, String storageType, Duration expiration) throws IOException {
    if (expiration.isZero() || expiration.isNegative()) {
      throw new IllegalArgumentException("expiration must be positive, got " + expiration);
    }
    Stage stage = Stage.VALIDATE;
    try {
      if (!Files.isRegularFile(localPath)) {
        throw new NotFoundException(localPath.toString());
      }
      Path fileName = localPath.getFileName();
      String remotePath = REMOTE_ROOT + "/" + UUID.randomUUID() + "/" + (fileName == null ? "file" : fileName.toString());

      stage = Stage.RESOLVE;
      try (StorageBackend backend = registry.open(storageType, config.optionsFor(storageType))) {
        if (!backend.supportsSharing()) {
          throw new UnsupportedCapabilityException(storageType + " storage cannot make share links");
        }

        stage = Stage.UPLOAD;
        backend.upload(localPath, remotePath);

        stage = Stage.SHARE;
        Instant issued = clock.now();
        String url;
        try {
          url = backend.generateShareLink(remotePath, expiration);
        } catch (IOException | RuntimeException e) {
          try {
            backend.delete(remotePath);
          } catch (IOException | RuntimeException cleanup) {
            LOG.warn("could not delete {} after failing to share it", remotePath, cleanup);
            e.addSuppressed(cleanup);
          }
          throw e;
        }
        LOG.info("shared {} as {} until {}", localPath, remotePath, issued.plus(expiration));
        return new ShareLink(remotePath, issued.plus(expiration), url);
      }
    } catch (IOException e) {
      throw BackupException.at(stage, e);
    }
  }

}
