package restore.prim.storage;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Bucket;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import com.google.cloud.storage.StorageOptions;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import restore.prim.ConfigurationException;
import restore.prim.NotFoundException;
import restore.prim.TransferException;
import restore.prim.UnsupportedCapabilityException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Google Cloud Storage.
 *
 * <p>Options: <code>bucketName</code> is required.  <code>credentialPath</code> names a
 * service account key file; without it, application default credentials are used.
 * Share links are V4 signed URLs and need the service account key, so sharing is only
 * offered when <code>credentialPath</code> is given.  <code>projectId</code> is optional.
 */
public class GcsStorage implements StorageBackend {

  private static final Logger LOG = LoggerFactory.getLogger(GcsStorage.class);
  private static final int NOT_FOUND = 404;

  private @Nullable Storage storage;
  private String bucketName;
  private boolean canSign;

  @Override
  public void initialize(Map<String, String> options) throws IOException {
    BackendOptions opts = BackendOptions.of("gcp", options).require("bucketName");
    opts.check();
    bucketName = opts.get("bucketName");
    @Nullable String credentialPath = opts.optional("credentialPath");

    StorageOptions.Builder builder = StorageOptions.newBuilder();
    if (credentialPath != null) {
      builder.setCredentials(credentials(credentialPath));
      canSign = true;
    }
    @Nullable String projectId = opts.optional("projectId");
    if (projectId != null) {
      builder.setProjectId(projectId);
    }

    try {
      storage = builder.build().getService();
      Bucket bucket = storage.get(bucketName);
      if (bucket == null) {
        throw new ConfigurationException("gcp: bucket " + bucketName + " does not exist");
      }
    } catch (StorageException e) {
      throw new TransferException("cannot reach bucket " + bucketName, e);
    }
  }

  static GoogleCredentials credentials(String credentialPath) throws IOException {
    try (InputStream in = Files.newInputStream(Paths.get(credentialPath))) {
      return GoogleCredentials.fromStream(in);
    } catch (NoSuchFileException e) {
      throw new ConfigurationException("gcp: credential file " + credentialPath + " does not exist", e);
    } catch (IOException | IllegalArgumentException e) {
      throw new ConfigurationException("gcp: credential file " + credentialPath + " is not a usable key file", e);
    }
  }

  private Storage storage() {
    if (storage == null) {
      throw new IllegalStateException("not initialized");
    }
    return storage;
  }

  @Override
  public void upload(Path localFile, String remotePath) throws IOException {
    BlobInfo info = BlobInfo.newBuilder(BlobId.of(bucketName, remotePath))
            .setContentType("application/octet-stream")
            .build();
    try {
      storage().createFrom(info, localFile);
    } catch (NoSuchFileException e) {
      throw new NotFoundException(localFile.toString(), e);
    } catch (StorageException e) {
      throw new TransferException("failed to upload " + remotePath, e);
    }
  }

  @Override
  public void download(String remotePath, Path localFile) throws IOException {
    try {
      Blob blob = storage().get(BlobId.of(bucketName, remotePath));
      if (blob == null) {
        throw new NotFoundException(remotePath);
      }
      Path parent = localFile.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      blob.downloadTo(localFile);
    } catch (StorageException e) {
      if (e.getCode() == NOT_FOUND) {
        throw new NotFoundException(remotePath, e);
      }
      throw new TransferException("failed to download " + remotePath, e);
    }
  }

  @Override
  public boolean exists(String remotePath) throws IOException {
    try {
      return storage().get(BlobId.of(bucketName, remotePath)) != null;
    } catch (StorageException e) {
      if (e.getCode() == NOT_FOUND) {
        return false;
      }
      throw new TransferException("failed to look up " + remotePath, e);
    }
  }

  @Override
  public void delete(String remotePath) throws IOException {
    try {
      storage().delete(BlobId.of(bucketName, remotePath));
    } catch (StorageException e) {
      if (e.getCode() != NOT_FOUND) {
        throw new TransferException("failed to delete " + remotePath, e);
      }
    }
  }

  @Override
  public boolean supportsSharing() {
    return canSign;
  }

  @Override
  public String generateShareLink(String remotePath, Duration expiration) throws IOException {
    if (!canSign) {
      throw new UnsupportedCapabilityException("gcp: share links need a service account key (credentialPath)");
    }
    try {
      URL url = storage().signUrl(
              BlobInfo.newBuilder(BlobId.of(bucketName, remotePath)).build(),
              expiration.toSeconds(), TimeUnit.SECONDS,
              Storage.SignUrlOption.withV4Signature());
      return url.toString();
    } catch (StorageException | IllegalArgumentException | IllegalStateException e) {
      throw new TransferException("failed to sign a URL for " + remotePath, e);
    }
  }

  @Override
  public void close() {
    Storage s = storage;
    storage = null;
    if (s != null) {
      try {
        s.close();
      } catch (Exception e) {
        LOG.warn("failed to close the client for bucket {}", bucketName, e);
      }
    }
  }

}
