package restore.prim.storage;

import com.azure.core.exception.AzureException;
import com.azure.storage.blob.BlobClient;
import com.azure.storage.blob.BlobContainerClient;
import com.azure.storage.blob.BlobContainerClientBuilder;
import com.azure.storage.blob.models.BlobErrorCode;
import com.azure.storage.blob.models.BlobStorageException;
import com.azure.storage.blob.sas.BlobSasPermission;
import com.azure.storage.blob.sas.BlobServiceSasSignatureValues;
import org.checkerframework.checker.nullness.qual.Nullable;
import restore.prim.NotFoundException;
import restore.prim.TransferException;
import restore.prim.UnsupportedCapabilityException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Map;

/**
 * Azure Blob Storage.
 *
 * <p>Options: <code>connectionString</code> and <code>containerName</code> are required.
 * The container is created if it does not exist.  Share links are read-only SAS URLs,
 * which can only be signed when the connection string carries an account key.
 */
public class AzureBlobStorage implements StorageBackend {

  private @Nullable BlobContainerClient container;
  private boolean canSign;

  @Override
  public void initialize(Map<String, String> options) throws IOException {
    BackendOptions opts = BackendOptions.of("azure", options).require("connectionString", "containerName");
    opts.check();
    String connectionString = opts.get("connectionString");
    canSign = connectionString.toLowerCase(Locale.ROOT).contains("accountkey=");
    try {
      container = new BlobContainerClientBuilder()
              .connectionString(connectionString)
              .containerName(opts.get("containerName"))
              .buildClient();
      container.createIfNotExists();
    } catch (AzureException | IllegalArgumentException e) {
      throw new TransferException("cannot reach container " + opts.get("containerName"), e);
    }
  }

  private BlobClient blob(String remotePath) {
    if (container == null) {
      throw new IllegalStateException("not initialized");
    }
    return container.getBlobClient(remotePath);
  }

  private static boolean isNotFound(BlobStorageException e) {
    return e.getStatusCode() == 404 || BlobErrorCode.BLOB_NOT_FOUND.equals(e.getErrorCode());
  }

  @Override
  public void upload(Path localFile, String remotePath) throws IOException {
    if (!Files.isRegularFile(localFile)) {
      throw new NotFoundException(localFile.toString());
    }
    try {
      blob(remotePath).uploadFromFile(localFile.toString(), true);
    } catch (AzureException | UncheckedIOException e) {
      throw new TransferException("failed to upload " + remotePath, e);
    }
  }

  @Override
  public void download(String remotePath, Path localFile) throws IOException {
    try {
      Path parent = localFile.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      blob(remotePath).downloadToFile(localFile.toString(), true);
    } catch (BlobStorageException e) {
      if (isNotFound(e)) {
        throw new NotFoundException(remotePath, e);
      }
      throw new TransferException("failed to download " + remotePath, e);
    } catch (AzureException | UncheckedIOException e) {
      throw new TransferException("failed to download " + remotePath, e);
    }
  }

  @Override
  public boolean exists(String remotePath) throws IOException {
    try {
      return blob(remotePath).exists();
    } catch (AzureException e) {
      throw new TransferException("failed to look up " + remotePath, e);
    }
  }

  @Override
  public void delete(String remotePath) throws IOException {
    try {
      blob(remotePath).deleteIfExists();
    } catch (AzureException e) {
      throw new TransferException("failed to delete " + remotePath, e);
    }
  }

  @Override
  public boolean supportsSharing() {
    return canSign;
  }

  @Override
  public String generateShareLink(String remotePath, Duration expiration) throws IOException {
    if (!canSign) {
      throw new UnsupportedCapabilityException("azure: share links need a connection string with an account key");
    }
    BlobClient blob = blob(remotePath);
    BlobServiceSasSignatureValues values = new BlobServiceSasSignatureValues(
            OffsetDateTime.now(ZoneOffset.UTC).plus(expiration),
            new BlobSasPermission().setReadPermission(true));
    try {
      return blob.getBlobUrl() + "?" + blob.generateSas(values);
    } catch (AzureException | IllegalStateException e) {
      throw new TransferException("failed to sign a URL for " + remotePath, e);
    }
  }

  @Override
  public void close() {
    container = null;
  }

}
