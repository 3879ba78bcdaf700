package restore.prim.storage;

import com.dropbox.core.DbxDownloader;
import com.dropbox.core.DbxException;
import com.dropbox.core.DbxRequestConfig;
import com.dropbox.core.oauth.DbxCredential;
import com.dropbox.core.v2.DbxClientV2;
import com.dropbox.core.v2.files.CommitInfo;
import com.dropbox.core.v2.files.DeleteErrorException;
import com.dropbox.core.v2.files.DownloadErrorException;
import com.dropbox.core.v2.files.FileMetadata;
import com.dropbox.core.v2.files.GetMetadataErrorException;
import com.dropbox.core.v2.files.UploadSessionCursor;
import com.dropbox.core.v2.files.WriteMode;
import com.dropbox.core.v2.sharing.CreateSharedLinkWithSettingsErrorException;
import com.dropbox.core.v2.sharing.ListSharedLinksResult;
import com.dropbox.core.v2.sharing.SharedLinkSettings;
import com.google.common.annotations.VisibleForTesting;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import restore.prim.NotFoundException;
import restore.prim.TransferException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Map;

/**
 * Dropbox.
 *
 * <p>Options: either <code>accessToken</code>, or all of <code>refreshToken</code>,
 * <code>appKey</code> and <code>appSecret</code> (in which case a fresh access token is
 * obtained at startup and refreshed as needed).  Remote paths are placed relative to the
 * root of the app folder.  Share links are Dropbox shared links with an expiry; when a
 * link for the file already exists it is returned instead.
 */
public class DropboxStorage implements StorageBackend {

  private static final Logger LOG = LoggerFactory.getLogger(DropboxStorage.class);

  private static final String CLIENT_IDENTIFIER = "restore-backup";

  /** Uploads bigger than this use an upload session. */
  private static final long CHUNK_SIZE = 64L * 1024 * 1024;

  private @Nullable DbxClientV2 client;

  @Override
  public void initialize(Map<String, String> options) throws IOException {
    BackendOptions opts = BackendOptions.of("dropbox", options);
    boolean useAccessToken = opts.has("accessToken");
    if (!useAccessToken) {
      opts.require("refreshToken", "appKey", "appSecret");
    }
    opts.check();

    DbxRequestConfig config = DbxRequestConfig.newBuilder(CLIENT_IDENTIFIER).build();
    try {
      if (useAccessToken) {
        client = new DbxClientV2(config, opts.get("accessToken"));
      } else {
        DbxCredential credential = new DbxCredential("", 0L, opts.get("refreshToken"), opts.get("appKey"), opts.get("appSecret"));
        credential.refresh(config);
        client = new DbxClientV2(config, credential);
      }
      client.users().getCurrentAccount();
    } catch (DbxException e) {
      throw new TransferException("cannot connect to Dropbox", e);
    }
  }

  @VisibleForTesting
  static String toDropboxPath(String remotePath) {
    String p = remotePath.replace('\\', '/');
    while (p.startsWith("/")) {
      p = p.substring(1);
    }
    return "/" + p;
  }

  private DbxClientV2 client() {
    if (client == null) {
      throw new IllegalStateException("not initialized");
    }
    return client;
  }

  @Override
  public void upload(Path localFile, String remotePath) throws IOException {
    String path = toDropboxPath(remotePath);
    try (InputStream in = Files.newInputStream(localFile)) {
      long size = Files.size(localFile);
      if (size <= CHUNK_SIZE) {
        client().files().uploadBuilder(path).withMode(WriteMode.OVERWRITE).uploadAndFinish(in);
      } else {
        uploadInChunks(in, size, path);
      }
    } catch (NoSuchFileException e) {
      throw new NotFoundException(localFile.toString(), e);
    } catch (DbxException e) {
      throw new TransferException("failed to upload " + remotePath, e);
    }
  }

  private void uploadInChunks(InputStream in, long size, String path) throws DbxException, IOException {
    String sessionId = client().files().uploadSessionStart().uploadAndFinish(in, CHUNK_SIZE).getSessionId();
    long uploaded = CHUNK_SIZE;
    while (size - uploaded > CHUNK_SIZE) {
      client().files().uploadSessionAppendV2(new UploadSessionCursor(sessionId, uploaded)).uploadAndFinish(in, CHUNK_SIZE);
      uploaded += CHUNK_SIZE;
    }
    CommitInfo commit = CommitInfo.newBuilder(path).withMode(WriteMode.OVERWRITE).build();
    client().files().uploadSessionFinish(new UploadSessionCursor(sessionId, uploaded), commit).uploadAndFinish(in, size - uploaded);
  }

  @Override
  public void download(String remotePath, Path localFile) throws IOException {
    try (DbxDownloader<FileMetadata> downloader = client().files().download(toDropboxPath(remotePath))) {
      Path parent = localFile.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      try (OutputStream out = Files.newOutputStream(localFile)) {
        downloader.download(out);
      }
    } catch (DownloadErrorException e) {
      if (e.errorValue.isPath() && e.errorValue.getPathValue().isNotFound()) {
        throw new NotFoundException(remotePath, e);
      }
      throw new TransferException("failed to download " + remotePath, e);
    } catch (DbxException e) {
      throw new TransferException("failed to download " + remotePath, e);
    }
  }

  @Override
  public boolean exists(String remotePath) throws IOException {
    try {
      client().files().getMetadata(toDropboxPath(remotePath));
      return true;
    } catch (GetMetadataErrorException e) {
      if (e.errorValue.isPath() && e.errorValue.getPathValue().isNotFound()) {
        return false;
      }
      throw new TransferException("failed to look up " + remotePath, e);
    } catch (DbxException e) {
      throw new TransferException("failed to look up " + remotePath, e);
    }
  }

  @Override
  public void delete(String remotePath) throws IOException {
    try {
      client().files().deleteV2(toDropboxPath(remotePath));
    } catch (DeleteErrorException e) {
      if (e.errorValue.isPathLookup() && e.errorValue.getPathLookupValue().isNotFound()) {
        LOG.debug("{} was already absent", remotePath);
        return;
      }
      throw new TransferException("failed to delete " + remotePath, e);
    } catch (DbxException e) {
      throw new TransferException("failed to delete " + remotePath, e);
    }
  }

  @Override
  public boolean supportsSharing() {
    return true;
  }

  @Override
  public String generateShareLink(String remotePath, Duration expiration) throws IOException {
    String path = toDropboxPath(remotePath);
    SharedLinkSettings settings = SharedLinkSettings.newBuilder()
            .withExpires(Date.from(Instant.now().plus(expiration)))
            .build();
    try {
      return client().sharing().createSharedLinkWithSettings(path, settings).getUrl();
    } catch (CreateSharedLinkWithSettingsErrorException e) {
      if (e.errorValue.isSharedLinkAlreadyExists()) {
        return existingLink(path, e);
      }
      throw new TransferException("failed to share " + remotePath, e);
    } catch (DbxException e) {
      throw new TransferException("failed to share " + remotePath, e);
    }
  }

  private String existingLink(String path, CreateSharedLinkWithSettingsErrorException cause) throws IOException {
    try {
      ListSharedLinksResult links = client().sharing().listSharedLinksBuilder()
              .withPath(path)
              .withDirectOnly(true)
              .start();
      if (!links.getLinks().isEmpty()) {
        return links.getLinks().get(0).getUrl();
      }
    } catch (DbxException e) {
      cause.addSuppressed(e);
    }
    throw new TransferException("a shared link for " + path + " exists but could not be retrieved", cause);
  }

  @Override
  public void close() {
    client = null;
  }

}
