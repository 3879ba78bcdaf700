package restore.prim.storage;

import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.extensions.java6.auth.oauth2.AuthorizationCodeInstalledApp;
import com.google.api.client.extensions.jetty.auth.oauth2.LocalServerReceiver;
import com.google.api.client.googleapis.auth.oauth2.GoogleAuthorizationCodeFlow;
import com.google.api.client.googleapis.auth.oauth2.GoogleClientSecrets;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.http.FileContent;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.client.util.store.FileDataStoreFactory;
import com.google.api.services.drive.Drive;
import com.google.api.services.drive.DriveScopes;
import com.google.api.services.drive.model.File;
import com.google.common.annotations.VisibleForTesting;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import restore.prim.NotFoundException;
import restore.prim.TransferException;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Google Drive, authorized through the OAuth installed-application flow.  The first run
 * opens a browser for consent; the resulting tokens are kept in <code>token_folder</code>.
 *
 * <p>Options: <code>client_id</code> and <code>client_secret</code> are required.
 * <code>token_folder</code> defaults to <code>Drive.Storage.Token</code> and
 * <code>backup_folder_name</code>, the top-level Drive folder holding everything, to
 * <code>Restore Backups</code>.  Each <code>/</code>-separated segment of a remote path
 * becomes a Drive folder.
 */
public class GoogleDriveStorage implements StorageBackend {

  private static final Logger LOG = LoggerFactory.getLogger(GoogleDriveStorage.class);

  private static final String APPLICATION_NAME = "restore-backup";
  private static final String FOLDER_MIME_TYPE = "application/vnd.google-apps.folder";
  private static final String DEFAULT_TOKEN_FOLDER = "Drive.Storage.Token";
  private static final String DEFAULT_BACKUP_FOLDER = "Restore Backups";
  private static final int CALLBACK_PORT = 8888;

  private @Nullable Drive drive;
  private String rootFolderId;

  /** Folder path (relative to the backup folder) to Drive folder id. */
  private final Map<String, String> folderCache = new HashMap<>();

  @Override
  public synchronized void initialize(Map<String, String> options) throws IOException {
    BackendOptions opts = BackendOptions.of("gdrive", options).require("client_id", "client_secret");
    opts.check();
    Path tokenFolder = Paths.get(opts.optional("token_folder", DEFAULT_TOKEN_FOLDER));
    String backupFolderName = opts.optional("backup_folder_name", DEFAULT_BACKUP_FOLDER);

    try {
      NetHttpTransport transport = GoogleNetHttpTransport.newTrustedTransport();
      JsonFactory json = GsonFactory.getDefaultInstance();
      GoogleClientSecrets secrets = new GoogleClientSecrets().setInstalled(new GoogleClientSecrets.Details()
              .setClientId(opts.get("client_id"))
              .setClientSecret(opts.get("client_secret")));
      GoogleAuthorizationCodeFlow flow = new GoogleAuthorizationCodeFlow.Builder(
              transport, json, secrets, Collections.singletonList(DriveScopes.DRIVE_FILE))
              .setDataStoreFactory(new FileDataStoreFactory(tokenFolder.toFile()))
              .setAccessType("offline")
              .build();
      LocalServerReceiver receiver = new LocalServerReceiver.Builder().setPort(CALLBACK_PORT).build();
      Credential credential = new AuthorizationCodeInstalledApp(flow, receiver).authorize("user");
      drive = new Drive.Builder(transport, json, credential).setApplicationName(APPLICATION_NAME).build();
      rootFolderId = findOrCreateFolder(backupFolderName, "root");
    } catch (GeneralSecurityException | IOException e) {
      throw new TransferException("cannot connect to Google Drive", e);
    }
  }

  private Drive drive() {
    if (drive == null) {
      throw new IllegalStateException("not initialized");
    }
    return drive;
  }

  /**
   * Quote a value for use inside a single-quoted Drive query literal.
   */
  @VisibleForTesting
  static String escapeQueryLiteral(String value) {
    return value.replace("\\", "\\\\").replace("'", "\\'");
  }

  private @Nullable String findChild(String name, String parentId, boolean folder) throws IOException {
    String query = "name = '" + escapeQueryLiteral(name) + "' and '" + parentId + "' in parents and trashed = false and mimeType "
            + (folder ? "= '" : "!= '") + FOLDER_MIME_TYPE + "'";
    List<File> files = drive().files().list()
            .setQ(query)
            .setSpaces("drive")
            .setFields("files(id, name)")
            .execute()
            .getFiles();
    return files == null || files.isEmpty() ? null : files.get(0).getId();
  }

  private String findOrCreateFolder(String name, String parentId) throws IOException {
    @Nullable String id = findChild(name, parentId, true);
    if (id != null) {
      return id;
    }
    LOG.debug("creating Drive folder {}", name);
    File metadata = new File()
            .setName(name)
            .setMimeType(FOLDER_MIME_TYPE)
            .setParents(Collections.singletonList(parentId));
    return drive().files().create(metadata).setFields("id").execute().getId();
  }

  /**
   * @param create whether to create missing folders
   * @return the id of the folder holding <code>remotePath</code>, or null if it does not
   *         exist and <code>create</code> is false
   */
  private @Nullable String parentFolder(String remotePath, boolean create) throws IOException {
    String[] parts = remotePath.split("/");
    String parentId = rootFolderId;
    StringBuilder prefix = new StringBuilder();
    for (int i = 0; i < parts.length - 1; ++i) {
      if (parts[i].isEmpty()) {
        continue;
      }
      prefix.append(parts[i]).append('/');
      String key = prefix.toString();
      @Nullable String cached = folderCache.get(key);
      if (cached == null) {
        cached = create ? findOrCreateFolder(parts[i], parentId) : findChild(parts[i], parentId, true);
        if (cached == null) {
          return null;
        }
        folderCache.put(key, cached);
      }
      parentId = cached;
    }
    return parentId;
  }

  private static String fileName(String remotePath) {
    int slash = remotePath.lastIndexOf('/');
    return slash < 0 ? remotePath : remotePath.substring(slash + 1);
  }

  private @Nullable String findFile(String remotePath) throws IOException {
    @Nullable String parent = parentFolder(remotePath, false);
    return parent == null ? null : findChild(fileName(remotePath), parent, false);
  }

  @Override
  public synchronized void upload(Path localFile, String remotePath) throws IOException {
    if (!Files.isRegularFile(localFile)) {
      throw new NotFoundException(localFile.toString());
    }
    try {
      String parent = parentFolder(remotePath, true);
      FileContent content = new FileContent("application/octet-stream", localFile.toFile());
      @Nullable String existing = findChild(fileName(remotePath), parent, false);
      if (existing != null) {
        drive().files().update(existing, new File(), content).execute();
      } else {
        File metadata = new File()
                .setName(fileName(remotePath))
                .setParents(Collections.singletonList(parent));
        drive().files().create(metadata, content).setFields("id").execute();
      }
    } catch (IOException e) {
      throw new TransferException("failed to upload " + remotePath, e);
    }
  }

  @Override
  public synchronized void download(String remotePath, Path localFile) throws IOException {
    @Nullable String id;
    try {
      id = findFile(remotePath);
    } catch (IOException e) {
      throw new TransferException("failed to look up " + remotePath, e);
    }
    if (id == null) {
      throw new NotFoundException(remotePath);
    }
    Path parent = localFile.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (OutputStream out = Files.newOutputStream(localFile)) {
      drive().files().get(id).executeMediaAndDownloadTo(out);
    } catch (IOException e) {
      throw new TransferException("failed to download " + remotePath, e);
    }
  }

  @Override
  public synchronized boolean exists(String remotePath) throws IOException {
    try {
      return findFile(remotePath) != null;
    } catch (IOException e) {
      throw new TransferException("failed to look up " + remotePath, e);
    }
  }

  @Override
  public synchronized void delete(String remotePath) throws IOException {
    try {
      @Nullable String id = findFile(remotePath);
      if (id != null) {
        drive().files().delete(id).execute();
      }
    } catch (IOException e) {
      throw new TransferException("failed to delete " + remotePath, e);
    }
  }

  @Override
  public synchronized void close() {
    drive = null;
    folderCache.clear();
  }

}
