package restore.prim.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import restore.prim.NotFoundException;
import restore.prim.TransferException;
import restore.prim.fs.DurableFiles;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Map;

/**
 * Keeps backups in a directory on a locally mounted disk.  Uploads are atomic: a
 * concurrent reader sees the old object or the new one.
 *
 * <p>Options: <code>path</code> (required), the root directory.  It is created if
 * missing.
 */
public class LocalStorage implements StorageBackend {

  private static final Logger LOG = LoggerFactory.getLogger(LocalStorage.class);

  private Path root;

  @Override
  public void initialize(Map<String, String> options) throws IOException {
    BackendOptions opts = BackendOptions.of("local", options).require("path");
    opts.check();
    Path dir = Paths.get(opts.get("path")).toAbsolutePath().normalize();
    try {
      Files.createDirectories(dir);
    } catch (IOException e) {
      throw new TransferException("cannot create storage directory " + dir, e);
    }
    this.root = dir;
  }

  private Path resolve(String remotePath) throws IOException {
    Path p = root.resolve(remotePath).normalize();
    if (!p.startsWith(root) || p.equals(root)) {
      throw new TransferException("remote path '" + remotePath + "' is outside the storage directory");
    }
    return p;
  }

  @Override
  public void upload(Path localFile, String remotePath) throws IOException {
    if (!Files.isRegularFile(localFile)) {
      throw new NotFoundException(localFile.toString());
    }
    Path target = resolve(remotePath);
    try {
      DurableFiles.atomicCopy(localFile, target);
    } catch (NoSuchFileException e) {
      throw new NotFoundException(localFile.toString(), e);
    } catch (IOException e) {
      throw new TransferException("failed to store " + remotePath, e);
    }
  }

  @Override
  public void download(String remotePath, Path localFile) throws IOException {
    Path source = resolve(remotePath);
    if (!Files.isRegularFile(source)) {
      throw new NotFoundException(remotePath);
    }
    try {
      Path parent = localFile.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.copy(source, localFile, StandardCopyOption.REPLACE_EXISTING);
    } catch (NoSuchFileException e) {
      throw new NotFoundException(remotePath, e);
    } catch (IOException e) {
      throw new TransferException("failed to fetch " + remotePath, e);
    }
  }

  @Override
  public boolean exists(String remotePath) throws IOException {
    return Files.isRegularFile(resolve(remotePath));
  }

  @Override
  public void delete(String remotePath) throws IOException {
    try {
      if (!Files.deleteIfExists(resolve(remotePath))) {
        LOG.debug("{} was already absent", remotePath);
      }
    } catch (IOException e) {
      throw new TransferException("failed to delete " + remotePath, e);
    }
  }

  @Override
  public void close() {
  }

  @Override
  public String toString() {
    return "LocalStorage(" + root + ')';
  }

}
