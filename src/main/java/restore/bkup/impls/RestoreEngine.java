package restore.bkup.impls;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import restore.bkup.Util;
import restore.bkup.types.ArchiveName;
import restore.bkup.types.BackupRecord;
import restore.bkup.types.Config;
import restore.bkup.types.PasswordProvider;
import restore.bkup.types.RestoreReport;
import restore.prim.AuthenticationException;
import restore.prim.BackupException;
import restore.prim.BackupException.Stage;
import restore.prim.ConfigurationException;
import restore.prim.NotFoundException;
import restore.prim.storage.StorageBackend;
import restore.prim.storage.StorageRegistry;
import restore.prim.transforms.Encryption;
import restore.prim.transforms.XZCompression;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Undoes {@link BackupEngine}: download, decrypt, decompress, unpack.
 *
 * <p>An encrypted artifact is decrypted completely, and so authenticated, before any
 * file is extracted.  A wrong password therefore leaves the target directory untouched.
 * Existing files in the target directory are overwritten.
 *
 * <p>A partial (incremental or differential) backup is restored together with the
 * backups it builds on, oldest first, so the result is the whole directory as it was.
 * Every artifact of such a chain is downloaded and decrypted before the first one is
 * unpacked.
 */
public class RestoreEngine {

  private static final Logger LOG = LoggerFactory.getLogger(RestoreEngine.class);

  private final Config config;
  private final StorageRegistry registry;
  private final StateStore state;
  private final PasswordProvider passwords;
  private final Archiver archiver;

  private record Step(String remotePath, ArchiveName name, String storageType, List<String> deletedFiles) {
  }

  public RestoreEngine(Config config, StorageRegistry registry, StateStore state, PasswordProvider passwords, Archiver archiver) {
    this.config = config;
    this.registry = registry;
    this.state = state;
    this.passwords = passwords;
    this.archiver = archiver;
  }

  /**
   * Restore a backup artifact into a directory.
   *
   * @param backupPath the remote path of the artifact
   * @param targetDir where to put the files; created if missing
   * @param storageOverride the storage type to fetch from, or null to use the one recorded
   *                        for each artifact (falling back to the configured default)
   * @throws NotFoundException if the artifact, or one it builds on, does not exist
   * @throws AuthenticationException if the password does not decrypt the artifact
   */
  public RestoreReport restoreFromBackup(String backupPath, Path targetDir, @Nullable String storageOverride) throws IOException {
    Stopwatch stopwatch = Stopwatch.createStarted();
    List<Path> temporaries = new ArrayList<>();
    Stage stage = Stage.VALIDATE;
    try {
      List<Step> steps = plan(backupPath, storageOverride);

      List<Path> artifacts = new ArrayList<>();
      for (Step step : steps) {
        stage = Stage.RESOLVE;
        Path artifact = temporary(temporaries);
        try (StorageBackend backend = registry.open(step.storageType(), config.optionsFor(step.storageType()))) {
          stage = Stage.DOWNLOAD;
          backend.download(step.remotePath(), artifact);
        }
        if (step.name().encrypted()) {
          stage = Stage.DECRYPT;
          artifact = decrypt(artifact, temporaries);
        }
        artifacts.add(artifact);
      }

      stage = Stage.UNPACK;
      Path root = targetDir.toAbsolutePath().normalize();
      Set<String> restored = new TreeSet<>();
      long bytes = 0;
      for (int i = 0; i < steps.size(); ++i) {
        Step step = steps.get(i);
        Archiver.UnpackResult result;
        try (InputStream raw = new BufferedInputStream(Files.newInputStream(artifacts.get(i)), Util.SUGGESTED_BUFFER_SIZE);
             InputStream in = step.name().compressed() ? new XZCompression().unApply(raw) : raw) {
          result = archiver.unpack(in, step.name().format(), root);
        }
        restored.addAll(result.files());
        bytes += result.totalBytes();
        for (String deleted : step.deletedFiles()) {
          Path victim = root.resolve(deleted).normalize();
          if (victim.startsWith(root) && !victim.equals(root)) {
            Files.deleteIfExists(victim);
            restored.remove(deleted);
          } else {
            LOG.warn("not deleting {}: outside {}", deleted, root);
          }
        }
      }
      LOG.info("restored {} files ({}) from {} ({} artifacts) into {} in {}",
              restored.size(), Util.formatSize(bytes), backupPath, steps.size(), targetDir, stopwatch);
      return new RestoreReport(targetDir, restored.size(), bytes);
    } catch (IOException e) {
      throw BackupException.at(stage, e);
    } finally {
      for (Path p : temporaries) {
        Util.deleteQuietly(p);
      }
    }
  }

  /**
   * Restore the newest recorded backup of a directory.
   */
  public RestoreReport restoreLatest(Path sourcePath, Path targetDir) throws IOException {
    @Nullable BackupRecord latest = state.latest(BackupEngine.sourceKey(sourcePath));
    if (latest == null) {
      throw new NotFoundException("no recorded backup of " + sourcePath);
    }
    return restoreFromBackup(latest.remotePath(), targetDir, null);
  }

  /**
   * The artifacts to apply, oldest first.  An artifact the state does not know about is
   * restored on its own.
   */
  private List<Step> plan(String backupPath, @Nullable String storageOverride) throws IOException {
    @Nullable BackupRecord record = state.findByRemotePath(backupPath);
    if (record == null) {
      String storageType = storageOverride != null ? storageOverride : config.getDefaultStorageType();
      return ImmutableList.of(new Step(backupPath, ArchiveName.parse(backupPath), storageType, ImmutableList.of()));
    }
    ImmutableList.Builder<Step> steps = ImmutableList.builder();
    for (BackupRecord r : state.chain(record)) {
      steps.add(new Step(
              r.remotePath(),
              ArchiveName.parse(r.remotePath()),
              storageOverride != null ? storageOverride : r.storageType(),
              r.deletedFiles()));
    }
    return steps.build();
  }

  private Path decrypt(Path encrypted, List<Path> temporaries) throws IOException {
    @Nullable String password = passwords.password();
    if (password == null) {
      throw new ConfigurationException("the backup is encrypted but no password is available");
    }
    Path plain = temporary(temporaries);
    try (InputStream in = new Encryption(password).unApply(new BufferedInputStream(Files.newInputStream(encrypted), Util.SUGGESTED_BUFFER_SIZE))) {
      Files.copy(in, plain, StandardCopyOption.REPLACE_EXISTING);
    } catch (AuthenticationException e) {
      passwords.forget();
      throw e;
    }
    return plain;
  }

  private Path temporary(List<Path> temporaries) throws IOException {
    Path dir = config.getTempDir();
    Path p = dir == null
            ? Files.createTempFile("restore-", ".tmp")
            : Files.createTempFile(Files.createDirectories(dir), "restore-", ".tmp");
    temporaries.add(p);
    return p;
  }

}
