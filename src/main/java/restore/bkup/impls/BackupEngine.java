package restore.bkup.impls;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import restore.bkup.Util;
import restore.bkup.types.ArchiveName;
import restore.bkup.types.BackupRecord;
import restore.bkup.types.BackupType;
import restore.bkup.types.Config;
import restore.bkup.types.PasswordProvider;
import restore.prim.BackupException;
import restore.prim.BackupException.Stage;
import restore.prim.ConfigurationException;
import restore.prim.NotFoundException;
import restore.prim.storage.StorageBackend;
import restore.prim.storage.StorageRegistry;
import restore.prim.time.UnreliableWallClock;
import restore.prim.transforms.BlobTransformer;
import restore.prim.transforms.Encryption;
import restore.prim.transforms.XZCompression;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Backs up one directory: archive, then optionally compress, then optionally encrypt,
 * then upload, then record.
 *
 * <p>A backup either completes all of these steps or leaves no trace: a record is written
 * only after the upload finished, and every local temporary is deleted no matter how the
 * backup ends.  Failures carry the {@link Stage} they happened in.
 *
 * <p>With {@link BackupType#INCREMENTAL} or {@link BackupType#DIFFERENTIAL} only changed
 * files are archived, and a directory that did not change since its last backup is not
 * backed up again.  The first backup of a directory is always full, and so is every
 * {@value #MAX_CHAIN_LENGTH}th one in a row of incremental backups, so that a restore
 * never needs more than that many artifacts.
 *
 * <p>Each call opens its own storage backend, so concurrent calls for different
 * directories are safe.
 */
public class BackupEngine {

  private static final Logger LOG = LoggerFactory.getLogger(BackupEngine.class);

  public static final String REMOTE_ROOT = "backups";

  public static final int MAX_CHAIN_LENGTH = 10;

  private final Config config;
  private final StorageRegistry registry;
  private final StateStore state;
  private final PasswordProvider passwords;
  private final Archiver archiver;
  private final ChangeDetector detector;
  private final UnreliableWallClock clock;
  private final @Nullable RetentionManager retention;

  public BackupEngine(
          Config config,
          StorageRegistry registry,
          StateStore state,
          PasswordProvider passwords,
          Archiver archiver,
          UnreliableWallClock clock,
          @Nullable RetentionManager retention) {
    this.config = config;
    this.registry = registry;
    this.state = state;
    this.passwords = passwords;
    this.archiver = archiver;
    this.detector = new ChangeDetector(archiver.filesystem());
    this.clock = clock;
    this.retention = retention;
  }

  /**
   * The key under which records for a directory are kept.
   */
  public static String sourceKey(Path sourcePath) {
    return sourcePath.toAbsolutePath().normalize().toString();
  }

  /**
   * The remote folder for a directory's artifacts: its name plus a digest of its full
   * path, so that <code>/a/docs</code> and <code>/b/docs</code> never share one.
   */
  public static String remoteFolder(Path sourcePath) {
    Path fileName = sourcePath.toAbsolutePath().normalize().getFileName();
    String digest = Util.toHex(Util.sha256Digest().digest(sourceKey(sourcePath).getBytes(StandardCharsets.UTF_8)));
    return ArchiveName.sanitize(fileName == null ? "root" : fileName.toString()) + "-" + digest.substring(0, 8);
  }

  /**
   * Back up a directory.
   *
   * @param sourcePath the directory
   * @param storageOverride a storage type that beats the configured ones, or null
   * @return the record of the completed backup, or the latest existing record if the
   *         directory did not change since then and the configured type is not full
   * @throws NotFoundException if <code>sourcePath</code> is not a directory
   * @throws BackupException (or a subclass) for any other failure
   */
  public BackupRecord backupDirectory(Path sourcePath, @Nullable String storageOverride) throws IOException {
    Stopwatch stopwatch = Stopwatch.createStarted();
    Path source = sourcePath.toAbsolutePath().normalize();
    String key = sourceKey(source);
    String storageType = storageOverride != null ? storageOverride : config.storageTypeFor(source);
    boolean encrypt = config.isEncryptionEnabled();
    boolean compress = config.isCompressionEnabled() && !config.getArchiveFormat().isCompressed();
    List<Path> temporaries = new ArrayList<>();

    Stage stage = Stage.VALIDATE;
    try {
      if (!Files.isDirectory(source)) {
        throw new NotFoundException(source.toString());
      }
      @Nullable String password = null;
      if (encrypt) {
        password = passwords.password();
        if (password == null) {
          throw new ConfigurationException("encryption is enabled but no password is available");
        }
      }

      @Nullable BackupRecord latest = state.latest(key);
      StateStore.@Nullable Manifests previous = state.manifests(key);
      ChangeDetector.Snapshot snapshot = detector.snapshot(source, config.exclusionMatchers(),
              previous == null ? ImmutableMap.of() : previous.latest());
      if (snapshot.totalBytes() > config.getSizeThresholdBytes()) {
        LOG.warn("{} holds {}, more than the {} size threshold",
                source, Util.formatSize(snapshot.totalBytes()), Util.formatSize(config.getSizeThresholdBytes()));
      }

      BackupType kind = backupType(latest, previous);
      ChangeDetector.@Nullable Changes changes = null;
      if (kind != BackupType.FULL) {
        if (ChangeDetector.diff(snapshot.files(), previous.latest()).isEmpty()) {
          LOG.info("nothing changed in {} since {}; not backing it up", source, latest.remotePath());
          return latest;
        }
        changes = ChangeDetector.diff(snapshot.files(), kind == BackupType.INCREMENTAL ? previous.latest() : previous.base());
        LOG.debug("{} backup of {}: {} changed, {} deleted",
                kind, source, changes.changed().size(), changes.deleted().size());
      }

      stage = Stage.RESOLVE;
      try (StorageBackend backend = registry.open(storageType, config.optionsFor(storageType))) {
        Instant timestamp = nextTimestamp(key);
        Path fileName = source.getFileName();
        ArchiveName name = ArchiveName.forBackup(
                fileName == null ? "root" : fileName.toString(),
                timestamp, config.getArchiveFormat(), compress, encrypt);
        String remotePath = REMOTE_ROOT + "/" + remoteFolder(source) + "/" + name.fileName();

        stage = Stage.ARCHIVE;
        Path artifact = temporary(temporaries, "." + config.getArchiveFormat().extension());
        Archiver.PackResult packed = changes == null
                ? archiver.pack(source, artifact, config.getArchiveFormat(), config.exclusionMatchers())
                : archiver.pack(source, artifact, config.getArchiveFormat(), config.exclusionMatchers(), changes.changed()::contains);

        if (compress) {
          stage = Stage.COMPRESS;
          artifact = transform(artifact, new XZCompression(), temporaries, ArchiveName.XZ_SUFFIX);
        }
        if (encrypt) {
          stage = Stage.ENCRYPT;
          artifact = transform(artifact, new Encryption(password), temporaries, ArchiveName.ENCRYPTED_SUFFIX);
        }
        long storedBytes = Files.size(artifact);

        stage = Stage.UPLOAD;
        LOG.info("uploading {} ({}) to {} storage", remotePath, Util.formatSize(storedBytes), storageType);
        backend.upload(artifact, remotePath);

        stage = Stage.RECORD;
        if (Thread.currentThread().isInterrupted()) {
          throw new InterruptedIOException("backup of " + source + " was interrupted");
        }
        BackupRecord record = new BackupRecord(key, remotePath, timestamp, packed.totalBytes(), storedBytes, storageType, encrypt,
                kind, changes == null ? ImmutableList.of() : ImmutableList.copyOf(changes.deleted()));
        state.record(record, snapshot.files());
        LOG.info("backed up {} ({}): {} files, {} -> {} in {}",
                source, kind.name().toLowerCase(Locale.ROOT), packed.fileCount(),
                Util.formatSize(packed.totalBytes()), Util.formatSize(storedBytes), stopwatch);

        if (retention != null) {
          retention.apply(key, storageType, backend);
        }
        return record;
      }
    } catch (IOException e) {
      throw BackupException.at(stage, e);
    } finally {
      for (Path p : temporaries) {
        Util.deleteQuietly(p);
      }
    }
  }

  /**
   * The configured type, unless the directory needs a full backup.
   */
  private BackupType backupType(@Nullable BackupRecord latest, StateStore.@Nullable Manifests previous) {
    BackupType wanted = config.getBackupType();
    if (wanted == BackupType.FULL) {
      return BackupType.FULL;
    }
    if (latest == null || previous == null) {
      return BackupType.FULL;
    }
    List<BackupRecord> chain;
    try {
      chain = state.chain(latest);
    } catch (NotFoundException e) {
      LOG.info("starting a new full backup of {}: {}", latest.sourcePath(), e.getMessage());
      return BackupType.FULL;
    }
    return chain.size() >= MAX_CHAIN_LENGTH ? BackupType.FULL : wanted;
  }

  /**
   * Wall clocks can step backwards; records for one directory must not.
   */
  private Instant nextTimestamp(String key) {
    Instant now = clock.now();
    @Nullable BackupRecord latest = state.latest(key);
    if (latest != null && !now.isAfter(latest.timestamp())) {
      return latest.timestamp().plusMillis(1);
    }
    return now;
  }

  private Path temporary(List<Path> temporaries, String suffix) throws IOException {
    Path dir = config.getTempDir();
    Path p = dir == null
            ? Files.createTempFile("restore-", suffix)
            : Files.createTempFile(Files.createDirectories(dir), "restore-", suffix);
    temporaries.add(p);
    return p;
  }

  private Path transform(Path input, BlobTransformer transformer, List<Path> temporaries, String suffix) throws IOException {
    Path output = temporary(temporaries, suffix);
    try (InputStream in = transformer.apply(Files.newInputStream(input))) {
      Files.copy(in, output, StandardCopyOption.REPLACE_EXISTING);
    }
    return output;
  }

}
