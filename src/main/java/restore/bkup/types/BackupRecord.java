package restore.bkup.types;

import com.google.common.collect.ImmutableList;

import java.time.Instant;
import java.util.List;

/**
 * One completed backup.  Records exist only for backups whose upload finished.
 *
 * @param sourcePath the absolute, normalized directory that was backed up
 * @param remotePath where the artifact was stored
 * @param timestamp when the backup started (UTC)
 * @param sizeBytesOriginal total size of the files archived
 * @param sizeBytesStored size of the uploaded artifact
 * @param storageType the backend holding the artifact
 * @param encrypted whether the artifact is encrypted
 * @param kind whether the artifact holds every file or only changed ones
 * @param deletedFiles for partial backups, files (relative, <code>/</code>-separated) that
 *                     disappeared since the backup this one builds on
 */
public record BackupRecord(
        String sourcePath,
        String remotePath,
        Instant timestamp,
        long sizeBytesOriginal,
        long sizeBytesStored,
        String storageType,
        boolean encrypted,
        BackupType kind,
        List<String> deletedFiles) {

  public BackupRecord {
    deletedFiles = ImmutableList.copyOf(deletedFiles);
  }

  /**
   * A full backup.
   */
  public BackupRecord(
          String sourcePath,
          String remotePath,
          Instant timestamp,
          long sizeBytesOriginal,
          long sizeBytesStored,
          String storageType,
          boolean encrypted) {
    this(sourcePath, remotePath, timestamp, sizeBytesOriginal, sizeBytesStored, storageType, encrypted, BackupType.FULL, ImmutableList.of());
  }

}
