package restore.bkup.types;

import restore.prim.BackupException;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * The file name of a backup artifact, which records how to undo it:
 * <code>backup_{dir}_{yyyyMMdd'T'HHmmssSSS'Z'}.{tar|tar.xz|zip}[.enc]</code>.
 */
public record ArchiveName(String stem, ArchiveFormat format, boolean compressed, boolean encrypted) {

  public static final String XZ_SUFFIX = ".xz";
  public static final String ENCRYPTED_SUFFIX = ".enc";

  private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS'Z'").withZone(ZoneOffset.UTC);

  public static ArchiveName forBackup(String directoryName, Instant timestamp, ArchiveFormat format, boolean compressed, boolean encrypted) {
    return new ArchiveName("backup_" + sanitize(directoryName) + "_" + STAMP.format(timestamp), format, compressed, encrypted);
  }

  /**
   * Replace anything but letters, digits, dot, underscore and dash with an underscore.
   */
  public static String sanitize(String name) {
    String s = name.replaceAll("[^A-Za-z0-9._-]", "_");
    return s.isEmpty() || s.chars().allMatch(c -> c == '.') ? "root" : s;
  }

  /**
   * Recover the pipeline steps from an artifact name.
   * @param fileName a bare file name, or a remote path whose last segment is one
   * @throws BackupException if the name has no recognized archive extension
   */
  public static ArchiveName parse(String fileName) throws BackupException {
    String name = fileName.substring(fileName.lastIndexOf('/') + 1);
    boolean encrypted = name.endsWith(ENCRYPTED_SUFFIX);
    if (encrypted) {
      name = name.substring(0, name.length() - ENCRYPTED_SUFFIX.length());
    }
    boolean compressed = name.endsWith(XZ_SUFFIX);
    if (compressed) {
      name = name.substring(0, name.length() - XZ_SUFFIX.length());
    }
    for (ArchiveFormat format : ArchiveFormat.values()) {
      String ext = "." + format.extension();
      if (name.endsWith(ext) && name.length() > ext.length()) {
        return new ArchiveName(name.substring(0, name.length() - ext.length()), format, compressed, encrypted);
      }
    }
    throw new BackupException(BackupException.Stage.VALIDATE, "unrecognized backup artifact name: " + fileName, null);
  }

  public String fileName() {
    return stem + "." + format.extension() + (compressed ? XZ_SUFFIX : "") + (encrypted ? ENCRYPTED_SUFFIX : "");
  }

}
