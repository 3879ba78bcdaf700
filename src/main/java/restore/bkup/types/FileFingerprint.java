package restore.bkup.types;

import java.time.Instant;

/**
 * What a backup remembers about one file, to tell later whether it changed.
 *
 * @param sha256 lower-case hex digest of the contents
 */
public record FileFingerprint(long size, Instant modTime, String sha256) {

  /**
   * Same contents as <code>other</code>.  Modification times are ignored, so a file
   * that was only touched does not count as changed.
   */
  public boolean sameContents(FileFingerprint other) {
    return size == other.size && sha256.equals(other.sha256);
  }

}
