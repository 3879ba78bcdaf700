package restore.bkup.types;

/**
 * What goes into a backup artifact.
 */
public enum BackupType {
  /** Every file. */
  FULL,

  /** Files that changed since the previous backup of any type. */
  INCREMENTAL,

  /** Files that changed since the last full backup. */
  DIFFERENTIAL;

  /**
   * Case-insensitive lookup.
   * @throws IllegalArgumentException if no type has that name
   */
  public static BackupType named(String name) {
    for (BackupType t : values()) {
      if (t.name().equalsIgnoreCase(name.trim())) {
        return t;
      }
    }
    throw new IllegalArgumentException("unknown backup type '" + name + '\'');
  }
}
