package restore.bkup.types;

public enum ArchiveFormat {
  TAR("tar", false),
  ZIP("zip", true);

  private final String extension;
  private final boolean compressed;

  ArchiveFormat(String extension, boolean compressed) {
    this.extension = extension;
    this.compressed = compressed;
  }

  public String extension() {
    return extension;
  }

  /**
   * Whether the format compresses entries itself, making a separate compression pass
   * pointless.
   */
  public boolean isCompressed() {
    return compressed;
  }
}
