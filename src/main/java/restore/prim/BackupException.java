package restore.prim;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.util.Locale;

/**
 * Base class for every failure the backup and restore pipelines report.
 *
 * <p>A failure may carry the {@link Stage} of the pipeline in which it happened.
 * The stage is attached by whoever drives the pipeline, on the same exception
 * object that the lower layer threw, so callers can catch a specific subclass
 * (say, {@link AuthenticationException}) and still learn where it happened.
 */
public class BackupException extends IOException {

  public enum Stage {
    RESOLVE,
    VALIDATE,
    ARCHIVE,
    COMPRESS,
    ENCRYPT,
    UPLOAD,
    RECORD,
    DOWNLOAD,
    DECRYPT,
    UNPACK,
    SHARE,
  }

  private @Nullable Stage stage;

  public BackupException(String message) {
    super(message);
  }

  public BackupException(String message, @Nullable Throwable cause) {
    super(message, cause);
  }

  public BackupException(Stage stage, String message, @Nullable Throwable cause) {
    super(message, cause);
    this.stage = stage;
  }

  public @Nullable Stage stage() {
    return stage;
  }

  /**
   * Record the stage this failure happened in, unless a lower layer already did.
   * @param stage the stage
   * @return this exception
   */
  public BackupException atStage(Stage stage) {
    if (this.stage == null) {
      this.stage = stage;
    }
    return this;
  }

  /**
   * Attach a stage to an arbitrary I/O failure.  Members of the taxonomy are tagged
   * and returned as-is; anything else is wrapped.
   */
  public static BackupException at(Stage stage, IOException e) {
    if (e instanceof BackupException) {
      return ((BackupException) e).atStage(stage);
    }
    return new BackupException(stage, stage.name().toLowerCase(Locale.ROOT) + " failed: " + e.getMessage(), e);
  }

  @Override
  public String getMessage() {
    String message = super.getMessage();
    return stage == null ? message : "[" + stage + "] " + message;
  }

}
