package restore.bkup.types;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Duration;

/**
 * Which old backups of a directory to keep.  The newest <code>keepLast</code> backups are
 * always kept, and so is every backup younger than <code>maxAge</code>.  The newest backup
 * is never deleted.
 *
 * @param maxAge null to keep by count alone
 */
public record RetentionPolicy(boolean enabled, int keepLast, @Nullable Duration maxAge) {

  public static final RetentionPolicy DISABLED = new RetentionPolicy(false, Integer.MAX_VALUE, null);

  public RetentionPolicy {
    if (keepLast < 1) {
      throw new IllegalArgumentException("keepLast must be at least 1, got " + keepLast);
    }
    if (maxAge != null && maxAge.isNegative()) {
      throw new IllegalArgumentException("maxAge must not be negative");
    }
  }

}
