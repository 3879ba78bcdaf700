package restore.bkup.types;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Read-only view of everything the engine is told by its user.
 */
@Value
@Builder(toBuilder = true)
public class Config {

  /** Storage type used when neither the call nor the target names one. */
  @Builder.Default
  String defaultStorageType = "local";

  @Singular
  List<BackupTarget> targets;

  /**
   * Storage type per named component (for example "settings" or "programs").  Read by
   * the inventory collectors that run next to this engine.
   */
  @Singular
  Map<String, String> componentStorageTypes;

  /** Options for each storage type, keyed by lower-case type name. */
  @Singular
  Map<String, Map<String, String>> storageOptions;

  @Builder.Default
  boolean encryptionEnabled = false;

  @Builder.Default
  boolean compressionEnabled = true;

  @Builder.Default
  ArchiveFormat archiveFormat = ArchiveFormat.TAR;

  /**
   * Partial types fall back to {@link BackupType#FULL} when a directory has no usable
   * previous backup.
   */
  @Builder.Default
  BackupType backupType = BackupType.INCREMENTAL;

  /** Directories bigger than this are backed up with a warning. */
  @Builder.Default
  long sizeThresholdBytes = 500L * 1024 * 1024;

  /** Glob patterns for files and directories that are never archived or watched. */
  @Singular
  List<String> excludePatterns;

  @Builder.Default
  Duration debounce = Duration.ofSeconds(10);

  @Builder.Default
  Path stateFile = Paths.get(System.getProperty("user.home"), ".restore-state.json");

  /** Where temporary artifacts go; null for the system default. */
  @Nullable Path tempDir;

  @Builder.Default
  RetentionPolicy retention = RetentionPolicy.DISABLED;

  /**
   * @return the configured storage type for a watched directory, else the default
   */
  public String storageTypeFor(Path source) {
    Path normalized = source.toAbsolutePath().normalize();
    for (BackupTarget target : targets) {
      if (target.storageType() != null && target.path().toAbsolutePath().normalize().equals(normalized)) {
        return target.storageType();
      }
    }
    return defaultStorageType;
  }

  public String storageTypeForComponent(String component) {
    String type = componentStorageTypes.get(component);
    return type != null ? type : defaultStorageType;
  }

  public Map<String, String> optionsFor(String storageType) {
    String key = storageType.toLowerCase(Locale.ROOT);
    for (Map.Entry<String, Map<String, String>> entry : storageOptions.entrySet()) {
      if (entry.getKey().toLowerCase(Locale.ROOT).equals(key)) {
        return ImmutableMap.copyOf(entry.getValue());
      }
    }
    return ImmutableMap.of();
  }

  public Set<PathMatcher> exclusionMatchers() {
    ImmutableSet.Builder<PathMatcher> matchers = ImmutableSet.builder();
    for (String pattern : excludePatterns) {
      matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
    }
    return matchers.build();
  }

}
