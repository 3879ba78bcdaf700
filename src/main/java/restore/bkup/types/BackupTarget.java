package restore.bkup.types;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.nio.file.Path;

/**
 * A watched directory.
 *
 * @param storageType the backend its backups go to, or null for the configured default
 */
public record BackupTarget(Path path, @Nullable String storageType) {
}
