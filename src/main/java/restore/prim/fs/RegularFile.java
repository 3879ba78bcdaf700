package restore.prim.fs;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Information about a regular (i.e. non-link) file.
 *
 * <p>The metadata getters {@link #path()}, {@link #modTime()} and {@link #sizeInBytes()}
 * are pure and return information about an atomic snapshot of the file at some point in
 * the past.
 */
public record RegularFile(Path path, Instant modTime, long sizeInBytes) {
}
