package restore.bkup.impls;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import restore.bkup.Util;
import restore.bkup.types.FileFingerprint;
import restore.prim.fs.Filesystem;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;

/**
 * Fingerprints the files of a directory and compares fingerprints taken at different
 * times.  Keys are file names relative to the directory, separated by <code>/</code>,
 * the same names {@link Archiver} gives archive entries.
 */
public class ChangeDetector {

  private static final Logger LOG = LoggerFactory.getLogger(ChangeDetector.class);

  /**
   * @param files fingerprint of every file found
   * @param totalBytes sum of the file sizes
   */
  public record Snapshot(Map<String, FileFingerprint> files, long totalBytes) {
  }

  /**
   * @param changed files that are new or whose contents differ
   * @param deleted files that are gone
   */
  public record Changes(SortedSet<String> changed, SortedSet<String> deleted) {
    public boolean isEmpty() {
      return changed.isEmpty() && deleted.isEmpty();
    }
  }

  private final Filesystem filesystem;

  public ChangeDetector(Filesystem filesystem) {
    this.filesystem = filesystem;
  }

  /**
   * Fingerprint every file under <code>dir</code>.  Files whose size and modification
   * time match their entry in <code>known</code> keep that entry's digest instead of
   * being read again.
   */
  public Snapshot snapshot(Path dir, Set<PathMatcher> exclusions, Map<String, FileFingerprint> known) throws IOException {
    Map<String, FileFingerprint> files = new TreeMap<>();
    long[] total = new long[1];
    int[] hashed = new int[1];
    filesystem.scan(dir, exclusions, d -> { }, f -> {
      String name = Archiver.entryName(dir, f.path());
      FileFingerprint previous = known.get(name);
      FileFingerprint current;
      if (previous != null && previous.size() == f.sizeInBytes() && previous.modTime().equals(f.modTime())) {
        current = previous;
      } else {
        current = new FileFingerprint(f.sizeInBytes(), f.modTime(), Util.sha256(f.path()));
        hashed[0] += 1;
      }
      files.put(name, current);
      total[0] += f.sizeInBytes();
    });
    LOG.debug("fingerprinted {} files under {} ({} read)", files.size(), dir, hashed[0]);
    return new Snapshot(ImmutableMap.copyOf(files), total[0]);
  }

  public static Changes diff(Map<String, FileFingerprint> current, Map<String, FileFingerprint> baseline) {
    ImmutableSortedSet.Builder<String> changed = ImmutableSortedSet.naturalOrder();
    for (Map.Entry<String, FileFingerprint> entry : current.entrySet()) {
      FileFingerprint before = baseline.get(entry.getKey());
      if (before == null || !before.sameContents(entry.getValue())) {
        changed.add(entry.getKey());
      }
    }
    ImmutableSortedSet.Builder<String> deleted = ImmutableSortedSet.naturalOrder();
    for (String name : baseline.keySet()) {
      if (!current.containsKey(name)) {
        deleted.add(name);
      }
    }
    return new Changes(changed.build(), deleted.build());
  }

}
