package restore.prim.fs;

import restore.prim.IOConsumer;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Set;

public interface Filesystem {

  /**
   * Scan a directory tree, calling the appropriate consumers for each entry.
   * Symbolic links are not followed and not reported.
   *
   * @param path the directory to scan
   * @param exclusions a set of patterns to skip.  A path is skipped if any pattern matches its
   *                   full path or the name returned by {@link Path#getFileName()}.  If a
   *                   directory is skipped, then the contents of the directory are skipped as
   *                   well.
   * @param onDirectory a consumer for directories below <code>path</code> (not
   *                    <code>path</code> itself), called before their contents
   * @param onFile a consumer for regular files
   * @throws IOException
   */
  void scan(Path path, Set<PathMatcher> exclusions, IOConsumer<Path> onDirectory, IOConsumer<RegularFile> onFile) throws IOException;

  /**
   * Test a path against exclusion patterns the same way {@link #scan} does.
   */
  static boolean isExcluded(Set<PathMatcher> exclusions, Path path) {
    Path name = path.getFileName();
    return exclusions.stream().anyMatch(r -> r.matches(path) || (name != null && r.matches(name)));
  }

}
