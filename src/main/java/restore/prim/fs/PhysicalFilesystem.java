package restore.prim.fs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import restore.prim.IOConsumer;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.FileVisitor;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Set;

public class PhysicalFilesystem implements Filesystem {

  private static final Logger LOG = LoggerFactory.getLogger(PhysicalFilesystem.class);

  @Override
  public void scan(Path path, Set<PathMatcher> exclusions, IOConsumer<Path> onDirectory, IOConsumer<RegularFile> onFile) throws IOException {
    Files.walkFileTree(path, new Visitor(path, exclusions) {
      @Override
      protected void onDirectory(Path dir) throws IOException {
        onDirectory.accept(dir);
      }

      @Override
      protected void onFile(Path file, BasicFileAttributes attrs) throws IOException {
        onFile.accept(new RegularFile(file, attrs.lastModifiedTime().toInstant(), attrs.size()));
      }
    });
  }

  private static abstract class Visitor implements FileVisitor<Path> {
    private final Path root;
    private final Set<PathMatcher> exclusionRules;

    Visitor(Path root, Set<PathMatcher> exclusionRules) {
      this.root = root;
      this.exclusionRules = exclusionRules;
    }

    @Override
    public FileVisitResult preVisitDirectory(Path dirPath, BasicFileAttributes attrs) throws IOException {
      if (dirPath.equals(root)) {
        return FileVisitResult.CONTINUE;
      }
      if (Filesystem.isExcluded(exclusionRules, dirPath)) {
        return FileVisitResult.SKIP_SUBTREE;
      }
      onDirectory(dirPath);
      return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult visitFile(Path filePath, BasicFileAttributes attrs) throws IOException {
      if (filePath.getFileName() == null) {
        throw new IllegalArgumentException("No filename for path " + filePath);
      }
      if (attrs.isRegularFile() && !Filesystem.isExcluded(exclusionRules, filePath)) {
        onFile(filePath, attrs);
      }
      return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult visitFileFailed(Path file, IOException exc) {
      LOG.warn("failed to visit {}: {}", file, exc.toString());
      return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
      return FileVisitResult.CONTINUE;
    }

    protected abstract void onDirectory(Path dir) throws IOException;
    protected abstract void onFile(Path file, BasicFileAttributes attrs) throws IOException;
  }

}
