package restore.bkup.impls;

import org.apache.commons.compress.archivers.ArchiveEntry;
import org.apache.commons.compress.archivers.ArchiveInputStream;
import org.apache.commons.compress.archivers.ArchiveOutputStream;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveInputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import restore.bkup.Util;
import restore.bkup.types.ArchiveFormat;
import restore.prim.BackupException;
import restore.prim.fs.Filesystem;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.util.Date;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Packs a directory tree into a single tar or zip file and unpacks it again.  Entry
 * names are relative to the packed directory and always use <code>/</code>.
 */
public class Archiver {

  private static final Logger LOG = LoggerFactory.getLogger(Archiver.class);

  public record PackResult(long fileCount, long totalBytes) {
  }

  /**
   * @param files names of the files extracted
   */
  public record UnpackResult(long fileCount, long totalBytes, Set<String> files) {
  }

  private final Filesystem filesystem;

  public Archiver(Filesystem filesystem) {
    this.filesystem = filesystem;
  }

  public Filesystem filesystem() {
    return filesystem;
  }

  /**
   * @param sourceDir the directory to pack
   * @param archive the file to write
   * @param exclusions patterns of files and directories to leave out
   */
  public PackResult pack(Path sourceDir, Path archive, ArchiveFormat format, Set<PathMatcher> exclusions) throws IOException {
    return pack(sourceDir, archive, format, exclusions, name -> true);
  }

  /**
   * Pack only some files.  Directories are always included, so the archive keeps the
   * shape of the tree.
   *
   * @param include tested with each file's entry name
   */
  public PackResult pack(Path sourceDir, Path archive, ArchiveFormat format, Set<PathMatcher> exclusions, Predicate<String> include) throws IOException {
    long[] counts = new long[2];
    try (OutputStream file = new BufferedOutputStream(Files.newOutputStream(archive), Util.SUGGESTED_BUFFER_SIZE);
         ArchiveOutputStream out = open(file, format)) {
      filesystem.scan(sourceDir, exclusions,
              dir -> {
                ArchiveEntry entry = out.createArchiveEntry(dir.toFile(), entryName(sourceDir, dir) + "/");
                out.putArchiveEntry(entry);
                out.closeArchiveEntry();
              },
              f -> {
                if (Thread.currentThread().isInterrupted()) {
                  throw new InterruptedIOException("interrupted while archiving " + sourceDir);
                }
                String name = entryName(sourceDir, f.path());
                if (!include.test(name)) {
                  return;
                }
                ArchiveEntry entry = out.createArchiveEntry(f.path().toFile(), name);
                out.putArchiveEntry(entry);
                long n = Files.copy(f.path(), out);
                out.closeArchiveEntry();
                counts[0] += 1;
                counts[1] += n;
              });
      out.finish();
    }
    LOG.debug("packed {} files ({}) from {}", counts[0], Util.formatSize(counts[1]), sourceDir);
    return new PackResult(counts[0], counts[1]);
  }

  private static ArchiveOutputStream open(OutputStream out, ArchiveFormat format) {
    switch (format) {
      case TAR:
        TarArchiveOutputStream tar = new TarArchiveOutputStream(out);
        tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
        tar.setBigNumberMode(TarArchiveOutputStream.BIGNUMBER_POSIX);
        return tar;
      case ZIP:
        return new ZipArchiveOutputStream(out);
      default:
        throw new IllegalArgumentException("unknown format " + format);
    }
  }

  static String entryName(Path root, Path p) {
    Path relative = root.relativize(p);
    StringBuilder name = new StringBuilder();
    for (Path part : relative) {
      if (name.length() > 0) {
        name.append('/');
      }
      name.append(part);
    }
    return name.toString();
  }

  /**
   * Extract every entry into <code>targetDir</code>, replacing files that already exist.
   *
   * @throws BackupException if an entry would land outside <code>targetDir</code>
   */
  public UnpackResult unpack(InputStream archive, ArchiveFormat format, Path targetDir) throws IOException {
    Path root = targetDir.toAbsolutePath().normalize();
    Files.createDirectories(root);
    long bytes = 0;
    Set<String> files = new TreeSet<>();
    try (ArchiveInputStream in = open(archive, format)) {
      ArchiveEntry entry;
      while ((entry = in.getNextEntry()) != null) {
        if (!in.canReadEntryData(entry)) {
          LOG.warn("skipping unreadable archive entry {}", entry.getName());
          continue;
        }
        Path target = root.resolve(entry.getName()).normalize();
        if (!target.startsWith(root)) {
          throw new BackupException(BackupException.Stage.UNPACK, "archive entry " + entry.getName() + " escapes " + root, null);
        }
        if (entry.isDirectory()) {
          Files.createDirectories(target);
          continue;
        }
        if (isSpecial(entry)) {
          LOG.warn("skipping archive entry {} that is not a regular file", entry.getName());
          continue;
        }
        Path parent = target.getParent();
        if (parent != null) {
          Files.createDirectories(parent);
        }
        bytes += Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        files.add(entryName(root, target));
        Date modified = entry.getLastModifiedDate();
        if (modified != null) {
          Files.setLastModifiedTime(target, FileTime.fromMillis(modified.getTime()));
        }
      }
    }
    return new UnpackResult(files.size(), bytes, files);
  }

  private static ArchiveInputStream open(InputStream in, ArchiveFormat format) {
    switch (format) {
      case TAR:
        return new TarArchiveInputStream(in);
      case ZIP:
        return new ZipArchiveInputStream(in);
      default:
        throw new IllegalArgumentException("unknown format " + format);
    }
  }

  private static boolean isSpecial(ArchiveEntry entry) {
    if (entry instanceof TarArchiveEntry) {
      return !((TarArchiveEntry) entry).isFile();
    }
    if (entry instanceof ZipArchiveEntry) {
      return ((ZipArchiveEntry) entry).isUnixSymlink();
    }
    return false;
  }

}
