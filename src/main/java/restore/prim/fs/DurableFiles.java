package restore.prim.fs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import restore.prim.IOConsumer;

import java.io.BufferedOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Crash-safe file replacement.  Data is written to a temporary sibling of the target,
 * flushed to disk, and renamed over the target.  A reader sees either the old contents
 * or the new contents, never a mix.
 */
public abstract class DurableFiles {

  private static final Logger LOG = LoggerFactory.getLogger(DurableFiles.class);

  /**
   * Atomically replace <code>target</code> with whatever <code>writer</code> produces.
   * The writer must not close the stream it is given.
   */
  public static void atomicWrite(Path target, IOConsumer<OutputStream> writer) throws IOException {
    Path absolute = target.toAbsolutePath();
    Path dir = absolute.getParent();
    Files.createDirectories(dir);
    Path tmp = Files.createTempFile(dir, "." + absolute.getFileName(), ".tmp");
    boolean moved = false;
    try {
      try (FileOutputStream fos = new FileOutputStream(tmp.toFile());
           OutputStream out = new BufferedOutputStream(fos)) {
        writer.accept(out);
        out.flush();
        fos.getFD().sync();
      }
      try {
        Files.move(tmp, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING);
      }
      moved = true;
      syncDirectory(dir);
    } finally {
      if (!moved) {
        Files.deleteIfExists(tmp);
      }
    }
  }

  public static void atomicWrite(Path target, byte[] data) throws IOException {
    atomicWrite(target, out -> out.write(data));
  }

  public static void atomicCopy(Path source, Path target) throws IOException {
    atomicWrite(target, out -> Files.copy(source, out));
  }

  private static void syncDirectory(Path dir) {
    // Not every platform lets you open a directory for reading.
    try (FileChannel channel = FileChannel.open(dir, StandardOpenOption.READ)) {
      channel.force(true);
    } catch (IOException e) {
      LOG.debug("could not sync directory {}: {}", dir, e.toString());
    }
  }

}
