package restore.bkup.impls;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Watches directory trees with the platform {@link WatchService}.  Directories created
 * after subscription are watched as they appear.  When the platform drops events, the
 * affected directory itself is reported as changed.
 */
public class DirectoryChangeSource implements ChangeSource {

  private static final Logger LOG = LoggerFactory.getLogger(DirectoryChangeSource.class);

  private final Map<WatchKey, Path> keys = new ConcurrentHashMap<>();
  private @Nullable WatchService watcher;
  private @Nullable Thread thread;

  @Override
  public synchronized void subscribe(Collection<Path> roots, Consumer<Path> onChange) throws IOException {
    if (watcher != null) {
      throw new IllegalStateException("already subscribed");
    }
    WatchService service = FileSystems.getDefault().newWatchService();
    watcher = service;
    for (Path root : roots) {
      registerAll(service, root);
    }
    Thread t = new Thread(() -> pump(service, onChange), "change-source");
    t.setDaemon(true);
    t.start();
    thread = t;
  }

  private void registerAll(WatchService service, Path root) throws IOException {
    Files.walkFileTree(root, new SimpleFileVisitor<>() {
      @Override
      public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
        WatchKey key = dir.register(service,
                StandardWatchEventKinds.ENTRY_CREATE,
                StandardWatchEventKinds.ENTRY_MODIFY,
                StandardWatchEventKinds.ENTRY_DELETE);
        keys.put(key, dir);
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult visitFileFailed(Path file, IOException exc) {
        LOG.warn("cannot watch {}: {}", file, exc.toString());
        return FileVisitResult.CONTINUE;
      }
    });
  }

  private void pump(WatchService service, Consumer<Path> onChange) {
    for (;;) {
      WatchKey key;
      try {
        key = service.take();
      } catch (InterruptedException | ClosedWatchServiceException e) {
        LOG.debug("change source stopped");
        return;
      }
      Path dir = keys.get(key);
      if (dir == null) {
        key.reset();
        continue;
      }
      for (WatchEvent<?> event : key.pollEvents()) {
        if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
          onChange.accept(dir);
          continue;
        }
        Path child = dir.resolve((Path) event.context());
        if (event.kind() == StandardWatchEventKinds.ENTRY_CREATE && Files.isDirectory(child)) {
          try {
            registerAll(service, child);
          } catch (IOException | ClosedWatchServiceException e) {
            LOG.warn("cannot watch new directory {}: {}", child, e.toString());
          }
        }
        onChange.accept(child);
      }
      if (!key.reset()) {
        keys.remove(key);
      }
    }
  }

  @Override
  public synchronized void close() {
    if (watcher != null) {
      try {
        watcher.close();
      } catch (IOException e) {
        LOG.warn("failed to close watch service: {}", e.toString());
      }
      watcher = null;
    }
    if (thread != null) {
      thread.interrupt();
      thread = null;
    }
    keys.clear();
  }

}
