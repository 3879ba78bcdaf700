package restore.bkup.impls;

import restore.bkup.types.PasswordProvider;
import restore.prim.TransferException;
import restore.prim.storage.InMemoryStorage;
import restore.prim.storage.StorageRegistry;
import restore.prim.time.UnreliableWallClock;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * Shared helpers for the engine tests.
 */
final class Fixtures {

  private Fixtures() {
  }

  /**
   * In-memory storage that counts calls and can be told to fail.
   */
  static class RecordingStorage extends InMemoryStorage {
    final AtomicInteger uploads = new AtomicInteger();
    final AtomicInteger deletes = new AtomicInteger();
    final AtomicInteger links = new AtomicInteger();
    final List<String> uploadedPaths = Collections.synchronizedList(new ArrayList<>());
    volatile boolean failUploads = false;
    volatile boolean failLinks = false;
    volatile boolean failDeletes = false;

    RecordingStorage(Map<String, byte[]> entries, boolean sharing) {
      super(entries, sharing);
    }

    @Override
    public void upload(Path localFile, String remotePath) throws IOException {
      uploads.incrementAndGet();
      if (failUploads) {
        throw new TransferException("upload refused");
      }
      super.upload(localFile, remotePath);
      uploadedPaths.add(remotePath);
    }

    @Override
    public void delete(String remotePath) throws IOException {
      deletes.incrementAndGet();
      if (failDeletes) {
        throw new TransferException("delete refused");
      }
      super.delete(remotePath);
    }

    @Override
    public String generateShareLink(String remotePath, Duration expiration) throws IOException {
      links.incrementAndGet();
      if (failLinks) {
        throw new TransferException("link refused");
      }
      return super.generateShareLink(remotePath, expiration);
    }
  }

  /**
   * Storage types registered under one registry, each with its own objects; every
   * opened instance of a type sees the same objects.
   */
  static class Backends {
    final StorageRegistry registry = new StorageRegistry();
    final Map<String, Map<String, byte[]>> objects = new HashMap<>();
    final Map<String, AtomicReference<RecordingStorage>> lastOpened = new HashMap<>();
    final Map<String, AtomicInteger> opens = new HashMap<>();

    Backends add(String type, boolean sharing) {
      Map<String, byte[]> entries = new TreeMap<>();
      AtomicReference<RecordingStorage> last = new AtomicReference<>();
      AtomicInteger count = new AtomicInteger();
      objects.put(type, entries);
      lastOpened.put(type, last);
      opens.put(type, count);
      registry.register(type, () -> {
        RecordingStorage s = new RecordingStorage(entries, sharing);
        last.set(s);
        count.incrementAndGet();
        return s;
      });
      return this;
    }

    Map<String, byte[]> objects(String type) {
      return objects.get(type);
    }

    RecordingStorage last(String type) {
      return lastOpened.get(type).get();
    }

    int opens(String type) {
      return opens.get(type).get();
    }
  }

  /**
   * A clock that moves forward one second every time it is read.
   */
  static UnreliableWallClock steppingClock(Instant start) {
    AtomicInteger ticks = new AtomicInteger();
    return () -> start.plusSeconds(ticks.getAndIncrement());
  }

  static UnreliableWallClock fixedClock(Instant when) {
    return () -> when;
  }

  static PasswordProvider password(String password, AtomicInteger forgets) {
    return new PasswordProvider() {
      @Override
      public String password() {
        return password;
      }

      @Override
      public void forget() {
        forgets.incrementAndGet();
      }
    };
  }

  static void write(Path file, String text) throws IOException {
    Path parent = file.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.write(file, text.getBytes(StandardCharsets.UTF_8));
  }

  static String read(Path file) throws IOException {
    return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
  }

  static long countEntries(Path dir) throws IOException {
    if (!Files.exists(dir)) {
      return 0;
    }
    try (Stream<Path> s = Files.walk(dir)) {
      return s.filter(Files::isRegularFile).count();
    }
  }

  /**
   * A small tree: two files at the top, one nested, one that sample exclusions skip.
   */
  static Path sampleTree(String name) throws IOException {
    Path root = Files.createTempDirectory("src").resolve(name);
    write(root.resolve("a.txt"), "alpha");
    write(root.resolve("b.txt"), "bravo bravo bravo");
    write(root.resolve("sub/c.txt"), "charlie");
    write(root.resolve("scratch.tmp"), "junk");
    return root;
  }

}
