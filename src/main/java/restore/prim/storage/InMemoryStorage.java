package restore.prim.storage;

import com.google.common.collect.ImmutableSortedSet;
import restore.prim.NotFoundException;
import restore.prim.UnsupportedCapabilityException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedSet;

/**
 * A backend that keeps objects in memory.  Useful for tests and for callers that
 * embed the engine.  Several instances may share one set of objects by passing the
 * same map to {@link #InMemoryStorage(Map, boolean)}.
 */
public class InMemoryStorage implements StorageBackend {

  private final Map<String, byte[]> entries;
  private final boolean sharing;
  private boolean closed = false;

  public InMemoryStorage() {
    this(new HashMap<>(), false);
  }

  /**
   * @param entries backing map; all access synchronizes on it
   * @param sharing whether {@link #generateShareLink(String, Duration)} is offered
   */
  public InMemoryStorage(Map<String, byte[]> entries, boolean sharing) {
    this.entries = entries;
    this.sharing = sharing;
  }

  @Override
  public void initialize(Map<String, String> options) {
  }

  @Override
  public void upload(Path localFile, String remotePath) throws IOException {
    byte[] data;
    try {
      data = Files.readAllBytes(localFile);
    } catch (NoSuchFileException e) {
      throw new NotFoundException(localFile.toString(), e);
    }
    synchronized (entries) {
      entries.put(remotePath, data);
    }
  }

  @Override
  public void download(String remotePath, Path localFile) throws IOException {
    byte[] data;
    synchronized (entries) {
      data = entries.get(remotePath);
    }
    if (data == null) {
      throw new NotFoundException(remotePath);
    }
    Path parent = localFile.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.write(localFile, data);
  }

  @Override
  public boolean exists(String remotePath) {
    synchronized (entries) {
      return entries.containsKey(remotePath);
    }
  }

  @Override
  public void delete(String remotePath) throws IOException {
    synchronized (entries) {
      entries.remove(remotePath);
    }
  }

  @Override
  public boolean supportsSharing() {
    return sharing;
  }

  @Override
  public String generateShareLink(String remotePath, Duration expiration) throws IOException {
    if (!sharing) {
      throw new UnsupportedCapabilityException("in-memory storage was created without sharing");
    }
    if (!exists(remotePath)) {
      throw new NotFoundException(remotePath);
    }
    return "memory:///" + remotePath + "?expires=" + expiration.toSeconds();
  }

  public SortedSet<String> names() {
    synchronized (entries) {
      return ImmutableSortedSet.copyOf(entries.keySet());
    }
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    closed = true;
  }

  @Override
  public String toString() {
    return "InMemoryStorage" + names();
  }

}
