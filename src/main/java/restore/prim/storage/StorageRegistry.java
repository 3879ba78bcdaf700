package restore.prim.storage;

import com.google.common.collect.ImmutableSortedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import restore.prim.ConfigurationException;

import java.io.IOException;
import java.util.Locale;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Maps storage type names (case-insensitive) to backend factories.
 *
 * <p>Backends obtained from {@link #open(String, Map)} are already initialized and are
 * owned by the caller, who must close them.
 */
public class StorageRegistry {

  private static final Logger LOG = LoggerFactory.getLogger(StorageRegistry.class);

  private final Map<String, Supplier<? extends StorageBackend>> factories = new TreeMap<>();

  /**
   * @return a registry with every built-in backend
   */
  public static StorageRegistry withDefaults() {
    return new StorageRegistry()
            .register("local", LocalStorage::new)
            .register("s3", S3Storage::new)
            .register("b2", B2Storage::new)
            .register("gcp", GcsStorage::new)
            .register("azure", AzureBlobStorage::new)
            .register("dropbox", DropboxStorage::new)
            .register("sftp", SftpStorage::new)
            .register("github", GitHubStorage::new)
            .register("gdrive", GoogleDriveStorage::new);
  }

  public synchronized StorageRegistry register(String name, Supplier<? extends StorageBackend> factory) {
    factories.put(normalize(name), factory);
    return this;
  }

  public synchronized SortedSet<String> names() {
    return ImmutableSortedSet.copyOf(factories.keySet());
  }

  public synchronized boolean isRegistered(String name) {
    return factories.containsKey(normalize(name));
  }

  /**
   * Create and initialize a backend.  If initialization fails the half-built backend is
   * closed before the failure propagates.
   *
   * @param name a storage type, in any letter case
   * @param options options for that backend
   * @return an initialized backend that the caller must close
   * @throws ConfigurationException if <code>name</code> is unknown or the options are bad
   */
  public StorageBackend open(String name, Map<String, String> options) throws IOException {
    Supplier<? extends StorageBackend> factory;
    synchronized (this) {
      factory = factories.get(normalize(name));
    }
    if (factory == null) {
      throw new ConfigurationException("unknown storage type '" + name + "'; valid types are " + String.join(", ", names()));
    }
    StorageBackend backend = factory.get();
    try {
      backend.initialize(options);
    } catch (IOException | RuntimeException e) {
      backend.close();
      throw e;
    }
    LOG.debug("opened {} storage", normalize(name));
    return backend;
  }

  private static String normalize(String name) {
    return name.trim().toLowerCase(Locale.ROOT);
  }

}
