package restore.bkup.impls;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import restore.bkup.types.BackupRecord;
import restore.bkup.types.Config;
import restore.bkup.types.RetentionPolicy;
import restore.prim.storage.StorageBackend;
import restore.prim.storage.StorageRegistry;
import restore.prim.time.UnreliableWallClock;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Deletes old backups of a directory according to a {@link RetentionPolicy}.
 * Retention is housekeeping: its failures are logged and never propagate.
 */
public class RetentionManager {

  private static final Logger LOG = LoggerFactory.getLogger(RetentionManager.class);

  private final RetentionPolicy policy;
  private final Config config;
  private final StorageRegistry registry;
  private final StateStore state;
  private final UnreliableWallClock clock;

  public RetentionManager(RetentionPolicy policy, Config config, StorageRegistry registry, StateStore state, UnreliableWallClock clock) {
    this.policy = policy;
    this.config = config;
    this.registry = registry;
    this.state = state;
    this.clock = clock;
  }

  /**
   * A backup the policy would drop is still kept while a kept partial backup builds on it.
   *
   * @param history records of one directory, in any order
   * @return the records the policy does not keep, oldest first
   */
  @VisibleForTesting
  static List<BackupRecord> expired(List<BackupRecord> history, RetentionPolicy policy, Instant now) {
    if (!policy.enabled() || history.size() <= 1) {
      return ImmutableList.of();
    }
    List<BackupRecord> newestFirst = new ArrayList<>(history);
    newestFirst.sort(Comparator.comparing(BackupRecord::timestamp).reversed());
    List<BackupRecord> result = new ArrayList<>();
    for (int i = newestFirst.size() - 1; i >= policy.keepLast(); --i) {
      BackupRecord r = newestFirst.get(i);
      Duration maxAge = policy.maxAge();
      boolean young = maxAge != null && Duration.between(r.timestamp(), now).compareTo(maxAge) < 0;
      if (!young) {
        result.add(r);
      }
    }
    if (result.isEmpty()) {
      return result;
    }

    List<BackupRecord> oldestFirst = Lists.reverse(newestFirst);
    Set<BackupRecord> needed = new HashSet<>();
    for (BackupRecord kept : oldestFirst) {
      if (!result.contains(kept)) {
        needed.addAll(StateStore.chain(oldestFirst, kept));
      }
    }
    result.removeAll(needed);
    return result;
  }

  /**
   * Apply the policy to one directory.
   *
   * @param sourceKey the directory's key in the state store
   * @param storageType the storage type <code>current</code> was opened for
   * @param current an open backend, used for records stored there; other storage types
   *                are opened as needed
   */
  public void apply(String sourceKey, String storageType, StorageBackend current) {
    List<BackupRecord> doomed = expired(state.history(sourceKey), policy, clock.now());
    if (doomed.isEmpty()) {
      return;
    }

    Map<String, List<BackupRecord>> byType = new LinkedHashMap<>();
    for (BackupRecord r : doomed) {
      byType.computeIfAbsent(r.storageType().toLowerCase(Locale.ROOT), t -> new ArrayList<>()).add(r);
    }

    List<String> deleted = new ArrayList<>();
    for (Map.Entry<String, List<BackupRecord>> entry : byType.entrySet()) {
      if (entry.getKey().equalsIgnoreCase(storageType)) {
        deleteAll(current, entry.getValue(), deleted);
      } else {
        try (StorageBackend other = registry.open(entry.getKey(), config.optionsFor(entry.getKey()))) {
          deleteAll(other, entry.getValue(), deleted);
        } catch (IOException e) {
          LOG.warn("retention: cannot open {} storage; keeping {} old backups of {} for now: {}",
                  entry.getKey(), entry.getValue().size(), sourceKey, e.toString());
        }
      }
    }

    try {
      state.remove(sourceKey, deleted);
    } catch (IOException e) {
      LOG.warn("retention: deleted {} backups of {} but could not update the state file", deleted.size(), sourceKey, e);
    }
    if (!deleted.isEmpty()) {
      LOG.info("retention: deleted {} old backups of {}", deleted.size(), sourceKey);
    }
  }

  private static void deleteAll(StorageBackend backend, List<BackupRecord> records, List<String> deleted) {
    for (BackupRecord r : records) {
      try {
        backend.delete(r.remotePath());
        deleted.add(r.remotePath());
      } catch (IOException e) {
        LOG.warn("retention: failed to delete {}: {}", r.remotePath(), e.toString());
      }
    }
  }

}
