package restore.bkup.impls;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import restore.bkup.types.BackupRecord;
import restore.bkup.types.BackupType;
import restore.bkup.types.FileFingerprint;
import restore.prim.BackupException;
import restore.prim.NotFoundException;
import restore.prim.StateCorruptionException;
import restore.prim.fs.DurableFiles;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Durable record of completed backups, kept as a JSON file.
 *
 * <p>The file is read once by {@link #load()} and rewritten in full, atomically, after
 * every change.  A crash at any moment leaves either the previous file or the new one.
 * Unknown fields are ignored and missing ones take defaults, so older and newer versions
 * of the file can be read.  A file that cannot be read at all is replaced by an empty
 * state (with a warning) rather than stopping the engine.
 *
 * <p>All methods are thread-safe.  Updates are serialized and persisted before they
 * return.
 */
public class StateStore {

  private static final Logger LOG = LoggerFactory.getLogger(StateStore.class);

  /** Oldest records beyond this many per directory are forgotten. */
  public static final int MAX_HISTORY = 50;

  private static final int FORMAT_VERSION = 1;

  private static class JsonRecord {
    public String remotePath;
    public String timestamp;
    public long sizeBytesOriginal;
    public long sizeBytesStored;
    public String storageType;
    public boolean encrypted;
    public String type;
    public List<String> deletedFiles;
  }

  private static class JsonFingerprint {
    public long size;
    public String modified;
    public String sha256;
  }

  private static class JsonManifests {
    public Map<String, JsonFingerprint> latest;
    public Map<String, JsonFingerprint> base;
  }

  private static class JsonState {
    public int version = FORMAT_VERSION;
    public Map<String, List<JsonRecord>> paths = new LinkedHashMap<>();
    public Map<String, JsonManifests> manifests = new LinkedHashMap<>();
  }

  /**
   * File fingerprints of a directory.
   *
   * @param latest as of the newest backup
   * @param base as of the newest full backup
   */
  public record Manifests(Map<String, FileFingerprint> latest, Map<String, FileFingerprint> base) {
  }

  private final Path file;
  private final ObjectMapper mapper = new ObjectMapper()
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
          .configure(SerializationFeature.INDENT_OUTPUT, true);

  /** Source path to records, oldest first. */
  private final Map<String, List<BackupRecord>> history = new LinkedHashMap<>();

  private final Map<String, Manifests> manifests = new LinkedHashMap<>();

  public StateStore(Path file) {
    this.file = file;
  }

  public Path file() {
    return file;
  }

  /**
   * Replace the in-memory state with the contents of the file.  Never fails: a missing
   * file gives an empty state, and so does an unreadable one.
   */
  public synchronized void load() {
    history.clear();
    manifests.clear();
    JsonState json;
    try (InputStream in = Files.newInputStream(file)) {
      json = mapper.readValue(in, JsonState.class);
    } catch (NoSuchFileException e) {
      LOG.info("no state file at {}; starting fresh", file);
      return;
    } catch (IOException | RuntimeException e) {
      StateCorruptionException corruption = new StateCorruptionException(file, e);
      LOG.warn("{}; starting with an empty state", corruption.getMessage(), corruption);
      return;
    }
    if (json == null || json.paths == null) {
      LOG.warn("state file {} is empty; starting fresh", file);
      return;
    }
    for (Map.Entry<String, List<JsonRecord>> entry : json.paths.entrySet()) {
      if (entry.getKey() == null || entry.getValue() == null) {
        continue;
      }
      List<BackupRecord> records = new ArrayList<>();
      for (JsonRecord r : entry.getValue()) {
        @Nullable BackupRecord record = fromJson(entry.getKey(), r);
        if (record != null) {
          records.add(record);
        }
      }
      records.sort((a, b) -> a.timestamp().compareTo(b.timestamp()));
      if (!records.isEmpty()) {
        history.put(entry.getKey(), records);
      }
    }
    if (json.manifests != null) {
      for (Map.Entry<String, JsonManifests> entry : json.manifests.entrySet()) {
        JsonManifests m = entry.getValue();
        if (entry.getKey() != null && m != null && history.containsKey(entry.getKey())) {
          manifests.put(entry.getKey(), new Manifests(fromJson(m.latest), fromJson(m.base)));
        }
      }
    }
    LOG.debug("loaded state for {} directories from {}", history.size(), file);
  }

  private static @Nullable BackupRecord fromJson(String sourcePath, @Nullable JsonRecord r) {
    if (r == null || r.remotePath == null || r.timestamp == null) {
      LOG.warn("ignoring incomplete record for {}", sourcePath);
      return null;
    }
    Instant timestamp;
    try {
      timestamp = Instant.parse(r.timestamp);
    } catch (DateTimeParseException e) {
      LOG.warn("ignoring record for {} with bad timestamp {}", sourcePath, r.timestamp);
      return null;
    }
    BackupType kind = BackupType.FULL;
    if (r.type != null) {
      try {
        kind = BackupType.named(r.type);
      } catch (IllegalArgumentException e) {
        LOG.warn("ignoring record for {} with unknown type {}", sourcePath, r.type);
        return null;
      }
    }
    return new BackupRecord(
            sourcePath,
            r.remotePath,
            timestamp,
            r.sizeBytesOriginal,
            r.sizeBytesStored,
            r.storageType != null ? r.storageType : "local",
            r.encrypted,
            kind,
            r.deletedFiles == null
                    ? ImmutableList.of()
                    : r.deletedFiles.stream().filter(Objects::nonNull).collect(Collectors.toList()));
  }

  /**
   * Entries that cannot be read are dropped; the files they describe then count as
   * changed.
   */
  private static Map<String, FileFingerprint> fromJson(@Nullable Map<String, JsonFingerprint> json) {
    if (json == null) {
      return ImmutableMap.of();
    }
    ImmutableMap.Builder<String, FileFingerprint> result = ImmutableMap.builder();
    for (Map.Entry<String, JsonFingerprint> entry : json.entrySet()) {
      JsonFingerprint f = entry.getValue();
      if (entry.getKey() == null || f == null || f.modified == null || f.sha256 == null) {
        continue;
      }
      try {
        result.put(entry.getKey(), new FileFingerprint(f.size, Instant.parse(f.modified), f.sha256));
      } catch (DateTimeParseException e) {
        LOG.debug("dropping fingerprint of {} with bad time {}", entry.getKey(), f.modified);
      }
    }
    return result.build();
  }

  private static Map<String, JsonFingerprint> toJson(Map<String, FileFingerprint> files) {
    Map<String, JsonFingerprint> result = new TreeMap<>();
    for (Map.Entry<String, FileFingerprint> entry : files.entrySet()) {
      JsonFingerprint f = new JsonFingerprint();
      f.size = entry.getValue().size();
      f.modified = entry.getValue().modTime().toString();
      f.sha256 = entry.getValue().sha256();
      result.put(entry.getKey(), f);
    }
    return result;
  }

  private static JsonRecord toJson(BackupRecord record) {
    JsonRecord r = new JsonRecord();
    r.remotePath = record.remotePath();
    r.timestamp = record.timestamp().toString();
    r.sizeBytesOriginal = record.sizeBytesOriginal();
    r.sizeBytesStored = record.sizeBytesStored();
    r.storageType = record.storageType();
    r.encrypted = record.encrypted();
    r.type = record.kind().name();
    r.deletedFiles = record.deletedFiles().isEmpty() ? null : record.deletedFiles();
    return r;
  }

  /**
   * Append a record and persist.  The oldest records are forgotten once a directory has
   * more than {@link #MAX_HISTORY}, together with any partial backups that relied on them.
   *
   * @throws IllegalArgumentException if the record is not newer than the latest one for
   *         its directory
   * @throws BackupException if the state could not be written; the in-memory state is
   *         left unchanged
   */
  public synchronized void record(BackupRecord record) throws IOException {
    record(record, null);
  }

  /**
   * Append a record together with the fingerprints of the files it was taken from, and
   * persist both at once.
   *
   * @param files fingerprints of every file in the directory at backup time, or null to
   *              keep the current ones
   */
  public synchronized void record(BackupRecord record, @Nullable Map<String, FileFingerprint> files) throws IOException {
    String key = record.sourcePath();
    @Nullable BackupRecord latest = latest(key);
    if (latest != null && !record.timestamp().isAfter(latest.timestamp())) {
      throw new IllegalArgumentException("record at " + record.timestamp() + " is not newer than " + latest.timestamp() + " for " + key);
    }
    @Nullable List<BackupRecord> before = history.get(key);
    @Nullable Manifests manifestsBefore = manifests.get(key);

    List<BackupRecord> records = before == null ? new ArrayList<>() : new ArrayList<>(before);
    records.add(record);
    while (records.size() > MAX_HISTORY) {
      records.remove(0);
      while (records.size() > 1 && records.get(0).kind() != BackupType.FULL) {
        records.remove(0);
      }
    }
    history.put(key, records);
    if (files != null) {
      Map<String, FileFingerprint> copy = ImmutableMap.copyOf(files);
      Map<String, FileFingerprint> base = record.kind() == BackupType.FULL || manifestsBefore == null
              ? copy
              : manifestsBefore.base();
      manifests.put(key, new Manifests(copy, base));
    }

    try {
      persist();
    } catch (IOException e) {
      if (before == null) {
        history.remove(key);
      } else {
        history.put(key, before);
      }
      if (manifestsBefore == null) {
        manifests.remove(key);
      } else {
        manifests.put(key, manifestsBefore);
      }
      throw BackupException.at(BackupException.Stage.RECORD, e);
    }
  }

  /**
   * Forget records (for instance after their artifacts were deleted) and persist.
   */
  public synchronized void remove(String sourcePath, Collection<String> remotePaths) throws IOException {
    List<BackupRecord> records = history.get(sourcePath);
    if (records == null || remotePaths.isEmpty()) {
      return;
    }
    Set<String> doomed = ImmutableSet.copyOf(remotePaths);
    if (records.removeIf(r -> doomed.contains(r.remotePath()))) {
      if (records.isEmpty()) {
        history.remove(sourcePath);
        manifests.remove(sourcePath);
      }
      persist();
    }
  }

  /**
   * @return fingerprints recorded with the latest backups of a directory, or null if
   *         there are none
   */
  public synchronized @Nullable Manifests manifests(String sourcePath) {
    return history.containsKey(sourcePath) ? manifests.get(sourcePath) : null;
  }

  /**
   * The backups that restore a directory to the state captured by <code>target</code>,
   * oldest first.  For a full backup that is just <code>target</code>.
   *
   * @throws NotFoundException if a backup the chain needs is no longer recorded
   */
  public synchronized List<BackupRecord> chain(BackupRecord target) throws NotFoundException {
    List<BackupRecord> chain = chain(history(target.sourcePath()), target);
    if (chain.get(0).kind() != BackupType.FULL) {
      throw new NotFoundException("record of the backups " + target.remotePath() + " builds on");
    }
    return chain;
  }

  /**
   * Walk back from <code>target</code>: an incremental backup needs the backup before
   * it, a differential one needs the last full backup before it.
   *
   * @param history records of one directory, oldest first
   * @return the records found, oldest first; the first is not a full backup if the
   *         history is missing some
   */
  static List<BackupRecord> chain(List<BackupRecord> history, BackupRecord target) {
    List<BackupRecord> newestFirst = new ArrayList<>();
    newestFirst.add(target);
    int i = history.indexOf(target);
    BackupRecord current = target;
    while (current.kind() != BackupType.FULL && i > 0) {
      i -= 1;
      BackupRecord previous = history.get(i);
      if (current.kind() == BackupType.DIFFERENTIAL && previous.kind() != BackupType.FULL) {
        continue;
      }
      newestFirst.add(previous);
      current = previous;
    }
    return Lists.reverse(newestFirst);
  }

  public synchronized @Nullable BackupRecord latest(String sourcePath) {
    List<BackupRecord> records = history.get(sourcePath);
    return records == null || records.isEmpty() ? null : records.get(records.size() - 1);
  }

  /**
   * @return records for a directory, oldest first
   */
  public synchronized List<BackupRecord> history(String sourcePath) {
    List<BackupRecord> records = history.get(sourcePath);
    return records == null ? ImmutableList.of() : ImmutableList.copyOf(records);
  }

  public synchronized @Nullable BackupRecord findByRemotePath(String remotePath) {
    for (List<BackupRecord> records : history.values()) {
      for (BackupRecord r : records) {
        if (r.remotePath().equals(remotePath)) {
          return r;
        }
      }
    }
    return null;
  }

  public synchronized Set<String> paths() {
    return ImmutableSet.copyOf(history.keySet());
  }

  private void persist() throws IOException {
    JsonState json = new JsonState();
    for (Map.Entry<String, List<BackupRecord>> entry : history.entrySet()) {
      List<JsonRecord> records = new ArrayList<>();
      for (BackupRecord r : entry.getValue()) {
        records.add(toJson(r));
      }
      json.paths.put(entry.getKey(), records);
    }
    for (Map.Entry<String, Manifests> entry : manifests.entrySet()) {
      JsonManifests m = new JsonManifests();
      m.latest = toJson(entry.getValue().latest());
      m.base = toJson(entry.getValue().base());
      json.manifests.put(entry.getKey(), m);
    }
    DurableFiles.atomicWrite(file, mapper.writeValueAsBytes(json));
  }

}
