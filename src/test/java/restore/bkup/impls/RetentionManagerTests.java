package restore.bkup.impls;

import com.google.common.collect.ImmutableMap;
import org.testng.Assert;
import org.testng.annotations.Test;
import restore.bkup.types.BackupRecord;
import restore.bkup.types.BackupType;
import restore.bkup.types.Config;
import restore.bkup.types.RetentionPolicy;
import restore.prim.storage.StorageBackend;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Test
public class RetentionManagerTests {

  private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

  private static BackupRecord daysAgo(int days, String storageType) {
    return new BackupRecord("/docs", "backups/docs/" + days + ".tar", NOW.minus(Duration.ofDays(days)), 1, 1, storageType, false);
  }

  private static BackupRecord daysAgo(int days, BackupType kind) {
    return new BackupRecord("/docs", "backups/docs/" + days + ".tar", NOW.minus(Duration.ofDays(days)), 1, 1, "memory", false,
            kind, List.of());
  }

  private static List<BackupRecord> history(int... days) {
    List<BackupRecord> result = new ArrayList<>();
    for (int d : days) {
      result.add(daysAgo(d, "memory"));
    }
    return result;
  }

  @Test
  public void testDisabledKeepsEverything() {
    Assert.assertEquals(RetentionManager.expired(history(9, 8, 7), RetentionPolicy.DISABLED, NOW), List.of());
  }

  @Test
  public void testKeepLast() {
    RetentionPolicy policy = new RetentionPolicy(true, 2, null);
    Assert.assertEquals(
            RetentionManager.expired(history(1, 40, 3, 20), policy, NOW),
            List.of(daysAgo(40, "memory"), daysAgo(20, "memory")));
  }

  @Test
  public void testYoungRecordsSurvive() {
    RetentionPolicy policy = new RetentionPolicy(true, 1, Duration.ofDays(10));
    Assert.assertEquals(
            RetentionManager.expired(history(1, 5, 9, 11, 30), policy, NOW),
            List.of(daysAgo(30, "memory"), daysAgo(11, "memory")));
  }

  @Test
  public void testNewestAlwaysSurvives() {
    RetentionPolicy policy = new RetentionPolicy(true, 1, Duration.ZERO);
    Assert.assertEquals(RetentionManager.expired(history(100), policy, NOW), List.of());
    Assert.assertEquals(
            RetentionManager.expired(history(100, 200), policy, NOW),
            List.of(daysAgo(200, "memory")));
  }

  @Test
  public void testBackupsOthersBuildOnSurvive() {
    RetentionPolicy policy = new RetentionPolicy(true, 1, null);
    List<BackupRecord> history = List.of(
            daysAgo(30, BackupType.FULL), daysAgo(20, BackupType.INCREMENTAL), daysAgo(10, BackupType.INCREMENTAL));
    Assert.assertEquals(RetentionManager.expired(history, policy, NOW), List.of());
  }

  @Test
  public void testOldChainsExpireWhole() {
    RetentionPolicy policy = new RetentionPolicy(true, 2, null);
    List<BackupRecord> history = List.of(
            daysAgo(40, BackupType.FULL), daysAgo(30, BackupType.INCREMENTAL),
            daysAgo(20, BackupType.FULL), daysAgo(15, BackupType.INCREMENTAL), daysAgo(10, BackupType.DIFFERENTIAL));
    Assert.assertEquals(
            RetentionManager.expired(history, policy, NOW),
            List.of(daysAgo(40, BackupType.FULL), daysAgo(30, BackupType.INCREMENTAL)));
  }

  @Test
  public void testApplyDeletesFromRecordedBackends() throws IOException {
    Fixtures.Backends backends = new Fixtures.Backends().add("memory", false).add("other", false);
    StateStore state = new StateStore(Files.createTempDirectory("retention").resolve("state.json"));
    state.load();
    BackupRecord oldOther = daysAgo(30, "other");
    BackupRecord oldMemory = daysAgo(20, "memory");
    BackupRecord newest = daysAgo(1, "memory");
    for (BackupRecord r : List.of(oldOther, oldMemory, newest)) {
      state.record(r);
      backends.objects(r.storageType()).put(r.remotePath(), new byte[] { 1 });
    }

    Config config = Config.builder().defaultStorageType("memory").build();
    RetentionManager retention = new RetentionManager(new RetentionPolicy(true, 1, null), config, backends.registry, state, Fixtures.fixedClock(NOW));
    try (StorageBackend current = backends.registry.open("memory", ImmutableMap.of())) {
      retention.apply("/docs", "memory", current);
    }

    Assert.assertEquals(state.history("/docs"), List.of(newest));
    Assert.assertEquals(backends.objects("memory").keySet(), java.util.Set.of(newest.remotePath()));
    Assert.assertTrue(backends.objects("other").isEmpty());
    Assert.assertEquals(backends.opens("memory"), 1, "the current backend is reused");
    Assert.assertEquals(backends.opens("other"), 1);
    Assert.assertTrue(backends.last("other").isClosed());
  }

  @Test
  public void testFailedDeletesAreKept() throws IOException {
    Fixtures.Backends backends = new Fixtures.Backends().add("memory", false);
    StateStore state = new StateStore(Files.createTempDirectory("retention").resolve("state.json"));
    state.load();
    state.record(daysAgo(10, "memory"));
    state.record(daysAgo(1, "memory"));

    Config config = Config.builder().defaultStorageType("memory").build();
    RetentionManager retention = new RetentionManager(new RetentionPolicy(true, 1, null), config, backends.registry, state, Fixtures.fixedClock(NOW));
    try (Fixtures.RecordingStorage current = (Fixtures.RecordingStorage) backends.registry.open("memory", ImmutableMap.of())) {
      current.failDeletes = true;
      retention.apply("/docs", "memory", current);
    }
    Assert.assertEquals(state.history("/docs").size(), 2);
  }

}
