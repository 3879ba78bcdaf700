package restore.bkup.impls;

import org.testng.Assert;
import org.testng.annotations.Test;
import com.google.common.collect.ImmutableMap;
import restore.bkup.types.BackupRecord;
import restore.bkup.types.BackupType;
import restore.bkup.types.FileFingerprint;
import restore.prim.NotFoundException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.stream.Stream;

@Test
public class StateStoreTests {

  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

  private static BackupRecord record(String source, int second) {
    return new BackupRecord(source, "backups/x/" + source.replace('/', '_') + "-" + second + ".tar.xz",
            T0.plusSeconds(second), 100, 40, "local", false);
  }

  private static BackupRecord record(String source, int second, BackupType kind, String... deleted) {
    return new BackupRecord(source, "backups/x/" + source.replace('/', '_') + "-" + second + ".tar.xz",
            T0.plusSeconds(second), 100, 40, "local", false, kind, Arrays.asList(deleted));
  }

  private static Map<String, FileFingerprint> files(String... namesAndDigests) {
    ImmutableMap.Builder<String, FileFingerprint> files = ImmutableMap.builder();
    for (int i = 0; i < namesAndDigests.length; i += 2) {
      files.put(namesAndDigests[i], new FileFingerprint(3, T0, namesAndDigests[i + 1]));
    }
    return files.build();
  }

  private static StateStore fresh() throws IOException {
    StateStore store = new StateStore(Files.createTempDirectory("state").resolve("state.json"));
    store.load();
    return store;
  }

  @Test
  public void testEmptyWhenMissing() throws IOException {
    StateStore store = fresh();
    Assert.assertTrue(store.paths().isEmpty());
    Assert.assertNull(store.latest("/docs"));
    Assert.assertEquals(store.history("/docs"), List.of());
  }

  @Test
  public void testReload() throws IOException {
    StateStore store = fresh();
    store.record(record("/docs", 1));
    store.record(record("/docs", 2));
    store.record(record("/pics", 1));

    StateStore again = new StateStore(store.file());
    again.load();
    Assert.assertEquals(again.paths(), store.paths());
    Assert.assertEquals(again.history("/docs"), Arrays.asList(record("/docs", 1), record("/docs", 2)));
    Assert.assertEquals(again.latest("/pics"), record("/pics", 1));
    Assert.assertEquals(again.findByRemotePath(record("/docs", 1).remotePath()), record("/docs", 1));
  }

  @Test
  public void testNoTemporaryFilesLeft() throws IOException {
    StateStore store = fresh();
    store.record(record("/docs", 1));
    store.record(record("/docs", 2));
    try (Stream<Path> entries = Files.list(store.file().getParent())) {
      Assert.assertEquals(entries.count(), 1L);
    }
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testRecordsMustMoveForward() throws IOException {
    StateStore store = fresh();
    store.record(record("/docs", 5));
    store.record(record("/docs", 5));
  }

  @Test
  public void testHistoryIsCapped() throws IOException {
    StateStore store = fresh();
    for (int i = 0; i < StateStore.MAX_HISTORY + 7; ++i) {
      store.record(record("/docs", i));
    }
    List<BackupRecord> history = store.history("/docs");
    Assert.assertEquals(history.size(), StateStore.MAX_HISTORY);
    Assert.assertEquals(history.get(0), record("/docs", 7));
    Assert.assertEquals(history.get(history.size() - 1), record("/docs", StateStore.MAX_HISTORY + 6));
  }

  @Test
  public void testCorruptFileGivesEmptyState() throws IOException {
    StateStore store = fresh();
    Files.write(store.file(), "{ this is not json".getBytes(StandardCharsets.UTF_8));
    store.load();
    Assert.assertTrue(store.paths().isEmpty());
    store.record(record("/docs", 1));
    StateStore again = new StateStore(store.file());
    again.load();
    Assert.assertEquals(again.latest("/docs"), record("/docs", 1));
  }

  @Test
  public void testTolerantParsing() throws IOException {
    StateStore store = fresh();
    String json = "{\n"
            + "  \"version\": 7,\n"
            + "  \"somethingNew\": [1, 2, 3],\n"
            + "  \"paths\": {\n"
            + "    \"/docs\": [\n"
            + "      {\"remotePath\": \"backups/docs/b.tar\", \"timestamp\": \"2024-01-01T00:00:02Z\", \"color\": \"blue\"},\n"
            + "      {\"remotePath\": \"backups/docs/a.tar\", \"timestamp\": \"2024-01-01T00:00:01Z\", \"storageType\": \"s3\", \"encrypted\": true},\n"
            + "      {\"timestamp\": \"2024-01-01T00:00:03Z\"},\n"
            + "      {\"remotePath\": \"backups/docs/c.tar\", \"timestamp\": \"yesterday\"}\n"
            + "    ]\n"
            + "  }\n"
            + "}\n";
    Files.write(store.file(), json.getBytes(StandardCharsets.UTF_8));
    store.load();
    List<BackupRecord> history = store.history("/docs");
    Assert.assertEquals(history.size(), 2);
    Assert.assertEquals(history.get(0).remotePath(), "backups/docs/a.tar");
    Assert.assertEquals(history.get(0).storageType(), "s3");
    Assert.assertTrue(history.get(0).encrypted());
    Assert.assertEquals(history.get(1).remotePath(), "backups/docs/b.tar");
    Assert.assertEquals(history.get(1).storageType(), "local");
    Assert.assertEquals(history.get(1).sizeBytesOriginal(), 0L);
  }

  @Test
  public void testRemove() throws IOException {
    StateStore store = fresh();
    store.record(record("/docs", 1));
    store.record(record("/docs", 2));
    store.remove("/docs", List.of(record("/docs", 1).remotePath()));
    Assert.assertEquals(store.history("/docs"), List.of(record("/docs", 2)));
    store.remove("/docs", List.of(record("/docs", 2).remotePath()));
    Assert.assertTrue(store.paths().isEmpty());

    StateStore again = new StateStore(store.file());
    again.load();
    Assert.assertTrue(again.paths().isEmpty());
  }

  @Test
  public void testConcurrentRecordsAreAllKept() throws Exception {
    StateStore store = fresh();
    int threads = 8;
    int perThread = 5;
    CountDownLatch go = new CountDownLatch(1);
    List<Thread> workers = new ArrayList<>();
    List<Throwable> failures = new ArrayList<>();
    for (int t = 0; t < threads; ++t) {
      String source = "/dir" + t;
      Thread worker = new Thread(() -> {
        try {
          go.await();
          for (int i = 0; i < perThread; ++i) {
            store.record(record(source, i));
          }
        } catch (Exception e) {
          synchronized (failures) {
            failures.add(e);
          }
        }
      });
      workers.add(worker);
      worker.start();
    }
    go.countDown();
    for (Thread worker : workers) {
      worker.join();
    }
    Assert.assertEquals(failures, List.of());

    StateStore again = new StateStore(store.file());
    again.load();
    Assert.assertEquals(again.paths().size(), threads);
    for (int t = 0; t < threads; ++t) {
      Assert.assertEquals(again.history("/dir" + t).size(), perThread);
    }
  }

  @Test
  public void testKindAndDeletionsAreKept() throws IOException {
    StateStore store = fresh();
    store.record(record("/docs", 1, BackupType.FULL));
    store.record(record("/docs", 2, BackupType.INCREMENTAL, "gone.txt", "sub/also-gone.txt"));

    StateStore again = new StateStore(store.file());
    again.load();
    BackupRecord latest = again.latest("/docs");
    Assert.assertNotNull(latest);
    Assert.assertEquals(latest.kind(), BackupType.INCREMENTAL);
    Assert.assertEquals(latest.deletedFiles(), Arrays.asList("gone.txt", "sub/also-gone.txt"));
    Assert.assertEquals(again.history("/docs").get(0).kind(), BackupType.FULL);
  }

  @Test
  public void testRecordsWithoutTypeAreFull() throws IOException {
    StateStore store = fresh();
    String json = "{\"paths\": {\"/docs\": ["
            + "{\"remotePath\": \"backups/docs/a.tar\", \"timestamp\": \"2024-01-01T00:00:01Z\"},"
            + "{\"remotePath\": \"backups/docs/b.tar\", \"timestamp\": \"2024-01-01T00:00:02Z\", \"type\": \"SYNTHETIC\"}"
            + "]}}";
    Files.write(store.file(), json.getBytes(StandardCharsets.UTF_8));
    store.load();
    List<BackupRecord> history = store.history("/docs");
    Assert.assertEquals(history.size(), 1);
    Assert.assertEquals(history.get(0).kind(), BackupType.FULL);
    Assert.assertEquals(history.get(0).deletedFiles(), List.of());
  }

  @Test
  public void testManifests() throws IOException {
    StateStore store = fresh();
    Assert.assertNull(store.manifests("/docs"));
    store.record(record("/docs", 1, BackupType.FULL), files("a.txt", "aa"));
    store.record(record("/docs", 2, BackupType.INCREMENTAL), files("a.txt", "a2"));
    store.record(record("/docs", 3, BackupType.INCREMENTAL), files("a.txt", "a3", "b.txt", "bb"));

    StateStore again = new StateStore(store.file());
    again.load();
    StateStore.Manifests manifests = again.manifests("/docs");
    Assert.assertNotNull(manifests);
    Assert.assertEquals(manifests.latest(), files("a.txt", "a3", "b.txt", "bb"));
    Assert.assertEquals(manifests.base(), files("a.txt", "aa"));

    again.record(record("/docs", 4, BackupType.FULL), files("c.txt", "cc"));
    Assert.assertEquals(again.manifests("/docs").base(), files("c.txt", "cc"));
  }

  @Test
  public void testRecordWithoutFilesKeepsManifests() throws IOException {
    StateStore store = fresh();
    store.record(record("/docs", 1, BackupType.FULL), files("a.txt", "aa"));
    store.record(record("/docs", 2, BackupType.FULL));
    Assert.assertEquals(store.manifests("/docs").latest(), files("a.txt", "aa"));
  }

  @Test
  public void testRemovingEverythingForgetsManifests() throws IOException {
    StateStore store = fresh();
    store.record(record("/docs", 1, BackupType.FULL), files("a.txt", "aa"));
    store.remove("/docs", List.of(record("/docs", 1).remotePath()));
    Assert.assertNull(store.manifests("/docs"));

    store.record(record("/docs", 2, BackupType.FULL));
    Assert.assertNull(store.manifests("/docs"));
  }

  @Test
  public void testChains() throws IOException {
    StateStore store = fresh();
    BackupRecord full = record("/docs", 1, BackupType.FULL);
    BackupRecord inc1 = record("/docs", 2, BackupType.INCREMENTAL);
    BackupRecord inc2 = record("/docs", 3, BackupType.INCREMENTAL);
    BackupRecord diff = record("/docs", 4, BackupType.DIFFERENTIAL);
    for (BackupRecord r : Arrays.asList(full, inc1, inc2, diff)) {
      store.record(r);
    }
    Assert.assertEquals(store.chain(full), List.of(full));
    Assert.assertEquals(store.chain(inc2), List.of(full, inc1, inc2));
    Assert.assertEquals(store.chain(diff), List.of(full, diff));
  }

  @Test(expectedExceptions = NotFoundException.class)
  public void testBrokenChain() throws IOException {
    StateStore store = fresh();
    BackupRecord full = record("/docs", 1, BackupType.FULL);
    BackupRecord inc = record("/docs", 2, BackupType.INCREMENTAL);
    store.record(full);
    store.record(inc);
    store.remove("/docs", List.of(full.remotePath()));
    store.chain(inc);
  }

  @Test
  public void testCappingNeverOrphansPartialBackups() throws IOException {
    StateStore store = fresh();
    int second = 0;
    for (int round = 0; round < 6; ++round) {
      store.record(record("/docs", second++, BackupType.FULL));
      for (int i = 0; i < 9; ++i) {
        store.record(record("/docs", second++, BackupType.INCREMENTAL));
      }
    }
    List<BackupRecord> history = store.history("/docs");
    Assert.assertTrue(history.size() <= StateStore.MAX_HISTORY);
    Assert.assertEquals(history.get(0).kind(), BackupType.FULL);
    Assert.assertEquals(store.chain(history.get(history.size() - 1)).size(), 10);
  }

}
