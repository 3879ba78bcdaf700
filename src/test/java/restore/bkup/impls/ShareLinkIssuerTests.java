package restore.bkup.impls;

import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import restore.bkup.types.Config;
import restore.bkup.types.ShareLink;
import restore.prim.BackupException;
import restore.prim.NotFoundException;
import restore.prim.TransferException;
import restore.prim.UnsupportedCapabilityException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

@Test
public class ShareLinkIssuerTests {

  private static final Instant NOW = Instant.parse("2024-05-05T12:00:00Z");

  private Fixtures.Backends backends;
  private ShareLinkIssuer issuer;
  private Path file;

  @BeforeMethod
  public void setup() throws IOException {
    backends = new Fixtures.Backends().add("sharing", true).add("plain", false);
    issuer = new ShareLinkIssuer(Config.builder().build(), backends.registry, Fixtures.fixedClock(NOW));
    file = Files.createTempDirectory("share").resolve("report.pdf");
    Fixtures.write(file, "%PDF");
  }

  @Test
  public void testShare() throws IOException {
    ShareLink link = issuer.shareFile(file, "sharing", Duration.ofMinutes(30));
    Assert.assertTrue(link.remotePath().matches("shared/[0-9a-f-]{36}/report\\.pdf"), link.remotePath());
    Assert.assertEquals(link.expiresAt(), NOW.plus(Duration.ofMinutes(30)));
    Assert.assertEquals(link.url(), "memory:///" + link.remotePath() + "?expires=1800");
    Assert.assertTrue(backends.objects("sharing").containsKey(link.remotePath()));
    Assert.assertTrue(backends.last("sharing").isClosed());
  }

  @Test
  public void testEachShareGetsItsOwnLocation() throws IOException {
    ShareLink a = issuer.shareFile(file, "sharing", Duration.ofMinutes(1));
    ShareLink b = issuer.shareFile(file, "sharing", Duration.ofMinutes(1));
    Assert.assertNotEquals(a.remotePath(), b.remotePath());
  }

  @Test
  public void testBackendWithoutSharingFailsBeforeUploading() throws IOException {
    try {
      issuer.shareFile(file, "plain", Duration.ofMinutes(30));
      Assert.fail();
    } catch (UnsupportedCapabilityException e) {
      Assert.assertEquals(e.stage(), BackupException.Stage.RESOLVE);
    }
    Fixtures.RecordingStorage plain = backends.last("plain");
    Assert.assertEquals(plain.uploads.get(), 0);
    Assert.assertEquals(plain.links.get(), 0);
    Assert.assertTrue(backends.objects("plain").isEmpty());
  }

  @Test
  public void testFailedLinkDeletesUpload() throws IOException {
    Fixtures.Backends failing = failingLinks(false);
    ShareLinkIssuer issuer = new ShareLinkIssuer(Config.builder().build(), failing.registry, Fixtures.fixedClock(NOW));
    try {
      issuer.shareFile(file, "sharing", Duration.ofMinutes(30));
      Assert.fail();
    } catch (TransferException e) {
      Assert.assertEquals(e.getMessage(), "[SHARE] link refused");
      Assert.assertEquals(e.getSuppressed().length, 0);
    }
    Fixtures.RecordingStorage s = failing.last("sharing");
    Assert.assertEquals(s.uploads.get(), 1);
    Assert.assertEquals(s.deletes.get(), 1);
    Assert.assertTrue(failing.objects("sharing").isEmpty());
  }

  @Test
  public void testFailedCleanupDoesNotHideOriginalError() throws IOException {
    Fixtures.Backends failing = failingLinks(true);
    ShareLinkIssuer issuer = new ShareLinkIssuer(Config.builder().build(), failing.registry, Fixtures.fixedClock(NOW));
    try {
      issuer.shareFile(file, "sharing", Duration.ofMinutes(30));
      Assert.fail();
    } catch (TransferException e) {
      Assert.assertTrue(e.getMessage().endsWith("link refused"), e.getMessage());
      Assert.assertEquals(e.getSuppressed().length, 1);
      Assert.assertTrue(e.getSuppressed()[0].getMessage().endsWith("delete refused"));
    }
    Assert.assertEquals(failing.last("sharing").deletes.get(), 1);
  }

  private static Fixtures.Backends failingLinks(boolean failDeletes) {
    Fixtures.Backends failing = new Fixtures.Backends();
    java.util.Map<String, byte[]> entries = new java.util.TreeMap<>();
    failing.objects.put("sharing", entries);
    java.util.concurrent.atomic.AtomicReference<Fixtures.RecordingStorage> last = new java.util.concurrent.atomic.AtomicReference<>();
    failing.lastOpened.put("sharing", last);
    failing.registry.register("sharing", () -> {
      Fixtures.RecordingStorage s = new Fixtures.RecordingStorage(entries, true);
      s.failLinks = true;
      s.failDeletes = failDeletes;
      last.set(s);
      return s;
    });
    return failing;
  }

  @Test(expectedExceptions = NotFoundException.class)
  public void testMissingFile() throws IOException {
    issuer.shareFile(file.resolveSibling("missing.pdf"), "sharing", Duration.ofMinutes(5));
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testExpirationMustBePositive() throws IOException {
    issuer.shareFile(file, "sharing", Duration.ZERO);
  }

}
