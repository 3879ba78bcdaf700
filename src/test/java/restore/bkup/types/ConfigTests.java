package restore.bkup.types;

import com.google.common.collect.ImmutableMap;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.nio.file.Paths;
import java.time.Duration;

@Test
public class ConfigTests {

  @Test
  public void testDefaults() {
    Config config = Config.builder().build();
    Assert.assertEquals(config.getDefaultStorageType(), "local");
    Assert.assertFalse(config.isEncryptionEnabled());
    Assert.assertTrue(config.isCompressionEnabled());
    Assert.assertEquals(config.getArchiveFormat(), ArchiveFormat.TAR);
    Assert.assertEquals(config.getDebounce(), Duration.ofSeconds(10));
    Assert.assertFalse(config.getRetention().enabled());
    Assert.assertNull(config.getTempDir());
    Assert.assertEquals(config.getBackupType(), BackupType.INCREMENTAL);
    Assert.assertEquals(config.getSizeThresholdBytes(), 500L * 1024 * 1024);
  }

  @Test
  public void testBackupTypeNames() {
    Assert.assertEquals(BackupType.named("full"), BackupType.FULL);
    Assert.assertEquals(BackupType.named(" Differential "), BackupType.DIFFERENTIAL);
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testUnknownBackupType() {
    BackupType.named("mirror");
  }

  @Test
  public void testStorageTypeResolution() {
    Config config = Config.builder()
            .defaultStorageType("s3")
            .target(new BackupTarget(Paths.get("/data/photos"), "gdrive"))
            .target(new BackupTarget(Paths.get("/data/docs"), null))
            .componentStorageType("settings", "github")
            .build();
    Assert.assertEquals(config.storageTypeFor(Paths.get("/data/photos/")), "gdrive");
    Assert.assertEquals(config.storageTypeFor(Paths.get("/data/docs")), "s3");
    Assert.assertEquals(config.storageTypeFor(Paths.get("/elsewhere")), "s3");
    Assert.assertEquals(config.storageTypeForComponent("settings"), "github");
    Assert.assertEquals(config.storageTypeForComponent("programs"), "s3");
  }

  @Test
  public void testOptionsLookupIgnoresCase() {
    Config config = Config.builder()
            .storageOption("SFTP", ImmutableMap.of("host", "nas"))
            .build();
    Assert.assertEquals(config.optionsFor("sftp"), ImmutableMap.of("host", "nas"));
    Assert.assertEquals(config.optionsFor("s3"), ImmutableMap.of());
  }

  @Test
  public void testExclusionMatchers() {
    Config config = Config.builder().excludePattern("*.tmp").build();
    Assert.assertEquals(config.exclusionMatchers().size(), 1);
    Assert.assertTrue(config.exclusionMatchers().iterator().next().matches(Paths.get("x.tmp")));
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testRetentionKeepsAtLeastOne() {
    new RetentionPolicy(true, 0, null);
  }

}
