package restore.bkup;

import org.testng.Assert;
import org.testng.annotations.Test;
import restore.bkup.impls.BackupEngine;
import restore.bkup.impls.StateStore;
import restore.bkup.types.ArchiveFormat;
import restore.bkup.types.BackupType;
import restore.bkup.types.Config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Stream;

@Test
public class MainTests {

  private static Path configFile(String json) throws IOException {
    Path file = Files.createTempDirectory("config").resolve("config.json");
    Files.write(file, json.getBytes(StandardCharsets.UTF_8));
    return file;
  }

  @Test
  public void testLoadConfig() throws IOException {
    Path file = configFile("{\n"
            + "  // comments are allowed\n"
            + "  \"defaultStorageType\": \"s3\",\n"
            + "  \"targets\": [\n"
            + "    {\"path\": \"/data/docs\"},\n"
            + "    {\"path\": \"/data/photos\", \"storageType\": \"gdrive\"}\n"
            + "  ],\n"
            + "  \"componentStorageTypes\": {\"settings\": \"github\"},\n"
            + "  \"storage\": {\"s3\": {\"bucketName\": \"b\", \"region\": \"us-east-2\"}},\n"
            + "  \"encryption\": true,\n"
            + "  \"compression\": false,\n"
            + "  \"archiveFormat\": \"ZIP\",\n"
            + "  \"exclude\": [\"*.tmp\", \"node_modules\"],\n"
            + "  \"debounceSeconds\": 3,\n"
            + "  \"stateFile\": \"/var/lib/restore/state.json\",\n"
            + "  \"retention\": {\"keepLast\": 4, \"maxAgeDays\": 30},\n"
            + "  \"backupType\": \"differential\",\n"
            + "  \"sizeThresholdMB\": 20,\n"
            + "  \"someFutureSetting\": 1\n"
            + "}\n");
    Config config = Main.loadConfig(file);
    Assert.assertEquals(config.getDefaultStorageType(), "s3");
    Assert.assertEquals(config.getTargets().size(), 2);
    Assert.assertEquals(config.storageTypeFor(Paths.get("/data/photos")), "gdrive");
    Assert.assertEquals(config.storageTypeFor(Paths.get("/data/docs")), "s3");
    Assert.assertEquals(config.storageTypeForComponent("settings"), "github");
    Assert.assertEquals(config.optionsFor("S3"), Map.of("bucketName", "b", "region", "us-east-2"));
    Assert.assertTrue(config.isEncryptionEnabled());
    Assert.assertFalse(config.isCompressionEnabled());
    Assert.assertEquals(config.getArchiveFormat(), ArchiveFormat.ZIP);
    Assert.assertEquals(config.getExcludePatterns().size(), 2);
    Assert.assertEquals(config.getDebounce(), Duration.ofSeconds(3));
    Assert.assertEquals(config.getStateFile(), Paths.get("/var/lib/restore/state.json"));
    Assert.assertTrue(config.getRetention().enabled());
    Assert.assertEquals(config.getRetention().keepLast(), 4);
    Assert.assertEquals(config.getRetention().maxAge(), Duration.ofDays(30));
    Assert.assertEquals(config.getBackupType(), BackupType.DIFFERENTIAL);
    Assert.assertEquals(config.getSizeThresholdBytes(), 20L * 1024 * 1024);
  }

  @Test
  public void testEmptyConfigGivesDefaults() throws IOException {
    Config config = Main.loadConfig(configFile("{}"));
    Assert.assertEquals(config, Config.builder().build());
  }

  @Test
  public void testHomeIsExpanded() throws IOException {
    Config config = Main.loadConfig(configFile("{\"targets\": [{\"path\": \"~/Documents\"}]}"));
    Assert.assertEquals(config.getTargets().get(0).path(), Paths.get(System.getProperty("user.home"), "Documents"));
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testUnknownArchiveFormat() throws IOException {
    Main.loadConfig(configFile("{\"archiveFormat\": \"rar\"}"));
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testUnknownBackupType() throws IOException {
    Main.loadConfig(configFile("{\"backupType\": \"mirror\"}"));
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testNonPositiveSizeThreshold() throws IOException {
    Main.loadConfig(configFile("{\"sizeThresholdMB\": 0}"));
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testTargetWithoutPath() throws IOException {
    Main.loadConfig(configFile("{\"targets\": [{\"storageType\": \"s3\"}]}"));
  }

  @Test
  public void testUsageErrors() {
    Assert.assertEquals(Main.run(new String[] { "--help" }), 0);
    Assert.assertEquals(Main.run(new String[] {}), Main.EXIT_USAGE);
    Assert.assertEquals(Main.run(new String[] { "--bogus" }), Main.EXIT_USAGE);
    Assert.assertEquals(Main.run(new String[] { "--restore", "backups/x/y.tar" }), Main.EXIT_USAGE);
    Assert.assertEquals(Main.run(new String[] { "--backup", "/a", "--watch" }), Main.EXIT_USAGE);
    Assert.assertEquals(Main.run(new String[] { "--share", "/a", "--expires", "soon" }), Main.EXIT_USAGE);
  }

  @Test
  public void testMissingConfigFile() throws IOException {
    Path missing = Files.createTempDirectory("config").resolve("nope.json");
    Assert.assertEquals(Main.run(new String[] { "--config", missing.toString(), "--backup", "/a" }), Main.EXIT_FAILURE);
  }

  @Test
  public void testBackupAndRestoreFromCommandLine() throws IOException {
    Path work = Files.createTempDirectory("cli");
    Path source = Files.createDirectories(work.resolve("docs"));
    Files.write(source.resolve("note.txt"), "remember".getBytes(StandardCharsets.UTF_8));
    Path state = work.resolve("state.json");
    Path cfg = configFile("{\n"
            + "  \"defaultStorageType\": \"local\",\n"
            + "  \"storage\": {\"local\": {\"path\": \"" + work.resolve("remote").toString().replace("\\", "\\\\") + "\"}},\n"
            + "  \"stateFile\": \"" + state.toString().replace("\\", "\\\\") + "\"\n"
            + "}\n");

    Assert.assertEquals(Main.run(new String[] { "--config", cfg.toString(), "--backup", source.toString() }), 0);

    StateStore store = new StateStore(state);
    store.load();
    String remote = store.latest(BackupEngine.sourceKey(source)).remotePath();
    try (Stream<Path> files = Files.walk(work.resolve("remote"))) {
      Assert.assertEquals(files.filter(Files::isRegularFile).count(), 1L);
    }

    Path target = work.resolve("restored");
    Assert.assertEquals(Main.run(new String[] { "--config", cfg.toString(), "--restore", remote, "--target", target.toString() }), 0);
    Assert.assertEquals(new String(Files.readAllBytes(target.resolve("note.txt")), StandardCharsets.UTF_8), "remember");

    Assert.assertEquals(Main.run(new String[] { "--config", cfg.toString(), "--share", source.resolve("note.txt").toString() }), Main.EXIT_FAILURE);
  }

}
