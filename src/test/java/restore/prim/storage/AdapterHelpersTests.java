package restore.prim.storage;

import org.testng.Assert;
import org.testng.annotations.Test;
import restore.prim.ConfigurationException;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

@Test
public class AdapterHelpersTests {

  @Test
  public void testB2RegionFromEndpoint() {
    Assert.assertEquals(B2Storage.regionFromEndpoint(URI.create("https://s3.us-west-004.backblazeb2.com")), "us-west-004");
    Assert.assertEquals(B2Storage.regionFromEndpoint(URI.create("https://s3.eu-central-003.backblazeb2.com/")), "eu-central-003");
    Assert.assertEquals(B2Storage.regionFromEndpoint(URI.create("https://b2.example.com")), "us-east-1");
  }

  @Test
  public void testS3Endpoint() throws ConfigurationException {
    Assert.assertNull(S3Storage.endpoint(null));
    Assert.assertEquals(S3Storage.endpoint("http://localhost:9000"), URI.create("http://localhost:9000"));
  }

  @Test(expectedExceptions = ConfigurationException.class)
  public void testBadS3Endpoint() throws ConfigurationException {
    S3Storage.endpoint("http://bad host:9000");
  }

  @Test
  public void testDropboxPaths() {
    Assert.assertEquals(DropboxStorage.toDropboxPath("backups/docs/a.tar"), "/backups/docs/a.tar");
    Assert.assertEquals(DropboxStorage.toDropboxPath("/backups/a.tar"), "/backups/a.tar");
    Assert.assertEquals(DropboxStorage.toDropboxPath("backups\\docs\\a.tar"), "/backups/docs/a.tar");
  }

  @Test
  public void testSftpParentDirectories() {
    Assert.assertEquals(SftpStorage.parentDirectories("backups/docs/a.tar"), Arrays.asList("backups", "backups/docs"));
    Assert.assertEquals(SftpStorage.parentDirectories("/srv/backups/a.tar"), Arrays.asList("/srv", "/srv/backups"));
    Assert.assertEquals(SftpStorage.parentDirectories("a.tar"), Collections.emptyList());
  }

  @Test
  public void testDriveQueryEscaping() {
    Assert.assertEquals(GoogleDriveStorage.escapeQueryLiteral("Bob's files"), "Bob\\'s files");
    Assert.assertEquals(GoogleDriveStorage.escapeQueryLiteral("a\\b"), "a\\\\b");
  }

  @Test
  public void testMalformedGcsCredentials() throws IOException {
    Path key = Files.createTempFile("gcs-key", ".json");
    try {
      Files.write(key, "{\"type\": ".getBytes(StandardCharsets.UTF_8));
      try {
        GcsStorage.credentials(key.toString());
        Assert.fail("a truncated key file was accepted");
      } catch (ConfigurationException e) {
        Assert.assertTrue(e.getMessage().contains(key.toString()), e.getMessage());
      }
    } finally {
      Files.deleteIfExists(key);
    }
  }

  @Test(expectedExceptions = ConfigurationException.class)
  public void testMissingGcsCredentials() throws IOException {
    GcsStorage.credentials(Files.createTempDirectory("gcs").resolve("absent.json").toString());
  }

}
