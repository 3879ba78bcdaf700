package restore.bkup.types;

import org.testng.Assert;
import org.testng.annotations.Test;
import restore.prim.BackupException;

import java.time.Instant;

@Test
public class ArchiveNameTests {

  private static final Instant WHEN = Instant.parse("2024-03-05T07:08:09.123Z");

  @Test
  public void testBackupNames() {
    Assert.assertEquals(
            ArchiveName.forBackup("Documents", WHEN, ArchiveFormat.TAR, true, true).fileName(),
            "backup_Documents_20240305T070809123Z.tar.xz.enc");
    Assert.assertEquals(
            ArchiveName.forBackup("My Photos", WHEN, ArchiveFormat.ZIP, false, false).fileName(),
            "backup_My_Photos_20240305T070809123Z.zip");
  }

  @Test
  public void testSanitize() {
    Assert.assertEquals(ArchiveName.sanitize("a/b\\c:d"), "a_b_c_d");
    Assert.assertEquals(ArchiveName.sanitize(""), "root");
    Assert.assertEquals(ArchiveName.sanitize(".."), "root");
    Assert.assertEquals(ArchiveName.sanitize("v1.2-final_x"), "v1.2-final_x");
  }

  @Test
  public void testParseRecoversPipeline() throws BackupException {
    ArchiveName name = ArchiveName.parse("backups/docs/backup_docs_20240305T070809123Z.tar.xz.enc");
    Assert.assertEquals(name.stem(), "backup_docs_20240305T070809123Z");
    Assert.assertEquals(name.format(), ArchiveFormat.TAR);
    Assert.assertTrue(name.compressed());
    Assert.assertTrue(name.encrypted());

    name = ArchiveName.parse("x.zip");
    Assert.assertEquals(name.format(), ArchiveFormat.ZIP);
    Assert.assertFalse(name.compressed());
    Assert.assertFalse(name.encrypted());

    name = ArchiveName.parse("x.tar.enc");
    Assert.assertFalse(name.compressed());
    Assert.assertTrue(name.encrypted());
  }

  @Test
  public void testParseInvertsFileName() throws BackupException {
    ArchiveName name = ArchiveName.forBackup("src", WHEN, ArchiveFormat.TAR, true, false);
    Assert.assertEquals(ArchiveName.parse(name.fileName()), name);
  }

  @Test
  public void testUnknownExtension() {
    for (String bad : new String[] { "notes.txt", ".tar", "archive.tar.gz", "" }) {
      try {
        ArchiveName.parse(bad);
        Assert.fail(bad);
      } catch (BackupException e) {
        Assert.assertEquals(e.stage(), BackupException.Stage.VALIDATE);
      }
    }
  }

}
