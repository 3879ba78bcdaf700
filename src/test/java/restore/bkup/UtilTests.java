package restore.bkup;

import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

@Test
public class UtilTests {

  @Test
  public void testFormatSize() {
    Assert.assertEquals(Util.formatSize(0), "0 bytes");
    Assert.assertEquals(Util.formatSize(1024), "1024 bytes");
    Assert.assertEquals(Util.formatSize(1025), "2 Kb");
    Assert.assertEquals(Util.formatSize(Util.ONE_GB * 3), "3 Gb");
    Assert.assertEquals(Util.formatSize(Util.ONE_GB), "1024 Mb");
  }

  @Test
  public void testDivideAndRoundUp() {
    Assert.assertEquals(Util.divideAndRoundUp(10, 5), 2L);
    Assert.assertEquals(Util.divideAndRoundUp(11, 5), 3L);
    Assert.assertEquals(Util.divideAndRoundUp(0, 5), 0L);
  }

  @Test
  public void testSha256() throws IOException {
    Path file = Files.createTempFile("sha", ".txt");
    Files.write(file, "abc".getBytes(StandardCharsets.UTF_8));
    Assert.assertEquals(Util.sha256(file), "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    Assert.assertEquals(Util.toHex(new byte[] { 0, 15, (byte) 0xff }), "000fff");
  }

  @Test
  public void testReadChunk() throws IOException {
    byte[] chunk = new byte[4];
    InputStream in = new ByteArrayInputStream(new byte[] { 1, 2, 3, 4, 5, 6 });
    Assert.assertEquals(Util.readChunk(in, chunk), 4);
    Assert.assertEquals(Util.readChunk(in, chunk), 2);
    Assert.assertEquals(Util.readChunk(in, chunk), 0);
  }

  @Test
  public void testCreateInputStream() throws IOException {
    try (InputStream in = Util.createInputStream(out -> out.write("produced".getBytes(StandardCharsets.UTF_8)))) {
      Assert.assertEquals(new String(Util.read(in), StandardCharsets.UTF_8), "produced");
    }
  }

  @Test
  public void testProducerFailureSurfacesOnClose() {
    try {
      try (InputStream in = Util.createInputStream(out -> {
        out.write(1);
        throw new IOException("producer broke");
      })) {
        Util.drain(in);
      }
      Assert.fail();
    } catch (IOException e) {
      Assert.assertEquals(e.getMessage(), "producer broke");
    }
  }

  @Test
  public void testDeleteQuietly() throws IOException {
    Path file = Files.createTempFile("util", ".tmp");
    Util.deleteQuietly(file);
    Assert.assertFalse(Files.exists(file));
    Util.deleteQuietly(file);
    Util.deleteQuietly(null);
  }

}
