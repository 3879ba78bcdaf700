package restore.prim.transforms;

import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static restore.prim.transforms.EncryptionTests.apply;
import static restore.prim.transforms.EncryptionTests.convertAndDeconvert;

@Test
public class XZCompressionTests {

  private void check(String text) throws IOException {
    convertAndDeconvert(text, new XZCompression());
  }

  @Test
  public void testEmptyString() throws Exception {
    check("");
  }

  @Test
  public void testFoo() throws Exception {
    check("foo");
  }

  @Test
  public void testLong() throws Exception {
    check("aosfha;efhaw;ofn;awegb;awibg;awoehij;awoeijfd;awfi;oawehfgaow;e;aewg");
  }

  @Test
  public void testCompresses() throws Exception {
    byte[] zeros = new byte[1024 * 1024];
    Assert.assertTrue(apply(new XZCompression(), zeros).length < zeros.length / 100);
  }

  @Test
  public void testUnsupportedPresetFallsBack() throws Exception {
    byte[] data = "fallback".getBytes(StandardCharsets.UTF_8);
    Assert.assertEquals(EncryptionTests.unApply(new XZCompression(99), apply(new XZCompression(99), data)), data);
  }

}
