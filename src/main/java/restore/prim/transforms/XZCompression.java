package restore.prim.transforms;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tukaani.xz.LZMA2Options;
import org.tukaani.xz.UnsupportedOptionsException;
import org.tukaani.xz.XZInputStream;
import org.tukaani.xz.XZOutputStream;
import restore.bkup.Util;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

public class XZCompression implements BlobTransformer {

  private static final Logger LOG = LoggerFactory.getLogger(XZCompression.class);

  /** Presets above 6 need hundreds of megabytes of memory per stream. */
  public static final int DEFAULT_PRESET = LZMA2Options.PRESET_DEFAULT;

  private final LZMA2Options options;

  public XZCompression() {
    this(DEFAULT_PRESET);
  }

  public XZCompression(int preset) {
    LZMA2Options options;
    try {
      options = new LZMA2Options(preset);
    } catch (UnsupportedOptionsException e) {
      LOG.warn("XZ library does not support compression preset {}; using the default instead", preset);
      options = new LZMA2Options();
    }
    this.options = options;
  }

  @Override
  public InputStream apply(InputStream data) {
    return Util.createInputStream(os -> {
      try (OutputStream out = new XZOutputStream(os, options);
           InputStream copy = data /* ensure data gets closed */) {
        Util.copyStream(copy, out);
      }
    });
  }

  @Override
  public InputStream unApply(InputStream data) throws IOException {
    return new XZInputStream(data);
  }

}
