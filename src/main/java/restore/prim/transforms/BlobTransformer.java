package restore.prim.transforms;

import org.checkerframework.checker.mustcall.qual.MustCallAlias;

import java.io.IOException;
import java.io.InputStream;

/**
 * A reversible byte-stream transformation, such as compression or encryption.
 * <code>unApply(apply(x))</code> yields the bytes of <code>x</code>.
 */
public interface BlobTransformer {

  @MustCallAlias InputStream apply(@MustCallAlias InputStream data) throws IOException;
  @MustCallAlias InputStream unApply(@MustCallAlias InputStream data) throws IOException;

  default BlobTransformer followedBy(BlobTransformer next) {
    BlobTransformer self = this;
    return new BlobTransformer() {
      @Override
      public @MustCallAlias InputStream apply(@MustCallAlias InputStream data) throws IOException {
        return next.apply(self.apply(data));
      }

      @Override
      public @MustCallAlias InputStream unApply(@MustCallAlias InputStream data) throws IOException {
        return self.unApply(next.unApply(data));
      }
    };
  }
}
