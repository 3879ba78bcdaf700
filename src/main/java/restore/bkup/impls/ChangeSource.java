package restore.bkup.impls;

import restore.prim.QuietAutoCloseable;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.function.Consumer;

/**
 * Something that reports filesystem changes under a set of directories.
 */
public interface ChangeSource extends QuietAutoCloseable {

  /**
   * Start reporting changes.  <code>onChange</code> is called with the path that changed,
   * from a thread owned by this source, until {@link #close()}.
   */
  void subscribe(Collection<Path> roots, Consumer<Path> onChange) throws IOException;

}
