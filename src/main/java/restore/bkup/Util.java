package restore.bkup;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import restore.prim.IOConsumer;
import restore.prim.QuietAutoCloseable;

import java.io.ByteArrayOutputStream;
import java.io.Console;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

public abstract class Util {

  private static final Logger LOG = LoggerFactory.getLogger(Util.class);

  public static final long ONE_BYTE = 1;
  public static final long ONE_KB = ONE_BYTE * 1024;
  public static final long ONE_MB = ONE_KB * 1024;
  public static final long ONE_GB = ONE_MB * 1024;
  public static final long ONE_TB = ONE_GB * 1024;

  /**
   * The suggested size of in-memory byte buffers for I/O.
   * The value is 8192, which is currently the size used by {@link java.io.BufferedInputStream}
   * on desktop JVMs.
   *
   * <p>Performance note: there is a large benefit to having every layer of a software
   * system use the same buffer size.  If data from one stream using one buffer size is
   * piped to a consumer reading with a different buffer size, the mismatch can cause
   * an unexpected performance hit.
   */
  public static final int SUGGESTED_BUFFER_SIZE = 8192;

  /**
   * A thread-local byte array of {@link #SUGGESTED_BUFFER_SIZE} bytes.
   */
  private static final ThreadLocal<byte[]> MEM_BUFFER = ThreadLocal.withInitial(() -> new byte[SUGGESTED_BUFFER_SIZE]);

  public static long copyStream(InputStream in, OutputStream out) throws IOException {
    byte[] buf = MEM_BUFFER.get();
    long count = 0;
    int n;
    while ((n = in.read(buf)) >= 0) {
      out.write(buf, 0, n);
      count += n;
    }
    return count;
  }

  public static byte[] read(InputStream in) throws IOException {
    try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      copyStream(in, out);
      return out.toByteArray();
    }
  }

  public static MessageDigest sha256Digest() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      // every JRE is required to support SHA-256
      throw new UnsupportedOperationException(e);
    }
  }

  public static byte[] sha256(InputStream in) throws IOException {
    MessageDigest md = sha256Digest();
    byte[] buf = MEM_BUFFER.get();
    int nread;
    while ((nread = in.read(buf)) >= 0) {
      md.update(buf, 0, nread);
    }
    return md.digest();
  }

  public static String sha256(Path file) throws IOException {
    try (InputStream in = Files.newInputStream(file)) {
      return toHex(sha256(in));
    }
  }

  private static final String HEX_CHARS = "0123456789abcdef";
  public static String toHex(byte[] bytes) {
    StringBuilder builder = new StringBuilder(bytes.length * 2);
    for (byte b : bytes) {
      int i = Byte.toUnsignedInt(b);
      builder.append(HEX_CHARS.charAt((i >> 4) & 0xF));
      builder.append(HEX_CHARS.charAt(i & 0xF));
    }
    return builder.toString();
  }

  /**
   * Read a password from the console, asking twice.
   * @return the password, or null if the user gave up or the two entries differ
   * @throws IllegalStateException if there is no console
   */
  public static @Nullable String readPassword(String prompt) {
    Console cons = System.console();
    if (cons == null) {
      throw new IllegalStateException("not connected to console");
    }
    char[] c1 = cons.readPassword("%s: ", prompt);
    if (c1 == null) return null;
    char[] c2 = cons.readPassword("Confirm: ");
    if (c2 == null) return null;
    try {
      if (!Arrays.equals(c1, c2)) {
        LOG.warn("passwords do not match");
        return null;
      }
      return new String(c1);
    } finally {
      Arrays.fill(c1, '\0');
      Arrays.fill(c2, '\0');
    }
  }

  public static long divideAndRoundUp(long numerator, long denominator) {
    return (numerator + denominator - 1) / denominator;
  }

  public static String formatSize(long l) {
    if (l > ONE_TB) return divideAndRoundUp(l, ONE_TB) + " Tb";
    if (l > ONE_GB) return divideAndRoundUp(l, ONE_GB) + " Gb";
    if (l > ONE_MB) return divideAndRoundUp(l, ONE_MB) + " Mb";
    if (l > ONE_KB) return divideAndRoundUp(l, ONE_KB) + " Kb";
    return l + " bytes";
  }

  /**
   * Turn a producer of bytes into a stream of those bytes.  The writer runs on its own
   * thread; any exception it throws is rethrown from {@link InputStream#close()}.
   */
  public static InputStream createInputStream(IOConsumer<OutputStream> writer) {
    PipedInputStream in = new PipedInputStream(SUGGESTED_BUFFER_SIZE);
    CountDownLatch gate = new CountDownLatch(1);
    AtomicReference<Exception> err = new AtomicReference<>(null);

    Thread t = new Thread(() -> {
      try (PipedOutputStream out = new PipedOutputStream(in)) {
        gate.countDown();
        writer.accept(out);
      } catch (Exception e) {
        err.set(e);
      } finally {
        // If an exception was thrown constructing the PipedOutputStream,
        // then unblock the waiting parent thread.
        while (gate.getCount() > 0) {
          gate.countDown();
        }
      }
    });
    t.start();

    boolean interrupted = false;
    for (;;) {
      try {
        gate.await();
        break;
      } catch (InterruptedException e) {
        interrupted = true;
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }

    return new FilterInputStream(in) {
      @Override
      public void close() throws IOException {
        try {
          long dropped = Util.drain(this.in);
          if (dropped > 0) {
            LOG.debug("dropped {} unread bytes", dropped);
          }
          t.join();
          Exception e = err.get();
          if (e instanceof IOException) {
            throw (IOException) e;
          } else if (e != null) {
            throw new IOException("byte producer failed", e);
          }
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new InterruptedIOException();
        } finally {
          super.close();
        }
      }
    };
  }

  public static long drain(InputStream in) throws IOException {
    byte[] buf = MEM_BUFFER.get();
    long count = 0;
    int n;
    while ((n = in.read(buf)) >= 0) {
      count += n;
    }
    return count;
  }

  public static int readChunk(InputStream in, byte[] chunk) throws IOException {
    int soFar = 0;
    int n;
    while (soFar < chunk.length && (n = in.read(chunk, soFar, chunk.length - soFar)) >= 0) {
      soFar += n;
    }
    return soFar;
  }

  /**
   * Delete a temporary file, logging instead of failing.  Used on cleanup paths where
   * the original outcome must not be replaced.
   */
  public static void deleteQuietly(@Nullable Path file) {
    if (file == null) {
      return;
    }
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      LOG.warn("failed to delete temporary file {}: {}", file, e.toString());
    }
  }

  /**
   * Prevent the current thread from stopping during a JVM shutdown.
   * One common source of shutdowns is the Unix <code>SIGINT</code> signal that is
   * sent when a console user presses Ctrl+C.
   *
   * <p>Note that this method does not prevent all possible causes of process
   * termination; for instance, the <code>SIGKILL</code> signal cannot be prevented.
   *
   * <p>Sample usage for this method:
   *
   * <pre>
   *   try (QuietAutoCloseable ignored = Util.catchShutdown(orchestrator::stop)) {
   *     orchestrator.awaitShutdown();
   *   }
   *   // normal shutdowns are possible again out here
   * </pre>
   *
   * @param onShutdown a hook that is run when a shutdown would have occurred
   * @return an object whose {@link QuietAutoCloseable#close() close method} re-enables normal shutdown
   */
  public static QuietAutoCloseable catchShutdown(Runnable onShutdown) {
    // Source of this trick:
    // https://stackoverflow.com/a/2922031/784284

    final var unstoppableThread = Thread.currentThread();
    final var runtime = Runtime.getRuntime();
    final var shutdownHook = new Thread(() -> {
      onShutdown.run();
      for (;;) {
        try {
          unstoppableThread.join();
          return;
        } catch (InterruptedException e) {
          LOG.info("Ignoring interrupt during shutdown...");
        }
      }
    });

    runtime.addShutdownHook(shutdownHook);
    return () -> {
      try {
        runtime.removeShutdownHook(shutdownHook);
      } catch (IllegalStateException e) {
        // This happens if the JVM is shutting down, in which case our hook
        // is already committed to running and removing it won't matter.
        LOG.debug("shutdown already in progress");
      }
    };
  }

}
