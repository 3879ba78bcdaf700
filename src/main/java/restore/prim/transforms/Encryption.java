package restore.prim.transforms;

import org.bouncycastle.crypto.PBEParametersGenerator;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.io.CipherInputStream;
import org.bouncycastle.crypto.io.CipherOutputStream;
import org.bouncycastle.crypto.io.InvalidCipherTextIOException;
import org.bouncycastle.crypto.modes.GCMBlockCipher;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.KeyParameter;
import restore.bkup.Util;
import restore.prim.AuthenticationException;
import restore.prim.BackupException;

import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * Password-based authenticated encryption.
 *
 * <p>The key is derived from the password with PBKDF2-HMAC-SHA256 and a random salt.
 * Data is encrypted with AES-256 in GCM mode under a random nonce.  The output is a
 * self-describing header followed by the ciphertext and its 128-bit tag:
 *
 * <pre>
 *   magic "RSTE" | version (1 byte) | iterations (4 bytes) | salt (16 bytes) | nonce (12 bytes)
 * </pre>
 *
 * The header is authenticated along with the data, so it cannot be altered without
 * detection.
 *
 * <p>GCM releases plaintext before the tag has been checked.  Consumers that act on the
 * decrypted bytes (for example by extracting files) should read the whole stream before
 * trusting any of it.  A wrong password or corrupted ciphertext surfaces as an
 * {@link AuthenticationException} at the end of the stream.
 */
public class Encryption implements BlobTransformer {

  public static final int DEFAULT_ITERATIONS = 100_000;

  private static final byte[] MAGIC = { 'R', 'S', 'T', 'E' };
  private static final byte VERSION = 1;
  private static final int SALT_BYTES = 16;
  private static final int NONCE_BYTES = 12;
  private static final int KEY_BITS = 256;
  private static final int TAG_BITS = 128;
  private static final int MAX_ITERATIONS = 10_000_000;
  private static final SecureRandom RANDOM = new SecureRandom();

  private final char[] password;
  private final int iterations;

  public Encryption(String password) {
    this(password, DEFAULT_ITERATIONS);
  }

  public Encryption(String password, int iterations) {
    if (iterations < 1) {
      throw new IllegalArgumentException("iterations must be positive, got " + iterations);
    }
    this.password = password.toCharArray();
    this.iterations = iterations;
  }

  @Override
  public InputStream apply(InputStream data) {
    return Util.createInputStream(os -> {
      byte[] salt = new byte[SALT_BYTES];
      byte[] nonce = new byte[NONCE_BYTES];
      synchronized (RANDOM) {
        RANDOM.nextBytes(salt);
        RANDOM.nextBytes(nonce);
      }
      byte[] header = header(iterations, salt, nonce);
      os.write(header);
      GCMBlockCipher cipher = new GCMBlockCipher(new AESEngine());
      cipher.init(true, new AEADParameters(deriveKey(salt, iterations), TAG_BITS, nonce, header));
      try (OutputStream out = new CipherOutputStream(os, cipher);
           InputStream copy = data /* ensure data gets closed */) {
        Util.copyStream(copy, out);
      }
    });
  }

  @Override
  public InputStream unApply(InputStream data) throws IOException {
    DataInputStream in = new DataInputStream(data);
    byte[] magic = new byte[MAGIC.length];
    byte version;
    int iterations;
    byte[] salt = new byte[SALT_BYTES];
    byte[] nonce = new byte[NONCE_BYTES];
    try {
      in.readFully(magic);
      version = in.readByte();
      iterations = in.readInt();
      in.readFully(salt);
      in.readFully(nonce);
    } catch (EOFException e) {
      throw new BackupException(BackupException.Stage.DECRYPT, "truncated encryption header", e);
    }
    if (!Arrays.equals(magic, MAGIC)) {
      throw new BackupException(BackupException.Stage.DECRYPT, "not an encrypted archive (bad magic number)", null);
    }
    if (version != VERSION) {
      throw new BackupException(BackupException.Stage.DECRYPT, "unsupported encryption format version " + version, null);
    }
    if (iterations < 1 || iterations > MAX_ITERATIONS) {
      throw new BackupException(BackupException.Stage.DECRYPT, "implausible key derivation iteration count " + iterations, null);
    }

    GCMBlockCipher cipher = new GCMBlockCipher(new AESEngine());
    cipher.init(false, new AEADParameters(deriveKey(salt, iterations), TAG_BITS, nonce, header(iterations, salt, nonce)));
    return new FilterInputStream(new CipherInputStream(in, cipher)) {
      @Override
      public int read() throws IOException {
        try {
          return super.read();
        } catch (InvalidCipherTextIOException e) {
          throw authenticationFailure(e);
        }
      }

      @Override
      public int read(byte[] b, int off, int len) throws IOException {
        try {
          return super.read(b, off, len);
        } catch (InvalidCipherTextIOException e) {
          throw authenticationFailure(e);
        }
      }
    };
  }

  private static AuthenticationException authenticationFailure(InvalidCipherTextIOException e) {
    return new AuthenticationException("wrong password or corrupted archive", e);
  }

  private KeyParameter deriveKey(byte[] salt, int iterations) {
    PKCS5S2ParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA256Digest());
    byte[] passwordBytes = PBEParametersGenerator.PKCS5PasswordToUTF8Bytes(password);
    try {
      generator.init(passwordBytes, salt, iterations);
      return (KeyParameter) generator.generateDerivedParameters(KEY_BITS);
    } finally {
      Arrays.fill(passwordBytes, (byte) 0);
    }
  }

  private static byte[] header(int iterations, byte[] salt, byte[] nonce) throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (DataOutputStream out = new DataOutputStream(bytes)) {
      out.write(MAGIC);
      out.writeByte(VERSION);
      out.writeInt(iterations);
      out.write(salt);
      out.write(nonce);
    }
    return bytes.toByteArray();
  }

}
