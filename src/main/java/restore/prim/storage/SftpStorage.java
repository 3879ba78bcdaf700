package restore.prim.storage;

import com.google.common.annotations.VisibleForTesting;
import com.jcraft.jsch.ChannelSftp;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import com.jcraft.jsch.SftpException;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import restore.prim.NotFoundException;
import restore.prim.TransferException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * An SSH file transfer server.
 *
 * <p>Options: <code>host</code> and <code>username</code> are required, plus either
 * <code>password</code> or <code>privateKeyPath</code> (with an optional
 * <code>passphrase</code>).  <code>port</code> defaults to 22.  When
 * <code>knownHosts</code> names a known_hosts file the server key is checked against it;
 * otherwise any server key is accepted.  Remote paths are relative to the login directory
 * and missing directories are created on upload.
 *
 * <p>An SFTP channel serves one request at a time, so every operation is synchronized.
 */
public class SftpStorage implements StorageBackend {

  private static final Logger LOG = LoggerFactory.getLogger(SftpStorage.class);

  private static final int DEFAULT_PORT = 22;
  private static final int CONNECT_TIMEOUT_MILLIS = 30_000;

  private @Nullable Session session;
  private @Nullable ChannelSftp channel;

  @Override
  public synchronized void initialize(Map<String, String> options) throws IOException {
    BackendOptions opts = BackendOptions.of("sftp", options)
            .require("host", "username")
            .requireOneOf("password", "privateKeyPath");
    int port = opts.intValue("port", DEFAULT_PORT, 1, 65535);
    opts.check();

    JSch jsch = new JSch();
    try {
      @Nullable String key = opts.optional("privateKeyPath");
      if (key != null) {
        @Nullable String passphrase = opts.optional("passphrase");
        if (passphrase != null) {
          jsch.addIdentity(key, passphrase);
        } else {
          jsch.addIdentity(key);
        }
      }
      @Nullable String knownHosts = opts.optional("knownHosts");
      if (knownHosts != null) {
        jsch.setKnownHosts(knownHosts);
      }

      session = jsch.getSession(opts.get("username"), opts.get("host"), port);
      if (knownHosts == null) {
        session.setConfig("StrictHostKeyChecking", "no");
      }
      @Nullable String password = opts.optional("password");
      if (password != null) {
        session.setPassword(password);
      }
      session.connect(CONNECT_TIMEOUT_MILLIS);

      channel = (ChannelSftp) session.openChannel("sftp");
      channel.connect(CONNECT_TIMEOUT_MILLIS);
    } catch (JSchException e) {
      throw new TransferException("cannot connect to " + opts.get("host") + ":" + port, e);
    }
  }

  private ChannelSftp channel() {
    if (channel == null) {
      throw new IllegalStateException("not initialized");
    }
    return channel;
  }

  /**
   * @return the directories that must exist for <code>remotePath</code>, outermost first
   */
  @VisibleForTesting
  static List<String> parentDirectories(String remotePath) {
    List<String> result = new ArrayList<>();
    String[] parts = remotePath.split("/");
    StringBuilder prefix = new StringBuilder(remotePath.startsWith("/") ? "/" : "");
    for (int i = 0; i < parts.length - 1; ++i) {
      if (parts[i].isEmpty()) {
        continue;
      }
      prefix.append(parts[i]);
      result.add(prefix.toString());
      prefix.append('/');
    }
    return result;
  }

  private void makeParents(String remotePath) throws SftpException {
    for (String dir : parentDirectories(remotePath)) {
      if (!stat(dir)) {
        LOG.debug("creating remote directory {}", dir);
        channel().mkdir(dir);
      }
    }
  }

  private boolean stat(String remotePath) throws SftpException {
    try {
      channel().stat(remotePath);
      return true;
    } catch (SftpException e) {
      if (e.id == ChannelSftp.SSH_FX_NO_SUCH_FILE) {
        return false;
      }
      throw e;
    }
  }

  @Override
  public synchronized void upload(Path localFile, String remotePath) throws IOException {
    if (!Files.isRegularFile(localFile)) {
      throw new NotFoundException(localFile.toString());
    }
    try {
      makeParents(remotePath);
      channel().put(localFile.toString(), remotePath, ChannelSftp.OVERWRITE);
    } catch (SftpException e) {
      throw new TransferException("failed to upload " + remotePath, e);
    }
  }

  @Override
  public synchronized void download(String remotePath, Path localFile) throws IOException {
    try {
      if (!stat(remotePath)) {
        throw new NotFoundException(remotePath);
      }
      Path parent = localFile.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      channel().get(remotePath, localFile.toString());
    } catch (SftpException e) {
      throw new TransferException("failed to download " + remotePath, e);
    }
  }

  @Override
  public synchronized boolean exists(String remotePath) throws IOException {
    try {
      return stat(remotePath);
    } catch (SftpException e) {
      throw new TransferException("failed to look up " + remotePath, e);
    }
  }

  @Override
  public synchronized void delete(String remotePath) throws IOException {
    try {
      if (stat(remotePath)) {
        channel().rm(remotePath);
      }
    } catch (SftpException e) {
      throw new TransferException("failed to delete " + remotePath, e);
    }
  }

  @Override
  public synchronized void close() {
    if (channel != null) {
      channel.disconnect();
      channel = null;
    }
    if (session != null) {
      session.disconnect();
      session = null;
    }
  }

}
