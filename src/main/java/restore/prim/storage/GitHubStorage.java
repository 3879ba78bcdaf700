package restore.prim.storage;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.kohsuke.github.GHContent;
import org.kohsuke.github.GHContentBuilder;
import org.kohsuke.github.GHFileNotFoundException;
import org.kohsuke.github.GHRepository;
import org.kohsuke.github.GitHub;
import org.kohsuke.github.GitHubBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import restore.prim.NotFoundException;
import restore.prim.TransferException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;

/**
 * A GitHub repository, through the repository contents API.  Every upload and delete is
 * a commit.  GitHub rejects files over 100 Mb, so this backend suits small backups.
 *
 * <p>Options: <code>token</code>, <code>owner</code> and <code>repo</code> are required;
 * <code>branch</code> defaults to the repository's default branch.
 */
public class GitHubStorage implements StorageBackend {

  private static final Logger LOG = LoggerFactory.getLogger(GitHubStorage.class);

  private @Nullable GHRepository repository;
  private @Nullable String branch;

  @Override
  public void initialize(Map<String, String> options) throws IOException {
    BackendOptions opts = BackendOptions.of("github", options).require("token", "owner", "repo");
    opts.check();
    branch = opts.optional("branch");
    String name = opts.get("owner") + "/" + opts.get("repo");
    try {
      GitHub github = new GitHubBuilder().withOAuthToken(opts.get("token")).build();
      repository = github.getRepository(name);
    } catch (IOException e) {
      throw new TransferException("cannot open repository " + name, e);
    }
  }

  private GHRepository repository() {
    if (repository == null) {
      throw new IllegalStateException("not initialized");
    }
    return repository;
  }

  private @Nullable GHContent lookup(String remotePath) throws IOException {
    try {
      return branch == null
              ? repository().getFileContent(remotePath)
              : repository().getFileContent(remotePath, branch);
    } catch (GHFileNotFoundException e) {
      return null;
    } catch (IOException e) {
      throw new TransferException("failed to look up " + remotePath, e);
    }
  }

  @Override
  public void upload(Path localFile, String remotePath) throws IOException {
    byte[] data;
    try {
      data = Files.readAllBytes(localFile);
    } catch (NoSuchFileException e) {
      throw new NotFoundException(localFile.toString(), e);
    }
    @Nullable GHContent existing = lookup(remotePath);
    GHContentBuilder builder = repository().createContent()
            .path(remotePath)
            .content(data)
            .message("Update " + remotePath);
    if (branch != null) {
      builder.branch(branch);
    }
    if (existing != null) {
      builder.sha(existing.getSha());
    }
    try {
      builder.commit();
    } catch (IOException e) {
      throw new TransferException("failed to upload " + remotePath, e);
    }
  }

  @Override
  public void download(String remotePath, Path localFile) throws IOException {
    @Nullable GHContent content = lookup(remotePath);
    if (content == null || !content.isFile()) {
      throw new NotFoundException(remotePath);
    }
    Path parent = localFile.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (InputStream in = content.read()) {
      Files.copy(in, localFile, StandardCopyOption.REPLACE_EXISTING);
    } catch (GHFileNotFoundException e) {
      throw new NotFoundException(remotePath, e);
    } catch (IOException e) {
      throw new TransferException("failed to download " + remotePath, e);
    }
  }

  @Override
  public boolean exists(String remotePath) throws IOException {
    return lookup(remotePath) != null;
  }

  @Override
  public void delete(String remotePath) throws IOException {
    @Nullable GHContent content = lookup(remotePath);
    if (content == null) {
      return;
    }
    try {
      if (branch == null) {
        content.delete("Delete " + remotePath);
      } else {
        content.delete("Delete " + remotePath, branch);
      }
    } catch (GHFileNotFoundException e) {
      LOG.debug("{} was deleted concurrently", remotePath);
    } catch (IOException e) {
      throw new TransferException("failed to delete " + remotePath, e);
    }
  }

  @Override
  public void close() {
    repository = null;
  }

}
