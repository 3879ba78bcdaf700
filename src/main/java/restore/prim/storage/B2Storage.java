package restore.prim.storage;

import com.google.common.annotations.VisibleForTesting;
import org.checkerframework.checker.nullness.qual.Nullable;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Backblaze B2, through its S3-compatible API.
 *
 * <p>Options: <code>keyId</code>, <code>applicationKey</code>, <code>serviceUrl</code>
 * (for example <code>https://s3.us-west-004.backblazeb2.com</code>) and
 * <code>bucketName</code> are required.  <code>region</code> defaults to the one named in
 * the service URL.  The bucket must already exist.
 */
public class B2Storage implements StorageBackend {

  private static final Pattern REGION_IN_URL = Pattern.compile("^s3\\.([a-z0-9-]+)\\.backblazeb2\\.com$");
  private static final String FALLBACK_REGION = "us-east-1";

  private @Nullable S3Bucket bucket;

  @Override
  public void initialize(Map<String, String> options) throws IOException {
    BackendOptions opts = BackendOptions.of("b2", options)
            .require("keyId", "applicationKey", "serviceUrl", "bucketName");
    opts.check();

    URI endpoint = Objects.requireNonNull(S3Storage.endpoint(opts.get("serviceUrl")));
    var credentials = StaticCredentialsProvider.create(
            AwsBasicCredentials.create(opts.get("keyId"), opts.get("applicationKey")));
    Region region = Region.of(opts.optional("region", regionFromEndpoint(endpoint)));
    S3Configuration pathStyle = S3Configuration.builder().pathStyleAccessEnabled(true).build();

    S3Client client = S3Client.builder()
            .credentialsProvider(credentials)
            .region(region)
            .endpointOverride(endpoint)
            .serviceConfiguration(pathStyle)
            .build();
    S3Presigner presigner = S3Presigner.builder()
            .credentialsProvider(credentials)
            .region(region)
            .endpointOverride(endpoint)
            .serviceConfiguration(pathStyle)
            .build();
    bucket = new S3Bucket(client, presigner, opts.get("bucketName"));
    bucket.verify(false);
  }

  @VisibleForTesting
  static String regionFromEndpoint(URI endpoint) {
    String host = endpoint.getHost();
    if (host != null) {
      Matcher m = REGION_IN_URL.matcher(host);
      if (m.matches()) {
        return m.group(1);
      }
    }
    return FALLBACK_REGION;
  }

  private S3Bucket bucket() {
    if (bucket == null) {
      throw new IllegalStateException("not initialized");
    }
    return bucket;
  }

  @Override
  public void upload(Path localFile, String remotePath) throws IOException {
    bucket().upload(localFile, remotePath);
  }

  @Override
  public void download(String remotePath, Path localFile) throws IOException {
    bucket().download(remotePath, localFile);
  }

  @Override
  public boolean exists(String remotePath) throws IOException {
    return bucket().exists(remotePath);
  }

  @Override
  public void delete(String remotePath) throws IOException {
    bucket().delete(remotePath);
  }

  @Override
  public boolean supportsSharing() {
    return true;
  }

  @Override
  public String generateShareLink(String remotePath, Duration expiration) throws IOException {
    return bucket().presign(remotePath, expiration);
  }

  @Override
  public void close() {
    if (bucket != null) {
      bucket.close();
      bucket = null;
    }
  }

}
