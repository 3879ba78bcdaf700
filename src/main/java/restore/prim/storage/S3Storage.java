package restore.prim.storage;

import org.checkerframework.checker.nullness.qual.Nullable;
import restore.prim.ConfigurationException;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Amazon S3.
 *
 * <p>Options: <code>accessKeyId</code>, <code>secretAccessKey</code>, <code>region</code>
 * and <code>bucketName</code> are required; <code>endpoint</code> overrides the service
 * URL.  The bucket is created if it does not exist.
 */
public class S3Storage implements StorageBackend {

  private @Nullable S3Bucket bucket;

  @Override
  public void initialize(Map<String, String> options) throws IOException {
    BackendOptions opts = BackendOptions.of("s3", options)
            .require("accessKeyId", "secretAccessKey", "region", "bucketName");
    opts.check();

    var credentials = StaticCredentialsProvider.create(
            AwsBasicCredentials.create(opts.get("accessKeyId"), opts.get("secretAccessKey")));
    Region region = Region.of(opts.get("region"));
    @Nullable URI endpoint = endpoint(opts.optional("endpoint"));

    S3ClientBuilder client = S3Client.builder().credentialsProvider(credentials).region(region);
    S3Presigner.Builder presigner = S3Presigner.builder().credentialsProvider(credentials).region(region);
    if (endpoint != null) {
      client.endpointOverride(endpoint);
      presigner.endpointOverride(endpoint);
    }
    bucket = new S3Bucket(client.build(), presigner.build(), opts.get("bucketName"));
    bucket.verify(true);
  }

  static @Nullable URI endpoint(@Nullable String value) throws ConfigurationException {
    if (value == null) {
      return null;
    }
    try {
      return new URI(value);
    } catch (URISyntaxException e) {
      throw new ConfigurationException("malformed endpoint URL " + value, e);
    }
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
