package restore.prim.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import restore.bkup.Util;
import restore.prim.ConfigurationException;
import restore.prim.NotFoundException;
import restore.prim.TransferException;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.AbortMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompletedMultipartUpload;
import software.amazon.awssdk.services.s3.model.CompletedPart;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.UploadPartRequest;
import software.amazon.awssdk.services.s3.model.UploadPartResponse;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Object operations against one bucket of an S3-compatible service.  Shared by the
 * <code>s3</code> and <code>b2</code> backends, which differ only in how the client is
 * built.
 */
class S3Bucket {

  private static final Logger LOG = LoggerFactory.getLogger(S3Bucket.class);

  /** Objects at least this big are sent in parts of this size. */
  static final int BYTES_PER_MULTIPART_UPLOAD_CHUNK = 16 * 1024 * 1024;

  /** S3 allows at most 10000 parts per upload. */
  private static final int MAX_PARTS = 10_000;

  /** Presigned URLs can live at most seven days. */
  static final Duration MAX_PRESIGN_DURATION = Duration.ofDays(7);

  private final S3Client s3client;
  private final S3Presigner presigner;
  private final String bucket;

  S3Bucket(S3Client s3client, S3Presigner presigner, String bucket) {
    this.s3client = s3client;
    this.presigner = presigner;
    this.bucket = bucket;
  }

  /**
   * Make sure the bucket is reachable.
   * @param createIfMissing whether to create an absent bucket or fail
   */
  void verify(boolean createIfMissing) throws IOException {
    try {
      s3client.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
    } catch (NoSuchBucketException e) {
      if (!createIfMissing) {
        throw new ConfigurationException("bucket " + bucket + " does not exist", e);
      }
      LOG.info("creating bucket {}", bucket);
      try {
        s3client.createBucket(CreateBucketRequest.builder().bucket(bucket).build());
      } catch (SdkException e2) {
        throw new TransferException("failed to create bucket " + bucket, e2);
      }
    } catch (SdkException e) {
      throw new TransferException("cannot reach bucket " + bucket, e);
    }
  }

  void upload(Path localFile, String key) throws IOException {
    try (InputStream stream = Files.newInputStream(localFile)) {
      byte[] buffer = new byte[(int) Math.min(BYTES_PER_MULTIPART_UPLOAD_CHUNK, Math.max(Files.size(localFile), 1))];
      int n = Util.readChunk(stream, buffer);
      if (n < BYTES_PER_MULTIPART_UPLOAD_CHUNK) {
        s3client.putObject(
                PutObjectRequest.builder()
                        .bucket(bucket)
                        .key(key)
                        .contentLength((long) n)
                        .contentType("application/octet-stream")
                        .build(),
                RequestBody.fromByteBuffer(ByteBuffer.wrap(buffer, 0, n)));
      } else {
        doMultipartUpload(key, buffer, stream);
      }
    } catch (NoSuchFileException e) {
      throw new NotFoundException(localFile.toString(), e);
    } catch (SdkException e) {
      throw new TransferException("failed to upload " + key, e);
    }
  }

  /**
   * Do a multipart upload.
   * The length of the <code>buffer</code> array specifies the part size.
   * @param key the key to upload
   * @param buffer a fully-filled byte array with the first chunk of data
   *               (NOTE: this procedure modifies <code>buffer</code> in-place)
   * @param stream a stream with the rest of the data
   */
  private void doMultipartUpload(String key, byte[] buffer, InputStream stream) throws IOException {
    String uploadId = s3client.createMultipartUpload(
            CreateMultipartUploadRequest.builder().bucket(bucket).key(key).build()).uploadId();
    boolean completed = false;
    try {
      int partNumber = 1;
      int n = buffer.length;
      List<CompletedPart> parts = new ArrayList<>();
      do {
        if (partNumber > MAX_PARTS) {
          throw new TransferException(key + " is too large for a multipart upload");
        }
        UploadPartResponse response = s3client.uploadPart(
                UploadPartRequest.builder()
                        .bucket(bucket)
                        .key(key)
                        .partNumber(partNumber)
                        .uploadId(uploadId)
                        .build(),
                RequestBody.fromByteBuffer(ByteBuffer.wrap(buffer, 0, n)));
        parts.add(CompletedPart.builder().partNumber(partNumber).eTag(response.eTag()).build());
        ++partNumber;
        n = Util.readChunk(stream, buffer);
      } while (n > 0);

      s3client.completeMultipartUpload(CompleteMultipartUploadRequest.builder()
              .bucket(bucket)
              .key(key)
              .uploadId(uploadId)
              .multipartUpload(CompletedMultipartUpload.builder().parts(parts).build())
              .build());
      completed = true;
    } finally {
      if (!completed) {
        abort(key, uploadId);
      }
    }
  }

  private void abort(String key, String uploadId) {
    try {
      s3client.abortMultipartUpload(AbortMultipartUploadRequest.builder()
              .bucket(bucket)
              .key(key)
              .uploadId(uploadId)
              .build());
    } catch (SdkException e) {
      LOG.warn("failed to abort multipart upload {} of {}: {}", uploadId, key, e.toString());
    }
  }

  void download(String key, Path localFile) throws IOException {
    try (ResponseInputStream<GetObjectResponse> in = s3client.getObject(
            GetObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build())) {
      Path parent = localFile.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.copy(in, localFile, StandardCopyOption.REPLACE_EXISTING);
    } catch (NoSuchKeyException e) {
      throw new NotFoundException(key, e);
    } catch (SdkException e) {
      // "SdkClientException" indicates any other kind of error, including:
      //   - malformed request
      //   - network error
      //   - unable to parse response from Amazon
      throw new TransferException("failed to download " + key, e);
    }
  }

  boolean exists(String key) throws IOException {
    try {
      s3client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());
      return true;
    } catch (NoSuchKeyException e) {
      return false;
    } catch (S3Exception e) {
      // HEAD responses have no body, so some services report a bare 404
      if (e.statusCode() == 404) {
        return false;
      }
      throw new TransferException("failed to look up " + key, e);
    } catch (SdkException e) {
      throw new TransferException("failed to look up " + key, e);
    }
  }

  void delete(String key) throws IOException {
    try {
      s3client.deleteObject(
              DeleteObjectRequest.builder()
                      .bucket(bucket)
                      .key(key)
                      .build());
    } catch (SdkException e) {
      throw new TransferException("failed to delete " + key, e);
    }
  }

  String presign(String key, Duration expiration) throws IOException {
    if (expiration.compareTo(MAX_PRESIGN_DURATION) > 0) {
      throw new TransferException("presigned URLs cannot outlive " + MAX_PRESIGN_DURATION.toDays() + " days");
    }
    try {
      return presigner.presignGetObject(GetObjectPresignRequest.builder()
              .signatureDuration(expiration)
              .getObjectRequest(GetObjectRequest.builder().bucket(bucket).key(key).build())
              .build()).url().toString();
    } catch (SdkException e) {
      throw new TransferException("failed to presign " + key, e);
    }
  }

  void close() {
    presigner.close();
    s3client.close();
  }

}
