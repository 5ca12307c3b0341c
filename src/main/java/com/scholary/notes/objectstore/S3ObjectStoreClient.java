package com.scholary.notes.objectstore;

import java.io.InputStream;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * S3/MinIO implementation of ObjectStoreClient.
 *
 * <p>Uses AWS SDK v2, which talks to real S3 and to S3-compatible services like MinIO. MinIO needs
 * the endpoint override and path-style access. The SDK retries transient failures itself; 404 and
 * 403 fail fast.
 */
public class S3ObjectStoreClient implements ObjectStoreClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStoreClient.class);

  private final S3Client s3Client;

  public S3ObjectStoreClient(ObjectStoreProperties properties) {
    LOGGER.info(
        "Initializing S3 client: endpoint={}, bucket={}, pathStyleAccess={}",
        properties.endpoint(),
        properties.bucket(),
        properties.pathStyleAccess());

    AwsBasicCredentials credentials =
        AwsBasicCredentials.create(properties.accessKey(), properties.secretKey());

    Region region =
        properties.region() != null && !properties.region().isEmpty()
            ? Region.of(properties.region())
            : Region.US_EAST_1;

    this.s3Client =
        S3Client.builder()
            .region(region)
            .credentialsProvider(StaticCredentialsProvider.create(credentials))
            .endpointOverride(URI.create(properties.endpoint()))
            .forcePathStyle(properties.pathStyleAccess())
            .build();
  }

  S3ObjectStoreClient(S3Client s3Client) {
    this.s3Client = s3Client;
  }

  @Override
  public InputStream getObjectStream(String bucket, String key) {
    LOGGER.debug("Fetching object: bucket={}, key={}", bucket, key);

    try {
      GetObjectRequest request = GetObjectRequest.builder().bucket(bucket).key(key).build();
      InputStream stream = s3Client.getObject(request);
      LOGGER.info("Retrieved object: bucket={}, key={}", bucket, key);
      return stream;

    } catch (NoSuchKeyException e) {
      String message = String.format("Object not found: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message);
      throw new ObjectStoreException(message, e);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to retrieve object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);

    } catch (RuntimeException e) {
      String message =
          String.format("Unexpected error retrieving object: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public void putObject(
      String bucket, String key, InputStream data, long contentLength, String contentType) {
    LOGGER.debug(
        "Uploading object: bucket={}, key={}, contentLength={}, contentType={}",
        bucket,
        key,
        contentLength,
        contentType);

    try {
      PutObjectRequest request =
          PutObjectRequest.builder()
              .bucket(bucket)
              .key(key)
              .contentType(contentType)
              .contentLength(contentLength)
              .build();

      s3Client.putObject(request, RequestBody.fromInputStream(data, contentLength));
      LOGGER.info("Uploaded object: bucket={}, key={}", bucket, key);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to upload object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);

    } catch (RuntimeException e) {
      String message =
          String.format("Unexpected error uploading object: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public ObjectMetadata getObjectMetadata(String bucket, String key) {
    LOGGER.debug("Getting metadata for object: bucket={}, key={}", bucket, key);

    try {
      HeadObjectResponse response = head(bucket, key);
      return new ObjectMetadata(response.contentLength(), response.contentType());

    } catch (NoSuchKeyException e) {
      String message = String.format("Object not found: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message);
      throw new ObjectStoreException(message, e);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to get metadata: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public boolean objectExists(String bucket, String key) {
    try {
      head(bucket, key);
      return true;

    } catch (NoSuchKeyException e) {
      return false;

    } catch (S3Exception e) {
      // HEAD responses carry no body, so a missing key can surface as a bare 404
      if (e.statusCode() == 404) {
        return false;
      }
      String message =
          String.format(
              "Failed to check object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  private HeadObjectResponse head(String bucket, String key) {
    return s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());
  }

  /** Release the SDK's connections on shutdown. */
  public void close() {
    LOGGER.info("Closing S3 client");
    s3Client.close();
  }
}
