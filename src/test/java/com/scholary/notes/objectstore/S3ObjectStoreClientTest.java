package com.scholary.notes.objectstore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.notes.objectstore.ObjectStoreClient.ObjectMetadata;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.MinIOContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;

/** Runs the client against a MinIO container. Skipped when Docker isn't available. */
@Testcontainers(disabledWithoutDocker = true)
class S3ObjectStoreClientTest {

  private static final String BUCKET = "lectures";

  @Container
  static MinIOContainer minio = new MinIOContainer("minio/minio:RELEASE.2023-09-04T19-57-37Z");

  private static S3ObjectStoreClient client;

  @BeforeAll
  static void setUp() {
    try (S3Client admin =
        S3Client.builder()
            .region(Region.US_EAST_1)
            .credentialsProvider(
                StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(minio.getUserName(), minio.getPassword())))
            .endpointOverride(URI.create(minio.getS3URL()))
            .forcePathStyle(true)
            .build()) {
      admin.createBucket(CreateBucketRequest.builder().bucket(BUCKET).build());
    }

    client =
        new S3ObjectStoreClient(
            new ObjectStoreProperties(
                minio.getS3URL(), minio.getUserName(), minio.getPassword(), BUCKET, "", true));
  }

  @AfterAll
  static void tearDown() {
    client.close();
  }

  @Test
  void putObject_shouldStoreContentAndMetadata() throws Exception {
    byte[] data = "# Notes".getBytes(StandardCharsets.UTF_8);

    client.putObject(
        BUCKET, "jobs/a/a_notes.md", new ByteArrayInputStream(data), data.length, "text/markdown");

    ObjectMetadata metadata = client.getObjectMetadata(BUCKET, "jobs/a/a_notes.md");
    assertThat(metadata.contentLength()).isEqualTo(data.length);
    assertThat(metadata.contentType()).isEqualTo("text/markdown");
    try (InputStream in = client.getObjectStream(BUCKET, "jobs/a/a_notes.md")) {
      assertThat(in.readAllBytes()).isEqualTo(data);
    }
  }

  @Test
  void objectExists_shouldReportMissingKeys() {
    byte[] data = {1, 2, 3};
    client.putObject(
        BUCKET, "present.bin", new ByteArrayInputStream(data), data.length, "application/octet-stream");

    assertThat(client.objectExists(BUCKET, "present.bin")).isTrue();
    assertThat(client.objectExists(BUCKET, "absent.bin")).isFalse();
  }

  @Test
  void getObjectStream_shouldThrowForMissingObject() {
    assertThatThrownBy(() -> client.getObjectStream(BUCKET, "nope.mp4"))
        .isInstanceOf(ObjectStoreException.class)
        .hasMessageContaining("nope.mp4");
  }

  @Test
  void getObjectMetadata_shouldThrowForMissingObject() {
    assertThatThrownBy(() -> client.getObjectMetadata(BUCKET, "nope.mp4"))
        .isInstanceOf(ObjectStoreException.class);
  }
}
