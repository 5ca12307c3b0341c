package com.scholary.notes.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.notes.config.PipelineProperties;
import com.scholary.notes.config.PipelineProperties.QuotaProperties;
import com.scholary.notes.objectstore.ObjectStoreClient;
import com.scholary.notes.objectstore.ObjectStoreClient.ObjectMetadata;
import com.scholary.notes.objectstore.ObjectStoreException;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class InputAcquirerTest {

  @TempDir Path tempDir;

  @Mock private ObjectStoreClient objectStoreClient;

  private Path workDir;
  private InputAcquirer acquirer;

  @BeforeEach
  void setUp() {
    workDir = tempDir.resolve("work");
    PipelineProperties properties =
        new PipelineProperties(
            workDir.toString(),
            1,
            1,
            1,
            true,
            1024 * 1024,
            new QuotaProperties("free", Map.of("free", 30), null));
    acquirer = new InputAcquirer(objectStoreClient, properties);
  }

  private static JobContext context(PipelineInput input) {
    return new JobContext("job-1", "alice", input.kind().defaultActionType(), input);
  }

  @Test
  void acquire_shouldDownloadStoredObjectIntoTempDir() throws Exception {
    byte[] data = "fake mp4 bytes".getBytes(StandardCharsets.UTF_8);
    when(objectStoreClient.getObjectMetadata("uploads", "lectures/week1.mp4"))
        .thenReturn(new ObjectMetadata(data.length, "video/mp4"));
    when(objectStoreClient.getObjectStream("uploads", "lectures/week1.mp4"))
        .thenReturn(new ByteArrayInputStream(data));
    JobContext context =
        context(PipelineInput.storedObject(InputKind.VIDEO, "uploads", "lectures/week1.mp4"));

    Path file = acquirer.acquire(context);

    assertThat(file).isEqualTo(workDir.resolve("job-1_input.mp4"));
    assertThat(Files.readAllBytes(file)).isEqualTo(data);
    assertThat(context.sourceFile()).isEqualTo(file);
    assertThat(context.tempFiles()).containsExactly(file);
  }

  @Test
  void acquire_shouldUseLocalFileInPlace() throws Exception {
    Path upload = Files.writeString(tempDir.resolve("slides.pdf"), "%PDF-1.4");
    JobContext context = context(PipelineInput.localFile(InputKind.DOCUMENT, upload));

    assertThat(acquirer.acquire(context)).isEqualTo(upload);
    assertThat(context.tempFiles()).containsExactly(upload);
  }

  @Test
  void acquire_shouldRejectOversizedStoredObjectBeforeDownload() {
    when(objectStoreClient.getObjectMetadata("uploads", "big.mp4"))
        .thenReturn(new ObjectMetadata(5L * 1024 * 1024, "video/mp4"));
    JobContext context = context(PipelineInput.storedObject(InputKind.VIDEO, "uploads", "big.mp4"));

    assertThatThrownBy(() -> acquirer.acquire(context))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Input is 5 MB, larger than the 1 MB limit");
    verify(objectStoreClient, never()).getObjectStream(anyString(), anyString());
    assertThat(context.tempFiles()).containsExactly(workDir.resolve("job-1_input.mp4"));
  }

  @Test
  void acquire_shouldRegisterOversizedLocalFileForCleanup() throws Exception {
    Path upload = Files.write(tempDir.resolve("huge.mp4"), new byte[2 * 1024 * 1024]);
    JobContext context = context(PipelineInput.localFile(InputKind.VIDEO, upload));

    assertThatThrownBy(() -> acquirer.acquire(context)).isInstanceOf(ValidationException.class);
    assertThat(context.tempFiles()).containsExactly(upload);
  }

  @Test
  void acquire_shouldWrapObjectStoreFailures() {
    when(objectStoreClient.getObjectMetadata("uploads", "missing.mp4"))
        .thenThrow(new ObjectStoreException("Object not found: uploads/missing.mp4"));
    JobContext context =
        context(PipelineInput.storedObject(InputKind.VIDEO, "uploads", "missing.mp4"));

    assertThatThrownBy(() -> acquirer.acquire(context))
        .isInstanceOf(AcquisitionException.class)
        .hasMessageContaining("missing.mp4")
        .hasCauseInstanceOf(ObjectStoreException.class);
  }

  @Test
  void acquire_shouldFailForUnreadableLocalFile() {
    JobContext context =
        context(PipelineInput.localFile(InputKind.AUDIO, tempDir.resolve("gone.mp3")));

    assertThatThrownBy(() -> acquirer.acquire(context)).isInstanceOf(AcquisitionException.class);
  }
}
