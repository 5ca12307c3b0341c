package com.scholary.notes.pipeline;

import com.scholary.notes.config.PipelineProperties;
import com.scholary.notes.objectstore.ObjectStoreClient;
import com.scholary.notes.objectstore.ObjectStoreClient.ObjectMetadata;
import com.scholary.notes.objectstore.ObjectStoreException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Brings a job's input onto local disk.
 *
 * <p>Stored objects are downloaded into the temp directory. Local uploads are used in place. Either
 * way the file is registered as temporary and is checked against the input size limit.
 */
@Component
public class InputAcquirer {

  private static final Logger LOGGER = LoggerFactory.getLogger(InputAcquirer.class);

  private final ObjectStoreClient objectStoreClient;
  private final Path tempDir;
  private final long maxInputBytes;

  public InputAcquirer(ObjectStoreClient objectStoreClient, PipelineProperties properties) {
    this.objectStoreClient = objectStoreClient;
    this.tempDir = Paths.get(properties.tempDir());
    this.maxInputBytes = properties.maxInputBytes();
  }

  /**
   * Make the input available as a local file and record it on the context.
   *
   * @throws ValidationException if the input exceeds the size limit
   * @throws AcquisitionException if the input can't be read or downloaded
   */
  public Path acquire(JobContext context) {
    PipelineInput input = context.input();
    Path file =
        input.isStoredObject()
            ? tempDir.resolve(context.jobId() + "_input" + input.extension())
            : input.localFile();
    // registered first so a rejected or partial input is still cleaned up
    context.addTempFile(file);
    if (input.isStoredObject()) {
      download(input, file);
    } else {
      checkLocal(file);
    }
    context.setSourceFile(file);
    return file;
  }

  private void checkLocal(Path file) {
    long size;
    try {
      size = Files.size(file);
    } catch (IOException e) {
      throw new AcquisitionException("Input file is not readable: " + file.getFileName(), e);
    }
    checkSize(size);
  }

  private void download(PipelineInput input, Path target) {
    try {
      ObjectMetadata metadata = objectStoreClient.getObjectMetadata(input.bucket(), input.key());
      checkSize(metadata.contentLength());

      Files.createDirectories(tempDir);
      LOGGER.info(
          "Downloading input: bucket={}, key={}, size={} bytes",
          input.bucket(),
          input.key(),
          metadata.contentLength());
      try (InputStream in = objectStoreClient.getObjectStream(input.bucket(), input.key())) {
        Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (ObjectStoreException e) {
      throw new AcquisitionException(
          "Failed to fetch input " + input.key() + ": " + e.getMessage(), e);
    } catch (IOException e) {
      throw new AcquisitionException("Failed to store input " + input.key() + " locally", e);
    }
  }

  private void checkSize(long size) {
    if (size > maxInputBytes) {
      throw new ValidationException(
          String.format(
              Locale.ROOT,
              "Input is %d MB, larger than the %d MB limit",
              size / 1024 / 1024, maxInputBytes / 1024 / 1024));
    }
  }
}
