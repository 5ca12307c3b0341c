package com.scholary.notes.transcription;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for a faster-whisper style transcription API.
 *
 * <p>Posts the extracted audio as multipart/form-data to {@code {baseUrl}/api/v1/transcribe} and
 * retries transient failures (IO errors and 5xx responses) with exponential backoff plus jitter.
 * A 4xx response or an unreadable body is not retried.
 */
public class WhisperClient implements TranscriptionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperClient.class);

  private final HttpClient httpClient;
  private final WhisperProperties properties;
  private final ObjectMapper objectMapper;

  public WhisperClient(WhisperProperties properties, ObjectMapper objectMapper) {
    this(
        properties,
        objectMapper,
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build());
  }

  WhisperClient(WhisperProperties properties, ObjectMapper objectMapper, HttpClient httpClient) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient = httpClient;
    LOGGER.info("Initialized Whisper client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public TranscriptionResult transcribe(Path audioFile) {
    LOGGER.info("Transcribing audio: file={}", audioFile.getFileName());

    int attempt = 0;
    Exception lastException = null;

    while (attempt < properties.maxRetries()) {
      try {
        return attemptTranscribe(audioFile);
      } catch (IOException e) {
        lastException = e;
        attempt++;
        if (attempt < properties.maxRetries()) {
          long backoffMs = (long) (Math.pow(2, attempt) * 1000 + Math.random() * 1000);
          LOGGER.warn(
              "Transcription attempt {} failed, retrying in {}ms: {}",
              attempt,
              backoffMs,
              e.getMessage());
          sleep(backoffMs);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new TranscriptionException("Transcription interrupted", e);
      }
    }

    throw new TranscriptionException(
        String.format("Transcription failed after %d attempts", properties.maxRetries()),
        lastException);
  }

  private TranscriptionResult attemptTranscribe(Path audioFile)
      throws IOException, InterruptedException {

    String boundary = UUID.randomUUID().toString();
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/api/v1/transcribe"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "multipart/form-data; boundary=" + boundary)
            .POST(buildMultipartBody(audioFile, boundary))
            .build();

    LOGGER.debug("Sending transcription request to {}", request.uri());

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    int status = response.statusCode();
    if (status >= 400 && status < 500) {
      throw new TranscriptionException(
          String.format(
              "Transcription service rejected the request (%d): %s", status, response.body()));
    }
    if (status != 200) {
      throw new IOException(
          String.format("Transcription service returned status %d: %s", status, response.body()));
    }

    WhisperResponse whisperResponse;
    try {
      whisperResponse = objectMapper.readValue(response.body(), WhisperResponse.class);
    } catch (JsonProcessingException e) {
      throw new TranscriptionException(
          "Transcription service returned an unreadable response: " + e.getOriginalMessage(), e);
    }
    TranscriptionResult result = whisperResponse.toResult();

    LOGGER.info(
        "Transcription successful: {} segments, language={}, {} chars",
        result.segments().size(),
        result.language(),
        result.text().length());
    return result;
  }

  /**
   * Build a multipart/form-data body with a single file part.
   *
   * <pre>
   * --boundary
   * Content-Disposition: form-data; name="file"; filename="audio.wav"
   * Content-Type: audio/wav
   *
   * [binary data]
   * --boundary--
   * </pre>
   */
  private BodyPublisher buildMultipartBody(Path audioFile, String boundary) throws IOException {
    String filename = audioFile.getFileName().toString();
    byte[] fileBytes = Files.readAllBytes(audioFile);

    String head =
        "--"
            + boundary
            + "\r\n"
            + "Content-Disposition: form-data; name=\"file\"; filename=\""
            + filename
            + "\"\r\n"
            + "Content-Type: audio/wav\r\n\r\n";
    String tail = "\r\n--" + boundary + "--\r\n";

    byte[] prefix = head.getBytes(StandardCharsets.UTF_8);
    byte[] suffix = tail.getBytes(StandardCharsets.UTF_8);

    byte[] body = new byte[prefix.length + fileBytes.length + suffix.length];
    System.arraycopy(prefix, 0, body, 0, prefix.length);
    System.arraycopy(fileBytes, 0, body, prefix.length, fileBytes.length);
    System.arraycopy(suffix, 0, body, prefix.length + fileBytes.length, suffix.length);

    return BodyPublishers.ofByteArray(body);
  }

  private void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TranscriptionException("Transcription interrupted", e);
    }
  }
}
