package com.scholary.notes.notes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates notes through an OpenAI-compatible {@code /chat/completions} endpoint.
 *
 * <p>Long content is split into chunks at sentence boundaries and each chunk is sent as its own
 * request; the parts are stitched together under one document header. Every request first waits
 * on the shared {@link RequestThrottle}. When the result looks like something generated recently
 * (per {@link GeneratedNotesTracker}) the whole generation is retried a few times before the last
 * result is accepted anyway.
 *
 * <p>This collaborator never throws: any failure is logged and reported as empty.
 */
public class ChatCompletionNotesGenerator implements NotesGenerator {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChatCompletionNotesGenerator.class);

  private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=\\. )");

  private final NotesProperties properties;
  private final ObjectMapper objectMapper;
  private final RequestThrottle throttle;
  private final GeneratedNotesTracker tracker;
  private final HttpClient httpClient;

  public ChatCompletionNotesGenerator(
      NotesProperties properties,
      ObjectMapper objectMapper,
      RequestThrottle throttle,
      GeneratedNotesTracker tracker,
      HttpClient httpClient) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.throttle = throttle;
    this.tracker = tracker;
    this.httpClient = httpClient;

    if (!properties.isConfigured()) {
      LOGGER.warn(
          "Notes generation disabled: enabled={}, apiKeySet={}",
          properties.enabled(),
          properties.apiKey() != null && !properties.apiKey().isBlank());
    } else {
      LOGGER.info(
          "Initialized notes generator: baseUrl={}, model={}",
          properties.baseUrl(),
          properties.model());
    }
  }

  @Override
  public Optional<String> generateNotes(String content, ContentType type) {
    if (!properties.isConfigured()) {
      LOGGER.warn("Notes generation not available, skipping");
      return Optional.empty();
    }
    if (content == null || content.strip().length() < properties.minContentChars()) {
      LOGGER.warn("Content too short for notes generation");
      return Optional.empty();
    }

    try {
      List<String> chunks = splitContent(content, properties.maxChunkChars());
      LOGGER.info(
          "Generating notes: type={}, chars={}, chunks={}", type, content.length(), chunks.size());

      String notes = null;
      for (int attempt = 1; attempt <= properties.maxAttempts(); attempt++) {
        notes = generateOnce(chunks, type);
        if (!tracker.isSimilar(notes)) {
          tracker.track(notes);
          LOGGER.info("Generated unique notes on attempt {}", attempt);
          return Optional.of(notes);
        }
        LOGGER.warn("Generated notes resemble recent output, retrying (attempt {})", attempt);
      }

      LOGGER.warn("Using possibly repetitive notes after {} attempts", properties.maxAttempts());
      tracker.track(notes);
      return Optional.of(notes);

    } catch (NotesServiceException e) {
      LOGGER.error("Notes generation failed: {}", e.getMessage(), e);
      return Optional.empty();
    } catch (RuntimeException e) {
      LOGGER.error("Unexpected notes generation failure", e);
      return Optional.empty();
    }
  }

  private String generateOnce(List<String> chunks, ContentType type) {
    if (chunks.size() == 1) {
      return complete(NotesPrompts.single(chunks.get(0), type));
    }

    StringBuilder combined = new StringBuilder(type.combinedHeader()).append("\n\n---\n\n");
    for (int i = 0; i < chunks.size(); i++) {
      LOGGER.info("Processing chunk {}/{}", i + 1, chunks.size());
      if (i > 0) {
        combined.append("\n\n");
      }
      combined.append(complete(NotesPrompts.sequential(chunks.get(i), type, i + 1, chunks.size())));
    }
    return combined.toString();
  }

  /** One chat completion call, spaced by the throttle. */
  private String complete(String prompt) {
    try {
      throttle.acquire();

      HttpRequest request =
          HttpRequest.newBuilder()
              .uri(URI.create(properties.baseUrl() + "/chat/completions"))
              .timeout(Duration.ofSeconds(properties.readTimeout()))
              .header("Content-Type", "application/json")
              .header("Authorization", "Bearer " + properties.apiKey())
              .POST(HttpRequest.BodyPublishers.ofString(requestBody(prompt)))
              .build();

      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() != 200) {
        throw new NotesServiceException(
            String.format(
                "Notes service returned status %d: %s", response.statusCode(), response.body()));
      }

      JsonNode text = objectMapper.readTree(response.body()).at("/choices/0/message/content");
      if (text.isMissingNode() || text.isNull() || text.asText().isBlank()) {
        throw new NotesServiceException("Notes service returned no content");
      }
      return text.asText().strip();

    } catch (IOException e) {
      throw new NotesServiceException("Notes service call failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new NotesServiceException("Notes generation interrupted", e);
    }
  }

  private String requestBody(String prompt) throws IOException {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("model", properties.model());
    body.put("temperature", properties.temperature());
    body.put("max_tokens", properties.maxTokens());
    body.put("top_p", 0.9);
    ArrayNode messages = body.putArray("messages");
    messages.addObject().put("role", "system").put("content", NotesPrompts.SYSTEM_PROMPT);
    messages.addObject().put("role", "user").put("content", prompt);
    return objectMapper.writeValueAsString(body);
  }

  /**
   * Split text into chunks of at most {@code maxChars}, breaking after ". ".
   *
   * <p>A single sentence longer than the limit becomes its own oversized chunk.
   */
  static List<String> splitContent(String text, int maxChars) {
    List<String> chunks = new ArrayList<>();
    if (text.length() <= maxChars) {
      chunks.add(text);
      return chunks;
    }

    StringBuilder current = new StringBuilder();
    for (String sentence : SENTENCE_BREAK.split(text)) {
      if (current.length() + sentence.length() > maxChars && current.length() > 0) {
        chunks.add(current.toString().strip());
        current.setLength(0);
      }
      current.append(sentence);
    }
    if (current.length() > 0) {
      chunks.add(current.toString().strip());
    }
    return chunks;
  }
}
