package com.scholary.notes.notes;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ChatCompletionNotesGeneratorTest {

  private static final String LECTURE =
      "Today we look at hash tables. A hash table maps keys to values. "
          + "Collisions are resolved with chaining.";

  @Mock private HttpClient httpClient;
  @Mock private HttpResponse<String> response;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final GeneratedNotesTracker tracker = new GeneratedNotesTracker(10, Duration.ofHours(1));

  private static NotesProperties properties(boolean enabled, String apiKey, int maxChunkChars) {
    return new NotesProperties(
        enabled,
        "https://llm.example.com/v1",
        apiKey,
        "test-model",
        5,
        30,
        1000,
        0.3,
        0,
        maxChunkChars,
        50,
        3,
        10,
        1);
  }

  private ChatCompletionNotesGenerator generator(NotesProperties properties) {
    return new ChatCompletionNotesGenerator(
        properties, objectMapper, new RequestThrottle(Duration.ZERO), tracker, httpClient);
  }

  private void respond(int status, String body) throws IOException, InterruptedException {
    when(httpClient.send(
            any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(response);
    when(response.statusCode()).thenReturn(status);
    when(response.body()).thenReturn(body);
  }

  private static String completion(String content) {
    return "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":"
        + "\"" + content.replace("\n", "\\n") + "\"}}]}";
  }

  @Test
  void generateNotes_shouldReturnCompletionContent() throws Exception {
    respond(200, completion("## Hash tables\nKeys map to values.\n"));

    Optional<String> notes =
        generator(properties(true, "secret", 15000)).generateNotes(LECTURE, ContentType.VIDEO);

    assertThat(notes).contains("## Hash tables\nKeys map to values.");
    ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient)
        .send(request.capture(), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
    assertThat(request.getValue().uri().toString())
        .isEqualTo("https://llm.example.com/v1/chat/completions");
    assertThat(request.getValue().headers().firstValue("Authorization")).contains("Bearer secret");
  }

  @Test
  void generateNotes_shouldSkipWhenDisabled() throws Exception {
    Optional<String> notes =
        generator(properties(false, "secret", 15000)).generateNotes(LECTURE, ContentType.VIDEO);

    assertThat(notes).isEmpty();
    verify(httpClient, never()).send(any(), any());
  }

  @Test
  void generateNotes_shouldSkipWithoutApiKey() throws Exception {
    Optional<String> notes =
        generator(properties(true, " ", 15000)).generateNotes(LECTURE, ContentType.VIDEO);

    assertThat(notes).isEmpty();
    verify(httpClient, never()).send(any(), any());
  }

  @Test
  void generateNotes_shouldSkipShortContent() throws Exception {
    Optional<String> notes =
        generator(properties(true, "secret", 15000))
            .generateNotes("Too short.", ContentType.DOCUMENT);

    assertThat(notes).isEmpty();
    verify(httpClient, never()).send(any(), any());
  }

  @Test
  void generateNotes_shouldReturnEmptyOnErrorStatus() throws Exception {
    respond(429, "{\"error\":\"rate limited\"}");

    Optional<String> notes =
        generator(properties(true, "secret", 15000)).generateNotes(LECTURE, ContentType.VIDEO);

    assertThat(notes).isEmpty();
  }

  @Test
  void generateNotes_shouldReturnEmptyWhenCompletionIsBlank() throws Exception {
    respond(200, completion("   "));

    Optional<String> notes =
        generator(properties(true, "secret", 15000)).generateNotes(LECTURE, ContentType.VIDEO);

    assertThat(notes).isEmpty();
  }

  @Test
  void generateNotes_shouldReturnEmptyOnIoFailure() throws Exception {
    when(httpClient.send(
            any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenThrow(new IOException("connection reset"));

    Optional<String> notes =
        generator(properties(true, "secret", 15000)).generateNotes(LECTURE, ContentType.VIDEO);

    assertThat(notes).isEmpty();
  }

  @Test
  void generateNotes_shouldReturnEmptyOnUnexpectedRuntimeFailure() throws Exception {
    when(httpClient.send(
            any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenThrow(new IllegalStateException("client closed"));

    Optional<String> notes =
        generator(properties(true, "secret", 15000)).generateNotes(LECTURE, ContentType.VIDEO);

    assertThat(notes).isEmpty();
  }

  @Test
  void generateNotes_shouldRetryWhenNotesRepeatRecentOutput() throws Exception {
    String repeated = "## Hash tables\nKeys map to values.";
    tracker.track(repeated);
    respond(200, completion(repeated));

    Optional<String> notes =
        generator(properties(true, "secret", 15000)).generateNotes(LECTURE, ContentType.VIDEO);

    assertThat(notes).contains(repeated);
    verify(httpClient, times(3))
        .send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
  }

  @Test
  void generateNotes_shouldCombineChunksUnderHeader() throws Exception {
    respond(200, completion("## Part\nA part."));

    Optional<String> notes =
        generator(properties(true, "secret", 70)).generateNotes(LECTURE, ContentType.VIDEO);

    assertThat(notes).isPresent();
    assertThat(notes.get()).startsWith("# Complete Course Notes\n\n---\n\n## Part");
    verify(httpClient, times(2))
        .send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
  }

  @Test
  void splitContent_shouldBreakOnSentences() {
    List<String> chunks =
        ChatCompletionNotesGenerator.splitContent("One two. Three four. Five six. Seven.", 20);

    assertThat(chunks).containsExactly("One two.", "Three four.", "Five six. Seven.");
  }

  @Test
  void splitContent_shouldKeepShortTextWhole() {
    assertThat(ChatCompletionNotesGenerator.splitContent("Short text.", 100))
        .containsExactly("Short text.");
  }
}
