package com.scholary.notes.transcription;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class WhisperClientTest {

  @TempDir Path tempDir;

  @Mock private HttpClient httpClient;
  @Mock private HttpResponse<String> response;

  private Path audio;

  @BeforeEach
  void setUp() throws IOException {
    audio = Files.write(tempDir.resolve("job_audio.wav"), new byte[] {82, 73, 70, 70});
  }

  private WhisperClient client(int maxRetries) {
    return new WhisperClient(
        new WhisperProperties("http://whisper:8090", 5, 60, maxRetries),
        new ObjectMapper(),
        httpClient);
  }

  private void respond(int status, String body) throws IOException, InterruptedException {
    when(httpClient.send(
            any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(response);
    when(response.statusCode()).thenReturn(status);
    when(response.body()).thenReturn(body);
  }

  @Test
  void transcribe_shouldParseSegmentsAndLanguage() throws Exception {
    respond(
        200,
        "{\"text\":\"Hello there. Welcome.\",\"language\":\"en\",\"duration\":4.0,"
            + "\"segments\":[{\"start\":0.0,\"end\":2.0,\"text\":\"Hello there.\",\"id\":0},"
            + "{\"start\":2.0,\"end\":4.0,\"text\":\"Welcome.\",\"id\":1}]}");

    TranscriptionResult result = client(3).transcribe(audio);

    assertThat(result.text()).isEqualTo("Hello there. Welcome.");
    assertThat(result.language()).isEqualTo("en");
    assertThat(result.segments())
        .containsExactly(
            new TranscriptSegment(0.0, 2.0, "Hello there."),
            new TranscriptSegment(2.0, 4.0, "Welcome."));

    ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient)
        .send(request.capture(), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
    assertThat(request.getValue().uri().toString())
        .isEqualTo("http://whisper:8090/api/v1/transcribe");
    assertThat(request.getValue().headers().firstValue("Content-Type").orElseThrow())
        .startsWith("multipart/form-data; boundary=");
  }

  @Test
  void transcribe_shouldNotRetryClientErrors() throws Exception {
    respond(415, "unsupported media");

    assertThatThrownBy(() -> client(3).transcribe(audio))
        .isInstanceOf(TranscriptionException.class)
        .hasMessageContaining("415");
    verify(httpClient, times(1))
        .send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
  }

  @Test
  void transcribe_shouldFailAfterServerErrors() throws Exception {
    respond(503, "busy");

    assertThatThrownBy(() -> client(1).transcribe(audio))
        .isInstanceOf(TranscriptionException.class)
        .hasMessage("Transcription failed after 1 attempts")
        .hasCauseInstanceOf(IOException.class);
  }

  @Test
  void transcribe_shouldNotRetryUnreadableResponse() throws Exception {
    respond(200, "<html>gateway page</html>");

    assertThatThrownBy(() -> client(3).transcribe(audio))
        .isInstanceOf(TranscriptionException.class)
        .hasMessageStartingWith("Transcription service returned an unreadable response");
    verify(httpClient, times(1))
        .send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
  }

  @Test
  void transcribe_shouldFailWhenAudioFileIsMissing() {
    assertThatThrownBy(() -> client(1).transcribe(tempDir.resolve("missing.wav")))
        .isInstanceOf(TranscriptionException.class);
  }
}
