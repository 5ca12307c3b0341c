package com.scholary.notes.media;

import com.scholary.notes.pipeline.AcquisitionException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link MediaToolkit} backed by the ffmpeg and ffprobe executables.
 *
 * <p>Process output goes to a temp file rather than a pipe so a chatty process can't block on a
 * full buffer while we wait for it with a timeout.
 */
@Component
public class FfmpegMediaToolkit implements MediaToolkit {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegMediaToolkit.class);

  private final MediaProperties properties;

  public FfmpegMediaToolkit(MediaProperties properties) {
    this.properties = properties;
  }

  @Override
  public Path extractAudio(Path input, Path output) {
    LOGGER.info("Extracting audio: input={}, output={}", input.getFileName(), output.getFileName());

    List<String> command =
        List.of(
            properties.ffmpegPath(),
            "-hide_banner",
            "-loglevel", "error",
            "-i", input.toString(),
            "-vn",
            "-acodec", "pcm_s16le",
            "-ar", String.valueOf(properties.audioSampleRate()),
            "-ac", "1",
            "-y",
            output.toString());

    String log = run(command, "ffmpeg");
    if (!Files.isRegularFile(output)) {
      throw new AcquisitionException("ffmpeg produced no audio: " + log);
    }
    return output;
  }

  @Override
  public Duration probeDuration(Path input) {
    List<String> command =
        List.of(
            properties.ffprobePath(),
            "-v", "error",
            "-show_entries", "format=duration",
            "-of", "default=noprint_wrappers=1:nokey=1",
            input.toString());

    String output = run(command, "ffprobe").trim();
    try {
      double seconds = Double.parseDouble(output);
      Duration duration = Duration.ofMillis(Math.round(seconds * 1000));
      LOGGER.info("Probed duration: file={}, seconds={}", input.getFileName(), seconds);
      return duration;
    } catch (NumberFormatException e) {
      throw new AcquisitionException("Failed to parse duration from ffprobe output: " + output, e);
    }
  }

  /** Run a process to completion and return its combined output. */
  private String run(List<String> command, String tool) {
    Path log = null;
    try {
      log = Files.createTempFile(tool + "-", ".log");
      ProcessBuilder pb = new ProcessBuilder(command);
      pb.redirectErrorStream(true);
      pb.redirectOutput(log.toFile());

      Process process = pb.start();
      if (!process.waitFor(properties.processTimeoutSeconds(), TimeUnit.SECONDS)) {
        process.destroyForcibly();
        throw new AcquisitionException(
            String.format("%s timed out after %d seconds", tool, properties.processTimeoutSeconds()));
      }

      String output = Files.readString(log, StandardCharsets.UTF_8);
      if (process.exitValue() != 0) {
        LOGGER.error("{} failed: exitCode={}, output={}", tool, process.exitValue(), output);
        throw new AcquisitionException(
            String.format("%s failed with exit code %d: %s", tool, process.exitValue(), output.strip()));
      }
      return output;

    } catch (IOException e) {
      throw new AcquisitionException(tool + " could not be run: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AcquisitionException(tool + " interrupted", e);
    } finally {
      if (log != null) {
        TempFileCleaner.delete(log);
      }
    }
  }
}
