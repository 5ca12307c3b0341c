package com.scholary.notes.media;

import java.nio.file.Path;
import java.time.Duration;

/** Audio extraction and probing for media inputs. */
public interface MediaToolkit {

  /**
   * Extract the audio track as 16-bit mono WAV.
   *
   * @param input video or audio file
   * @param output WAV file to write
   * @return the written file
   * @throws com.scholary.notes.pipeline.AcquisitionException if extraction fails or times out
   */
  Path extractAudio(Path input, Path output);

  /**
   * Measure a media file's duration.
   *
   * @throws com.scholary.notes.pipeline.AcquisitionException if the file can't be probed
   */
  Duration probeDuration(Path input);
}
