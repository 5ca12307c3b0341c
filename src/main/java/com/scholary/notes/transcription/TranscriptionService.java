package com.scholary.notes.transcription;

import java.nio.file.Path;

/**
 * Speech-to-text collaborator.
 *
 * <p>Lets the pipeline swap transcription providers and lets tests mock them.
 */
public interface TranscriptionService {

  /**
   * Transcribe a whole audio file.
   *
   * @param audioFile the extracted audio
   * @return text, language and time-coded segments
   * @throws TranscriptionException if transcription fails
   */
  TranscriptionResult transcribe(Path audioFile);
}
