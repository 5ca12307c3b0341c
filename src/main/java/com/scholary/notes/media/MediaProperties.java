package com.scholary.notes.media;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for media tooling.
 *
 * @param ffmpegPath ffmpeg executable
 * @param ffprobePath ffprobe executable
 * @param processTimeoutSeconds upper bound for a single ffmpeg/ffprobe run
 * @param audioSampleRate sample rate of the extracted mono WAV
 * @param minDocumentChars documents with less extracted text are rejected
 */
@ConfigurationProperties(prefix = "media")
@Validated
public record MediaProperties(
    @NotBlank String ffmpegPath,
    @NotBlank String ffprobePath,
    @Positive int processTimeoutSeconds,
    @Positive int audioSampleRate,
    @PositiveOrZero int minDocumentChars) {}
