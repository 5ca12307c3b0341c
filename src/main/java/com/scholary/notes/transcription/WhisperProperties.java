package com.scholary.notes.transcription;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Whisper client.
 *
 * <p>Timeouts are in seconds. Long lectures need a generous read timeout.
 */
@ConfigurationProperties(prefix = "whisper")
@Validated
public record WhisperProperties(
    @NotBlank String baseUrl,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries) {}
