package com.scholary.notes.notes;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the notes generator, an OpenAI-compatible chat completion API.
 *
 * <p>An empty {@code apiKey} disables generation the same way {@code enabled=false} does.
 */
@ConfigurationProperties(prefix = "notes")
@Validated
public record NotesProperties(
    boolean enabled,
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String model,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxTokens,
    @DecimalMin("0.0") @DecimalMax("2.0") double temperature,
    @PositiveOrZero long minRequestIntervalMillis,
    @Positive int maxChunkChars,
    @PositiveOrZero int minContentChars,
    @Positive int maxAttempts,
    @Positive int trackerMaxSize,
    @Positive int trackerExpireHours) {

  public boolean isConfigured() {
    return enabled && apiKey != null && !apiKey.isBlank();
  }
}
