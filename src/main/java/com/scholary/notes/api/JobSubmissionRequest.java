package com.scholary.notes.api;

import com.scholary.notes.job.ActionType;
import com.scholary.notes.pipeline.InputKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request to process an object already in the store.
 *
 * <p>{@code owner} is optional; anonymous jobs are processed but never charged. {@code actionType}
 * defaults from {@code kind}.
 */
public record JobSubmissionRequest(
    String owner,
    ActionType actionType,
    @NotNull InputKind kind,
    @NotBlank String bucket,
    @NotBlank String key) {}
