package com.scholary.notes.pipeline;

import com.scholary.notes.config.PipelineProperties;
import com.scholary.notes.config.PipelineProperties.QuotaProperties;
import com.scholary.notes.media.MediaToolkit;
import java.time.Duration;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Rejects media longer than the owner's plan allows.
 *
 * <p>Anonymous jobs and documents are not limited. A duration that can't be probed fails the job.
 */
@Component
public class QuotaValidator {

  private static final Logger LOGGER = LoggerFactory.getLogger(QuotaValidator.class);

  private final MediaToolkit mediaToolkit;
  private final QuotaProperties quota;

  public QuotaValidator(MediaToolkit mediaToolkit, PipelineProperties properties) {
    this.mediaToolkit = mediaToolkit;
    this.quota = properties.quota();
  }

  /**
   * @throws ValidationException if the media exceeds the plan limit
   * @throws AcquisitionException if the duration can't be measured
   */
  public void validate(JobContext context) {
    if (context.owner() == null || !context.kind().isMedia()) {
      return;
    }
    Integer limitMinutes = quota.limitMinutesOf(context.owner());
    if (limitMinutes == null) {
      LOGGER.warn("No duration limit configured for plan {}", quota.planOf(context.owner()));
      return;
    }

    Duration duration = mediaToolkit.probeDuration(context.sourceFile());
    double minutes = duration.toMillis() / 60_000.0;
    LOGGER.info(
        "Media duration {} minutes, plan={}, limit={} minutes",
        String.format(Locale.ROOT, "%.1f", minutes),
        quota.planOf(context.owner()),
        limitMinutes);
    if (minutes > limitMinutes) {
      throw new ValidationException(
          String.format(
              Locale.ROOT,
              "Video duration (%.1f minutes) exceeds your plan limit of %d minutes.",
              minutes, limitMinutes));
    }
  }
}
