package com.scholary.notes.credit;

import com.scholary.notes.job.ActionType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Credit pricing.
 *
 * @param trialCredits balance granted to an owner seen for the first time
 * @param costs credits per action; actions missing here cost 1
 */
@ConfigurationProperties(prefix = "credits")
@Validated
public record CreditProperties(
    @PositiveOrZero int trialCredits, @NotNull Map<ActionType, Integer> costs) {

  public int costOf(ActionType action) {
    if (action == null) {
      return 1;
    }
    return costs.getOrDefault(action, 1);
  }
}
