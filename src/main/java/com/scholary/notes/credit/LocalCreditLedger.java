package com.scholary.notes.credit;

import com.scholary.notes.job.ActionType;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-process credit ledger.
 *
 * <p>Owners seen for the first time start with the configured trial credits. Deductions are
 * atomic per owner, so two jobs finishing together can't both spend the last credit.
 */
@Component
public class LocalCreditLedger implements CreditLedger {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalCreditLedger.class);

  private final CreditProperties properties;
  private final Map<String, Integer> balances = new ConcurrentHashMap<>();

  public LocalCreditLedger(CreditProperties properties) {
    this.properties = properties;
  }

  @Override
  public CreditDecision check(String owner, ActionType action) {
    requireOwner(owner);
    int cost = properties.costOf(action);
    int balance = balance(owner);
    if (balance < cost) {
      return new CreditDecision(false, balance, cost, insufficient(balance, cost));
    }
    return new CreditDecision(
        true, balance, cost, String.format("Sufficient credits available (%d credits)", balance));
  }

  @Override
  public CreditDecision deduct(String owner, ActionType action) {
    requireOwner(owner);
    int cost = properties.costOf(action);
    boolean[] charged = {false};

    int remaining =
        balances.compute(
            owner,
            (id, current) -> {
              int balance = current == null ? properties.trialCredits() : current;
              if (balance < cost) {
                return balance;
              }
              charged[0] = true;
              return balance - cost;
            });

    if (!charged[0]) {
      LOGGER.warn(
          "Credit deduction denied: owner={}, action={}, balance={}", owner, action, remaining);
      return new CreditDecision(false, remaining, cost, insufficient(remaining, cost));
    }

    LOGGER.info(
        "Credits deducted: owner={}, action={}, cost={}, remaining={}",
        owner,
        action,
        cost,
        remaining);
    return new CreditDecision(
        true,
        remaining,
        cost,
        String.format("Credits deducted successfully. Remaining: %d", remaining));
  }

  @Override
  public int balance(String owner) {
    requireOwner(owner);
    return balances.computeIfAbsent(
        owner,
        id -> {
          LOGGER.info("New owner {} granted {} trial credits", id, properties.trialCredits());
          return properties.trialCredits();
        });
  }

  private static void requireOwner(String owner) {
    if (owner == null || owner.isBlank()) {
      throw new LedgerException("Credit operations need an owner");
    }
  }

  private static String insufficient(int balance, int cost) {
    return String.format("Insufficient credits. You have %d credits but need %d.", balance, cost);
  }
}
