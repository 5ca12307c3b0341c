package com.scholary.notes.credit;

import com.scholary.notes.job.ActionType;

/** Usage accounting per owner. */
public interface CreditLedger {

  /**
   * Check whether the owner can afford an action, without charging.
   *
   * @throws LedgerException if the ledger can't be consulted
   */
  CreditDecision check(String owner, ActionType action);

  /**
   * Charge the owner for an action.
   *
   * @return a decision with {@code allowed=false} when the balance is too low
   * @throws LedgerException if the ledger can't be updated
   */
  CreditDecision deduct(String owner, ActionType action);

  /** Current balance, granting trial credits to an owner seen for the first time. */
  int balance(String owner);
}
