package com.scholary.notes.credit;

/**
 * Outcome of a credit check or deduction.
 *
 * @param allowed whether the action may proceed (or was charged)
 * @param balance the owner's balance after the operation
 * @param cost credits the action costs
 * @param message human-readable explanation
 */
public record CreditDecision(boolean allowed, int balance, int cost, String message) {}
