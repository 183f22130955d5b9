package io.spendwise.ledger.recurring;

/** Cadence of a recurring template. Each value needs exactly one anchor field on the template. */
public enum Frequency {
  /** No anchor field. */
  DAILY,
  /** Anchored on {@code dayOfWeek}, 0 = Sunday through 6 = Saturday. */
  WEEKLY,
  /** Anchored on {@code dayOfMonth}, 1..31, clamped to the length of shorter months. */
  MONTHLY,
  /** Anchored on {@code month}, 0 = January through 11 = December. */
  YEARLY
}
