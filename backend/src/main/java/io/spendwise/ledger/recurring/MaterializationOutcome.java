package io.spendwise.ledger.recurring;

/** Result of one attempt to materialize a due template. */
public enum MaterializationOutcome {
  /** An entry was written and the template advanced or was deactivated. */
  MATERIALIZED,
  /** The template was no longer due when re-read; another cycle or an edit got there first. */
  NOT_DUE,
  /** The ledger already held an entry for the occurrence; the template advanced without one. */
  ALREADY_RECORDED
}
