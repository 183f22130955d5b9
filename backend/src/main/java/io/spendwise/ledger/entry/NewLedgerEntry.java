package io.spendwise.ledger.entry;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Everything needed to write one ledger entry.
 *
 * @param recurringTemplateId originating template, null for manual entries
 */
public record NewLedgerEntry(
    String ownerId,
    EntryType type,
    BigDecimal amount,
    EntryCategory category,
    String description,
    Instant date,
    boolean fromRecurring,
    UUID recurringTemplateId) {

  public static NewLedgerEntry manual(
      String ownerId,
      EntryType type,
      BigDecimal amount,
      EntryCategory category,
      String description,
      Instant date) {
    return new NewLedgerEntry(ownerId, type, amount, category, description, date, false, null);
  }
}
