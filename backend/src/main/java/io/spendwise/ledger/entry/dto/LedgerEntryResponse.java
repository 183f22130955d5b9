package io.spendwise.ledger.entry.dto;

import io.spendwise.ledger.entry.EntryCategory;
import io.spendwise.ledger.entry.EntryType;
import io.spendwise.ledger.entry.LedgerEntry;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record LedgerEntryResponse(
    UUID id,
    EntryType type,
    BigDecimal amount,
    EntryCategory category,
    String categoryLabel,
    String description,
    Instant date,
    boolean fromRecurring,
    UUID recurringTemplateId,
    Instant createdAt) {

  public static LedgerEntryResponse from(LedgerEntry entry) {
    return new LedgerEntryResponse(
        entry.getId(),
        entry.getType(),
        entry.getAmount(),
        entry.getCategory(),
        entry.getCategory().getLabel(),
        entry.getDescription(),
        entry.getDate(),
        entry.isFromRecurring(),
        entry.getRecurringTemplateId(),
        entry.getCreatedAt());
  }
}
