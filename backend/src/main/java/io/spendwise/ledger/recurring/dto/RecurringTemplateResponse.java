package io.spendwise.ledger.recurring.dto;

import io.spendwise.ledger.entry.EntryCategory;
import io.spendwise.ledger.entry.EntryType;
import io.spendwise.ledger.recurring.Frequency;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record RecurringTemplateResponse(
    UUID id,
    EntryType type,
    BigDecimal amount,
    EntryCategory category,
    String categoryLabel,
    String description,
    Frequency frequency,
    Instant startDate,
    Instant endDate,
    Integer dayOfMonth,
    Integer dayOfWeek,
    Integer month,
    boolean active,
    Instant lastProcessed,
    Instant nextOccurrence,
    Instant createdAt,
    Instant updatedAt) {}
