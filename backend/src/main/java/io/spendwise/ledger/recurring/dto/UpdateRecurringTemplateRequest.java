package io.spendwise.ledger.recurring.dto;

import io.spendwise.ledger.entry.EntryCategory;
import io.spendwise.ledger.entry.EntryType;
import io.spendwise.ledger.recurring.Frequency;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Partial update: a null field keeps the template's current value. {@code clearEndDate} removes the
 * end date, which a null {@code endDate} cannot express.
 */
public record UpdateRecurringTemplateRequest(
    EntryType type,
    @DecimalMin("0.01") @Digits(integer = 10, fraction = 2) BigDecimal amount,
    EntryCategory category,
    @Size(max = 200) String description,
    Frequency frequency,
    Instant startDate,
    Instant endDate,
    @Min(1) @Max(31) Integer dayOfMonth,
    @Min(0) @Max(6) Integer dayOfWeek,
    @Min(0) @Max(11) Integer month,
    Boolean clearEndDate) {}
