package io.spendwise.ledger.recurring.dto;

import io.spendwise.ledger.entry.EntryCategory;
import io.spendwise.ledger.entry.EntryType;
import io.spendwise.ledger.recurring.Frequency;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * @param createInitialEntry whether a start date already in the past writes one immediate entry for
 *     its first occurrence; defaults to true
 */
public record CreateRecurringTemplateRequest(
    @NotNull EntryType type,
    @NotNull @DecimalMin("0.01") @Digits(integer = 10, fraction = 2) BigDecimal amount,
    @NotNull EntryCategory category,
    @Size(max = 200) String description,
    @NotNull Frequency frequency,
    @NotNull Instant startDate,
    Instant endDate,
    @Min(1) @Max(31) Integer dayOfMonth,
    @Min(0) @Max(6) Integer dayOfWeek,
    @Min(0) @Max(11) Integer month,
    Boolean createInitialEntry) {}
