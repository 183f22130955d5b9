package io.spendwise.ledger.entry.dto;

import io.spendwise.ledger.entry.EntryCategory;
import io.spendwise.ledger.entry.EntryType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;

public record CreateLedgerEntryRequest(
    @NotNull EntryType type,
    @NotNull @DecimalMin("0.01") @Digits(integer = 10, fraction = 2) BigDecimal amount,
    @NotNull EntryCategory category,
    @Size(max = 200) String description,
    @NotNull Instant date) {}
