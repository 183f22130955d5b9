package io.spendwise.ledger.recurring;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration for recurring template processing. The periodic trigger reads its cron expression
 * from {@code ledger.recurring.cron} directly; {@code "-"} disables it.
 *
 * @param zone business time zone used for calendar arithmetic and the cron trigger
 * @param maxAmount upper bound accepted for a template amount
 * @param cycleTimeout wall-clock budget of a single processing cycle; templates not reached in
 *     time are deferred to the next cycle
 */
@ConfigurationProperties(prefix = "ledger.recurring")
public record RecurringProcessingProperties(
    @DefaultValue("UTC") ZoneId zone,
    @DefaultValue("10000000") BigDecimal maxAmount,
    @DefaultValue("10m") Duration cycleTimeout) {}
