package io.spendwise.ledger.recurring;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Summary of one processing cycle.
 *
 * @param asOf the reference instant templates were compared against
 * @param dueCount templates selected as due at the start of the cycle
 * @param processedCount templates that materialized an entry in this cycle
 * @param skippedCount templates another cycle (or an edit) had already moved on, including those
 *     that lost a write conflict
 * @param deferredCount templates left for the next cycle because this one timed out or was
 *     interrupted
 * @param errors one entry per template whose materialization rolled back; write conflicts appear
 *     here too, with a {@code "Write conflict: "} message, although they also count as skipped
 */
public record ProcessingResult(
    Instant asOf,
    int dueCount,
    int processedCount,
    int skippedCount,
    int deferredCount,
    List<TemplateFailure> errors) {

  public record TemplateFailure(UUID templateId, String message) {}
}
