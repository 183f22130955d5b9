package io.spendwise.ledger.recurring;

import io.spendwise.ledger.exception.ResourceConflictException;
import io.spendwise.ledger.recurring.ProcessingResult.TemplateFailure;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

/**
 * Batch processor that materializes every due recurring template. Driven daily by the cron trigger
 * below and on demand by the admin processing endpoint; both may run at the same time.
 *
 * <p>The loop is in the executor (not the service) so that each {@code materializeDueTemplate} call
 * goes through the Spring proxy and the {@code REQUIRES_NEW} transaction propagation takes effect.
 * A failing template rolls back alone and the loop moves on to the next one.
 */
@Component
public class RecurringTemplateExecutor {

  private static final Logger log = LoggerFactory.getLogger(RecurringTemplateExecutor.class);

  private final RecurringTemplateService templateService;
  private final RecurringProcessingProperties properties;
  private final Clock clock;

  public RecurringTemplateExecutor(
      RecurringTemplateService templateService,
      RecurringProcessingProperties properties,
      Clock clock) {
    this.templateService = templateService;
    this.properties = properties;
    this.clock = clock;
  }

  @Scheduled(cron = "${ledger.recurring.cron:0 0 3 * * *}", zone = "${ledger.recurring.zone:UTC}")
  public void processScheduled() {
    try {
      processDue(clock.instant());
    } catch (DataAccessException | TransactionException e) {
      log.error("Recurring processing cycle aborted: {}", e.getMessage(), e);
    }
  }

  /**
   * Runs one processing cycle against {@code now}. Selection failures propagate to the caller;
   * failures of individual templates are collected in the result.
   *
   * <p>The cycle stops early, between templates, when the thread is interrupted or the configured
   * cycle timeout has elapsed. Templates not reached stay due and are counted as deferred.
   */
  public ProcessingResult processDue(Instant now) {
    log.info("Recurring processing cycle started as of {}", now);
    Instant deadline = clock.instant().plus(properties.cycleTimeout());

    List<RecurringTemplate> dueTemplates = templateService.findDueTemplates(now);

    int processed = 0;
    int skipped = 0;
    int deferred = 0;
    int conflicts = 0;
    List<TemplateFailure> errors = new ArrayList<>();

    for (int i = 0; i < dueTemplates.size(); i++) {
      if (Thread.currentThread().isInterrupted() || clock.instant().isAfter(deadline)) {
        deferred = dueTemplates.size() - i;
        log.warn(
            "Recurring processing cycle stopped early, {} due templates deferred to the next cycle",
            deferred);
        break;
      }

      var template = dueTemplates.get(i);
      try {
        var outcome =
            templateService.materializeDueTemplate(
                template.getId(), template.getNextOccurrence(), now);
        if (outcome == MaterializationOutcome.MATERIALIZED) {
          processed++;
        } else {
          log.debug("Recurring template {} skipped: {}", template.getId(), outcome);
          skipped++;
        }
      } catch (OptimisticLockingFailureException | ResourceConflictException e) {
        // the other writer's entry stands; reported so conflicts stay visible
        log.warn(
            "Write conflict on recurring template {}, counted as skipped: {}",
            template.getId(),
            e.getMessage());
        skipped++;
        conflicts++;
        errors.add(new TemplateFailure(template.getId(), "Write conflict: " + describe(e)));
      } catch (Exception e) {
        log.error(
            "Failed to materialize recurring template {}: {}", template.getId(), e.getMessage(), e);
        errors.add(new TemplateFailure(template.getId(), describe(e)));
      }
    }

    log.info(
        "Recurring processing cycle completed: {} due, {} processed, {} skipped ({} on write"
            + " conflict), {} deferred, {} failed",
        dueTemplates.size(),
        processed,
        skipped,
        conflicts,
        deferred,
        errors.size() - conflicts);

    return new ProcessingResult(
        now, dueTemplates.size(), processed, skipped, deferred, List.copyOf(errors));
  }

  private static String describe(Exception e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }
}
