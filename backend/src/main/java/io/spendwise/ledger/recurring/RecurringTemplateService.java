package io.spendwise.ledger.recurring;

import io.spendwise.ledger.audit.AuditEventBuilder;
import io.spendwise.ledger.audit.AuditEventResponse;
import io.spendwise.ledger.audit.AuditService;
import io.spendwise.ledger.entry.LedgerService;
import io.spendwise.ledger.entry.NewLedgerEntry;
import io.spendwise.ledger.entry.dto.LedgerEntryResponse;
import io.spendwise.ledger.exception.InvalidStateException;
import io.spendwise.ledger.exception.ResourceNotFoundException;
import io.spendwise.ledger.recurring.dto.CreateRecurringTemplateRequest;
import io.spendwise.ledger.recurring.dto.RecurringTemplateResponse;
import io.spendwise.ledger.recurring.dto.UpdateRecurringTemplateRequest;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
public class RecurringTemplateService {

  private static final Logger log = LoggerFactory.getLogger(RecurringTemplateService.class);

  private static final String ENTITY_TYPE = "recurring_template";

  private final RecurringTemplateRepository templateRepository;
  private final NextOccurrenceCalculator calculator;
  private final LedgerService ledgerService;
  private final AuditService auditService;
  private final RecurringProcessingProperties properties;
  private final Clock clock;

  public RecurringTemplateService(
      RecurringTemplateRepository templateRepository,
      NextOccurrenceCalculator calculator,
      LedgerService ledgerService,
      AuditService auditService,
      RecurringProcessingProperties properties,
      Clock clock) {
    this.templateRepository = templateRepository;
    this.calculator = calculator;
    this.ledgerService = ledgerService;
    this.auditService = auditService;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Creates a template and computes its first {@code nextOccurrence}. A start date in the future is
   * aligned to its first matching date. A start date already past is caught up to the first
   * occurrence after now, optionally writing one immediate entry for the missed first occurrence.
   */
  @Transactional
  public RecurringTemplateResponse create(String ownerId, CreateRecurringTemplateRequest request) {
    validateAmount(request.amount());
    validateCadence(
        request.frequency(),
        request.startDate(),
        request.endDate(),
        request.dayOfMonth(),
        request.dayOfWeek(),
        request.month());

    Frequency frequency = request.frequency();
    var template =
        new RecurringTemplate(
            ownerId,
            request.type(),
            request.amount(),
            request.category(),
            trimToNull(request.description()),
            frequency,
            request.startDate(),
            request.endDate(),
            frequency == Frequency.MONTHLY ? request.dayOfMonth() : null,
            frequency == Frequency.WEEKLY ? request.dayOfWeek() : null,
            frequency == Frequency.YEARLY ? request.month() : null);

    Instant now = clock.instant();
    Instant first =
        calculator
            .firstOnOrAfter(template, request.startDate())
            .orElseThrow(RecurringTemplateService::noOccurrences);
    boolean createInitialEntry = !Boolean.FALSE.equals(request.createInitialEntry());
    boolean writeImmediateEntry = false;

    if (first.isAfter(now)) {
      template.scheduleNextOccurrence(first);
    } else {
      Optional<Instant> upcoming = calculator.upcoming(template, now);
      if (createInitialEntry) {
        writeImmediateEntry = true;
        template.recordProcessed(now);
        template.scheduleNextOccurrence(upcoming.orElse(first));
        if (upcoming.isEmpty()) {
          template.deactivate();
        }
      } else {
        template.scheduleNextOccurrence(
            upcoming.orElseThrow(RecurringTemplateService::noOccurrences));
      }
    }

    template = templateRepository.saveAndFlush(template);

    if (writeImmediateEntry) {
      ledgerService.createEntry(entryFor(template, first));
      log.info("Wrote catch-up entry dated {} for recurring template {}", first, template.getId());
    }

    log.info(
        "Created recurring template {} ({}), next occurrence {}",
        template.getId(),
        template.getFrequency(),
        template.getNextOccurrence());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("recurring_template.created")
            .entityType(ENTITY_TYPE)
            .entityId(template.getId())
            .details(
                Map.of(
                    "frequency", template.getFrequency().name(),
                    "amount", template.getAmount().toPlainString(),
                    "next_occurrence", template.getNextOccurrence().toString(),
                    "immediate_entry", writeImmediateEntry))
            .build());

    return buildResponse(template);
  }

  /**
   * Applies a partial update. Amount, category, type and description never move the schedule; any
   * change to the cadence recomputes {@code nextOccurrence} the same way creation does, without an
   * immediate entry. A null field keeps its value, so removing the end date takes {@code
   * clearEndDate}.
   */
  @Transactional
  public RecurringTemplateResponse update(
      String ownerId, UUID id, UpdateRecurringTemplateRequest request) {
    var template = findOwned(ownerId, id);

    if (request.amount() != null) {
      validateAmount(request.amount());
    }

    Frequency frequency = coalesce(request.frequency(), template.getFrequency());
    Instant startDate = coalesce(request.startDate(), template.getStartDate());
    boolean clearEndDate = Boolean.TRUE.equals(request.clearEndDate());
    if (clearEndDate && request.endDate() != null) {
      throw new InvalidStateException(
          "Invalid end date", "An update cannot both set and clear the end date");
    }
    Instant endDate = clearEndDate ? null : coalesce(request.endDate(), template.getEndDate());
    Integer dayOfMonth =
        frequency == Frequency.MONTHLY
            ? coalesce(request.dayOfMonth(), template.getDayOfMonth())
            : null;
    Integer dayOfWeek =
        frequency == Frequency.WEEKLY
            ? coalesce(request.dayOfWeek(), template.getDayOfWeek())
            : null;
    Integer month =
        frequency == Frequency.YEARLY ? coalesce(request.month(), template.getMonth()) : null;
    validateCadence(frequency, startDate, endDate, dayOfMonth, dayOfWeek, month);

    boolean cadenceChanged =
        frequency != template.getFrequency()
            || !startDate.equals(template.getStartDate())
            || !Objects.equals(endDate, template.getEndDate())
            || !Objects.equals(dayOfMonth, template.getDayOfMonth())
            || !Objects.equals(dayOfWeek, template.getDayOfWeek())
            || !Objects.equals(month, template.getMonth());

    template.updateDetails(
        coalesce(request.type(), template.getType()),
        coalesce(request.amount(), template.getAmount()),
        coalesce(request.category(), template.getCategory()),
        request.description() != null
            ? trimToNull(request.description())
            : template.getDescription());

    if (cadenceChanged) {
      template.reschedule(frequency, startDate, endDate, dayOfMonth, dayOfWeek, month);
      Instant now = clock.instant();
      Optional<Instant> first = calculator.firstOnOrAfter(template, startDate);
      Optional<Instant> next =
          first.isPresent() && first.get().isAfter(now)
              ? first
              : calculator.upcoming(template, now);
      template.scheduleNextOccurrence(next.orElseThrow(RecurringTemplateService::noOccurrences));
    }

    template = templateRepository.saveAndFlush(template);

    log.info(
        "Updated recurring template {} (cadence changed: {}), next occurrence {}",
        id,
        cadenceChanged,
        template.getNextOccurrence());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("recurring_template.updated")
            .entityType(ENTITY_TYPE)
            .entityId(id)
            .details(
                Map.of(
                    "cadence_changed", cadenceChanged,
                    "next_occurrence", template.getNextOccurrence().toString()))
            .build());

    return buildResponse(template);
  }

  /**
   * Flips the active flag. Reactivating a template whose next occurrence already passed moves it to
   * the first occurrence after now, and is rejected when no such occurrence exists before the end
   * date.
   */
  @Transactional
  public RecurringTemplateResponse toggleActive(String ownerId, UUID id) {
    var template = findOwned(ownerId, id);

    if (template.isActive()) {
      template.deactivate();
    } else {
      Instant now = clock.instant();
      if (template.getNextOccurrence().isBefore(now)) {
        Instant next =
            calculator
                .upcoming(template, now)
                .orElseThrow(
                    () ->
                        new InvalidStateException(
                            "Cannot activate", "Cannot activate - no valid future occurrences"));
        template.scheduleNextOccurrence(next);
      } else if (template.getEndDate() != null
          && !template.getNextOccurrence().isBefore(template.getEndDate())) {
        throw new InvalidStateException(
            "Cannot activate", "Cannot activate - no valid future occurrences");
      }
      template.activate();
    }

    template = templateRepository.save(template);

    log.info(
        "{} recurring template {}", template.isActive() ? "Activated" : "Deactivated", id);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType(
                template.isActive()
                    ? "recurring_template.activated"
                    : "recurring_template.deactivated")
            .entityType(ENTITY_TYPE)
            .entityId(id)
            .details(Map.of("next_occurrence", template.getNextOccurrence().toString()))
            .build());

    return buildResponse(template);
  }

  /** Deletes the template. Entries already materialized from it stay in the ledger. */
  @Transactional
  public void delete(String ownerId, UUID id) {
    var template = findOwned(ownerId, id);

    templateRepository.delete(template);

    log.info("Deleted recurring template {}", id);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("recurring_template.deleted")
            .entityType(ENTITY_TYPE)
            .entityId(id)
            .details(
                Map.of(
                    "frequency", template.getFrequency().name(),
                    "was_active", template.isActive()))
            .build());
  }

  @Transactional(readOnly = true)
  public RecurringTemplateResponse get(String ownerId, UUID id) {
    return buildResponse(findOwned(ownerId, id));
  }

  @Transactional(readOnly = true)
  public List<RecurringTemplateResponse> list(String ownerId, String status) {
    List<RecurringTemplate> templates;
    if (status == null || status.isBlank()) {
      templates = templateRepository.findByOwnerIdOrderByNextOccurrenceAsc(ownerId);
    } else if ("active".equalsIgnoreCase(status)) {
      templates = templateRepository.findByOwnerIdAndActiveOrderByNextOccurrenceAsc(ownerId, true);
    } else if ("inactive".equalsIgnoreCase(status)) {
      templates = templateRepository.findByOwnerIdAndActiveOrderByNextOccurrenceAsc(ownerId, false);
    } else {
      throw new InvalidStateException(
          "Invalid status filter", "Status must be 'active' or 'inactive', got: " + status);
    }
    return templates.stream().map(this::buildResponse).toList();
  }

  @Transactional(readOnly = true)
  public List<LedgerEntryResponse> listEntries(String ownerId, UUID id) {
    findOwned(ownerId, id);
    return ledgerService.listTemplateEntries(id);
  }

  @Transactional(readOnly = true)
  public List<AuditEventResponse> history(String ownerId, UUID id) {
    findOwned(ownerId, id);
    return auditService.findEntityHistory(ENTITY_TYPE, id).stream()
        .map(AuditEventResponse::from)
        .toList();
  }

  // --- Batch processing steps, driven by RecurringTemplateExecutor ---

  /** Active templates whose next occurrence is at or before {@code now}, oldest first. */
  @Transactional(readOnly = true)
  public List<RecurringTemplate> findDueTemplates(Instant now) {
    return templateRepository
        .findByActiveTrueAndNextOccurrenceLessThanEqualOrderByNextOccurrenceAscIdAsc(now);
  }

  /**
   * Materializes the occurrence a template was selected for and advances the template, all in one
   * transaction. The template is re-read first; if it was deleted, deactivated or already advanced
   * since selection nothing is written. When the ledger already holds an entry for the occurrence
   * (for example after a reactivation that kept an occurrence already materialized) the template is
   * advanced without a second entry.
   *
   * <p>A concurrent cycle that slips past the re-check still fails, either on the ledger's
   * (template, date) unique key or on the template's version column, and this transaction rolls
   * back as a whole.
   *
   * @param selectedOccurrence the {@code nextOccurrence} observed when the template was selected
   * @param now the cycle's reference instant, recorded as {@code lastProcessed}
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public MaterializationOutcome materializeDueTemplate(
      UUID templateId, Instant selectedOccurrence, Instant now) {
    var found = templateRepository.findById(templateId);
    if (found.isEmpty()) {
      log.info("Recurring template {} was deleted before processing", templateId);
      return MaterializationOutcome.NOT_DUE;
    }

    var template = found.get();
    Instant occurrence = template.getNextOccurrence();
    if (!template.isActive()
        || !occurrence.equals(selectedOccurrence)
        || occurrence.isAfter(now)) {
      log.info(
          "Recurring template {} is no longer due (active={}, next occurrence {})",
          templateId,
          template.isActive(),
          occurrence);
      return MaterializationOutcome.NOT_DUE;
    }

    Optional<Instant> following = calculator.next(template, occurrence);

    if (ledgerService.hasEntryFor(templateId, occurrence)) {
      template.completeCycle(now, following.orElse(null));
      templateRepository.saveAndFlush(template);
      log.warn(
          "Recurring template {} already had an entry for {}, advanced to {} without writing",
          templateId,
          occurrence,
          following.map(Instant::toString).orElse("none (deactivated)"));
      auditService.log(
          AuditEventBuilder.builder()
              .eventType("recurring_template.advanced")
              .entityType(ENTITY_TYPE)
              .entityId(templateId)
              .details(
                  Map.of(
                      "occurrence", occurrence.toString(),
                      "reason", "entry_already_recorded",
                      "deactivated", following.isEmpty()))
              .build());
      return MaterializationOutcome.ALREADY_RECORDED;
    }

    var entry = ledgerService.createEntry(entryFor(template, occurrence));

    template.completeCycle(now, following.orElse(null));
    templateRepository.saveAndFlush(template);

    if (following.isPresent()) {
      log.debug(
          "Materialized recurring template {} for {}, next occurrence {}",
          templateId,
          occurrence,
          following.get());
    } else {
      log.info(
          "Recurring template {} materialized its last occurrence {} and was deactivated",
          templateId,
          occurrence);
    }

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("recurring_template.materialized")
            .entityType(ENTITY_TYPE)
            .entityId(templateId)
            .details(
                Map.of(
                    "ledger_entry_id", entry.getId().toString(),
                    "occurrence", occurrence.toString(),
                    "deactivated", following.isEmpty()))
            .build());

    return MaterializationOutcome.MATERIALIZED;
  }

  private RecurringTemplate findOwned(String ownerId, UUID id) {
    return templateRepository
        .findByIdAndOwnerId(id, ownerId)
        .orElseThrow(() -> new ResourceNotFoundException("Recurring template", id));
  }

  private NewLedgerEntry entryFor(RecurringTemplate template, Instant date) {
    String description =
        template.getDescription() != null
            ? template.getDescription()
            : "Recurring: " + template.getCategory().getLabel();
    return new NewLedgerEntry(
        template.getOwnerId(),
        template.getType(),
        template.getAmount(),
        template.getCategory(),
        description,
        date,
        true,
        template.getId());
  }

  private void validateAmount(BigDecimal amount) {
    if (amount.compareTo(properties.maxAmount()) > 0) {
      throw new InvalidStateException(
          "Invalid amount", "Amount cannot exceed " + properties.maxAmount().toPlainString());
    }
  }

  private static void validateCadence(
      Frequency frequency,
      Instant startDate,
      Instant endDate,
      Integer dayOfMonth,
      Integer dayOfWeek,
      Integer month) {
    if (endDate != null && !endDate.isAfter(startDate)) {
      throw new InvalidStateException("Invalid end date", "End date must be after start date");
    }
    switch (frequency) {
      case DAILY -> {}
      case WEEKLY -> {
        if (dayOfWeek == null) {
          throw new InvalidStateException(
              "Missing day of week", "Day of week is required for weekly recurrence");
        }
      }
      case MONTHLY -> {
        if (dayOfMonth == null) {
          throw new InvalidStateException(
              "Missing day of month", "Day of month is required for monthly recurrence");
        }
      }
      case YEARLY -> {
        if (month == null) {
          throw new InvalidStateException(
              "Missing month", "Month is required for yearly recurrence");
        }
      }
    }
  }

  private static InvalidStateException noOccurrences() {
    return new InvalidStateException(
        "No valid occurrences", "The schedule has no occurrence before its end date");
  }

  private static <T> T coalesce(T value, T fallback) {
    return value != null ? value : fallback;
  }

  private static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  private RecurringTemplateResponse buildResponse(RecurringTemplate template) {
    return new RecurringTemplateResponse(
        template.getId(),
        template.getType(),
        template.getAmount(),
        template.getCategory(),
        template.getCategory().getLabel(),
        template.getDescription(),
        template.getFrequency(),
        template.getStartDate(),
        template.getEndDate(),
        template.getDayOfMonth(),
        template.getDayOfWeek(),
        template.getMonth(),
        template.isActive(),
        template.getLastProcessed(),
        template.getNextOccurrence(),
        template.getCreatedAt(),
        template.getUpdatedAt());
  }
}
