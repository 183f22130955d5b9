package io.spendwise.ledger.entry;

import io.spendwise.ledger.audit.AuditEventBuilder;
import io.spendwise.ledger.audit.AuditService;
import io.spendwise.ledger.entry.dto.CreateLedgerEntryRequest;
import io.spendwise.ledger.entry.dto.LedgerEntryResponse;
import io.spendwise.ledger.exception.InvalidStateException;
import io.spendwise.ledger.exception.ResourceConflictException;
import io.spendwise.ledger.recurring.RecurringProcessingProperties;
import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Write and read path of the ledger itself. Recurring materialization writes through here. */
@Service
public class LedgerService {

  private static final Logger log = LoggerFactory.getLogger(LedgerService.class);

  private static final int TEMPLATE_HISTORY_LIMIT = 50;

  private final LedgerEntryRepository entryRepository;
  private final AuditService auditService;
  private final RecurringProcessingProperties properties;
  private final Clock clock;

  public LedgerService(
      LedgerEntryRepository entryRepository,
      AuditService auditService,
      RecurringProcessingProperties properties,
      Clock clock) {
    this.entryRepository = entryRepository;
    this.auditService = auditService;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Persists one entry and flushes immediately so that a duplicate (template, date) pair fails
   * inside the caller's transaction.
   *
   * @throws ResourceConflictException if the template already has an entry for that date
   * @throws DataIntegrityViolationException for any other constraint the row breaks
   */
  @Transactional
  public LedgerEntry createEntry(NewLedgerEntry newEntry) {
    LedgerEntry entry;
    try {
      entry = entryRepository.saveAndFlush(new LedgerEntry(newEntry));
    } catch (DataIntegrityViolationException ex) {
      if (newEntry.recurringTemplateId() == null) {
        throw ex;
      }
      throw new ResourceConflictException(
          "Duplicate ledger entry",
          "Template %s already has an entry dated %s"
              .formatted(newEntry.recurringTemplateId(), newEntry.date()));
    }

    log.debug(
        "Created ledger entry {} for owner {} (recurring template {})",
        entry.getId(),
        entry.getOwnerId(),
        entry.getRecurringTemplateId());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("ledger_entry.created")
            .entityType("ledger_entry")
            .entityId(entry.getId())
            .details(
                Map.of(
                    "amount", entry.getAmount().toPlainString(),
                    "category", entry.getCategory().name(),
                    "date", entry.getDate().toString(),
                    "from_recurring", entry.isFromRecurring()))
            .build());

    return entry;
  }

  @Transactional(readOnly = true)
  public boolean hasEntryFor(UUID recurringTemplateId, Instant date) {
    return entryRepository.existsByRecurringTemplateIdAndDate(recurringTemplateId, date);
  }

  @Transactional
  public LedgerEntryResponse recordManualEntry(String ownerId, CreateLedgerEntryRequest request) {
    if (request.amount().compareTo(properties.maxAmount()) > 0) {
      throw new InvalidStateException(
          "Invalid amount", "Amount cannot exceed " + properties.maxAmount().toPlainString());
    }
    Instant latestAllowed = ZonedDateTime.now(clock).plusYears(1).toInstant();
    if (request.date().isAfter(latestAllowed)) {
      throw new InvalidStateException(
          "Invalid date", "Entry date cannot be more than 1 year in the future");
    }

    var entry =
        createEntry(
            NewLedgerEntry.manual(
                ownerId,
                request.type(),
                request.amount(),
                request.category(),
                trimToNull(request.description()),
                request.date()));

    log.info("Recorded manual ledger entry {} for owner {}", entry.getId(), ownerId);
    return LedgerEntryResponse.from(entry);
  }

  /**
   * Lists an owner's entries, newest first. Entries materialized from recurring templates are left
   * out unless {@code includeRecurring} is set.
   */
  @Transactional(readOnly = true)
  public Page<LedgerEntryResponse> listEntries(
      String ownerId, boolean includeRecurring, Pageable pageable) {
    Page<LedgerEntry> page =
        includeRecurring
            ? entryRepository.findByOwnerIdOrderByDateDesc(ownerId, pageable)
            : entryRepository.findByOwnerIdAndFromRecurringFalseOrderByDateDesc(ownerId, pageable);
    return page.map(LedgerEntryResponse::from);
  }

  @Transactional(readOnly = true)
  public List<LedgerEntryResponse> listTemplateEntries(UUID templateId) {
    return entryRepository
        .findByRecurringTemplateIdOrderByDateDesc(
            templateId, PageRequest.of(0, TEMPLATE_HISTORY_LIMIT))
        .getContent()
        .stream()
        .map(LedgerEntryResponse::from)
        .toList();
  }

  private static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }
}
