package io.spendwise.ledger.recurring;

import io.spendwise.ledger.entry.EntryCategory;
import io.spendwise.ledger.entry.EntryType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A persisted recurrence rule ("rent, monthly on the 5th"). It is not itself a ledger entry; the
 * batch processor materializes one entry per due occurrence and then advances {@link
 * #getNextOccurrence()}.
 *
 * <p>The {@code version} column makes a cycle commit fail instead of silently overwriting a
 * template another cycle has already advanced.
 */
@Entity
@Table(
    name = "recurring_templates",
    indexes = {
      @Index(name = "idx_recurring_templates_due", columnList = "active, next_occurrence"),
      @Index(name = "idx_recurring_templates_owner", columnList = "owner_id")
    })
public class RecurringTemplate {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "owner_id", nullable = false, length = 255)
  private String ownerId;

  @Enumerated(EnumType.STRING)
  @Column(name = "entry_type", nullable = false, length = 10)
  private EntryType type;

  @Column(name = "amount", nullable = false, precision = 12, scale = 2)
  private BigDecimal amount;

  @Enumerated(EnumType.STRING)
  @Column(name = "category", nullable = false, length = 30)
  private EntryCategory category;

  @Column(name = "description", length = 200)
  private String description;

  @Enumerated(EnumType.STRING)
  @Column(name = "frequency", nullable = false, length = 10)
  private Frequency frequency;

  @Column(name = "start_date", nullable = false)
  private Instant startDate;

  @Column(name = "end_date")
  private Instant endDate;

  @Column(name = "day_of_month")
  private Integer dayOfMonth;

  @Column(name = "day_of_week")
  private Integer dayOfWeek;

  @Column(name = "month_of_year")
  private Integer month;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "last_processed")
  private Instant lastProcessed;

  @Column(name = "next_occurrence", nullable = false)
  private Instant nextOccurrence;

  @Version
  @Column(name = "version", nullable = false)
  private Long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected RecurringTemplate() {}

  public RecurringTemplate(
      String ownerId,
      EntryType type,
      BigDecimal amount,
      EntryCategory category,
      String description,
      Frequency frequency,
      Instant startDate,
      Instant endDate,
      Integer dayOfMonth,
      Integer dayOfWeek,
      Integer month) {
    this.ownerId = ownerId;
    this.type = type;
    this.amount = amount;
    this.category = category;
    this.description = description;
    this.frequency = frequency;
    this.startDate = startDate;
    this.endDate = endDate;
    this.dayOfMonth = dayOfMonth;
    this.dayOfWeek = dayOfWeek;
    this.month = month;
    this.active = true;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /**
   * Completes one processing cycle. With a following occurrence the template moves on to it;
   * without one the template is deactivated and keeps the occurrence it last materialized.
   */
  public void completeCycle(Instant processedAt, Instant followingOccurrence) {
    this.lastProcessed = processedAt;
    if (followingOccurrence != null) {
      this.nextOccurrence = followingOccurrence;
    } else {
      this.active = false;
    }
    this.updatedAt = Instant.now();
  }

  public void scheduleNextOccurrence(Instant nextOccurrence) {
    this.nextOccurrence = nextOccurrence;
    this.updatedAt = Instant.now();
  }

  public void recordProcessed(Instant processedAt) {
    this.lastProcessed = processedAt;
    this.updatedAt = Instant.now();
  }

  public void activate() {
    this.active = true;
    this.updatedAt = Instant.now();
  }

  public void deactivate() {
    this.active = false;
    this.updatedAt = Instant.now();
  }

  public void updateDetails(
      EntryType type, BigDecimal amount, EntryCategory category, String description) {
    this.type = type;
    this.amount = amount;
    this.category = category;
    this.description = description;
    this.updatedAt = Instant.now();
  }

  /** Replaces the cadence. The caller recomputes {@code nextOccurrence} afterwards. */
  public void reschedule(
      Frequency frequency,
      Instant startDate,
      Instant endDate,
      Integer dayOfMonth,
      Integer dayOfWeek,
      Integer month) {
    this.frequency = frequency;
    this.startDate = startDate;
    this.endDate = endDate;
    this.dayOfMonth = dayOfMonth;
    this.dayOfWeek = dayOfWeek;
    this.month = month;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getOwnerId() {
    return ownerId;
  }

  public EntryType getType() {
    return type;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public EntryCategory getCategory() {
    return category;
  }

  public String getDescription() {
    return description;
  }

  public Frequency getFrequency() {
    return frequency;
  }

  public Instant getStartDate() {
    return startDate;
  }

  public Instant getEndDate() {
    return endDate;
  }

  public Integer getDayOfMonth() {
    return dayOfMonth;
  }

  public Integer getDayOfWeek() {
    return dayOfWeek;
  }

  public Integer getMonth() {
    return month;
  }

  public boolean isActive() {
    return active;
  }

  public Instant getLastProcessed() {
    return lastProcessed;
  }

  public Instant getNextOccurrence() {
    return nextOccurrence;
  }

  public Long getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
