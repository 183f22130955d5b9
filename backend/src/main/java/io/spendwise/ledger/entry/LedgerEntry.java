package io.spendwise.ledger.entry;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A single income or expense line in a user's ledger. Entries are immutable once written.
 *
 * <p>The (recurring_template_id, entry_date) unique constraint is the idempotency key of recurring
 * materialization: a template yields at most one entry per occurrence. Manual entries carry no
 * template id and are not constrained.
 */
@Entity
@Table(
    name = "ledger_entries",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uq_ledger_entries_template_date",
            columnNames = {"recurring_template_id", "entry_date"}),
    indexes = @Index(name = "idx_ledger_entries_owner_date", columnList = "owner_id, entry_date"))
public class LedgerEntry {

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

  @Column(name = "entry_date", nullable = false)
  private Instant date;

  @Column(name = "from_recurring", nullable = false)
  private boolean fromRecurring;

  // Not a foreign key: entries outlive the template they were materialized from
  @Column(name = "recurring_template_id")
  private UUID recurringTemplateId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected LedgerEntry() {}

  public LedgerEntry(NewLedgerEntry newEntry) {
    this.ownerId = newEntry.ownerId();
    this.type = newEntry.type();
    this.amount = newEntry.amount();
    this.category = newEntry.category();
    this.description = newEntry.description();
    this.date = newEntry.date();
    this.fromRecurring = newEntry.fromRecurring();
    this.recurringTemplateId = newEntry.recurringTemplateId();
    this.createdAt = Instant.now();
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

  public Instant getDate() {
    return date;
  }

  public boolean isFromRecurring() {
    return fromRecurring;
  }

  public UUID getRecurringTemplateId() {
    return recurringTemplateId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
