package io.spendwise.ledger.entry;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, UUID> {
  Page<LedgerEntry> findByOwnerIdOrderByDateDesc(String ownerId, Pageable pageable);

  Page<LedgerEntry> findByOwnerIdAndFromRecurringFalseOrderByDateDesc(
      String ownerId, Pageable pageable);

  Page<LedgerEntry> findByRecurringTemplateIdOrderByDateDesc(
      UUID recurringTemplateId, Pageable pageable);

  List<LedgerEntry> findByRecurringTemplateIdOrderByDateAsc(UUID recurringTemplateId);

  boolean existsByRecurringTemplateIdAndDate(UUID recurringTemplateId, Instant date);
}
