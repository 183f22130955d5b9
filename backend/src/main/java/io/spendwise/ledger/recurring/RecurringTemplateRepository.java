package io.spendwise.ledger.recurring;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RecurringTemplateRepository extends JpaRepository<RecurringTemplate, UUID> {
  List<RecurringTemplate>
      findByActiveTrueAndNextOccurrenceLessThanEqualOrderByNextOccurrenceAscIdAsc(Instant now);

  Optional<RecurringTemplate> findByIdAndOwnerId(UUID id, String ownerId);

  List<RecurringTemplate> findByOwnerIdOrderByNextOccurrenceAsc(String ownerId);

  List<RecurringTemplate> findByOwnerIdAndActiveOrderByNextOccurrenceAsc(
      String ownerId, boolean active);
}
