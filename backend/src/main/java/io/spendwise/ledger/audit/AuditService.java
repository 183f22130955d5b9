package io.spendwise.ledger.audit;

import java.util.List;
import java.util.UUID;

/** Records and reads back the audit trail of ledger and template changes. */
public interface AuditService {

  /**
   * Records a single audit event within the current transaction. If the enclosing transaction rolls
   * back, the audit event is rolled back with it.
   *
   * @param record the audit event data to persist
   */
  void log(AuditEventRecord record);

  /** Returns the events recorded for one entity, oldest first. */
  List<AuditEvent> findEntityHistory(String entityType, UUID entityId);
}
