package io.spendwise.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.spendwise.ledger.testutil.TestClockConfiguration;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.UUID;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@Import({TestcontainersConfiguration.class, TestClockConfiguration.class})
@ActiveProfiles("test")
class LedgerSchemaTest {

  @Autowired private Flyway flyway;
  @Autowired private JdbcTemplate jdbcTemplate;

  @Test
  void migrations_areAppliedAndCurrent() {
    var info = flyway.info();

    assertThat(info.pending()).isEmpty();
    assertThat(info.applied())
        .extracting(migration -> migration.getVersion().getVersion())
        .contains("1");
  }

  @Test
  void ledgerEntries_rejectSecondRowForSameTemplateAndDate() {
    UUID templateId = UUID.randomUUID();
    Timestamp entryDate = Timestamp.from(Instant.parse("2024-03-05T00:00:00Z"));
    insertRecurringEntry(templateId, entryDate);

    assertThatThrownBy(() -> insertRecurringEntry(templateId, entryDate))
        .isInstanceOf(DuplicateKeyException.class)
        .hasMessageContaining("uq_ledger_entries_template_date");
  }

  private void insertRecurringEntry(UUID templateId, Timestamp entryDate) {
    jdbcTemplate.update(
        """
        INSERT INTO ledger_entries (id, owner_id, entry_type, amount, category, entry_date,
            from_recurring, recurring_template_id, created_at)
        VALUES (?, 'user_schema', 'EXPENSE', 60.00, 'UTILITIES', ?, TRUE, ?, now())
        """,
        UUID.randomUUID(),
        entryDate,
        templateId);
  }
}
