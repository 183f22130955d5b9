package io.spendwise.ledger.recurring;

import io.spendwise.ledger.audit.AuditEventResponse;
import io.spendwise.ledger.entry.dto.LedgerEntryResponse;
import io.spendwise.ledger.recurring.dto.CreateRecurringTemplateRequest;
import io.spendwise.ledger.recurring.dto.RecurringTemplateResponse;
import io.spendwise.ledger.recurring.dto.UpdateRecurringTemplateRequest;
import io.spendwise.ledger.security.CurrentUser;
import jakarta.validation.Valid;
import java.net.URI;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/recurring-templates")
public class RecurringTemplateController {

  private final RecurringTemplateService templateService;
  private final RecurringTemplateExecutor executor;
  private final Clock clock;

  public RecurringTemplateController(
      RecurringTemplateService templateService, RecurringTemplateExecutor executor, Clock clock) {
    this.templateService = templateService;
    this.executor = executor;
    this.clock = clock;
  }

  @GetMapping
  @PreAuthorize("hasAnyRole('USER', 'ADMIN')")
  public ResponseEntity<List<RecurringTemplateResponse>> listTemplates(
      @RequestParam(required = false) String status) {
    return ResponseEntity.ok(templateService.list(CurrentUser.requireUserId(), status));
  }

  @GetMapping("/{id}")
  @PreAuthorize("hasAnyRole('USER', 'ADMIN')")
  public ResponseEntity<RecurringTemplateResponse> getTemplate(@PathVariable UUID id) {
    return ResponseEntity.ok(templateService.get(CurrentUser.requireUserId(), id));
  }

  @PostMapping
  @PreAuthorize("hasAnyRole('USER', 'ADMIN')")
  public ResponseEntity<RecurringTemplateResponse> createTemplate(
      @Valid @RequestBody CreateRecurringTemplateRequest request) {
    var response = templateService.create(CurrentUser.requireUserId(), request);
    return ResponseEntity.created(URI.create("/api/recurring-templates/" + response.id()))
        .body(response);
  }

  @PutMapping("/{id}")
  @PreAuthorize("hasAnyRole('USER', 'ADMIN')")
  public ResponseEntity<RecurringTemplateResponse> updateTemplate(
      @PathVariable UUID id, @Valid @RequestBody UpdateRecurringTemplateRequest request) {
    return ResponseEntity.ok(templateService.update(CurrentUser.requireUserId(), id, request));
  }

  @PatchMapping("/{id}/toggle-active")
  @PreAuthorize("hasAnyRole('USER', 'ADMIN')")
  public ResponseEntity<RecurringTemplateResponse> toggleActive(@PathVariable UUID id) {
    return ResponseEntity.ok(templateService.toggleActive(CurrentUser.requireUserId(), id));
  }

  @DeleteMapping("/{id}")
  @PreAuthorize("hasAnyRole('USER', 'ADMIN')")
  public ResponseEntity<Void> deleteTemplate(@PathVariable UUID id) {
    templateService.delete(CurrentUser.requireUserId(), id);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/{id}/entries")
  @PreAuthorize("hasAnyRole('USER', 'ADMIN')")
  public ResponseEntity<List<LedgerEntryResponse>> listEntries(@PathVariable UUID id) {
    return ResponseEntity.ok(templateService.listEntries(CurrentUser.requireUserId(), id));
  }

  @GetMapping("/{id}/history")
  @PreAuthorize("hasAnyRole('USER', 'ADMIN')")
  public ResponseEntity<List<AuditEventResponse>> history(@PathVariable UUID id) {
    return ResponseEntity.ok(templateService.history(CurrentUser.requireUserId(), id));
  }

  /** Runs a processing cycle immediately, across all users. Safe alongside the daily trigger. */
  @PostMapping("/process")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<ProcessingResult> processDue() {
    return ResponseEntity.ok(executor.processDue(clock.instant()));
  }
}
