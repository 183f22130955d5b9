package io.spendwise.ledger.entry;

import io.spendwise.ledger.entry.dto.CreateLedgerEntryRequest;
import io.spendwise.ledger.entry.dto.LedgerEntryResponse;
import io.spendwise.ledger.security.CurrentUser;
import jakarta.validation.Valid;
import java.net.URI;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/ledger-entries")
public class LedgerEntryController {

  private final LedgerService ledgerService;

  public LedgerEntryController(LedgerService ledgerService) {
    this.ledgerService = ledgerService;
  }

  @GetMapping
  @PreAuthorize("hasAnyRole('USER', 'ADMIN')")
  public ResponseEntity<Page<LedgerEntryResponse>> listEntries(
      @RequestParam(defaultValue = "false") boolean includeRecurring,
      @PageableDefault(size = 20) Pageable pageable) {
    return ResponseEntity.ok(
        ledgerService.listEntries(CurrentUser.requireUserId(), includeRecurring, pageable));
  }

  @PostMapping
  @PreAuthorize("hasAnyRole('USER', 'ADMIN')")
  public ResponseEntity<LedgerEntryResponse> createEntry(
      @Valid @RequestBody CreateLedgerEntryRequest request) {
    var response = ledgerService.recordManualEntry(CurrentUser.requireUserId(), request);
    return ResponseEntity.created(URI.create("/api/ledger-entries/" + response.id()))
        .body(response);
  }
}
