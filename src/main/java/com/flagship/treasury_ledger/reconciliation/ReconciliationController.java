package com.flagship.treasury_ledger.reconciliation;

import com.flagship.treasury_ledger.exception.NotFoundException;
import com.flagship.treasury_ledger.reconciliation.dto.ReconcileRequest;
import com.flagship.treasury_ledger.reconciliation.dto.ReconciliationResponse;
import com.flagship.treasury_ledger.reconciliation.dto.ResolveRequest;
import com.flagship.treasury_ledger.security.AccessGate;
import com.flagship.treasury_ledger.security.AuthenticatedPrincipal;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/treasury")
@RequiredArgsConstructor
public class ReconciliationController {

    private final ReconciliationService reconciliationService;
    private final AccessGate accessGate;

    @PostMapping("/reconcile")
    public ResponseEntity<ReconciliationResponse> reconcile(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody ReconcileRequest request) {
        AuthenticatedPrincipal guardian = accessGate.requireGuardian(authorization);
        ReconciliationRecord record = reconciliationService.reconcile(
            request.getExternalBalance(), request.getSource(), request.getNotes(), guardian.getSubject());
        return ResponseEntity.status(HttpStatus.CREATED).body(ReconciliationResponse.from(record));
    }

    @GetMapping("/reconciliations")
    public ResponseEntity<List<ReconciliationResponse>> history(
            @RequestParam(name = "status", required = false) ReconciliationStatus status,
            @RequestParam(name = "limit", defaultValue = "50") int limit) {
        return ResponseEntity.ok(reconciliationService.history(status, limit).stream()
                .map(ReconciliationResponse::from)
                .toList());
    }

    @GetMapping("/reconciliations/latest")
    public ResponseEntity<ReconciliationResponse> latest() {
        return reconciliationService.latest()
                .map(ReconciliationResponse::from)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new NotFoundException("ReconciliationRecord", "latest"));
    }

    @GetMapping("/reconciliations/{id}")
    public ResponseEntity<ReconciliationResponse> get(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(ReconciliationResponse.from(reconciliationService.get(id)));
    }

    @PostMapping("/reconciliations/{id}/resolve")
    public ResponseEntity<ReconciliationResponse> resolve(
            @PathVariable("id") UUID id,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody ResolveRequest request) {
        AuthenticatedPrincipal guardian = accessGate.requireGuardian(authorization);
        ReconciliationRecord resolved = reconciliationService.resolve(
            id, request.getResolutionNotes(), guardian.getSubject());
        return ResponseEntity.ok(ReconciliationResponse.from(resolved));
    }
}
