package com.flagship.treasury_ledger.ledger;

import com.flagship.treasury_ledger.ledger.dto.AllocationResponse;
import com.flagship.treasury_ledger.ledger.dto.CreateTransactionRequest;
import com.flagship.treasury_ledger.ledger.dto.RecordTransactionResponse;
import com.flagship.treasury_ledger.ledger.dto.TransactionPageResponse;
import com.flagship.treasury_ledger.ledger.dto.TransactionResponse;
import com.flagship.treasury_ledger.ledger.dto.UpdateStatusRequest;
import com.flagship.treasury_ledger.security.AccessGate;
import com.flagship.treasury_ledger.security.AuthenticatedPrincipal;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
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

import java.time.Instant;
import java.util.UUID;

/**
 * Ledger HTTP API.
 *
 * {@code POST /transactions} accepts an optional {@code Idempotency-Key};
 * a repeated key returns the original transaction with 200 instead of 201.
 * Status transitions and allocation retries need a guardian token.
 */
@RestController
@RequestMapping("/transactions")
@RequiredArgsConstructor
@Slf4j
public class TransactionController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final TransactionRecorder recorder;
    private final LedgerService ledgerService;
    private final AccessGate accessGate;

    @PostMapping
    public ResponseEntity<RecordTransactionResponse> createTransaction(
            @Valid @RequestBody CreateTransactionRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Received {} transaction request: amount={}, idempotencyKey={}",
                request.getType(), request.getAmount(), idempotencyKey);

        RecordTransactionCommand command = RecordTransactionCommand.builder()
            .type(request.getType())
            .status(request.getStatus())
            .amount(request.getAmount())
            .fromAccountId(request.getFromAccountId())
            .toAccountId(request.getToAccountId())
            .parentTransactionId(request.getParentTransactionId())
            .externalReference(request.getExternalReference())
            .metadata(request.getMetadata())
            .performedBy(request.getPerformedBy())
            .idempotencyKey(idempotencyKey == null || idempotencyKey.isBlank() ? null : idempotencyKey)
            .build();

        RecordedTransaction recorded = recorder.record(command);
        HttpStatus status = recorded.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(RecordTransactionResponse.from(recorded));
    }

    @GetMapping
    public ResponseEntity<TransactionPageResponse> listTransactions(
            @RequestParam(name = "type", required = false) TransactionType type,
            @RequestParam(name = "status", required = false) TransactionStatus status,
            @RequestParam(name = "account_id", required = false) UUID accountId,
            @RequestParam(name = "parent_id", required = false) UUID parentId,
            @RequestParam(name = "from", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(name = "to", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(name = "limit", defaultValue = "" + LedgerService.DEFAULT_PAGE_SIZE) int limit,
            @RequestParam(name = "offset", defaultValue = "0") int offset) {

        TransactionFilter filter = TransactionFilter.builder()
            .type(type)
            .status(status)
            .accountId(accountId)
            .parentTransactionId(parentId)
            .createdFrom(from)
            .createdTo(to)
            .build();
        return ResponseEntity.ok(TransactionPageResponse.from(ledgerService.listTransactions(filter, limit, offset)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<TransactionResponse> getTransaction(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(TransactionResponse.from(ledgerService.getTransaction(id)));
    }

    @GetMapping("/{id}/allocations")
    public ResponseEntity<AllocationResponse> getAllocations(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(AllocationResponse.from(ledgerService.getAllocations(id)));
    }

    @PostMapping("/{id}/status")
    public ResponseEntity<RecordTransactionResponse> updateStatus(
            @PathVariable("id") UUID id,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody UpdateStatusRequest request) {
        AuthenticatedPrincipal guardian = accessGate.requireGuardian(authorization);
        RecordedTransaction updated = recorder.updateStatus(id, request.getStatus(), guardian.getSubject());
        return ResponseEntity.ok(RecordTransactionResponse.from(updated));
    }

    /**
     * Administrative retry for a deposit that was left unallocated.
     */
    @PostMapping("/{id}/allocations")
    public ResponseEntity<AllocationResponse> retryAllocation(
            @PathVariable("id") UUID id,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        AuthenticatedPrincipal guardian = accessGate.requireGuardian(authorization);
        AllocationResult result = recorder.allocateDeposit(id, guardian.getSubject());
        HttpStatus status = result.getStatus() == AllocationResult.Status.ALLOCATED ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(AllocationResponse.from(result));
    }
}
