package com.flagship.treasury_ledger.treasury;

import com.flagship.treasury_ledger.ledger.AccountService;
import com.flagship.treasury_ledger.ledger.LogicalAccount;
import com.flagship.treasury_ledger.security.AccessGate;
import com.flagship.treasury_ledger.security.AuthenticatedPrincipal;
import com.flagship.treasury_ledger.treasury.dto.AccountResponse;
import com.flagship.treasury_ledger.treasury.dto.CreateAccountRequest;
import com.flagship.treasury_ledger.treasury.dto.TreasuryStatusResponse;
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
public class TreasuryController {

    private final TreasuryStatusService statusService;
    private final AccountService accountService;
    private final AccessGate accessGate;

    @GetMapping("/status")
    public ResponseEntity<TreasuryStatusResponse> status() {
        return ResponseEntity.ok(TreasuryStatusResponse.from(statusService.currentStatus()));
    }

    @GetMapping("/accounts")
    public ResponseEntity<List<AccountResponse>> listAccounts(
            @RequestParam(name = "include_inactive", defaultValue = "false") boolean includeInactive) {
        return ResponseEntity.ok(accountService.listAccounts(includeInactive).stream()
                .map(AccountResponse::from)
                .toList());
    }

    @GetMapping("/accounts/{id}")
    public ResponseEntity<AccountResponse> getAccount(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(AccountResponse.from(accountService.getAccount(id)));
    }

    @PostMapping("/accounts")
    public ResponseEntity<AccountResponse> createAccount(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody CreateAccountRequest request) {
        AuthenticatedPrincipal guardian = accessGate.requireGuardian(authorization);
        LogicalAccount account = accountService.createAccount(
            request.getAccountName(), request.getAccountType(), request.getDescription(), guardian.getSubject());
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }
}
