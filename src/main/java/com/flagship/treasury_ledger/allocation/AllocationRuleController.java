package com.flagship.treasury_ledger.allocation;

import com.flagship.treasury_ledger.allocation.dto.CreateRuleRequest;
import com.flagship.treasury_ledger.allocation.dto.RuleResponse;
import com.flagship.treasury_ledger.security.AccessGate;
import com.flagship.treasury_ledger.security.AuthenticatedPrincipal;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
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
@RequestMapping("/allocation-rules")
@RequiredArgsConstructor
public class AllocationRuleController {

    static final int DEFAULT_PRIORITY = 100;

    private final AllocationRuleService ruleService;
    private final AccessGate accessGate;

    @GetMapping
    public ResponseEntity<List<RuleResponse>> listRules(
            @RequestParam(name = "active_only", defaultValue = "false") boolean activeOnly) {
        return ResponseEntity.ok(ruleService.listRules(activeOnly).stream().map(RuleResponse::from).toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<RuleResponse> getRule(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(RuleResponse.from(ruleService.getRule(id)));
    }

    @PostMapping
    public ResponseEntity<RuleResponse> createRule(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody CreateRuleRequest request) {
        AuthenticatedPrincipal guardian = accessGate.requireGuardian(authorization);
        AllocationRule rule = ruleService.createRule(
            request.getRuleName(),
            request.getPriority() != null ? request.getPriority() : DEFAULT_PRIORITY,
            request.getAllocations(),
            request.getMinAmount(),
            request.getMaxAmount(),
            request.getDescription(),
            guardian.getSubject());
        return ResponseEntity.status(HttpStatus.CREATED).body(RuleResponse.from(rule));
    }

    /**
     * Deactivates the rule; the row is kept for history.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<RuleResponse> deactivateRule(
            @PathVariable("id") UUID id,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        AuthenticatedPrincipal guardian = accessGate.requireGuardian(authorization);
        return ResponseEntity.ok(RuleResponse.from(ruleService.deactivateRule(id, guardian.getSubject())));
    }
}
