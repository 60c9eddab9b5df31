package com.flagship.coin_ledger.workflow;

import com.flagship.coin_ledger.account.AccountService;
import com.flagship.coin_ledger.account.Actor;
import com.flagship.coin_ledger.ledger.LedgerEntry;
import com.flagship.coin_ledger.ledger.LedgerStore;
import com.flagship.coin_ledger.ledger.dto.LedgerEntryResponse;
import com.flagship.coin_ledger.subject.ModeratedSubject;
import com.flagship.coin_ledger.subject.SubjectKind;
import com.flagship.coin_ledger.subject.SubjectPersistenceService;
import com.flagship.coin_ledger.subject.SubjectStatus;
import com.flagship.coin_ledger.subject.dto.SubjectResponse;
import com.flagship.coin_ledger.workflow.dto.AdjustmentRequest;
import com.flagship.coin_ledger.workflow.dto.DecisionRequest;
import com.flagship.coin_ledger.workflow.dto.ReconciliationResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
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

import java.util.Map;
import java.util.UUID;

/**
 * Moderation and ledger administration. Every endpoint checks the caller's role
 * before doing anything else.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private final AccountService accountService;
    private final SubjectPersistenceService subjectPersistence;
    private final ApprovalWorkflow approvalWorkflow;
    private final CoinAdjustmentService coinAdjustmentService;
    private final LedgerStore ledgerStore;

    /**
     * Oldest first when filtered by status, newest first otherwise.
     */
    @GetMapping("/queues/{kind}")
    public ResponseEntity<Map<String, Object>> queue(
            @RequestHeader(Actor.HEADER) UUID adminId,
            @PathVariable("kind") SubjectKind kind,
            @RequestParam(value = "status", required = false) SubjectStatus status,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "20") int size) {

        accountService.requireAdmin(adminId);
        Page<ModeratedSubject> result = subjectPersistence.queue(kind, status, page, size);
        return ResponseEntity.ok(Map.of(
            "items", result.getContent().stream().map(SubjectResponse::from).toList(),
            "page", result.getNumber(),
            "size", result.getSize(),
            "total", result.getTotalElements()));
    }

    @PostMapping("/subjects/{id}/approve")
    public ResponseEntity<SubjectResponse> approve(@RequestHeader(Actor.HEADER) UUID adminId,
                                                   @PathVariable("id") UUID subjectId,
                                                   @Valid @RequestBody(required = false) DecisionRequest request) {
        return decide(adminId, subjectId, SubjectStatus.APPROVED, request);
    }

    @PostMapping("/subjects/{id}/reject")
    public ResponseEntity<SubjectResponse> reject(@RequestHeader(Actor.HEADER) UUID adminId,
                                                  @PathVariable("id") UUID subjectId,
                                                  @Valid @RequestBody(required = false) DecisionRequest request) {
        return decide(adminId, subjectId, SubjectStatus.REJECTED, request);
    }

    @PostMapping("/accounts/{id}/adjustments")
    public ResponseEntity<LedgerEntryResponse> adjust(@RequestHeader(Actor.HEADER) UUID adminId,
                                                      @PathVariable("id") UUID accountId,
                                                      @Valid @RequestBody AdjustmentRequest request) {
        LedgerEntry entry = coinAdjustmentService.adjust(adminId, accountId, request.getDelta(),
            request.getDescription());
        return ResponseEntity.status(HttpStatus.CREATED).body(LedgerEntryResponse.from(entry));
    }

    @GetMapping("/ledger/reconciliation")
    public ResponseEntity<ReconciliationResponse> reconcile(@RequestHeader(Actor.HEADER) UUID adminId) {
        accountService.requireAdmin(adminId);
        ReconciliationResponse response = ReconciliationResponse.from(ledgerStore.reconcileAll());
        log.info("Reconciliation requested by admin {}: consistent={}, mismatches={}",
                adminId, response.isConsistent(), response.getMismatches().size());
        return ResponseEntity.ok(response);
    }

    private ResponseEntity<SubjectResponse> decide(UUID adminId, UUID subjectId, SubjectStatus outcome,
                                                   DecisionRequest request) {
        accountService.requireAdmin(adminId);
        String note = request != null ? request.getNote() : null;
        ModeratedSubject decided = approvalWorkflow.decide(subjectId, outcome, adminId, note);
        return ResponseEntity.ok(SubjectResponse.from(decided));
    }
}
