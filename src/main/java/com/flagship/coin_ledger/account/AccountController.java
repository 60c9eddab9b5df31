package com.flagship.coin_ledger.account;

import com.flagship.coin_ledger.account.dto.AccountResponse;
import com.flagship.coin_ledger.account.dto.CreateAccountRequest;
import com.flagship.coin_ledger.account.dto.ProfileRequest;
import com.flagship.coin_ledger.exception.NotAdminException;
import com.flagship.coin_ledger.exception.SubjectNotFoundException;
import com.flagship.coin_ledger.ledger.LedgerStore;
import com.flagship.coin_ledger.subject.ModeratedSubject;
import com.flagship.coin_ledger.subject.SubjectPersistenceService;
import com.flagship.coin_ledger.subject.dto.SubjectResponse;
import com.flagship.coin_ledger.workflow.ApprovalWorkflow;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Account registration and the caller's own profile.
 *
 * Registration also submits the initial profile for moderation; the account cannot
 * post or connect until an admin approves it.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    private final AccountService accountService;
    private final SubjectPersistenceService subjectPersistence;
    private final ApprovalWorkflow approvalWorkflow;
    private final LedgerStore ledgerStore;

    @PostMapping("/api/accounts")
    public ResponseEntity<AccountResponse> createAccount(
            @Valid @RequestBody CreateAccountRequest request,
            @RequestHeader(value = Actor.HEADER, required = false) UUID actorId) {

        AccountRole role = request.getRole() != null ? request.getRole() : AccountRole.USER;
        if (role == AccountRole.ADMIN) {
            if (actorId == null) {
                throw new NotAdminException(null);
            }
            accountService.requireAdmin(actorId);
        }

        Account account = accountService.createAccount(request.getUsername(), role, request.getDisplayName());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(AccountResponse.from(account, 0L, profileOf(account.getId()).getStatus()));
    }

    @GetMapping("/api/me")
    public ResponseEntity<AccountResponse> me(@RequestHeader(Actor.HEADER) UUID actorId) {
        Account account = accountService.requireAccount(actorId);
        return ResponseEntity.ok(AccountResponse.from(
            account, ledgerStore.balanceOf(actorId), profileOf(actorId).getStatus()));
    }

    @GetMapping("/api/me/profile")
    public ResponseEntity<SubjectResponse> profile(@RequestHeader(Actor.HEADER) UUID actorId) {
        return ResponseEntity.ok(SubjectResponse.from(profileOf(actorId)));
    }

    /**
     * Any edit sends the profile back to moderation.
     */
    @PutMapping("/api/me/profile")
    public ResponseEntity<SubjectResponse> updateProfile(@RequestHeader(Actor.HEADER) UUID actorId,
                                                         @Valid @RequestBody ProfileRequest request) {
        accountService.requireAccount(actorId);
        ModeratedSubject profile = approvalWorkflow.resubmitProfile(actorId, request.getDisplayName(), request.getBio());
        return ResponseEntity.ok(SubjectResponse.from(profile));
    }

    private ModeratedSubject profileOf(UUID accountId) {
        return subjectPersistence.findById(accountId)
            .orElseThrow(() -> new SubjectNotFoundException(accountId));
    }
}
