package com.flagship.coin_ledger.gate;

import com.flagship.coin_ledger.account.AccountService;
import com.flagship.coin_ledger.account.Actor;
import com.flagship.coin_ledger.gate.dto.ConnectionRequestBody;
import com.flagship.coin_ledger.gate.dto.CreatePostRequest;
import com.flagship.coin_ledger.gate.dto.RespondRequest;
import com.flagship.coin_ledger.gate.dto.TopupRequestBody;
import com.flagship.coin_ledger.subject.ModeratedSubject;
import com.flagship.coin_ledger.subject.SubjectKind;
import com.flagship.coin_ledger.subject.SubjectPersistenceService;
import com.flagship.coin_ledger.subject.SubjectStatus;
import com.flagship.coin_ledger.subject.dto.SubjectResponse;
import com.flagship.coin_ledger.workflow.ApprovalWorkflow;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
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

/**
 * User endpoints for posts, connection requests and top-ups.
 *
 * The three create endpoints accept an optional Idempotency-Key header; repeating a key
 * returns the subject created by the first call and charges nothing.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class SubjectController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final CoinActionService coinActionService;
    private final ApprovalWorkflow approvalWorkflow;
    private final SubjectPersistenceService subjectPersistence;
    private final AccountService accountService;

    @PostMapping("/posts")
    public ResponseEntity<SubjectResponse> createPost(
            @RequestHeader(Actor.HEADER) UUID actorId,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody CreatePostRequest request) {

        log.info("Received post request: actor={}, idempotencyKey={}", actorId, idempotencyKey);
        ModeratedSubject post = coinActionService.createPost(actorId, request.getTitle(), request.getBody(),
            idempotencyKey);
        return created(post);
    }

    @GetMapping("/posts/my")
    public ResponseEntity<List<SubjectResponse>> myPosts(@RequestHeader(Actor.HEADER) UUID actorId) {
        accountService.requireAccount(actorId);
        return ResponseEntity.ok(toResponses(subjectPersistence.findOwned(actorId, SubjectKind.POST)));
    }

    @PostMapping("/connections")
    public ResponseEntity<SubjectResponse> requestConnection(
            @RequestHeader(Actor.HEADER) UUID actorId,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody ConnectionRequestBody request) {

        log.info("Received connection request: actor={}, target={}", actorId, request.getTargetAccountId());
        ModeratedSubject connection = coinActionService.requestConnection(actorId, request.getTargetAccountId(),
            request.getRelatedPostId(), idempotencyKey);
        return created(connection);
    }

    /**
     * @param direction "sent" (default) or "received"; received only lists requests an admin approved
     */
    @GetMapping("/connections")
    public ResponseEntity<List<SubjectResponse>> connections(
            @RequestHeader(Actor.HEADER) UUID actorId,
            @RequestParam(value = "direction", defaultValue = "sent") String direction) {

        accountService.requireAccount(actorId);
        List<ModeratedSubject> subjects = switch (direction) {
            case "sent" -> subjectPersistence.findOwned(actorId, SubjectKind.CONNECTION_REQUEST);
            case "received" -> subjectPersistence.findTargeting(actorId, SubjectKind.CONNECTION_REQUEST).stream()
                .filter(subject -> subject.getStatus() == SubjectStatus.APPROVED)
                .toList();
            default -> throw new IllegalArgumentException("direction must be 'sent' or 'received'");
        };
        return ResponseEntity.ok(toResponses(subjects));
    }

    @PostMapping("/connections/{id}/cancel")
    public ResponseEntity<SubjectResponse> cancelConnection(@RequestHeader(Actor.HEADER) UUID actorId,
                                                            @PathVariable("id") UUID subjectId) {
        return ResponseEntity.ok(SubjectResponse.from(approvalWorkflow.cancel(subjectId, actorId)));
    }

    @PostMapping("/connections/{id}/respond")
    public ResponseEntity<SubjectResponse> respondToConnection(@RequestHeader(Actor.HEADER) UUID actorId,
                                                               @PathVariable("id") UUID subjectId,
                                                               @Valid @RequestBody RespondRequest request) {
        ModeratedSubject answered = approvalWorkflow.respondToConnection(subjectId, actorId, request.getAccept());
        return ResponseEntity.ok(SubjectResponse.from(answered));
    }

    @PostMapping("/topups")
    public ResponseEntity<SubjectResponse> requestTopup(
            @RequestHeader(Actor.HEADER) UUID actorId,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody TopupRequestBody request) {

        log.info("Received top-up request: actor={}, amountMvr={}", actorId, request.getAmountMvr());
        ModeratedSubject topup = coinActionService.requestTopup(actorId, request.getAmountMvr(),
            request.getSlipPath(), idempotencyKey);
        return created(topup);
    }

    @GetMapping("/topups")
    public ResponseEntity<List<SubjectResponse>> myTopups(@RequestHeader(Actor.HEADER) UUID actorId) {
        accountService.requireAccount(actorId);
        return ResponseEntity.ok(toResponses(subjectPersistence.findOwned(actorId, SubjectKind.TOPUP_REQUEST)));
    }

    private static ResponseEntity<SubjectResponse> created(ModeratedSubject subject) {
        return ResponseEntity.status(HttpStatus.CREATED).body(SubjectResponse.from(subject));
    }

    private static List<SubjectResponse> toResponses(List<ModeratedSubject> subjects) {
        return subjects.stream().map(SubjectResponse::from).toList();
    }
}
