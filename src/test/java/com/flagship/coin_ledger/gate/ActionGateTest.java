package com.flagship.coin_ledger.gate;

import com.flagship.coin_ledger.TestFixtures;
import com.flagship.coin_ledger.account.AccountService;
import com.flagship.coin_ledger.exception.DomainEffectFailedException;
import com.flagship.coin_ledger.exception.InsufficientBalanceException;
import com.flagship.coin_ledger.exception.InvalidTargetException;
import com.flagship.coin_ledger.exception.NotEligibleException;
import com.flagship.coin_ledger.ledger.LedgerEntry;
import com.flagship.coin_ledger.ledger.LedgerReason;
import com.flagship.coin_ledger.ledger.LedgerStore;
import com.flagship.coin_ledger.outbox.OutboxService;
import com.flagship.coin_ledger.subject.ModeratedSubject;
import com.flagship.coin_ledger.subject.SubjectKind;
import com.flagship.coin_ledger.subject.SubjectPersistenceService;
import com.flagship.coin_ledger.subject.SubjectStatus;
import com.flagship.coin_ledger.subject.event.SubjectSubmittedEvent;
import com.flagship.coin_ledger.workflow.ApprovalWorkflow;
import com.flagship.coin_ledger.workflow.CoinAdjustmentService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Coin-gated actions: the debit and the subject it pays for are created together or not at all.
 *
 * Settings for this suite: cost-post = 2, cost-connect = 2.
 */
@SpringBootTest
class ActionGateTest {

    @Autowired
    private ActionGate actionGate;

    @Autowired
    private CoinActionService coinActionService;

    @Autowired
    private ApprovalWorkflow approvalWorkflow;

    @Autowired
    private SubjectPersistenceService subjectPersistence;

    @Autowired
    private LedgerStore ledgerStore;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private CoinAdjustmentService coinAdjustmentService;

    private TestFixtures fixtures;
    private UUID adminId;

    @BeforeEach
    void setUp() {
        fixtures = new TestFixtures(accountService, approvalWorkflow, coinAdjustmentService);
        adminId = fixtures.createAdmin();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private int historySize(UUID accountId) {
        return ledgerStore.history(accountId, null, 200).getEntries().size();
    }

    @Test
    @DisplayName("Scenario A: post debits 2 coins, rejection refunds them")
    void testPostDebitThenRefundOnReject() {
        printTestHeader("Scenario A: Post Debit Then Refund");

        // Given: an approved user with 5 coins
        UUID userId = fixtures.createApprovedUser(adminId, 5);
        printInput("Balance", ledgerStore.balanceOf(userId));

        // When: creating a post
        ModeratedSubject post = coinActionService.createPost(userId, "Looking for a partner", "Hello", null);

        // Then: 2 coins are debited and the post waits for moderation
        printOutput("Post", post.getId() + " " + post.getStatus());
        assertEquals(SubjectStatus.PENDING, post.getStatus());
        assertEquals(2L, post.getCoinCost());
        assertEquals(3L, ledgerStore.balanceOf(userId));

        List<LedgerEntry> debit = ledgerStore.entriesForReference("POST", post.getId());
        assertEquals(1, debit.size());
        assertEquals(-2L, debit.get(0).getDelta());
        assertEquals(LedgerReason.POST, debit.get(0).getReason());

        // When: the admin rejects it
        ModeratedSubject rejected = approvalWorkflow.decide(post.getId(), SubjectStatus.REJECTED, adminId, "spam");

        // Then: the coins come back exactly once
        assertEquals(SubjectStatus.REJECTED, rejected.getStatus());
        assertTrue(rejected.isRefundApplied());
        assertEquals(5L, ledgerStore.balanceOf(userId));
        assertEquals(2, ledgerStore.entriesForReference("POST", post.getId()).size());

        printSuccess("Balance 5 -> 3 -> 5, refundApplied = true");
    }

    @Test
    @DisplayName("Scenario B: a connection request without enough coins creates nothing")
    void testInsufficientBalance() {
        printTestHeader("Scenario B: Insufficient Balance");

        UUID userId = fixtures.createApprovedUser(adminId, 1);
        UUID targetId = fixtures.createApprovedUser(adminId, 0);

        InsufficientBalanceException e = assertThrows(InsufficientBalanceException.class,
            () -> coinActionService.requestConnection(userId, targetId, null, null));

        printOutput("Exception", e.getMessage());
        assertEquals(1L, e.getBalance());
        assertEquals(2L, e.getRequired());
        assertEquals(1L, ledgerStore.balanceOf(userId));
        assertTrue(subjectPersistence.findOwned(userId, SubjectKind.CONNECTION_REQUEST).isEmpty());

        printSuccess("No debit, no subject");
    }

    @Test
    @DisplayName("Scenario C: two concurrent posts on 3 coins, exactly one succeeds")
    void testConcurrentAttemptsSerializePerAccount() throws InterruptedException {
        printTestHeader("Scenario C: Concurrent Attempts");

        UUID userId = fixtures.createApprovedUser(adminId, 3);

        int threads = 2;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger successes = new AtomicInteger();
        List<Throwable> failures = Collections.synchronizedList(new ArrayList<>());

        for (int i = 0; i < threads; i++) {
            int n = i;
            executor.submit(() -> {
                try {
                    start.await();
                    coinActionService.createPost(userId, "Post " + n, "body", null);
                    successes.incrementAndGet();
                } catch (Throwable t) {
                    failures.add(t);
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        printOutput("Successes", successes.get());
        printOutput("Failures", failures);
        assertEquals(1, successes.get());
        assertEquals(1, failures.size());
        assertInstanceOf(InsufficientBalanceException.class, failures.get(0));
        assertEquals(1L, ledgerStore.balanceOf(userId));
        assertEquals(1, subjectPersistence.findOwned(userId, SubjectKind.POST).size());
        assertTrue(ledgerStore.reconcile(userId).isConsistent());

        printSuccess("One post, balance 1");
    }

    @Test
    @DisplayName("Posting requires an approved profile")
    void testPendingProfileNotEligible() {
        printTestHeader("Pending Profile Not Eligible");

        UUID userId = fixtures.createPendingUser();
        coinAdjustmentService.adjust(adminId, userId, 10, "seed");

        assertThrows(NotEligibleException.class,
            () -> coinActionService.createPost(userId, "Hi", "there", null));
        assertEquals(10L, ledgerStore.balanceOf(userId));

        // Rejected profiles are not eligible either
        approvalWorkflow.decide(userId, SubjectStatus.REJECTED, adminId, "incomplete");
        assertThrows(NotEligibleException.class,
            () -> coinActionService.createPost(userId, "Hi", "there", null));

        printSuccess("NotEligible for PENDING and REJECTED profiles");
    }

    @Test
    @DisplayName("A failing domain effect rolls back the debit and the subject row")
    void testDomainEffectFailureRollsBackDebit() {
        printTestHeader("Domain Effect Failure Rolls Back");

        UUID userId = fixtures.createApprovedUser(adminId, 5);
        int entriesBefore = historySize(userId);
        AtomicReference<UUID> attemptedId = new AtomicReference<>();

        // When: the effect inserts the subject and then fails
        DomainEffectFailedException e = assertThrows(DomainEffectFailedException.class,
            () -> actionGate.attempt(userId, ActionKind.POST, 2, subjectId -> {
                attemptedId.set(subjectId);
                subjectPersistence.insert(ModeratedSubject.post(subjectId, userId, 2, "t", "b"), null);
                throw new IllegalStateException("search index unavailable");
            }));

        // Then: nothing of the unit is left behind
        printOutput("Exception", e.getMessage());
        assertEquals(5L, ledgerStore.balanceOf(userId));
        assertEquals(entriesBefore, historySize(userId));
        assertTrue(subjectPersistence.findById(attemptedId.get()).isEmpty());
        assertTrue(ledgerStore.entriesForReference("POST", attemptedId.get()).isEmpty());
        assertTrue(outboxService.getEventsForAggregate(OutboxService.AGGREGATE_SUBJECT, attemptedId.get()).isEmpty());

        printSuccess("Balance, history, subject and outbox unchanged");
    }

    @Test
    @DisplayName("An effect that returns a different subject is treated as a failure")
    void testEffectMustCreateThePreallocatedSubject() {
        printTestHeader("Effect Must Create Preallocated Subject");

        UUID userId = fixtures.createApprovedUser(adminId, 5);

        assertThrows(DomainEffectFailedException.class,
            () -> actionGate.attempt(userId, ActionKind.POST, 2,
                subjectId -> ModeratedSubject.post(UUID.randomUUID(), userId, 2, "t", "b")));
        assertEquals(5L, ledgerStore.balanceOf(userId));

        printSuccess("Mismatched id rejected");
    }

    @Test
    @DisplayName("Submission writes a SubjectSubmitted event to the outbox")
    void testSubmissionEventInOutbox() {
        printTestHeader("Submission Event In Outbox");

        UUID userId = fixtures.createApprovedUser(adminId, 5);
        ModeratedSubject post = coinActionService.createPost(userId, "Hi", "there", null);

        var events = outboxService.getEventsForAggregate(OutboxService.AGGREGATE_SUBJECT, post.getId());
        assertEquals(1, events.size());
        assertEquals(SubjectSubmittedEvent.EVENT_TYPE, events.get(0).getEventType());
        assertTrue(events.get(0).getPayload().contains(post.getId().toString()));

        printSuccess("Outbox holds the submission");
    }

    @Test
    @DisplayName("Connection requests to yourself or to unknown accounts are invalid targets")
    void testInvalidConnectionTargets() {
        printTestHeader("Invalid Connection Targets");

        UUID userId = fixtures.createApprovedUser(adminId, 10);

        assertThrows(InvalidTargetException.class,
            () -> coinActionService.requestConnection(userId, userId, null, null));
        assertThrows(InvalidTargetException.class,
            () -> coinActionService.requestConnection(userId, UUID.randomUUID(), null, null));
        assertEquals(10L, ledgerStore.balanceOf(userId));

        printSuccess("InvalidTarget, no coins spent");
    }

    @Test
    @DisplayName("The related post of a connection request must belong to the target")
    void testRelatedPostMustBelongToTarget() {
        printTestHeader("Related Post Must Belong To Target");

        UUID userId = fixtures.createApprovedUser(adminId, 10);
        UUID targetId = fixtures.createApprovedUser(adminId, 10);
        UUID otherId = fixtures.createApprovedUser(adminId, 10);
        ModeratedSubject othersPost = coinActionService.createPost(otherId, "Other", "post", null);
        ModeratedSubject targetsPost = coinActionService.createPost(targetId, "Target", "post", null);

        assertThrows(InvalidTargetException.class,
            () -> coinActionService.requestConnection(userId, targetId, othersPost.getId(), null));

        ModeratedSubject request = coinActionService.requestConnection(userId, targetId, targetsPost.getId(), null);
        assertEquals(targetsPost.getId(), request.getRelatedPostId());
        assertEquals(8L, ledgerStore.balanceOf(userId));

        printSuccess("Only the target's own post is accepted");
    }

    @Test
    @DisplayName("A second open request to the same target fails and its debit is rolled back")
    void testDuplicateOpenConnectionRequest() {
        printTestHeader("Duplicate Open Connection Request");

        UUID userId = fixtures.createApprovedUser(adminId, 10);
        UUID targetId = fixtures.createApprovedUser(adminId, 0);

        coinActionService.requestConnection(userId, targetId, null, null);
        assertEquals(8L, ledgerStore.balanceOf(userId));

        assertThrows(DomainEffectFailedException.class,
            () -> coinActionService.requestConnection(userId, targetId, null, null));
        assertEquals(8L, ledgerStore.balanceOf(userId), "Second debit rolled back");
        assertEquals(1, subjectPersistence.findOwned(userId, SubjectKind.CONNECTION_REQUEST).size());

        printSuccess("One request, one debit");
    }

    @Test
    @DisplayName("Repeating an Idempotency-Key returns the same post and charges once")
    void testIdempotencyKeyChargesOnce() {
        printTestHeader("Idempotency Key Charges Once");

        UUID userId = fixtures.createApprovedUser(adminId, 5);
        String key = "post-" + UUID.randomUUID();

        ModeratedSubject first = coinActionService.createPost(userId, "Hi", "there", key);
        ModeratedSubject second = coinActionService.createPost(userId, "Hi", "there", key);

        printOutput("First", first.getId());
        printOutput("Second", second.getId());
        assertEquals(first.getId(), second.getId());
        assertEquals(3L, ledgerStore.balanceOf(userId));
        assertEquals(1, subjectPersistence.findOwned(userId, SubjectKind.POST).size());

        // Another account cannot reuse the key
        UUID otherId = fixtures.createApprovedUser(adminId, 5);
        assertThrows(DomainEffectFailedException.class,
            () -> coinActionService.createPost(otherId, "Hi", "there", key));
        assertEquals(5L, ledgerStore.balanceOf(otherId));

        printSuccess("Same subject, single debit");
    }

    @Test
    @DisplayName("Two concurrent requests with one Idempotency-Key both get the same post")
    void testConcurrentIdempotencyKeyReplays() throws InterruptedException {
        printTestHeader("Concurrent Idempotency Key Replays");

        UUID userId = fixtures.createApprovedUser(adminId, 5);
        String key = "race-" + UUID.randomUUID();

        int threads = 2;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        List<UUID> ids = Collections.synchronizedList(new ArrayList<>());
        List<Throwable> failures = Collections.synchronizedList(new ArrayList<>());

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    ids.add(coinActionService.createPost(userId, "Hi", "there", key).getId());
                } catch (Throwable t) {
                    failures.add(t);
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        printOutput("Ids", ids);
        printOutput("Failures", failures);
        assertTrue(failures.isEmpty(), "The later request replays instead of failing");
        assertEquals(2, ids.size());
        assertEquals(ids.get(0), ids.get(1));
        assertEquals(3L, ledgerStore.balanceOf(userId));
        assertEquals(1, subjectPersistence.findOwned(userId, SubjectKind.POST).size());

        printSuccess("One post, one debit, both callers see it");
    }

    @Test
    @DisplayName("Top-up requests are free and allowed before profile approval")
    void testTopupIsFree() {
        printTestHeader("Top-up Is Free");

        UUID userId = fixtures.createPendingUser();

        ModeratedSubject topup = coinActionService.requestTopup(userId, new BigDecimal("50.00"), "slips/a.jpg", null);

        assertEquals(SubjectKind.TOPUP_REQUEST, topup.getKind());
        assertEquals(SubjectStatus.PENDING, topup.getStatus());
        assertEquals(0L, topup.getCoinCost());
        assertEquals(0, new BigDecimal("10.00").compareTo(topup.getPricePerCoin()));
        assertEquals(0L, ledgerStore.balanceOf(userId));
        assertEquals(0, historySize(userId));

        assertThrows(IllegalArgumentException.class,
            () -> coinActionService.requestTopup(userId, BigDecimal.ZERO, "slips/b.jpg", null));

        printSuccess("No ledger entry for a top-up request");
    }
}
