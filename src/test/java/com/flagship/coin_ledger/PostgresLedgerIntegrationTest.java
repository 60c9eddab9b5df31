package com.flagship.coin_ledger;

import com.flagship.coin_ledger.account.AccountService;
import com.flagship.coin_ledger.exception.ActionRejectedException;
import com.flagship.coin_ledger.exception.InsufficientBalanceException;
import com.flagship.coin_ledger.gate.CoinActionService;
import com.flagship.coin_ledger.ledger.LedgerReason;
import com.flagship.coin_ledger.ledger.LedgerStore;
import com.flagship.coin_ledger.subject.ModeratedSubject;
import com.flagship.coin_ledger.subject.SubjectKind;
import com.flagship.coin_ledger.subject.SubjectPersistenceService;
import com.flagship.coin_ledger.subject.SubjectStatus;
import com.flagship.coin_ledger.workflow.ApprovalWorkflow;
import com.flagship.coin_ledger.workflow.CoinAdjustmentService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Row locking against a real PostgreSQL: many concurrent spenders on one account
 * and a reject/cancel race on one subject. Skipped when Docker is not available.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class PostgresLedgerIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("coin_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
    }

    @Autowired
    private CoinActionService coinActionService;

    @Autowired
    private ApprovalWorkflow approvalWorkflow;

    @Autowired
    private LedgerStore ledgerStore;

    @Autowired
    private SubjectPersistenceService subjectPersistence;

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

    @Test
    @DisplayName("Ten concurrent posts on 7 coins: exactly three succeed and the balance never goes negative")
    void testConcurrentSpendersNeverOverdraw() throws InterruptedException {
        UUID userId = fixtures.createApprovedUser(adminId, 7);

        int threads = 10;
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
        assertTrue(done.await(60, TimeUnit.SECONDS));
        executor.shutdown();

        System.out.println("OUTPUT - Successes: " + successes.get() + ", failures: " + failures.size());
        assertEquals(3, successes.get());
        assertTrue(failures.stream().allMatch(InsufficientBalanceException.class::isInstance));
        assertEquals(1L, ledgerStore.balanceOf(userId));
        assertEquals(3, subjectPersistence.findOwned(userId, SubjectKind.POST).size());
        assertTrue(ledgerStore.reconcile(userId).isConsistent());
    }

    @Test
    @DisplayName("Reject and cancel racing on one request refund exactly once")
    void testRejectCancelRace() throws InterruptedException {
        UUID userId = fixtures.createApprovedUser(adminId, 5);
        UUID targetId = fixtures.createApprovedUser(adminId, 0);
        ModeratedSubject request = coinActionService.requestConnection(userId, targetId, null, null);

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(2);
        List<Throwable> failures = Collections.synchronizedList(new ArrayList<>());

        List<Runnable> actions = List.of(
            () -> approvalWorkflow.decide(request.getId(), SubjectStatus.REJECTED, adminId, null),
            () -> approvalWorkflow.cancel(request.getId(), userId));
        for (Runnable action : actions) {
            executor.submit(() -> {
                try {
                    start.await();
                    action.run();
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

        assertEquals(1, failures.size());
        assertInstanceOf(ActionRejectedException.class, failures.get(0));
        long refunds = ledgerStore.entriesForReference("CONNECTION_REQUEST", request.getId()).stream()
            .filter(entry -> entry.getReason() == LedgerReason.REFUND)
            .count();
        assertEquals(1L, refunds);
        assertEquals(5L, ledgerStore.balanceOf(userId));
    }
}
