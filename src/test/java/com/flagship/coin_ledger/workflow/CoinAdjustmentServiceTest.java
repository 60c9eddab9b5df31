package com.flagship.coin_ledger.workflow;

import com.flagship.coin_ledger.TestFixtures;
import com.flagship.coin_ledger.account.AccountService;
import com.flagship.coin_ledger.exception.AccountNotFoundException;
import com.flagship.coin_ledger.exception.InsufficientBalanceException;
import com.flagship.coin_ledger.exception.InvalidDeltaException;
import com.flagship.coin_ledger.exception.NotAdminException;
import com.flagship.coin_ledger.ledger.LedgerEntry;
import com.flagship.coin_ledger.ledger.LedgerReason;
import com.flagship.coin_ledger.ledger.LedgerStore;
import com.flagship.coin_ledger.outbox.OutboxService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class CoinAdjustmentServiceTest {

    @Autowired
    private CoinAdjustmentService coinAdjustmentService;

    @Autowired
    private LedgerStore ledgerStore;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private ApprovalWorkflow approvalWorkflow;

    private UUID adminId;
    private UUID userId;

    @BeforeEach
    void setUp() {
        TestFixtures fixtures = new TestFixtures(accountService, approvalWorkflow, coinAdjustmentService);
        adminId = fixtures.createAdmin();
        userId = fixtures.createPendingUser();
    }

    @Test
    @DisplayName("Admins can add and remove coins; each adjustment is audited")
    void testAdjust() {
        LedgerEntry added = coinAdjustmentService.adjust(adminId, userId, 10, "Promo");
        LedgerEntry removed = coinAdjustmentService.adjust(adminId, userId, -4, "Correction");

        assertEquals(LedgerReason.ADJUST, added.getReason());
        assertEquals(-4L, removed.getDelta());
        assertNotEquals(added.getReferenceId(), removed.getReferenceId(), "Each adjustment is its own reference");
        assertEquals(6L, ledgerStore.balanceOf(userId));

        long audits = outboxService.getEventsForAggregate(OutboxService.AGGREGATE_AUDIT, userId).stream()
            .filter(e -> e.getPayload().contains("COINS_ADJUSTED"))
            .count();
        assertEquals(2L, audits);
    }

    @Test
    @DisplayName("Adjustments follow the ledger's rules")
    void testAdjustmentRules() {
        UUID otherUser = new TestFixtures(accountService, approvalWorkflow, coinAdjustmentService).createPendingUser();

        assertThrows(NotAdminException.class, () -> coinAdjustmentService.adjust(otherUser, userId, 10, "self-serve"));
        assertThrows(InvalidDeltaException.class, () -> coinAdjustmentService.adjust(adminId, userId, 0, "nothing"));
        assertThrows(InsufficientBalanceException.class,
            () -> coinAdjustmentService.adjust(adminId, userId, -1, "overdraw"));
        assertThrows(AccountNotFoundException.class,
            () -> coinAdjustmentService.adjust(adminId, UUID.randomUUID(), 5, "ghost"));

        assertEquals(0L, ledgerStore.balanceOf(userId));
        assertTrue(outboxService.getEventsForAggregate(OutboxService.AGGREGATE_AUDIT, userId).isEmpty(),
            "Rejected adjustments leave no audit record");
    }

    @Test
    @DisplayName("An adjustment that would overflow the balance is an invalid delta")
    void testOverflowingAdjustment() {
        coinAdjustmentService.adjust(adminId, userId, 5, "seed");

        assertThrows(InvalidDeltaException.class,
            () -> coinAdjustmentService.adjust(adminId, userId, Long.MAX_VALUE, "big"));
        assertThrows(InvalidDeltaException.class,
            () -> coinAdjustmentService.adjust(adminId, userId, Long.MIN_VALUE, "small"));

        assertEquals(5L, ledgerStore.balanceOf(userId));
        assertTrue(ledgerStore.reconcile(userId).isConsistent());
    }
}
