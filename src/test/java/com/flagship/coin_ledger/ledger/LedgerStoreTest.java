package com.flagship.coin_ledger.ledger;

import com.flagship.coin_ledger.TestFixtures;
import com.flagship.coin_ledger.account.AccountRole;
import com.flagship.coin_ledger.account.AccountService;
import com.flagship.coin_ledger.exception.AccountNotFoundException;
import com.flagship.coin_ledger.exception.InsufficientBalanceException;
import com.flagship.coin_ledger.exception.InvalidDeltaException;
import com.flagship.coin_ledger.exception.LedgerIntegrityException;
import com.flagship.coin_ledger.observability.IntegrityAlarm;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tries to break the ledger: zero deltas, overdrafts, duplicate references and a
 * drifted balance cache.
 */
@SpringBootTest
class LedgerStoreTest {

    @Autowired
    private LedgerStore ledgerStore;

    @Autowired
    private AccountService accountService;

    @Autowired
    private IntegrityAlarm integrityAlarm;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private UUID accountId;

    @BeforeEach
    void setUp() {
        accountId = accountService.createAccount(TestFixtures.uniqueUsername("ledger"), AccountRole.USER, "Ledger")
            .getId();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private LedgerEntry credit(long coins) {
        return ledgerStore.append(accountId, coins, LedgerReason.ADJUST, "ADMIN_ADJUSTMENT", UUID.randomUUID(),
            "test credit");
    }

    @Test
    @DisplayName("A new account starts at zero with an empty history")
    void testNewAccountIsEmpty() {
        printTestHeader("New Account Is Empty");

        assertEquals(0L, ledgerStore.balanceOf(accountId));
        LedgerPage page = ledgerStore.history(accountId, null, 10);
        assertTrue(page.getEntries().isEmpty());
        assertFalse(page.hasMore());

        printSuccess("Balance 0, no entries");
    }

    @Test
    @DisplayName("Balance is the sum of all appended deltas")
    void testBalanceIsSumOfDeltas() {
        printTestHeader("Balance Is Sum Of Deltas");

        // Given: three credits and one debit
        credit(5);
        credit(3);
        ledgerStore.append(accountId, -2, LedgerReason.POST, "POST", UUID.randomUUID(), "post submitted");
        credit(1);

        // Then
        long balance = ledgerStore.balanceOf(accountId);
        printOutput("Balance", balance);
        assertEquals(7L, balance);
        assertTrue(ledgerStore.reconcile(accountId).isConsistent(), "Cache must match the entry log");

        printSuccess("Balance derived from entries and matches cache");
    }

    @Test
    @DisplayName("Zero delta is rejected and nothing is written")
    void testZeroDeltaRejected() {
        printTestHeader("Zero Delta Rejected");

        assertThrows(InvalidDeltaException.class,
            () -> ledgerStore.append(accountId, 0, LedgerReason.ADJUST, "ADMIN_ADJUSTMENT", UUID.randomUUID(), "x"));
        assertTrue(ledgerStore.history(accountId, null, 10).getEntries().isEmpty());

        printSuccess("InvalidDelta, no entry");
    }

    @Test
    @DisplayName("A debit larger than the balance is rejected and the balance is unchanged")
    void testOverdraftRejected() {
        printTestHeader("Overdraft Rejected");

        credit(1);

        InsufficientBalanceException e = assertThrows(InsufficientBalanceException.class,
            () -> ledgerStore.append(accountId, -2, LedgerReason.CONNECT, "CONNECTION_REQUEST", UUID.randomUUID(),
                "connection submitted"));

        assertEquals(1L, e.getBalance());
        assertEquals(2L, e.getRequired());
        assertEquals(1L, ledgerStore.balanceOf(accountId));
        assertEquals(1, ledgerStore.history(accountId, null, 10).getEntries().size());

        printSuccess("InsufficientBalance, balance still 1");
    }

    @Test
    @DisplayName("Deltas that would overflow the balance are invalid, not wrapped")
    void testExtremeDeltasRejected() {
        printTestHeader("Extreme Deltas Rejected");

        // Given: 5 coins
        credit(5);

        // When / Then: the largest credit cannot be added on top
        InvalidDeltaException overflow = assertThrows(InvalidDeltaException.class, () -> credit(Long.MAX_VALUE));
        printOutput("Overflow", overflow.getMessage());

        // The smallest long has no positive counterpart
        assertThrows(InvalidDeltaException.class,
            () -> ledgerStore.append(accountId, Long.MIN_VALUE, LedgerReason.ADJUST, "ADMIN_ADJUSTMENT",
                UUID.randomUUID(), "x"));

        // The largest debit is an ordinary overdraft
        InsufficientBalanceException overdraft = assertThrows(InsufficientBalanceException.class,
            () -> ledgerStore.append(accountId, -Long.MAX_VALUE, LedgerReason.ADJUST, "ADMIN_ADJUSTMENT",
                UUID.randomUUID(), "x"));
        assertEquals(Long.MAX_VALUE, overdraft.getRequired());

        assertEquals(5L, ledgerStore.balanceOf(accountId));
        assertEquals(1, ledgerStore.history(accountId, null, 10).getEntries().size());
        assertTrue(ledgerStore.reconcile(accountId).isConsistent());

        printSuccess("Balance still 5, nothing written");
    }

    @Test
    @DisplayName("A description longer than the column is refused before anything is written")
    void testDescriptionTooLong() {
        printTestHeader("Description Too Long");

        assertThrows(IllegalArgumentException.class,
            () -> ledgerStore.append(accountId, 1, LedgerReason.ADJUST, "ADMIN_ADJUSTMENT", UUID.randomUUID(),
                "x".repeat(LedgerStore.MAX_DESCRIPTION_LENGTH + 1)));
        ledgerStore.append(accountId, 1, LedgerReason.ADJUST, "ADMIN_ADJUSTMENT", UUID.randomUUID(),
            "x".repeat(LedgerStore.MAX_DESCRIPTION_LENGTH));

        assertEquals(1L, ledgerStore.balanceOf(accountId));

        printSuccess("Only the entry at the limit was written");
    }

    @Test
    @DisplayName("Unknown accounts are reported as not found")
    void testUnknownAccount() {
        printTestHeader("Unknown Account");

        UUID unknown = UUID.randomUUID();
        assertThrows(AccountNotFoundException.class, () -> ledgerStore.balanceOf(unknown));
        assertThrows(AccountNotFoundException.class,
            () -> ledgerStore.append(unknown, 5, LedgerReason.ADJUST, "ADMIN_ADJUSTMENT", UUID.randomUUID(), "x"));

        printSuccess("AccountNotFound");
    }

    @Test
    @DisplayName("A second entry with the same reference and reason is an integrity fault")
    void testDuplicateReferenceIsIntegrityFault() {
        printTestHeader("Duplicate Reference Is Integrity Fault");

        // Given: a refund already recorded for a subject
        UUID subjectId = UUID.randomUUID();
        ledgerStore.append(accountId, 2, LedgerReason.REFUND, "POST", subjectId, "refund");
        long faultsBefore = integrityAlarm.getFaultCount();

        // When: the same refund is appended again
        LedgerIntegrityException e = assertThrows(LedgerIntegrityException.class,
            () -> ledgerStore.append(accountId, 2, LedgerReason.REFUND, "POST", subjectId, "refund again"));

        // Then: the fault is counted and the balance holds only one refund
        printOutput("Fault", e.getMessage());
        assertEquals(subjectId, e.getSubjectId());
        assertEquals(faultsBefore + 1, integrityAlarm.getFaultCount());
        assertEquals(2L, ledgerStore.balanceOf(accountId));
        assertEquals(1, ledgerStore.entriesForReference("POST", subjectId).size());

        printSuccess("Duplicate refund rejected by the unique index");
    }

    @Test
    @DisplayName("The same reference may carry a debit and a refund")
    void testDebitAndRefundShareReference() {
        printTestHeader("Debit And Refund Share Reference");

        credit(5);
        UUID subjectId = UUID.randomUUID();
        ledgerStore.append(accountId, -2, LedgerReason.POST, "POST", subjectId, "post submitted");
        ledgerStore.append(accountId, 2, LedgerReason.REFUND, "POST", subjectId, "refund");

        List<LedgerEntry> entries = ledgerStore.entriesForReference("POST", subjectId);
        assertEquals(2, entries.size());
        assertEquals(LedgerReason.POST, entries.get(0).getReason());
        assertEquals(LedgerReason.REFUND, entries.get(1).getReason());
        assertEquals(5L, ledgerStore.balanceOf(accountId));

        printSuccess("Debit and refund both recorded");
    }

    @Test
    @DisplayName("History pages newest first and the cursor resumes where the last page ended")
    void testHistoryPagination() {
        printTestHeader("History Pagination");

        for (int i = 1; i <= 5; i++) {
            credit(i);
        }

        LedgerPage first = ledgerStore.history(accountId, null, 2);
        assertEquals(2, first.getEntries().size());
        assertEquals(5L, first.getEntries().get(0).getDelta(), "Newest first");
        assertTrue(first.hasMore());

        LedgerPage second = ledgerStore.history(accountId, first.getNextCursor(), 2);
        assertEquals(List.of(3L, 2L), second.getEntries().stream().map(LedgerEntry::getDelta).toList());

        LedgerPage last = ledgerStore.history(accountId, second.getNextCursor(), 2);
        assertEquals(1, last.getEntries().size());
        assertEquals(1L, last.getEntries().get(0).getDelta());
        assertFalse(last.hasMore());

        printSuccess("Three pages, no gaps, no repeats");
    }

    @Test
    @DisplayName("A drifted cache is detected by reconciliation and repaired by the next append")
    void testCacheDriftDetectedAndRepaired() {
        printTestHeader("Cache Drift Detected And Repaired");

        credit(4);
        jdbcTemplate.update("UPDATE accounts SET cached_balance = 999 WHERE id = ?", accountId);

        ReconciliationResult drifted = ledgerStore.reconcile(accountId);
        printOutput("Drifted", drifted);
        assertFalse(drifted.isConsistent());
        assertEquals(999L, drifted.getCachedBalance());
        assertEquals(4L, drifted.getDerivedBalance());

        long faultsBefore = integrityAlarm.getFaultCount();
        credit(1);

        assertTrue(integrityAlarm.getFaultCount() > faultsBefore, "Drift seen during append is reported");
        ReconciliationResult repaired = ledgerStore.reconcile(accountId);
        assertTrue(repaired.isConsistent());
        assertEquals(5L, repaired.getCachedBalance());

        printSuccess("Entry log wins over the cache");
    }
}
