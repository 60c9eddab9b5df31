package com.flagship.coin_ledger.ledger;

import com.flagship.coin_ledger.exception.AccountNotFoundException;
import com.flagship.coin_ledger.exception.InsufficientBalanceException;
import com.flagship.coin_ledger.exception.InvalidDeltaException;
import com.flagship.coin_ledger.exception.LedgerIntegrityException;
import com.flagship.coin_ledger.observability.IntegrityAlarm;
import com.flagship.coin_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Sole writer and reader of financial truth.
 *
 * This service enforces the core invariants:
 * 1. Entries are append-only; nothing here issues UPDATE or DELETE on ledger_entries
 * 2. balance(account) == SUM(delta) over the account's entries
 * 3. balance(account) >= 0 after every committed append
 *
 * Appends on one account are linearized by a row lock on the account
 * (SELECT ... FOR UPDATE) held until the surrounding transaction ends. Appends on
 * different accounts never wait for each other.
 *
 * The accounts.cached_balance column is a projection written in the same
 * transaction as each entry; reconciliation checks it against the entry log.
 *
 * Plain JDBC on purpose: every invariant is visible as SQL and backed by a
 * database constraint (non-zero delta, one entry per reference and reason).
 */
@Service
@Slf4j
public class LedgerStore {

    static final int MAX_PAGE_SIZE = 200;
    public static final int MAX_DESCRIPTION_LENGTH = 255;

    private static final String INSERT_ENTRY =
        "INSERT INTO ledger_entries (account_id, delta, reason, reference_kind, reference_id, description, created_at) " +
        "VALUES (?, ?, ?, ?, ?, ?, ?)";

    private static final String ENTRY_COLUMNS =
        "id, account_id, delta, reason, reference_kind, reference_id, description, created_at";

    private final JdbcTemplate jdbcTemplate;
    private final LedgerMetrics metrics;
    private final IntegrityAlarm integrityAlarm;

    public LedgerStore(JdbcTemplate jdbcTemplate, LedgerMetrics metrics, IntegrityAlarm integrityAlarm) {
        this.jdbcTemplate = jdbcTemplate;
        this.metrics = metrics;
        this.integrityAlarm = integrityAlarm;
    }

    /**
     * Appends a signed delta to an account.
     *
     * Runs in the caller's transaction when there is one, so a debit and the
     * domain write that caused it commit or roll back together.
     *
     * @throws InvalidDeltaException if delta is zero, Long.MIN_VALUE, or would overflow the balance
     * @throws IllegalArgumentException if the description is longer than the column allows
     * @throws AccountNotFoundException if the account does not exist
     * @throws InsufficientBalanceException if a negative delta would overdraw the account
     * @throws LedgerIntegrityException if an entry with the same reference and reason already exists
     */
    @Transactional
    public LedgerEntry append(UUID accountId, long delta, LedgerReason reason,
                              String referenceKind, UUID referenceId, String description) {
        Objects.requireNonNull(accountId, "accountId");
        Objects.requireNonNull(reason, "reason");
        if (delta == 0) {
            metrics.recordAppend(reason.name(), "invalid_delta");
            throw new InvalidDeltaException();
        }
        if (delta == Long.MIN_VALUE) {
            metrics.recordAppend(reason.name(), "invalid_delta");
            throw new InvalidDeltaException("Ledger delta out of range: " + delta);
        }
        if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new IllegalArgumentException(
                "Description must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }

        long start = System.nanoTime();
        long cached = lockAccount(accountId);
        long balance = derivedBalance(accountId);

        if (cached != balance) {
            // The projection drifted; the entry log wins and the cache is rewritten below.
            integrityAlarm.raise("cache_drift",
                String.format("cached balance %d differs from derived balance %d", cached, balance),
                accountId, referenceId);
        }

        long newBalance;
        try {
            newBalance = Math.addExact(balance, delta);
        } catch (ArithmeticException e) {
            metrics.recordAppend(reason.name(), "invalid_delta");
            throw new InvalidDeltaException(
                String.format("Ledger delta %d overflows balance %d of account %s", delta, balance, accountId));
        }

        if (delta < 0 && newBalance < 0) {
            metrics.recordAppend(reason.name(), "insufficient_balance");
            throw new InsufficientBalanceException(accountId, balance, -delta);
        }

        Instant now = Instant.now();
        Long entryId;
        try {
            entryId = insertEntry(accountId, delta, reason, referenceKind, referenceId, description, now);
        } catch (DuplicateKeyException e) {
            metrics.recordAppend(reason.name(), "duplicate_reference");
            LedgerIntegrityException fault = new LedgerIntegrityException(
                String.format("Duplicate %s entry for %s %s", reason, referenceKind, referenceId),
                accountId, referenceId, e);
            integrityAlarm.raise("duplicate_reference", fault);
            throw fault;
        }

        jdbcTemplate.update("UPDATE accounts SET cached_balance = ? WHERE id = ?", newBalance, accountId);

        metrics.recordAppend(reason.name(), "success");
        metrics.recordAppendDuration(Duration.ofNanos(System.nanoTime() - start));
        log.debug("Appended ledger entry: entryId={}, accountId={}, delta={}, reason={}, balance={}",
                entryId, accountId, delta, reason, newBalance);

        return new LedgerEntry(entryId, accountId, delta, reason, referenceKind, referenceId, description, now);
    }

    /**
     * Locks the account row for the rest of the current transaction and returns the
     * cached balance. Callers that must check a balance before writing (the action gate)
     * take this lock first so the check and the append see the same state.
     */
    @Transactional
    public long lockAccount(UUID accountId) {
        List<Long> rows = jdbcTemplate.queryForList(
            "SELECT cached_balance FROM accounts WHERE id = ? FOR UPDATE",
            Long.class,
            accountId
        );
        if (rows.isEmpty()) {
            throw new AccountNotFoundException(accountId);
        }
        return rows.get(0);
    }

    /**
     * Current balance, derived from the entry log.
     * Reads after a committed append on the same account always include that append.
     */
    @Transactional(readOnly = true)
    public long balanceOf(UUID accountId) {
        requireAccount(accountId);
        return derivedBalance(accountId);
    }

    /**
     * History of an account, newest first, using keyset pagination on the entry id.
     *
     * @param beforeId cursor from the previous page, or null for the newest entries
     * @param limit page size, clamped to 1..200
     */
    @Transactional(readOnly = true)
    public LedgerPage history(UUID accountId, Long beforeId, int limit) {
        requireAccount(accountId);
        int pageSize = Math.max(1, Math.min(limit, MAX_PAGE_SIZE));

        List<LedgerEntry> rows;
        if (beforeId == null) {
            rows = jdbcTemplate.query(
                "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries WHERE account_id = ? ORDER BY id DESC LIMIT ?",
                ledgerEntryRowMapper(), accountId, pageSize + 1);
        } else {
            rows = jdbcTemplate.query(
                "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries WHERE account_id = ? AND id < ? ORDER BY id DESC LIMIT ?",
                ledgerEntryRowMapper(), accountId, beforeId, pageSize + 1);
        }

        if (rows.size() > pageSize) {
            List<LedgerEntry> page = new ArrayList<>(rows.subList(0, pageSize));
            return new LedgerPage(List.copyOf(page), page.get(page.size() - 1).getId());
        }
        return new LedgerPage(List.copyOf(rows), null);
    }

    /**
     * Entries that reference a subject, oldest first.
     */
    @Transactional(readOnly = true)
    public List<LedgerEntry> entriesForReference(String referenceKind, UUID referenceId) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries WHERE reference_kind = ? AND reference_id = ? ORDER BY id",
            ledgerEntryRowMapper(), referenceKind, referenceId);
    }

    /**
     * Compares the cached running total with the entry log in a single statement,
     * so both numbers come from the same snapshot.
     */
    @Transactional(readOnly = true)
    public ReconciliationResult reconcile(UUID accountId) {
        List<ReconciliationResult> rows = jdbcTemplate.query(
            "SELECT a.id, a.cached_balance, " +
            "COALESCE((SELECT SUM(e.delta) FROM ledger_entries e WHERE e.account_id = a.id), 0) AS derived " +
            "FROM accounts a WHERE a.id = ?",
            (rs, rowNum) -> new ReconciliationResult(
                UUID.fromString(rs.getString("id")),
                rs.getLong("cached_balance"),
                rs.getLong("derived")),
            accountId);
        if (rows.isEmpty()) {
            throw new AccountNotFoundException(accountId);
        }
        return rows.get(0);
    }

    /**
     * Reconciles every account and reports each mismatch as an integrity fault.
     *
     * @return only the inconsistent accounts
     */
    @Transactional(readOnly = true)
    public List<ReconciliationResult> reconcileAll() {
        List<ReconciliationResult> mismatches = jdbcTemplate.query(
            "SELECT a.id, a.cached_balance, COALESCE(s.derived, 0) AS derived FROM accounts a " +
            "LEFT JOIN (SELECT account_id, SUM(delta) AS derived FROM ledger_entries GROUP BY account_id) s " +
            "ON s.account_id = a.id",
            (rs, rowNum) -> new ReconciliationResult(
                UUID.fromString(rs.getString("id")),
                rs.getLong("cached_balance"),
                rs.getLong("derived")))
            .stream()
            .filter(result -> !result.isConsistent())
            .toList();

        for (ReconciliationResult mismatch : mismatches) {
            String type = mismatch.getDerivedBalance() < 0 ? "negative_balance" : "cache_drift";
            integrityAlarm.raise(type,
                String.format("reconciliation: cached=%d derived=%d",
                    mismatch.getCachedBalance(), mismatch.getDerivedBalance()),
                mismatch.getAccountId(), null);
        }
        return mismatches;
    }

    private Long insertEntry(UUID accountId, long delta, LedgerReason reason, String referenceKind,
                             UUID referenceId, String description, Instant createdAt) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(INSERT_ENTRY, new String[] {"id"});
            ps.setObject(1, accountId);
            ps.setLong(2, delta);
            ps.setString(3, reason.name());
            ps.setString(4, referenceKind);
            ps.setObject(5, referenceId);
            ps.setString(6, description);
            ps.setTimestamp(7, Timestamp.from(createdAt));
            return ps;
        }, keyHolder);

        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Database did not return an id for the new ledger entry");
        }
        return key.longValue();
    }

    private long derivedBalance(UUID accountId) {
        Long balance = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(delta), 0) FROM ledger_entries WHERE account_id = ?",
            Long.class,
            accountId
        );
        return balance != null ? balance : 0L;
    }

    private void requireAccount(UUID accountId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM accounts WHERE id = ?",
            Integer.class,
            accountId
        );
        if (count == null || count == 0) {
            throw new AccountNotFoundException(accountId);
        }
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> {
            String referenceId = rs.getString("reference_id");
            Timestamp createdAt = rs.getTimestamp("created_at");
            return new LedgerEntry(
                rs.getLong("id"),
                UUID.fromString(rs.getString("account_id")),
                rs.getLong("delta"),
                LedgerReason.valueOf(rs.getString("reason")),
                rs.getString("reference_kind"),
                referenceId != null ? UUID.fromString(referenceId) : null,
                rs.getString("description"),
                createdAt != null ? createdAt.toInstant() : null
            );
        };
    }
}
