package com.flagship.coin_ledger.account;

import com.flagship.coin_ledger.exception.AccountNotFoundException;
import com.flagship.coin_ledger.exception.NotAdminException;
import com.flagship.coin_ledger.subject.ModeratedSubject;
import com.flagship.coin_ledger.subject.SubjectPersistenceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Account registry and actor resolution.
 *
 * Creating an account also creates its PENDING profile subject, so every account
 * has exactly one USER_PROFILE whose id equals the account id.
 */
@Service
@Slf4j
public class AccountService {

    private final JdbcTemplate jdbcTemplate;
    private final SubjectPersistenceService subjectPersistence;

    public AccountService(JdbcTemplate jdbcTemplate, SubjectPersistenceService subjectPersistence) {
        this.jdbcTemplate = jdbcTemplate;
        this.subjectPersistence = subjectPersistence;
    }

    @Transactional
    public Account createAccount(String username, AccountRole role, String displayName) {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username is required");
        }
        UUID accountId = UUID.randomUUID();
        Instant now = Instant.now();
        try {
            jdbcTemplate.update(
                "INSERT INTO accounts (id, username, role, cached_balance, created_at) VALUES (?, ?, ?, 0, ?)",
                accountId,
                username,
                role.name(),
                Timestamp.from(now)
            );
        } catch (DuplicateKeyException e) {
            throw new IllegalArgumentException("Username already taken: " + username, e);
        }

        subjectPersistence.insert(ModeratedSubject.profile(accountId, displayName, null), null);
        log.info("Created account: accountId={}, username={}, role={}", accountId, username, role);
        return new Account(accountId, username, role, 0L, now);
    }

    @Transactional(readOnly = true)
    public Optional<Account> findById(UUID accountId) {
        List<Account> rows = jdbcTemplate.query(
            "SELECT id, username, role, cached_balance, created_at FROM accounts WHERE id = ?",
            accountRowMapper(),
            accountId
        );
        return rows.stream().findFirst();
    }

    /**
     * @throws AccountNotFoundException if the account does not exist
     */
    @Transactional(readOnly = true)
    public Account requireAccount(UUID accountId) {
        if (accountId == null) {
            throw new AccountNotFoundException(null);
        }
        return findById(accountId).orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    /**
     * @throws NotAdminException if the account exists but is not an admin
     */
    @Transactional(readOnly = true)
    public Account requireAdmin(UUID accountId) {
        Account account = requireAccount(accountId);
        if (!account.isAdmin()) {
            throw new NotAdminException(accountId);
        }
        return account;
    }

    @Transactional(readOnly = true)
    public boolean exists(UUID accountId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM accounts WHERE id = ?", Integer.class, accountId);
        return count != null && count > 0;
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            UUID.fromString(rs.getString("id")),
            rs.getString("username"),
            AccountRole.valueOf(rs.getString("role")),
            rs.getLong("cached_balance"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
