package com.flagship.treasury_ledger.ledger;

import com.flagship.treasury_ledger.audit.AuditAction;
import com.flagship.treasury_ledger.audit.AuditEntityType;
import com.flagship.treasury_ledger.audit.AuditService;
import com.flagship.treasury_ledger.exception.DuplicateAccountException;
import com.flagship.treasury_ledger.exception.InsufficientFundsException;
import com.flagship.treasury_ledger.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Account store.
 *
 * Reads and account creation are public. Balance changes go through
 * {@link #adjustBalance}, which is package-private so only the ledger and
 * the allocation engine can move value.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private static final String SELECT_ACCOUNT =
        "SELECT id, account_name, account_type, description, current_balance, is_active, created_at, updated_at " +
        "FROM logical_accounts ";

    private final JdbcTemplate jdbcTemplate;
    private final AuditService auditService;

    @Transactional
    public LogicalAccount createAccount(String name, AccountType type, String description, String actor) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Account name is required");
        }
        if (type == null) {
            throw new IllegalArgumentException("Account type is required");
        }
        if (findByName(name).isPresent()) {
            throw new DuplicateAccountException(name);
        }

        UUID id = UUID.randomUUID();
        try {
            jdbcTemplate.update(
                "INSERT INTO logical_accounts (id, account_name, account_type, description, current_balance, is_active) " +
                "VALUES (?, ?, ?, ?, 0, TRUE)",
                id, name, type.name(), description);
        } catch (DuplicateKeyException e) {
            // lost a race against a concurrent create of the same name
            throw new DuplicateAccountException(name);
        }

        LogicalAccount account = getAccount(id);
        auditService.record(AuditEntityType.LOGICAL_ACCOUNT, id, AuditAction.CREATE,
                null, snapshot(account), actor);

        log.info("Created account {} ({}) id={}", name, type, id);
        return account;
    }

    @Transactional(readOnly = true)
    public LogicalAccount getAccount(UUID id) {
        List<LogicalAccount> rows = jdbcTemplate.query(SELECT_ACCOUNT + "WHERE id = ?", accountRowMapper(), id);
        if (rows.isEmpty()) {
            throw new NotFoundException("LogicalAccount", id);
        }
        return rows.get(0);
    }

    @Transactional(readOnly = true)
    public LogicalAccount getAccountByName(String name) {
        return findByName(name).orElseThrow(() -> new NotFoundException("LogicalAccount", name));
    }

    @Transactional(readOnly = true)
    public Optional<LogicalAccount> findByName(String name) {
        return jdbcTemplate.query(SELECT_ACCOUNT + "WHERE account_name = ?", accountRowMapper(), name)
                .stream()
                .findFirst();
    }

    @Transactional(readOnly = true)
    public List<LogicalAccount> listAccounts(boolean includeInactive) {
        String sql = includeInactive
            ? SELECT_ACCOUNT + "ORDER BY account_name"
            : SELECT_ACCOUNT + "WHERE is_active = TRUE ORDER BY account_name";
        return jdbcTemplate.query(sql, accountRowMapper());
    }

    /**
     * Sum of all active balances, read in one statement so the figure is a
     * consistent snapshot.
     */
    @Transactional(readOnly = true)
    public BigDecimal totalActiveBalance() {
        BigDecimal total = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(current_balance), 0) FROM logical_accounts WHERE is_active = TRUE",
            BigDecimal.class);
        return total != null ? total : BigDecimal.ZERO;
    }

    /**
     * Applies a signed delta to one balance. Must run inside the caller's transaction.
     *
     * The conditional UPDATE takes the row lock and checks the floor in the
     * same statement, so concurrent writers to one account serialise here.
     *
     * @throws InsufficientFundsException if the balance would go negative
     * @throws NotFoundException if the account does not exist
     */
    void adjustBalance(UUID accountId, BigDecimal delta, UUID transactionId) {
        int updated = jdbcTemplate.update(
            "UPDATE logical_accounts SET current_balance = current_balance + ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND current_balance + ? >= 0",
            delta, accountId, delta);

        if (updated == 0) {
            Integer exists = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM logical_accounts WHERE id = ?", Integer.class, accountId);
            if (exists == null || exists == 0) {
                throw new NotFoundException("LogicalAccount", accountId);
            }
            throw new InsufficientFundsException(accountId, delta.negate());
        }
        log.debug("Adjusted balance of {} by {} for transaction {}", accountId, delta.toPlainString(), transactionId);
    }

    static Map<String, Object> snapshot(LogicalAccount account) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("account_name", account.getName());
        values.put("account_type", account.getType().name());
        values.put("description", account.getDescription());
        values.put("balance", account.getBalance().toPlainString());
        values.put("is_active", account.isActive());
        return values;
    }

    private RowMapper<LogicalAccount> accountRowMapper() {
        return (rs, rowNum) -> new LogicalAccount(
            rs.getObject("id", UUID.class),
            rs.getString("account_name"),
            AccountType.valueOf(rs.getString("account_type")),
            rs.getString("description"),
            rs.getBigDecimal("current_balance"),
            rs.getBoolean("is_active"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private static java.time.Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
