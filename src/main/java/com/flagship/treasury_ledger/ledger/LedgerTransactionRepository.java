package com.flagship.treasury_ledger.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to {@code ledger_transactions}. Holds SQL only; invariants
 * are checked by {@link LedgerService} and {@link AllocationEngine}.
 */
@Repository
@RequiredArgsConstructor
class LedgerTransactionRepository {

    private static final TypeReference<Map<String, String>> METADATA_TYPE = new TypeReference<>() {
    };

    private static final String SELECT_TRANSACTION =
        "SELECT id, transaction_type, status, amount, from_account_id, to_account_id, parent_transaction_id, " +
        "external_reference, idempotency_key, metadata, performed_by, created_at, completed_at " +
        "FROM ledger_transactions ";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    void insert(LedgerTransaction tx) {
        jdbcTemplate.update(
            "INSERT INTO ledger_transactions (id, transaction_type, status, amount, from_account_id, to_account_id, " +
            "parent_transaction_id, external_reference, idempotency_key, metadata, performed_by, created_at, completed_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS jsonb), ?, ?, ?)",
            tx.getId(),
            tx.getType().name(),
            tx.getStatus().name(),
            tx.getAmount(),
            tx.getFromAccountId(),
            tx.getToAccountId(),
            tx.getParentTransactionId(),
            tx.getExternalReference(),
            tx.getIdempotencyKey(),
            writeMetadata(tx.getMetadata()),
            tx.getPerformedBy(),
            toTimestamp(tx.getCreatedAt()),
            toTimestamp(tx.getCompletedAt())
        );
    }

    void updateStatus(UUID id, TransactionStatus status, Instant completedAt) {
        jdbcTemplate.update(
            "UPDATE ledger_transactions SET status = ?, completed_at = ? WHERE id = ?",
            status.name(), toTimestamp(completedAt), id);
    }

    Optional<LedgerTransaction> findById(UUID id) {
        return jdbcTemplate.query(SELECT_TRANSACTION + "WHERE id = ?", rowMapper(), id).stream().findFirst();
    }

    /**
     * Row-locks the transaction until the surrounding unit of work ends.
     */
    Optional<LedgerTransaction> findByIdForUpdate(UUID id) {
        return jdbcTemplate.query(SELECT_TRANSACTION + "WHERE id = ? FOR UPDATE", rowMapper(), id)
                .stream()
                .findFirst();
    }

    Optional<UUID> findIdByIdempotencyKey(String idempotencyKey) {
        return jdbcTemplate.queryForList(
                "SELECT id FROM ledger_transactions WHERE idempotency_key = ?", UUID.class, idempotencyKey)
            .stream()
            .findFirst();
    }

    List<LedgerTransaction> findAllocations(UUID parentId) {
        return jdbcTemplate.query(
            SELECT_TRANSACTION + "WHERE parent_transaction_id = ? AND transaction_type = 'INTERNAL_ALLOCATION' " +
            "ORDER BY created_at, id",
            rowMapper(), parentId);
    }

    /**
     * Children of a deposit joined with their target account names, largest
     * percentage first.
     */
    List<AllocationResult.Share> findAllocationShares(UUID parentId) {
        return jdbcTemplate.query(
            "SELECT t.id, t.to_account_id, a.account_name, t.amount, t.metadata ->> 'percentage' AS percentage " +
            "FROM ledger_transactions t JOIN logical_accounts a ON a.id = t.to_account_id " +
            "WHERE t.parent_transaction_id = ? AND t.transaction_type = 'INTERNAL_ALLOCATION' " +
            "ORDER BY CAST(COALESCE(t.metadata ->> 'percentage', '0') AS NUMERIC) DESC, a.account_name",
            (rs, rowNum) -> new AllocationResult.Share(
                rs.getObject("id", UUID.class),
                rs.getObject("to_account_id", UUID.class),
                rs.getString("account_name"),
                rs.getBigDecimal("amount"),
                rs.getString("percentage") != null ? new BigDecimal(rs.getString("percentage")) : null
            ),
            parentId);
    }

    List<LedgerTransaction> find(TransactionFilter filter, int limit, int offset) {
        List<Object> params = new ArrayList<>();
        String where = buildWhere(filter, params);
        params.add(limit);
        params.add(offset);
        return jdbcTemplate.query(
            SELECT_TRANSACTION + where + " ORDER BY created_at DESC, id DESC LIMIT ? OFFSET ?",
            rowMapper(), params.toArray());
    }

    long count(TransactionFilter filter) {
        List<Object> params = new ArrayList<>();
        String where = buildWhere(filter, params);
        Long total = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_transactions " + where, Long.class, params.toArray());
        return total != null ? total : 0L;
    }

    private String buildWhere(TransactionFilter filter, List<Object> params) {
        List<String> clauses = new ArrayList<>();
        if (filter.getType() != null) {
            clauses.add("transaction_type = ?");
            params.add(filter.getType().name());
        }
        if (filter.getStatus() != null) {
            clauses.add("status = ?");
            params.add(filter.getStatus().name());
        }
        if (filter.getAccountId() != null) {
            clauses.add("(from_account_id = ? OR to_account_id = ?)");
            params.add(filter.getAccountId());
            params.add(filter.getAccountId());
        }
        if (filter.getParentTransactionId() != null) {
            clauses.add("parent_transaction_id = ?");
            params.add(filter.getParentTransactionId());
        }
        if (filter.getCreatedFrom() != null) {
            clauses.add("created_at >= ?");
            params.add(Timestamp.from(filter.getCreatedFrom()));
        }
        if (filter.getCreatedTo() != null) {
            clauses.add("created_at < ?");
            params.add(Timestamp.from(filter.getCreatedTo()));
        }
        return clauses.isEmpty() ? "" : "WHERE " + String.join(" AND ", clauses);
    }

    private RowMapper<LedgerTransaction> rowMapper() {
        return (rs, rowNum) -> new LedgerTransaction(
            rs.getObject("id", UUID.class),
            TransactionType.valueOf(rs.getString("transaction_type")),
            TransactionStatus.valueOf(rs.getString("status")),
            rs.getBigDecimal("amount"),
            rs.getObject("from_account_id", UUID.class),
            rs.getObject("to_account_id", UUID.class),
            rs.getObject("parent_transaction_id", UUID.class),
            rs.getString("external_reference"),
            rs.getString("idempotency_key"),
            readMetadata(rs.getString("metadata")),
            rs.getString("performed_by"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("completed_at"))
        );
    }

    private String writeMetadata(Map<String, String> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata != null ? metadata : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize transaction metadata", e);
        }
    }

    private Map<String, String> readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable transaction metadata", e);
        }
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
