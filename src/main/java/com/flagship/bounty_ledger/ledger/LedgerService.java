package com.flagship.bounty_ledger.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

/**
 * The budget ledger: a running balance and a cumulative paid-out total.
 *
 * Two writers only. A balance observation overwrites the balance; a confirmed settlement
 * accrues its amount into the paid-out total. Accruals are recorded per payment id in
 * ledger_accruals, so accruing the same payment twice is a no-op and
 * {@code total_paid_out} always equals the sum of the accrual rows.
 *
 * Plain JDBC: the invariants are enforced by primary keys and single-statement updates.
 */
@Service
@Slf4j
public class LedgerService {

    static final String BUDGET_ID = "primary";

    private final JdbcTemplate jdbcTemplate;

    public LedgerService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Returns the budget record, creating it on first use.
     */
    @Transactional
    public Budget getBudget() {
        ensureBudget();
        return jdbcTemplate.queryForObject(
            "SELECT funding_address, balance, total_paid_out, last_updated FROM budget WHERE id = ?",
            budgetRowMapper(),
            BUDGET_ID
        );
    }

    /**
     * Overwrites the observed balance. A null funding address leaves the stored one unchanged.
     */
    @Transactional
    public Budget recordBalance(BigDecimal balance, String fundingAddress) {
        if (balance == null || balance.signum() < 0) {
            throw new IllegalArgumentException("Balance must be non-negative");
        }
        ensureBudget();
        jdbcTemplate.update(
            "UPDATE budget SET balance = ?, funding_address = COALESCE(?, funding_address), last_updated = ? " +
            "WHERE id = ?",
            balance,
            fundingAddress,
            now(),
            BUDGET_ID
        );
        log.info("Budget balance observed: {}", balance.toPlainString());
        return getBudget();
    }

    /**
     * Adds claimed rewards to the balance until the next observation overwrites it.
     */
    @Transactional
    public Budget creditBalance(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Credited amount must be positive");
        }
        ensureBudget();
        jdbcTemplate.update(
            "UPDATE budget SET balance = balance + ?, last_updated = ? WHERE id = ?",
            amount,
            now(),
            BUDGET_ID
        );
        return getBudget();
    }

    /**
     * Counts a confirmed payment into the paid-out total. Must run in the settlement commit's
     * transaction.
     *
     * @return false if this payment was already accrued
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean accrue(UUID paymentId, UUID workerId, BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Accrued amount must be positive");
        }
        if (isAccrued(paymentId)) {
            log.info("Payment {} already accrued, skipping", paymentId);
            return false;
        }
        ensureBudget();

        OffsetDateTime now = now();
        jdbcTemplate.update(
            "INSERT INTO ledger_accruals (payment_id, worker_id, amount, accrued_at) VALUES (?, ?, ?, ?)",
            paymentId,
            workerId,
            amount,
            now
        );
        jdbcTemplate.update(
            "UPDATE budget SET total_paid_out = total_paid_out + ?, last_updated = ? WHERE id = ?",
            amount,
            now,
            BUDGET_ID
        );
        log.debug("Accrued {} for payment {}", amount.toPlainString(), paymentId);
        return true;
    }

    @Transactional(readOnly = true)
    public boolean isAccrued(UUID paymentId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_accruals WHERE payment_id = ?",
            Integer.class,
            paymentId
        );
        return count != null && count > 0;
    }

    @Transactional(readOnly = true)
    public List<LedgerAccrual> getAccruals() {
        return jdbcTemplate.query(
            "SELECT payment_id, worker_id, amount, accrued_at FROM ledger_accruals ORDER BY accrued_at",
            (rs, rowNum) -> new LedgerAccrual(
                rs.getObject("payment_id", UUID.class),
                rs.getObject("worker_id", UUID.class),
                rs.getBigDecimal("amount"),
                rs.getObject("accrued_at", OffsetDateTime.class).toInstant()
            )
        );
    }

    @Transactional(readOnly = true)
    public BigDecimal sumAccruals() {
        BigDecimal total = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount), 0) FROM ledger_accruals",
            BigDecimal.class
        );
        return total != null ? total : BigDecimal.ZERO;
    }

    /**
     * Inserts the budget row if it is missing. A concurrent creator is absorbed by the
     * conflict clause, so the surrounding transaction stays usable.
     */
    private void ensureBudget() {
        jdbcTemplate.update(
            "INSERT INTO budget (id, funding_address, balance, total_paid_out, last_updated) " +
            "VALUES (?, '', 0, 0, ?) ON CONFLICT DO NOTHING",
            BUDGET_ID,
            now()
        );
    }

    private static OffsetDateTime now() {
        return OffsetDateTime.now(ZoneOffset.UTC);
    }

    private RowMapper<Budget> budgetRowMapper() {
        return (rs, rowNum) -> new Budget(
            rs.getString("funding_address"),
            rs.getBigDecimal("balance"),
            rs.getBigDecimal("total_paid_out"),
            rs.getObject("last_updated", OffsetDateTime.class).toInstant()
        );
    }
}
